package com.marquee.backend.util;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Text to display-code conversion for the 6x22 split-flap board.
 */
public final class CharacterConverter {

    public static final int ROWS = 6;
    public static final int COLS = 22;
    public static final int BLANK = 0;
    public static final int MAX_CODE = 71;

    public static final int RED = 63;
    public static final int ORANGE = 64;
    public static final int YELLOW = 65;
    public static final int GREEN = 66;
    public static final int BLUE = 67;
    public static final int VIOLET = 68;
    public static final int WHITE = 69;
    public static final int BLACK = 70;
    public static final int FILLED = 71;

    /** Characters a TEXT-mode message may contain (after uppercasing). */
    public static final String SUPPORTED_CHARACTERS =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789 .,:;!?'\"-()+=/°@#$%&";

    // Colour emoji become one private-use character per board cell until they are converted to codes
    private static final char COLOR_MARKER_BASE = '\uE000';

    private static final Map<Character, Integer> CHAR_TO_CODE;
    private static final Map<Integer, Character> CODE_TO_CHAR;
    private static final Map<Integer, Integer> COLOR_EMOJI;

    static {
        Map<Character, Integer> map = new HashMap<>();
        map.put(' ', 0);
        for (char c = 'A'; c <= 'Z'; c++) {
            map.put(c, c - 'A' + 1);
        }
        for (char c = '1'; c <= '9'; c++) {
            map.put(c, c - '1' + 27);
        }
        map.put('0', 36);
        map.put('!', 37);
        map.put('@', 38);
        map.put('#', 39);
        map.put('$', 40);
        map.put('(', 41);
        map.put(')', 42);
        map.put('-', 44);
        map.put('+', 46);
        map.put('&', 47);
        map.put('=', 48);
        map.put(';', 49);
        map.put(':', 50);
        map.put('\'', 52);
        map.put('"', 53);
        map.put('%', 54);
        map.put(',', 55);
        map.put('.', 56);
        map.put('/', 59);
        map.put('?', 60);
        map.put('°', 62);
        CHAR_TO_CODE = Collections.unmodifiableMap(map);

        Map<Integer, Character> reverse = new HashMap<>();
        map.forEach((character, code) -> reverse.put(code, character));
        CODE_TO_CHAR = Collections.unmodifiableMap(reverse);

        Map<Integer, Integer> emoji = new HashMap<>();
        putAll(emoji, RED, "🟥", "🔴", "❤", "🔺", "🔻");
        putAll(emoji, ORANGE, "🟧", "🟠", "🧡");
        putAll(emoji, YELLOW, "🟨", "🟡", "💛");
        putAll(emoji, GREEN, "🟩", "🟢", "💚");
        putAll(emoji, BLUE, "🟦", "🔵", "💙");
        putAll(emoji, VIOLET, "🟪", "🟣", "💜");
        putAll(emoji, WHITE, "⬜", "◻", "◽", "▫", "⚪", "🤍");
        // the board has no black tile
        putAll(emoji, BLANK, "⬛", "◼", "◾", "▪", "⚫", "🖤");
        COLOR_EMOJI = Collections.unmodifiableMap(emoji);
    }

    private static void putAll(Map<Integer, Integer> target, int code, String... emoji) {
        for (String symbol : emoji) {
            target.put(symbol.codePointAt(0), code);
        }
    }

    private CharacterConverter() {
    }

    /**
     * Device code for a character; unsupported characters map to blank.
     */
    public static int charToCode(char character) {
        if (isColorMarker(character)) {
            return character - COLOR_MARKER_BASE;
        }
        return CHAR_TO_CODE.getOrDefault(Character.toUpperCase(character), BLANK);
    }

    public static char codeToChar(int code) {
        return CODE_TO_CHAR.getOrDefault(code, ' ');
    }

    public static boolean isSupported(char character) {
        return isColorMarker(character) || SUPPORTED_CHARACTERS.indexOf(Character.toUpperCase(character)) >= 0;
    }

    private static boolean isColorMarker(char character) {
        return character >= COLOR_MARKER_BASE + RED && character <= COLOR_MARKER_BASE + WHITE;
    }

    /**
     * Replaces typographic quotes, dashes, ellipses and accented letters with their plain equivalents.
     * Colour-square emoji become single colour cells and every other emoji is dropped.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String replaced = text
                .replace('‘', '\'')
                .replace('’', '\'')
                .replace('“', '"')
                .replace('”', '"')
                .replace('–', '-')
                .replace('—', '-')
                .replace("…", "...")
                .replace(' ', ' ')
                .replace("\r\n", "\n")
                .replace('\r', '\n');
        String decomposed = Normalizer.normalize(replaced, Normalizer.Form.NFD);
        return replaceEmoji(decomposed.replaceAll("\\p{M}", ""));
    }

    private static String replaceEmoji(String text) {
        StringBuilder result = new StringBuilder(text.length());
        text.codePoints().forEach(codePoint -> {
            Integer colour = COLOR_EMOJI.get(codePoint);
            if (colour != null) {
                result.append(colour == BLANK ? ' ' : (char) (COLOR_MARKER_BASE + colour));
            } else if (!isPictographic(codePoint)) {
                result.appendCodePoint(codePoint);
            }
        });
        return result.toString();
    }

    // Emoji blocks plus the zero-width joiner; (C) (R) and TM are not in them and stay ordinary characters
    private static boolean isPictographic(int codePoint) {
        return codePoint == 0x200D
                || (codePoint >= 0x2300 && codePoint <= 0x23FF)
                || (codePoint >= 0x25A0 && codePoint <= 0x25FF)
                || (codePoint >= 0x2600 && codePoint <= 0x27BF)
                || (codePoint >= 0x2B00 && codePoint <= 0x2BFF)
                || (codePoint >= 0x1F000 && codePoint <= 0x1FAFF);
    }

    /**
     * Word-wraps text to the given width. Explicit newlines are kept, empty paragraphs are kept as empty lines
     * and words longer than the width are truncated.
     */
    public static List<String> wrapText(String text, int maxWidth) {
        if (text == null || text.isBlank()) {
            return List.of("");
        }
        List<String> lines = new ArrayList<>();
        for (String paragraph : text.split("\n", -1)) {
            if (paragraph.isBlank()) {
                lines.add("");
                continue;
            }
            StringBuilder current = new StringBuilder();
            for (String word : paragraph.split(" ")) {
                if (word.isEmpty()) {
                    continue;
                }
                int candidateLength = current.length() == 0 ? word.length() : current.length() + 1 + word.length();
                if (candidateLength <= maxWidth) {
                    if (current.length() > 0) {
                        current.append(' ');
                    }
                    current.append(word);
                } else {
                    if (current.length() > 0) {
                        lines.add(current.toString());
                    }
                    current = new StringBuilder(word.length() > maxWidth ? word.substring(0, maxWidth) : word);
                }
            }
            if (current.length() > 0) {
                lines.add(current.toString());
            }
        }
        return lines.isEmpty() ? List.of("") : lines;
    }

    public static String center(String text, int width) {
        if (text.length() >= width) {
            return text.substring(0, width);
        }
        int padding = width - text.length();
        int left = padding / 2;
        return " ".repeat(left) + text + " ".repeat(padding - left);
    }

    public static String padRight(String text, int width) {
        if (text.length() >= width) {
            return text.substring(0, width);
        }
        return text + " ".repeat(width - text.length());
    }

    public static int[] lineToCodes(String line, int width) {
        int[] codes = new int[width];
        for (int col = 0; col < width && col < line.length(); col++) {
            codes[col] = charToCode(line.charAt(col));
        }
        return codes;
    }

    /**
     * Converts row strings to a full board. Missing rows are blank, long rows are cut at the board width.
     */
    public static int[][] rowsToLayout(List<String> rows) {
        int[][] layout = new int[ROWS][COLS];
        for (int row = 0; row < ROWS && row < rows.size(); row++) {
            layout[row] = lineToCodes(normalize(rows.get(row)).toUpperCase(), COLS);
        }
        return layout;
    }

    public static String layoutToText(int[][] layout) {
        List<String> lines = new ArrayList<>();
        for (int[] row : layout) {
            StringBuilder line = new StringBuilder();
            for (int code : row) {
                line.append(codeToChar(code));
            }
            lines.add(line.toString().stripTrailing());
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return String.join("\n", lines);
    }
}
