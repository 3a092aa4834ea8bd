package com.marquee.backend.service.frame;

import com.marquee.backend.config.MarqueeProperties;
import com.marquee.backend.model.ContentData;
import com.marquee.backend.model.FormatOptions;
import com.marquee.backend.util.CharacterConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Board layout: rows 0-4 hold 21 columns of content, row 5 holds the info bar
 * ({@code DAY DDMON HH:MM [colour]TEMP}), column 21 of every row is the colour bar.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InfoBarFrameDecorator implements FrameDecorator {

    static final int CONTENT_ROWS = 5;
    static final int CONTENT_COLS = 21;

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("EEE", Locale.US);
    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("MMM", Locale.US);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm", Locale.US);

    private final MarqueeProperties properties;

    @Override
    public FrameResult decorate(String text, Instant timestamp, ContentData contentData, FormatOptions formatOptions) {
        try {
            List<String> warnings = new ArrayList<>();
            FormatOptions options = formatOptions != null ? formatOptions : FormatOptions.DEFAULT;
            List<String> lines = contentLines(text == null ? "" : text, options, warnings);
            List<Integer> colorBar = colorBar(contentData);
            int[][] layout = new int[CharacterConverter.ROWS][];
            for (int row = 0; row < CONTENT_ROWS; row++) {
                layout[row] = withColor(CharacterConverter.lineToCodes(lines.get(row), CONTENT_COLS), colorBar.get(row));
            }
            Instant at = timestamp != null ? timestamp : Instant.now();
            layout[CONTENT_ROWS] = withColor(infoBar(at, contentData), colorBar.get(CONTENT_ROWS));
            return new FrameResult(layout, warnings);
        } catch (RuntimeException e) {
            log.warn("Frame decoration failed, using minimal frame", e);
            return new FrameResult(minimalLayout(text), List.of("Frame generation failed: " + e.getMessage()));
        }
    }

    private List<String> contentLines(String text, FormatOptions options, List<String> warnings) {
        String upper = CharacterConverter.normalize(text).toUpperCase(Locale.ROOT);
        Set<String> unsupported = new LinkedHashSet<>();
        StringBuilder sanitized = new StringBuilder();
        for (char character : upper.toCharArray()) {
            if (character == '\n' || CharacterConverter.isSupported(character)) {
                sanitized.append(character);
            } else {
                unsupported.add(String.valueOf(character));
                sanitized.append(' ');
            }
        }
        if (!unsupported.isEmpty()) {
            warnings.add("Unsupported characters replaced with space: " + String.join(", ", unsupported));
        }

        List<String> wrapped = CharacterConverter.wrapText(sanitized.toString(), CONTENT_COLS);
        if (wrapped.size() > CONTENT_ROWS) {
            warnings.add("Content truncated: " + wrapped.size() + " lines reduced to " + CONTENT_ROWS);
            wrapped = wrapped.subList(0, CONTENT_ROWS);
        }
        int top = options.verticalCenter() ? (CONTENT_ROWS - wrapped.size()) / 2 : 0;
        List<String> lines = new ArrayList<>();
        for (int row = 0; row < CONTENT_ROWS; row++) {
            int index = row - top;
            String line = index >= 0 && index < wrapped.size() ? wrapped.get(index) : "";
            lines.add(options.textAlign() == FormatOptions.TextAlign.CENTER
                    ? CharacterConverter.center(line.strip(), CONTENT_COLS)
                    : CharacterConverter.padRight(line, CONTENT_COLS));
        }
        return lines;
    }

    int[] infoBar(Instant timestamp, ContentData contentData) {
        ZonedDateTime time = timestamp.atZone(ZoneId.of(properties.getFrame().getZone()));
        String info = DAY.format(time).toUpperCase(Locale.ROOT)
                + " " + time.getDayOfMonth() + MONTH.format(time).toUpperCase(Locale.ROOT)
                + " " + TIME.format(time);
        int colorPosition = -1;
        ContentData.Weather weather = contentData != null ? contentData.weather() : null;
        if (weather != null) {
            colorPosition = info.length() + 1;
            info = info + "  " + weather.temperature() + unitLetter(weather.unit());
        }
        int[] codes = CharacterConverter.lineToCodes(CharacterConverter.padRight(info, CONTENT_COLS), CONTENT_COLS);
        if (weather != null && weather.colorCode() != null && colorPosition < CONTENT_COLS) {
            codes[colorPosition] = weather.colorCode();
        }
        return codes;
    }

    private static String unitLetter(String unit) {
        return unit != null && unit.toUpperCase(Locale.ROOT).contains("C") ? "C" : "F";
    }

    private List<Integer> colorBar(ContentData contentData) {
        List<Integer> source = contentData != null && !contentData.colorBar().isEmpty()
                ? contentData.colorBar()
                : properties.getFrame().getColorBar();
        List<Integer> bar = new ArrayList<>();
        for (int row = 0; row < CharacterConverter.ROWS; row++) {
            Integer code = row < source.size() ? source.get(row) : null;
            bar.add(code != null ? code : CharacterConverter.WHITE);
        }
        return bar;
    }

    private static int[] withColor(int[] contentCodes, int color) {
        int[] row = new int[CharacterConverter.COLS];
        System.arraycopy(contentCodes, 0, row, 0, Math.min(contentCodes.length, CONTENT_COLS));
        row[CharacterConverter.COLS - 1] = color;
        return row;
    }

    private static int[][] minimalLayout(String text) {
        int[][] layout = new int[CharacterConverter.ROWS][CharacterConverter.COLS];
        String first = text == null ? "" : text.split("\n", 2)[0].toUpperCase(Locale.ROOT);
        for (int col = 0; col < CharacterConverter.COLS && col < first.length(); col++) {
            layout[0][col] = CharacterConverter.charToCode(first.charAt(col));
        }
        return layout;
    }
}
