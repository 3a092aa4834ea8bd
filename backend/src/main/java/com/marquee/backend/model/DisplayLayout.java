package com.marquee.backend.model;

import java.util.Arrays;
import java.util.List;

/**
 * A full-board frame. Pattern generators fill {@code characterCodes}; text-art generators may only
 * provide {@code rows}, which are converted to codes before sending.
 */
public record DisplayLayout(int[][] characterCodes, List<String> rows) {

    public DisplayLayout {
        rows = rows == null ? List.of() : List.copyOf(rows);
        characterCodes = characterCodes == null ? null : deepCopy(characterCodes);
    }

    public static DisplayLayout ofCodes(int[][] characterCodes) {
        return new DisplayLayout(characterCodes, List.of());
    }

    public static DisplayLayout ofRows(List<String> rows) {
        return new DisplayLayout(null, rows);
    }

    public boolean hasCharacterCodes() {
        return characterCodes != null && characterCodes.length > 0;
    }

    @Override
    public int[][] characterCodes() {
        return characterCodes == null ? null : deepCopy(characterCodes);
    }

    private static int[][] deepCopy(int[][] source) {
        int[][] copy = new int[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i] == null ? new int[0] : Arrays.copyOf(source[i], source[i].length);
        }
        return copy;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DisplayLayout that)) {
            return false;
        }
        return Arrays.deepEquals(characterCodes, that.characterCodes) && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.deepHashCode(characterCodes) + rows.hashCode();
    }

    @Override
    public String toString() {
        return "DisplayLayout{rows=" + rows + ", characterCodes=" + Arrays.deepToString(characterCodes) + "}";
    }
}
