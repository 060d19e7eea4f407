package io.templatexform.core.parse;

import java.util.Arrays;

/** Maps character offsets of a source text to 1-based lines and 0-based columns. */
public final class LineMap {

    private final int[] lineStarts;

    public LineMap(String source) {
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\n' || (c == '\r' && (i + 1 >= source.length() || source.charAt(i + 1) != '\n'))) {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
    }

    /** 1-based line of the given offset. */
    public int line(int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        return index >= 0 ? index + 1 : -index - 1;
    }

    /** 0-based column of the given offset. */
    public int column(int offset) {
        return offset - lineStarts[line(offset) - 1];
    }

    public int lineCount() {
        return lineStarts.length;
    }
}
