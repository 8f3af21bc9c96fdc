/*
 * Surveyor - Multi-Project Source Survey Driver
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.surveyor.analysis;

import java.util.Arrays;

/**
 * Line-start offset table for one source file. Converts 0-based character offsets into 1-based
 * line and column numbers. Recognizes {@code \n}, {@code \r\n} and lone {@code \r} line breaks.
 */
public final class LineInfo {
    private final int[] lineStarts;
    private final int length;

    private LineInfo(int[] lineStarts, int length) {
        this.lineStarts = lineStarts;
        this.length = length;
    }

    public static LineInfo of(String text) {
        int[] starts = new int[16];
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                i++;
            } else if (c != '\n' && c != '\r') {
                continue;
            }
            if (count == starts.length) {
                starts = Arrays.copyOf(starts, count * 2);
            }
            starts[count++] = i + 1;
        }
        return new LineInfo(Arrays.copyOf(starts, count), text.length());
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /** Returns the offset of the first character of the given 1-based line. */
    public int getOffsetOfLine(int lineNumber) {
        if (lineNumber < 1 || lineNumber > lineStarts.length) {
            throw new IndexOutOfBoundsException(
                    "Line " + lineNumber + " outside 1.." + lineStarts.length);
        }
        return lineStarts[lineNumber - 1];
    }

    public Location getLocation(int offset) {
        if (offset < 0 || offset > length) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside 0.." + length);
        }
        int index = Arrays.binarySearch(lineStarts, offset);
        int line = index >= 0 ? index : -index - 2;
        return new Location(line + 1, offset - lineStarts[line] + 1);
    }

    public record Location(int lineNumber, int columnNumber) {
        @Override
        public String toString() {
            return lineNumber + ":" + columnNumber;
        }
    }
}
