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

import java.util.Comparator;
import java.util.Objects;

/**
 * One finding reported for a file.
 *
 * @param line 1-based line
 * @param column 1-based column
 * @param severity category of the finding
 * @param message single-line description
 * @param lineInfo line table of the file the finding belongs to
 */
public record DiagnosticRecord(
        int line, int column, Severity severity, String message, LineInfo lineInfo) {

    public static final Comparator<DiagnosticRecord> BY_POSITION =
            Comparator.comparingInt(DiagnosticRecord::line)
                    .thenComparingInt(DiagnosticRecord::column);

    public DiagnosticRecord {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException(
                    "Position must be 1-based, got " + line + ":" + column);
        }
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
    }
}
