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
package net.boyechko.surveyor.report;

import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.surveyor.analysis.DiagnosticRecord;

/** Renders findings and run statistics as stable, line-oriented text. */
public final class DiagnosticFormatter {
    private DiagnosticFormatter() {}

    /** Returns {@code path:line:column: SEVERITY message}. */
    public static String format(String path, DiagnosticRecord record) {
        return path
                + ":"
                + record.line()
                + ":"
                + record.column()
                + ": "
                + record.severity()
                + " "
                + record.message();
    }

    /**
     * Writes one line per record and flushes, so output of a file is visible even if the run ends
     * right after it.
     */
    public static void formatFile(PrintStream out, String path, List<DiagnosticRecord> records) {
        for (DiagnosticRecord record : records) {
            out.println(format(path, record));
        }
        out.flush();
    }

    /**
     * Summary lines in fixed order. Roots processed, roots skipped and findings always come first,
     * even when zero.
     */
    public static List<String> summaryLines(RunSummary summary) {
        List<String> lines = new ArrayList<>();
        lines.add("Roots processed: " + summary.rootsProcessed());
        lines.add("Roots skipped: " + summary.rootsSkipped());
        lines.add("Findings: " + summary.findingsReported());
        lines.add(
                "Files analyzed: "
                        + summary.filesAnalyzed()
                        + (summary.filesFailed() > 0
                                ? " (" + summary.filesFailed() + " failed)"
                                : ""));
        if (summary.visitorsDisabled() > 0) {
            lines.add("Visitors disabled: " + summary.visitorsDisabled());
        }
        lines.add("Elapsed: " + formatElapsed(summary.elapsed()));
        return lines;
    }

    static String formatElapsed(Duration elapsed) {
        long millis = elapsed.toMillis();
        if (millis < 1000) {
            return millis + " ms";
        }
        return String.format("%d.%03d s", millis / 1000, millis % 1000);
    }
}
