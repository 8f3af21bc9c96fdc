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
import java.util.ArrayList;
import java.util.List;
import net.boyechko.surveyor.analysis.FileResult;
import net.boyechko.surveyor.core.AnalysisPass;
import net.boyechko.surveyor.core.SurveyListener;
import net.boyechko.surveyor.core.VerbosityLevel;
import net.boyechko.surveyor.discovery.AnalysisRoot;
import net.boyechko.surveyor.discovery.DiscoveryResult;
import net.boyechko.surveyor.visitor.Progress;

/** Console {@link SurveyListener}: short status lines, and a boxed summary at the end. */
public class SurveyReporter implements SurveyListener {
    private final PrintStream output;
    private final VerbosityLevel verbosity;

    private static final String SUCCESS = "✓";
    private static final String ERROR = "⛔️";
    private static final String WARNING = "✗";
    private static final String INFO = "○";

    private static final String INDENT = "│ ";
    private static final int HEADER_WIDTH = 68;
    private static final int LINE_WIDTH = 80;

    public SurveyReporter(PrintStream output, VerbosityLevel verbosity) {
        this.output = output;
        this.verbosity = verbosity;
    }

    @Override
    public void onDiscovery(DiscoveryResult result) {
        if (result.wasExpanded()) {
            printLine(
                    "Found " + result.total() + " roots in '" + result.container() + "'", INFO);
        } else {
            printLine("Surveying " + result.total() + " roots", INFO);
        }
        if (result.nestedCount() > 0) {
            printLine("Including " + result.nestedCount() + " nested roots", INFO);
        }
    }

    @Override
    public void onRootStart(AnalysisRoot root, Progress progress) {
        printLine("Opened " + root.displayName() + " " + progress, INFO, VerbosityLevel.VERBOSE);
    }

    @Override
    public void onRootFinished(AnalysisPass pass) {
        String message = pass.root().displayName() + ": " + pass.filesAnalyzed() + " files";
        if (!pass.failures().isEmpty()) {
            message += ", " + pass.failures().size() + " failed";
        }
        printLine(message, SUCCESS, VerbosityLevel.VERBOSE);
    }

    @Override
    public void onRootSkipped(AnalysisRoot root, String reason) {
        printLine("Skipping '" + root.displayName() + "': " + reason, ERROR, VerbosityLevel.QUIET);
    }

    @Override
    public void onFileFailed(FileResult.Failed failure) {
        printLine("Could not analyze " + failure.relativePath() + ": " + failure.reason(), WARNING);
    }

    @Override
    public void onSummary(RunSummary summary) {
        printBoxHeader("Summary");
        for (String line : DiagnosticFormatter.summaryLines(summary)) {
            printLine(line, INFO, VerbosityLevel.QUIET);
        }
        if (summary.aborted()) {
            printLine("Run aborted by a visitor failure", ERROR, VerbosityLevel.QUIET);
        } else if (summary.stopped()) {
            printLine("Run stopped early by a visitor", INFO, VerbosityLevel.QUIET);
        } else if (summary.limitReached()) {
            printLine("Run cut short by the debug limit", INFO, VerbosityLevel.QUIET);
        }
        printBoxFooter();
        output.flush();
    }

    @Override
    public void onError(String message) {
        printLine(message, ERROR, VerbosityLevel.QUIET);
    }

    @Override
    public void onInfo(String message) {
        printLine(message, INFO);
    }

    private void printBoxHeader(String title) {
        int filler = Math.max(0, HEADER_WIDTH - title.length() - 1);
        output.println("┌─ " + title + " " + "─".repeat(filler) + "─╮");
        output.println("│");
    }

    private void printBoxFooter() {
        output.println("│");
        output.println("└─╯");
    }

    /**
     * Prints an indented line with the given icon, word-wrapping long messages. Continuation lines
     * are aligned with the message start.
     */
    private void printLine(String message, String icon, VerbosityLevel level) {
        if (!verbosity.shouldShow(level)) {
            return;
        }
        String prefix = INDENT + icon + " ";
        String continuationPrefix = INDENT + "  ";
        List<String> lines = wordWrap(message, LINE_WIDTH);
        if (lines.isEmpty()) {
            output.println(prefix);
            return;
        }
        output.println(prefix + lines.get(0));
        for (int i = 1; i < lines.size(); i++) {
            output.println(continuationPrefix + lines.get(i));
        }
    }

    private void printLine(String message, String icon) {
        printLine(message, icon, VerbosityLevel.NORMAL);
    }

    static List<String> wordWrap(String text, int maxWidth) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (text.length() <= maxWidth) {
            return List.of(text);
        }

        List<String> lines = new ArrayList<>();
        StringBuilder currentLine = new StringBuilder();
        for (String word : text.split(" ")) {
            if (currentLine.isEmpty()) {
                currentLine.append(word);
            } else if (currentLine.length() + 1 + word.length() <= maxWidth) {
                currentLine.append(' ').append(word);
            } else {
                lines.add(currentLine.toString());
                currentLine.setLength(0);
                currentLine.append(word);
            }
        }
        if (!currentLine.isEmpty()) {
            lines.add(currentLine.toString());
        }
        return lines;
    }
}
