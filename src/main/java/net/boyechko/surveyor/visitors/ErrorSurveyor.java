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
package net.boyechko.surveyor.visitors;

import java.io.PrintStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import net.boyechko.surveyor.analysis.DiagnosticRecord;
import net.boyechko.surveyor.analysis.FileResult;
import net.boyechko.surveyor.analysis.Severity;
import net.boyechko.surveyor.discovery.AnalysisRoot;
import net.boyechko.surveyor.report.DiagnosticFormatter;
import net.boyechko.surveyor.visitor.Continuation;
import net.boyechko.surveyor.visitor.ErrorReporter;
import net.boyechko.surveyor.visitor.PostAnalysisCallback;
import net.boyechko.surveyor.visitor.PreAnalysisCallback;
import net.boyechko.surveyor.visitor.Progress;
import net.boyechko.surveyor.visitor.RunFinishedCallback;

/** Prints every finding above lint level, one line per finding, and totals them per severity. */
public class ErrorSurveyor
        implements PreAnalysisCallback, ErrorReporter, PostAnalysisCallback, RunFinishedCallback {

    static final Set<Severity> IGNORED = EnumSet.of(Severity.HINT, Severity.LINT, Severity.TODO);

    private final PrintStream out;
    private final Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
    private AnalysisRoot currentRoot;

    public ErrorSurveyor(PrintStream out) {
        this.out = out;
    }

    @Override
    public String name() {
        return "errors";
    }

    @Override
    public void preAnalysis(AnalysisRoot root, boolean isSubRoot, Progress progress) {
        currentRoot = root;
        String name = isSubRoot ? root.displayName() : root.name();
        out.println("Analyzing '" + name + "' • " + progress + "...");
    }

    @Override
    public boolean showError(DiagnosticRecord record) {
        return !IGNORED.contains(record.severity());
    }

    @Override
    public void reportErrors(FileResult.Analyzed result) {
        if (result.diagnostics().isEmpty()) {
            return;
        }
        String path =
                currentRoot != null
                        ? currentRoot.displayName() + "/" + result.relativePath()
                        : result.relativePath();
        DiagnosticFormatter.formatFile(out, path, result.diagnostics());
        for (DiagnosticRecord record : result.diagnostics()) {
            counts.merge(record.severity(), 1, Integer::sum);
        }
    }

    @Override
    public Continuation postAnalysis(AnalysisRoot root, Progress progress) {
        currentRoot = null;
        return Continuation.CONTINUE;
    }

    @Override
    public void onRunFinished() {
        if (counts.isEmpty()) {
            out.println("No findings");
        } else {
            out.println(
                    "Found "
                            + total()
                            + " findings ("
                            + counts.entrySet().stream()
                                    .map(e -> e.getValue() + " " + e.getKey())
                                    .collect(Collectors.joining(", "))
                            + ")");
        }
        out.flush();
    }

    public Map<Severity, Integer> counts() {
        return Collections.unmodifiableMap(counts);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
