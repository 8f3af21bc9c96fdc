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

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.boyechko.surveyor.analysis.DiagnosticRecord;
import net.boyechko.surveyor.analysis.FileResult;
import net.boyechko.surveyor.analysis.LineInfo;
import net.boyechko.surveyor.analysis.Severity;
import net.boyechko.surveyor.core.Driver;
import net.boyechko.surveyor.core.RunConfiguration;
import net.boyechko.surveyor.discovery.AnalysisRoot;
import net.boyechko.surveyor.report.LoggingListener;
import net.boyechko.surveyor.report.RunSummary;
import net.boyechko.surveyor.visitor.Continuation;
import net.boyechko.surveyor.visitor.Progress;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class ErrorSurveyorTest {
    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
    private final ErrorSurveyor surveyor = new ErrorSurveyor(out);

    @TempDir Path tempDir;

    @Test
    void announcesEachRootWithProgress() {
        surveyor.preAnalysis(AnalysisRoot.of(Path.of("/work/app"), 0), false, new Progress(1, 2));
        surveyor.preAnalysis(
                new AnalysisRoot(Path.of("/work/app/core"), "app", 1), true, new Progress(2, 2));

        assertEquals(
                List.of("Analyzing 'app' • [1/2]...", "Analyzing 'app/core' • [2/2]..."),
                lines());
    }

    @ParameterizedTest
    @EnumSource(
            value = Severity.class,
            names = {"HINT", "LINT", "TODO"})
    void lowSeveritiesAreFilteredOut(Severity severity) {
        assertFalse(surveyor.showError(record(1, 1, severity)));
    }

    @ParameterizedTest
    @EnumSource(
            value = Severity.class,
            names = {"ERROR", "WARNING", "INFO"})
    void otherSeveritiesAreShown(Severity severity) {
        assertTrue(surveyor.showError(record(1, 1, severity)));
    }

    @Test
    void printsFindingsQualifiedWithTheRoot() {
        surveyor.preAnalysis(AnalysisRoot.of(Path.of("/work/app"), 0), false, new Progress(1, 1));
        bytes.reset();

        surveyor.reportErrors(
                analyzed(
                        "src/A.java",
                        record(3, 5, Severity.ERROR),
                        record(7, 1, Severity.WARNING)));

        assertEquals(
                List.of(
                        "app/src/A.java:3:5: ERROR ERROR finding",
                        "app/src/A.java:7:1: WARNING WARNING finding"),
                lines());
    }

    @Test
    void totalsArePrintedAtRunEnd() {
        surveyor.preAnalysis(AnalysisRoot.of(Path.of("/work/app"), 0), false, new Progress(1, 1));
        surveyor.reportErrors(analyzed("A.java", record(1, 1, Severity.ERROR)));
        surveyor.reportErrors(analyzed("B.java"));
        surveyor.reportErrors(
                analyzed("C.java", record(1, 1, Severity.ERROR), record(2, 1, Severity.WARNING)));
        assertEquals(
                Continuation.CONTINUE,
                surveyor.postAnalysis(AnalysisRoot.of(Path.of("/work/app"), 0), new Progress(1, 1)));
        bytes.reset();

        surveyor.onRunFinished();

        assertEquals(3, surveyor.total());
        assertEquals(2, surveyor.counts().get(Severity.ERROR));
        assertEquals(List.of("Found 3 findings (2 ERROR, 1 WARNING)"), lines());
    }

    @Test
    void runWithoutFindingsSaysSo() {
        surveyor.onRunFinished();
        assertEquals(List.of("No findings"), lines());
    }

    @Test
    void surveysRealProjectsEndToEnd() throws IOException {
        Path projects = Files.createDirectory(tempDir.resolve("projects"));
        Path app = Files.createDirectory(projects.resolve("app"));
        Files.writeString(app.resolve("pom.xml"), "<project/>");
        Files.writeString(app.resolve("Broken.java"), "class Broken {\n  void m( {}\n}\n");
        Files.writeString(app.resolve("Fine.java"), "class Fine {\n  // TODO later\n}\n");
        Path lib = Files.createDirectory(projects.resolve("lib"));
        Files.writeString(lib.resolve("build.gradle"), "");
        Files.writeString(lib.resolve("Lib.java"), "class Lib {}\n");

        RunConfiguration config =
                RunConfiguration.builder()
                        .addRootPath(projects)
                        .showErrors(true)
                        .forceSkipInstall(true)
                        .build();
        RunSummary summary =
                new Driver.DriverBuilder()
                        .withConfiguration(config)
                        .withListener(new LoggingListener())
                        .addVisitor(surveyor)
                        .build()
                        .analyze();

        List<String> lines = lines();
        assertEquals("Analyzing 'app' • [1/2]...", lines.get(0));
        assertTrue(lines.contains("Analyzing 'lib' • [2/2]..."));
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("app/Broken.java:") && l.contains(" ERROR ")));
        assertTrue(lines.stream().noneMatch(l -> l.contains("TODO")));
        assertEquals(2, summary.rootsProcessed());
        assertEquals(surveyor.total(), summary.findingsReported());
    }

    private List<String> lines() {
        return bytes.toString(StandardCharsets.UTF_8).lines().toList();
    }

    private static FileResult.Analyzed analyzed(String relativePath, DiagnosticRecord... records) {
        return new FileResult.Analyzed(
                Path.of(relativePath), relativePath, null, List.of(records), LineInfo.of(""));
    }

    private static DiagnosticRecord record(int line, int column, Severity severity) {
        return new DiagnosticRecord(line, column, severity, severity + " finding", LineInfo.of(""));
    }
}
