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
package net.boyechko.surveyor.core;

import static net.boyechko.surveyor.core.ScriptedAnalysisEngine.analyzed;
import static net.boyechko.surveyor.core.ScriptedAnalysisEngine.failed;
import static org.junit.jupiter.api.Assertions.*;

import com.github.javaparser.StaticJavaParser;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.surveyor.analysis.DiagnosticRecord;
import net.boyechko.surveyor.analysis.FileResult;
import net.boyechko.surveyor.analysis.LineInfo;
import net.boyechko.surveyor.analysis.Severity;
import net.boyechko.surveyor.report.RunSummary;
import net.boyechko.surveyor.visitor.SurveyVisitor;
import net.boyechko.surveyor.visitor.VisitorRegistration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DriverTest {
    @TempDir Path tempDir;

    private final List<String> events = new ArrayList<>();
    private final ScriptedAnalysisEngine engine = new ScriptedAnalysisEngine();

    @Test
    void preAndPostCountsMatchRootsEntered() throws IOException {
        RecordingVisitor visitor = new RecordingVisitor("v", events);

        RunSummary summary = run(config(container("r1", "r2", "r3")).build(), visitor);

        assertEquals(3, visitor.count("pre"));
        assertEquals(3, visitor.count("post"));
        assertEquals(1, visitor.count("finished"));
        assertEquals(3, summary.rootsProcessed());
        assertEquals(List.of("r1", "r2", "r3"), engine.opened);
        assertEquals(3, engine.closed, "Every opened handle should be closed");
        assertTrue(summary.completed());
    }

    @Test
    void progressCountsFromOneOverTotal() throws IOException {
        RecordingVisitor visitor = new RecordingVisitor("v", events);

        run(config(container("r1", "r2")).build(), visitor);

        assertTrue(events.contains("v:pre:r1[1/2]"));
        assertTrue(events.contains("v:pre:r2[2/2]"));
    }

    @Test
    void debugLimitStopsBeforeOpeningTheNextRoot() throws IOException {
        RecordingVisitor visitor = new RecordingVisitor("v", events);

        RunSummary summary =
                run(config(container("r1", "r2", "r3", "r4", "r5")).debugLimit(2).build(), visitor);

        assertEquals(List.of("r1", "r2"), engine.opened);
        assertEquals(2, visitor.count("pre"));
        assertEquals(2, visitor.count("post"));
        assertEquals(1, visitor.count("finished"));
        assertTrue(summary.limitReached());
    }

    @Test
    void zeroDebugLimitEntersNoRoot() throws IOException {
        RecordingVisitor visitor = new RecordingVisitor("v", events);

        run(config(container("r1", "r2")).debugLimit(0).build(), visitor);

        assertTrue(engine.opened.isEmpty());
        assertEquals(List.of("v:finished"), events);
    }

    @Test
    void stopAfterSecondRootSkipsTheRest() throws IOException {
        RecordingVisitor visitor = new RecordingVisitor("v", events);
        visitor.stopAfterRoot = "r2";

        RunSummary summary =
                run(config(container("r1", "r2", "r3", "r4", "r5")).build(), visitor);

        assertEquals(List.of("r1", "r2"), engine.opened);
        assertEquals(2, visitor.count("pre"));
        assertEquals(1, visitor.count("finished"));
        assertEquals("v:finished", events.get(events.size() - 1));
        assertEquals(2, summary.rootsProcessed());
        assertTrue(summary.stopped());
    }

    @Test
    void stopFromOneVisitorStillRunsPostAnalysisOfTheOthers() throws IOException {
        RecordingVisitor first = new RecordingVisitor("first", events);
        RecordingVisitor second = new RecordingVisitor("second", events);
        first.stopAfterRoot = "r1";

        run(config(container("r1", "r2")).build(), first, second);

        assertEquals(1, second.count("post"));
        assertEquals(List.of("r1"), engine.opened);
    }

    @Test
    void zeroRootsStillFinishesOnce() throws IOException {
        Path empty = Files.createDirectory(tempDir.resolve("empty"));
        RecordingVisitor visitor = new RecordingVisitor("v", events);

        RunSummary summary = run(config(empty).build(), visitor);

        assertEquals(List.of("v:finished"), events);
        assertEquals(0, summary.rootsDiscovered());
        assertEquals(0, summary.rootsProcessed());
        assertTrue(engine.opened.isEmpty());
    }

    @Test
    void fileFailureDoesNotStopTheRoot() throws IOException {
        engine.script(
                "r1",
                analyzed("a.java"),
                analyzed("b.java"),
                failed("c.java"),
                analyzed("d.java"),
                analyzed("e.java"));
        RecordingVisitor visitor = new RecordingVisitor("v", events);
        List<String> failures = new ArrayList<>();
        SurveyListener listener =
                new NoOpSurveyListener() {
                    @Override
                    public void onFileFailed(FileResult.Failed failure) {
                        failures.add(failure.relativePath());
                    }
                };

        Driver driver =
                new Driver.DriverBuilder()
                        .withConfiguration(config(container("r1")).build())
                        .withEngine(engine)
                        .withListener(listener)
                        .addVisitor(visitor)
                        .build();
        RunSummary summary = driver.analyze();

        assertEquals(
                List.of("v:file:a.java", "v:file:b.java", "v:file:d.java", "v:file:e.java"),
                events.stream().filter(e -> e.startsWith("v:file:")).toList());
        assertEquals(List.of("c.java"), failures);
        assertEquals(4, summary.filesAnalyzed());
        assertEquals(1, summary.filesFailed());
        assertEquals(1, visitor.count("post"));
    }

    @Test
    void visitorWithoutCapabilitiesIsAccepted() throws IOException {
        SurveyVisitor bare = new SurveyVisitor() {};

        Driver driver =
                new Driver.DriverBuilder()
                        .withConfiguration(config(container("r1", "r2")).build())
                        .withEngine(engine)
                        .withListener(new NoOpSurveyListener())
                        .addVisitor(bare)
                        .build();
        RunSummary summary = driver.analyze();

        VisitorRegistration registration = driver.registrations().get(0);
        assertTrue(registration.capabilities().isEmpty());
        assertEquals(2, summary.rootsProcessed());
        assertEquals(DriverState.FINISHED, driver.state());
    }

    @Test
    void hooksRunInFixedOrderAndRegistrationOrder() throws IOException {
        RecordingVisitor first = new RecordingVisitor("first", events);
        RecordingVisitor second = new RecordingVisitor("second", events);

        run(config(container("r1")).build(), first, second);

        assertEquals(
                List.of(
                        "first:pre:r1[1/1]",
                        "second:pre:r1[1/1]",
                        "first:file:A.java",
                        "second:file:A.java",
                        "first:errors:A.java:0",
                        "second:errors:A.java:0",
                        "first:post:r1",
                        "second:post:r1",
                        "first:finished",
                        "second:finished"),
                events);
    }

    @Test
    void abortPolicyPropagatesAndSkipsRunFinished() throws IOException {
        RecordingVisitor visitor = new RecordingVisitor("v", events);
        visitor.failInHook = "preAnalysis";
        visitor.failOnRoot = "r2";
        List<RunSummary> summaries = new ArrayList<>();
        SurveyListener listener =
                new NoOpSurveyListener() {
                    @Override
                    public void onSummary(RunSummary summary) {
                        summaries.add(summary);
                    }
                };

        Driver driver =
                new Driver.DriverBuilder()
                        .withConfiguration(config(container("r1", "r2", "r3")).build())
                        .withEngine(engine)
                        .withListener(listener)
                        .addVisitor(visitor)
                        .build();

        VisitorException e = assertThrows(VisitorException.class, driver::analyze);
        assertEquals("v", e.visitorName());
        assertEquals("preAnalysis", e.hook());
        assertEquals(0, visitor.count("finished"));
        assertEquals(List.of("r1", "r2"), engine.opened);
        assertEquals(2, engine.closed, "Handle of the failing root should be closed");
        assertEquals(1, summaries.size(), "Summary should be reported even when aborted");
        assertTrue(summaries.get(0).aborted());
        assertEquals(1, summaries.get(0).rootsProcessed());
    }

    @Test
    void disablePolicyDropsOnlyTheFailingVisitor() throws IOException {
        RecordingVisitor failing = new RecordingVisitor("failing", events);
        RecordingVisitor healthy = new RecordingVisitor("healthy", events);
        failing.failInHook = "preAnalysis";

        RunSummary summary =
                run(
                        config(container("r1", "r2", "r3"))
                                .visitorFailurePolicy(VisitorFailurePolicy.DISABLE_VISITOR)
                                .build(),
                        failing,
                        healthy);

        assertEquals(0, failing.count("pre"));
        assertEquals(0, failing.count("post"));
        assertEquals(0, failing.count("finished"));
        assertEquals(3, healthy.count("pre"));
        assertEquals(1, healthy.count("finished"));
        assertEquals(1, summary.visitorsDisabled());
        assertEquals(3, summary.rootsProcessed());
    }

    @Test
    void showErrorsOffSkipsErrorReports() throws IOException {
        engine.script("r1", analyzed("A.java", record(Severity.ERROR)));
        RecordingVisitor visitor = new RecordingVisitor("v", events);

        RunSummary summary = run(config(container("r1")).showErrors(false).build(), visitor);

        assertEquals(0, visitor.count("errors"));
        assertEquals(1, visitor.count("file"));
        assertEquals(0, summary.findingsReported());
    }

    @Test
    void nodeTraversalRunsOnlyWhenUnitsAreResolved() throws IOException {
        engine.script("r1", analyzed("Foo.java", StaticJavaParser.parse("class Foo { class Bar {} }")));
        RecordingVisitor visitor = new RecordingVisitor("v", events);

        run(config(container("r1")).resolveUnits(true).build(), visitor);

        assertEquals(
                List.of("v:node:Foo", "v:node:Bar"),
                events.stream().filter(e -> e.startsWith("v:node:")).toList());
    }

    @Test
    void nodeTraversalIsSkippedWithoutResolvedUnits() throws IOException {
        engine.script("r1", analyzed("Foo.java", StaticJavaParser.parse("class Foo {}")));
        RecordingVisitor visitor = new RecordingVisitor("v", events);

        run(config(container("r1")).resolveUnits(false).build(), visitor);

        assertEquals(0, visitor.count("node"));
    }

    @Test
    void eachVisitorFiltersItsOwnFindings() throws IOException {
        engine.script("r1", analyzed("A.java", record(Severity.ERROR), record(Severity.TODO)));
        RecordingVisitor strict = new RecordingVisitor("strict", events);
        RecordingVisitor everything = new RecordingVisitor("everything", events);
        strict.filter = r -> r.severity() != Severity.TODO;

        RunSummary summary = run(config(container("r1")).build(), strict, everything);

        assertTrue(events.contains("strict:errors:A.java:1"));
        assertTrue(events.contains("everything:errors:A.java:2"));
        assertEquals(3, summary.findingsReported());
    }

    @Test
    void rootThatCannotBeOpenedIsSkipped() throws IOException {
        engine.failToOpen("r2");
        RecordingVisitor visitor = new RecordingVisitor("v", events);

        RunSummary summary = run(config(container("r1", "r2", "r3")).build(), visitor);

        assertFalse(events.stream().anyMatch(e -> e.contains("r2")));
        assertEquals(2, summary.rootsProcessed());
        assertEquals(1, summary.rootsSkipped());
        assertEquals(1, visitor.count("finished"));
    }

    @Test
    void missingInputCountsAsSkipped() throws IOException {
        Path project = container("r1").resolve("r1");
        RunConfiguration config =
                config(project).addRootPath(tempDir.resolve("missing")).build();

        RunSummary summary = run(config, new RecordingVisitor("v", events));

        assertEquals(1, summary.rootsProcessed());
        assertEquals(1, summary.rootsSkipped());
    }

    @Test
    void driverRunsOnlyOnce() throws IOException {
        Driver driver =
                new Driver.DriverBuilder()
                        .withConfiguration(config(container("r1")).build())
                        .withEngine(engine)
                        .withListener(new NoOpSurveyListener())
                        .build();
        driver.analyze();

        assertThrows(IllegalStateException.class, driver::analyze);
    }

    @Test
    void builderRequiresConfiguration() {
        assertThrows(IllegalStateException.class, () -> new Driver.DriverBuilder().build());
    }

    private RunSummary run(RunConfiguration config, SurveyVisitor... visitors) {
        Driver.DriverBuilder builder =
                new Driver.DriverBuilder()
                        .withConfiguration(config)
                        .withEngine(engine)
                        .withListener(new NoOpSurveyListener());
        for (SurveyVisitor visitor : visitors) {
            builder.addVisitor(visitor);
        }
        return builder.build().analyze();
    }

    private RunConfiguration.Builder config(Path input) {
        return RunConfiguration.builder().addRootPath(input).showErrors(true);
    }

    /** Creates a directory holding one project directory per name. */
    private Path container(String... names) throws IOException {
        Path container = Files.createDirectories(tempDir.resolve("projects"));
        for (String name : names) {
            Path project = Files.createDirectory(container.resolve(name));
            Files.writeString(project.resolve("pom.xml"), "<project/>");
        }
        return container;
    }

    private static DiagnosticRecord record(Severity severity) {
        return new DiagnosticRecord(1, 1, severity, severity + " finding", LineInfo.of(""));
    }
}
