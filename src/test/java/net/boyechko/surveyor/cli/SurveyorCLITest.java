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
package net.boyechko.surveyor.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import net.boyechko.surveyor.core.RunConfiguration;
import net.boyechko.surveyor.core.SurveyorSettings;
import net.boyechko.surveyor.core.VerbosityLevel;
import net.boyechko.surveyor.core.VisitorFailurePolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SurveyorCLITest {
    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
    private final PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);

    @TempDir Path tempDir;

    @ParameterizedTest
    @ValueSource(strings = {"-h", "--help"})
    void helpPrintsUsage(String flag) {
        assertEquals(SurveyorCLI.EXIT_OK, SurveyorCLI.run(new String[] {flag}, out, err));
        assertTrue(stdout().startsWith("Usage:"));
    }

    @Test
    void noArgumentsIsAUsageError() {
        assertEquals(SurveyorCLI.EXIT_USAGE, SurveyorCLI.run(new String[] {}, out, err));
        assertTrue(stderr().startsWith("Error: No input directory specified"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"--frobnicate", "--visitor=lint", "--limit=many", "--limit=-1",
        "--on-visitor-error=ignore", "--exclude="})
    void invalidOptionsAreUsageErrors(String option) {
        int exit = SurveyorCLI.run(new String[] {option, tempDir.toString()}, out, err);

        assertEquals(SurveyorCLI.EXIT_USAGE, exit);
        assertTrue(stderr().startsWith("Error: "), stderr());
    }

    @Test
    void missingConfigFileIsAUsageError() {
        String[] args = {"--config=" + tempDir.resolve("none.yaml"), tempDir.toString()};

        assertEquals(SurveyorCLI.EXIT_USAGE, SurveyorCLI.run(args, out, err));
        assertTrue(stderr().contains("Config file not found"));
    }

    @Test
    void parsesFlagsIntoConfig() throws Exception {
        SurveyorCLI.CLIConfig config =
                SurveyorCLI.parseArguments(
                        new String[] {
                            "--visitor=identifiers,errors",
                            "--identifiers=record, sealed",
                            "--exclude=generated,target",
                            "--limit=3",
                            "--on-visitor-error=disable",
                            "--no-nested",
                            "--no-resolve",
                            "-r=out/report.txt",
                            "-v",
                            "a",
                            "b"
                        });

        assertEquals(List.of(Path.of("a"), Path.of("b")), config.inputPaths());
        assertEquals(List.of("identifiers", "errors"), config.visitors());
        assertEquals(Set.of("record", "sealed"), config.identifiers());
        assertEquals(Set.of("generated", "target"), config.excludedPaths());
        assertEquals(Integer.valueOf(3), config.limit());
        assertEquals(VisitorFailurePolicy.DISABLE_VISITOR, config.onVisitorError());
        assertTrue(config.noNested());
        assertEquals(Boolean.FALSE, config.resolveUnits());
        assertNull(config.showErrors());
        assertEquals(Path.of("out/report.txt"), config.reportPath());
        assertEquals(VerbosityLevel.VERBOSE, config.verbosity());
    }

    @Test
    void errorsVisitorDefaultsToShowingErrors() throws Exception {
        RunConfiguration config = configFor("a");

        assertTrue(config.showErrors());
        assertFalse(config.resolveUnits());
        assertFalse(config.forceSkipInstall());
    }

    @Test
    void identifiersVisitorDefaultsToResolvedUnitsWithoutInstall() throws Exception {
        RunConfiguration config = configFor("--visitor=identifiers", "a");

        assertFalse(config.showErrors());
        assertTrue(config.resolveUnits());
        assertTrue(config.forceSkipInstall());
    }

    @Test
    void explicitFlagsWinOverVisitorDefaults() throws Exception {
        RunConfiguration config =
                configFor("--visitor=identifiers", "--show-errors", "--no-resolve", "--install", "a");

        assertTrue(config.showErrors());
        assertFalse(config.resolveUnits());
        assertFalse(config.forceSkipInstall());
    }

    @Test
    void commandLineOverridesSettings() throws Exception {
        RunConfiguration config =
                configFor("--exclude=vendor", "--limit=0", "--no-nested", "--on-visitor-error=disable", "a");

        assertEquals(Set.of("target", "build", "vendor"), config.excludedPaths());
        assertEquals(Integer.valueOf(0), config.debugLimit());
        assertFalse(config.splitNestedRoots());
        assertEquals(VisitorFailurePolicy.DISABLE_VISITOR, config.visitorFailurePolicy());
    }

    @Test
    void surveysProjectsAndPrintsSummary() throws IOException {
        Path projects = projects();

        int exit = SurveyorCLI.run(new String[] {"-q", projects.toString()}, out, err);

        assertEquals(SurveyorCLI.EXIT_OK, exit, stderr());
        String text = stdout();
        assertTrue(text.contains("Analyzing 'app' • [1/2]..."));
        assertTrue(text.contains("app/Broken.java:"));
        assertTrue(text.contains("┌─ Summary"));
        assertTrue(text.contains("Roots processed: 2"));
    }

    @Test
    void debugLimitFlagCutsTheRunShort() throws IOException {
        Path projects = projects();

        int exit = SurveyorCLI.run(new String[] {"-q", "--limit=1", projects.toString()}, out, err);

        assertEquals(SurveyorCLI.EXIT_OK, exit);
        assertTrue(stdout().contains("Roots processed: 1"));
        assertFalse(stdout().contains("Analyzing 'lib'"));
    }

    @Test
    void reportFileReceivesACopyOfTheOutput() throws IOException {
        Path projects = projects();
        Path report = tempDir.resolve("reports/survey.txt");

        int exit =
                SurveyorCLI.run(
                        new String[] {"-q", "--report=" + report, projects.toString()}, out, err);

        assertEquals(SurveyorCLI.EXIT_OK, exit);
        String saved = Files.readString(report, StandardCharsets.UTF_8);
        assertTrue(saved.contains("Roots processed: 2"));
        assertEquals(stdout(), saved);
    }

    @Test
    void noRootsExitsWithUsageError() throws IOException {
        Path empty = Files.createDirectory(tempDir.resolve("empty"));

        int exit = SurveyorCLI.run(new String[] {"-q", empty.toString()}, out, err);

        assertEquals(SurveyorCLI.EXIT_USAGE, exit);
        assertTrue(stdout().contains("Roots processed: 0"), "Summary should still print");
    }

    private RunConfiguration configFor(String... args) throws Exception {
        return SurveyorCLI.buildRunConfiguration(
                SurveyorCLI.parseArguments(args), SurveyorSettings.loadDefault());
    }

    private Path projects() throws IOException {
        Path projects = Files.createDirectory(tempDir.resolve("projects"));
        Path app = Files.createDirectory(projects.resolve("app"));
        Files.writeString(app.resolve("pom.xml"), "<project/>");
        Files.writeString(app.resolve("Broken.java"), "class Broken {\n  void m( {}\n}\n");
        Path lib = Files.createDirectory(projects.resolve("lib"));
        Files.writeString(lib.resolve("pom.xml"), "<project/>");
        Files.writeString(lib.resolve("Lib.java"), "class Lib {}\n");
        return projects;
    }

    private String stdout() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }
}
