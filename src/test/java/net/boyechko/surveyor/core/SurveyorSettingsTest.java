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

import static org.junit.jupiter.api.Assertions.*;

import com.github.javaparser.ParserConfiguration.LanguageLevel;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SurveyorSettingsTest {
    @TempDir Path tempDir;

    @Test
    void defaultSettingsLoadFromClasspath() {
        SurveyorSettings settings = SurveyorSettings.loadDefault();

        assertEquals(List.of("pom.xml", "build.gradle", "build.gradle.kts"), settings.manifest_markers);
        assertEquals(".", settings.hidden_prefix);
        assertEquals("JAVA_17", settings.language_level);
        assertTrue(settings.install_command.isEmpty());
        assertEquals("abort", settings.visitor_failure_policy);
    }

    @Test
    void defaultSettingsBuildAConfiguration() {
        RunConfiguration config =
                SurveyorSettings.loadDefault().toBuilder().addRootPath(tempDir).build();

        assertEquals(RunConfiguration.DEFAULT_MANIFEST_MARKERS, config.manifestMarkers());
        assertEquals(Set.of("target", "build"), config.excludedPaths());
        assertEquals(LanguageLevel.JAVA_17, config.languageLevel());
        assertEquals(VisitorFailurePolicy.ABORT, config.visitorFailurePolicy());
        assertTrue(config.splitNestedRoots());
    }

    @Test
    void resourceSettingsOverrideDefaults() {
        SurveyorSettings settings = SurveyorSettings.fromResource("/surveyor-test.yaml");
        RunConfiguration config = settings.toBuilder().addRootPath(tempDir).build();

        assertEquals(Set.of("pom.xml", "WORKSPACE"), config.manifestMarkers());
        assertEquals("_", config.hiddenPrefix());
        assertEquals(Set.of("generated"), config.excludedPaths());
        assertEquals(LanguageLevel.JAVA_11, config.languageLevel());
        assertFalse(config.splitNestedRoots());
        assertEquals(VisitorFailurePolicy.DISABLE_VISITOR, config.visitorFailurePolicy());
        assertEquals(Set.of(".java"), config.sourceExtensions(), "Missing keys keep defaults");
    }

    @Test
    void settingsLoadFromFile() throws IOException {
        Path file = tempDir.resolve("custom.yaml");
        Files.writeString(
                file,
                "install_command:\n  - mvn\n  - \"-q\"\n  - \"-o\"\n  - \"dependency:resolve\"\n");

        RunConfiguration config =
                SurveyorSettings.fromFile(file).toBuilder().addRootPath(tempDir).build();

        assertEquals(List.of("mvn", "-q", "-o", "dependency:resolve"), config.installCommand());
    }

    @Test
    void emptyFileKeepsEveryDefault() throws IOException {
        Path file = Files.writeString(tempDir.resolve("empty.yaml"), "");

        SurveyorSettings settings = SurveyorSettings.fromFile(file);

        assertNull(settings.manifest_markers);
        assertEquals(
                RunConfiguration.DEFAULT_MANIFEST_MARKERS,
                settings.toBuilder().addRootPath(tempDir).build().manifestMarkers());
    }

    @Test
    void missingResourceIsRejected() {
        assertThrows(
                IllegalArgumentException.class,
                () -> SurveyorSettings.fromResource("/no-such-settings.yaml"));
    }

    @Test
    void debugLimitPrefersSystemPropertyThenEnvironment() {
        assertEquals(2, SurveyorSettings.resolveDebugLimit("2", "5", 9));
        assertEquals(5, SurveyorSettings.resolveDebugLimit(null, "5", 9));
        assertEquals(9, SurveyorSettings.resolveDebugLimit(null, " ", 9));
        assertNull(SurveyorSettings.resolveDebugLimit(null, null, null));
    }

    @Test
    void invalidDebugLimitIsRejected() {
        assertThrows(
                IllegalArgumentException.class,
                () -> SurveyorSettings.resolveDebugLimit("many", null, null));
    }

    @ParameterizedTest
    @ValueSource(strings = {"JAVA_11", "java_11", "11", " 11 "})
    void languageLevelAcceptsSeveralSpellings(String name) {
        assertEquals(LanguageLevel.JAVA_11, SurveyorSettings.parseLanguageLevel(name));
    }

    @Test
    void unknownLanguageLevelIsRejected() {
        assertThrows(
                IllegalArgumentException.class, () -> SurveyorSettings.parseLanguageLevel("JAVA_99"));
    }
}
