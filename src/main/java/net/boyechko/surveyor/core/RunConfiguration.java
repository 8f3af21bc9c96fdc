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

import com.github.javaparser.ParserConfiguration.LanguageLevel;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable settings for one run, resolved once at startup.
 *
 * @param rootPaths input directories, in caller order
 * @param showErrors deliver findings to visitors that report errors
 * @param resolveUnits parse at the full language level and run node-level traversal
 * @param forceSkipInstall skip the dependency install step before analyzing a root
 * @param excludedPaths path segments whose files are never analyzed
 * @param debugLimit maximum number of roots to process, or null for no limit
 * @param manifestMarkers file names that mark a project directory
 * @param hiddenPrefix name prefix of hidden entries
 * @param sourceExtensions file name suffixes of source files
 * @param languageLevel JavaParser language level used when {@code resolveUnits} is on
 * @param installCommand command run in each root before analysis; empty to disable
 * @param splitNestedRoots analyze nested project directories as roots of their own
 * @param visitorFailurePolicy what to do when a visitor hook throws
 */
public record RunConfiguration(
        List<Path> rootPaths,
        boolean showErrors,
        boolean resolveUnits,
        boolean forceSkipInstall,
        Set<String> excludedPaths,
        Integer debugLimit,
        Set<String> manifestMarkers,
        String hiddenPrefix,
        Set<String> sourceExtensions,
        LanguageLevel languageLevel,
        List<String> installCommand,
        boolean splitNestedRoots,
        VisitorFailurePolicy visitorFailurePolicy) {

    public static final Set<String> DEFAULT_MANIFEST_MARKERS =
            Set.of("pom.xml", "build.gradle", "build.gradle.kts");

    public RunConfiguration {
        if (rootPaths == null || rootPaths.isEmpty()) {
            throw new IllegalArgumentException("At least one root path is required");
        }
        if (debugLimit != null && debugLimit < 0) {
            throw new IllegalArgumentException("Debug limit must not be negative: " + debugLimit);
        }
        if (manifestMarkers == null || manifestMarkers.isEmpty()) {
            throw new IllegalArgumentException("At least one manifest marker is required");
        }
        if (sourceExtensions == null || sourceExtensions.isEmpty()) {
            throw new IllegalArgumentException("At least one source extension is required");
        }
        if (languageLevel == null) {
            throw new IllegalArgumentException("Language level is required");
        }
        if (visitorFailurePolicy == null) {
            throw new IllegalArgumentException("Visitor failure policy is required");
        }
        rootPaths = List.copyOf(rootPaths);
        excludedPaths = excludedPaths != null ? Set.copyOf(excludedPaths) : Set.of();
        manifestMarkers = Set.copyOf(manifestMarkers);
        hiddenPrefix = hiddenPrefix != null ? hiddenPrefix : "";
        sourceExtensions = Set.copyOf(sourceExtensions);
        installCommand = installCommand != null ? List.copyOf(installCommand) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasDebugLimit() {
        return debugLimit != null;
    }

    /** Mutable builder; every field starts at its default. */
    public static class Builder {
        private final List<Path> rootPaths = new ArrayList<>();
        private boolean showErrors;
        private boolean resolveUnits;
        private boolean forceSkipInstall;
        private Set<String> excludedPaths = new LinkedHashSet<>();
        private Integer debugLimit;
        private Set<String> manifestMarkers = DEFAULT_MANIFEST_MARKERS;
        private String hiddenPrefix = ".";
        private Set<String> sourceExtensions = Set.of(".java");
        private LanguageLevel languageLevel = LanguageLevel.JAVA_17;
        private List<String> installCommand = List.of();
        private boolean splitNestedRoots = true;
        private VisitorFailurePolicy visitorFailurePolicy = VisitorFailurePolicy.ABORT;

        public Builder rootPaths(List<Path> paths) {
            rootPaths.clear();
            rootPaths.addAll(paths);
            return this;
        }

        public Builder addRootPath(Path path) {
            rootPaths.add(path);
            return this;
        }

        public Builder showErrors(boolean showErrors) {
            this.showErrors = showErrors;
            return this;
        }

        public Builder resolveUnits(boolean resolveUnits) {
            this.resolveUnits = resolveUnits;
            return this;
        }

        public Builder forceSkipInstall(boolean forceSkipInstall) {
            this.forceSkipInstall = forceSkipInstall;
            return this;
        }

        public Builder excludedPaths(Set<String> excludedPaths) {
            this.excludedPaths = new LinkedHashSet<>(excludedPaths);
            return this;
        }

        public Builder debugLimit(Integer debugLimit) {
            this.debugLimit = debugLimit;
            return this;
        }

        public Builder manifestMarkers(Set<String> manifestMarkers) {
            this.manifestMarkers = manifestMarkers;
            return this;
        }

        public Builder hiddenPrefix(String hiddenPrefix) {
            this.hiddenPrefix = hiddenPrefix;
            return this;
        }

        public Builder sourceExtensions(Set<String> sourceExtensions) {
            this.sourceExtensions = sourceExtensions;
            return this;
        }

        public Builder languageLevel(LanguageLevel languageLevel) {
            this.languageLevel = languageLevel;
            return this;
        }

        public Builder installCommand(List<String> installCommand) {
            this.installCommand = installCommand;
            return this;
        }

        public Builder splitNestedRoots(boolean splitNestedRoots) {
            this.splitNestedRoots = splitNestedRoots;
            return this;
        }

        public Builder visitorFailurePolicy(VisitorFailurePolicy visitorFailurePolicy) {
            this.visitorFailurePolicy = visitorFailurePolicy;
            return this;
        }

        public RunConfiguration build() {
            return new RunConfiguration(
                    rootPaths,
                    showErrors,
                    resolveUnits,
                    forceSkipInstall,
                    excludedPaths,
                    debugLimit,
                    manifestMarkers,
                    hiddenPrefix,
                    sourceExtensions,
                    languageLevel,
                    installCommand,
                    splitNestedRoots,
                    visitorFailurePolicy);
        }
    }
}
