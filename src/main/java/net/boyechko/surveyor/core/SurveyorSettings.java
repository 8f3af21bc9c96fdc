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
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Run defaults read from YAML. Every key is optional; a missing key keeps the built-in default of
 * {@link RunConfiguration.Builder}.
 */
public final class SurveyorSettings {
    private static final String DEFAULT_SETTINGS_RESOURCE = "/surveyor.yaml";
    private static final Logger logger = LoggerFactory.getLogger(SurveyorSettings.class);

    static final String DEBUG_LIMIT_PROPERTY = "surveyor.debug.limit";
    static final String DEBUG_LIMIT_ENV = "SURVEYOR_DEBUG_LIMIT";

    public List<String> manifest_markers;
    public String hidden_prefix;
    public List<String> source_extensions;
    public List<String> excluded_paths;
    public String language_level;
    public List<String> install_command;
    public Boolean split_nested_roots;
    public Integer debug_limit;
    public String visitor_failure_policy;

    public SurveyorSettings() {}

    /**
     * Load settings from a classpath resource.
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static SurveyorSettings fromResource(String resourcePath) {
        try (InputStream inputStream = SurveyorSettings.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            SurveyorSettings settings = load(inputStream);
            logger.debug("Loaded settings from resource {}", resourcePath);
            return settings;
        } catch (IOException e) {
            throw new IllegalStateException(
                    "Failed to load settings from resource " + resourcePath + ": " + e.getMessage(),
                    e);
        }
    }

    /** Load settings from a user file. */
    public static SurveyorSettings fromFile(Path file) throws IOException {
        try (InputStream inputStream = Files.newInputStream(file)) {
            SurveyorSettings settings = load(inputStream);
            logger.debug("Loaded settings from {}", file);
            return settings;
        }
    }

    /** Load default settings from the standard location. */
    public static SurveyorSettings loadDefault() {
        return fromResource(DEFAULT_SETTINGS_RESOURCE);
    }

    private static SurveyorSettings load(InputStream inputStream) {
        Yaml yaml = new Yaml(new Constructor(SurveyorSettings.class, new LoaderOptions()));
        SurveyorSettings settings = yaml.load(inputStream);
        // An empty document loads as null
        return settings != null ? settings : new SurveyorSettings();
    }

    /**
     * Returns a configuration builder seeded with these settings. The debug limit is resolved
     * against the system property and the environment first.
     */
    public RunConfiguration.Builder toBuilder() {
        RunConfiguration.Builder builder = RunConfiguration.builder();
        if (manifest_markers != null) {
            builder.manifestMarkers(new LinkedHashSet<>(manifest_markers));
        }
        if (hidden_prefix != null) {
            builder.hiddenPrefix(hidden_prefix);
        }
        if (source_extensions != null) {
            builder.sourceExtensions(new LinkedHashSet<>(source_extensions));
        }
        if (excluded_paths != null) {
            builder.excludedPaths(new LinkedHashSet<>(excluded_paths));
        }
        if (language_level != null) {
            builder.languageLevel(parseLanguageLevel(language_level));
        }
        if (install_command != null) {
            builder.installCommand(new ArrayList<>(install_command));
        }
        if (split_nested_roots != null) {
            builder.splitNestedRoots(split_nested_roots);
        }
        if (visitor_failure_policy != null) {
            builder.visitorFailurePolicy(VisitorFailurePolicy.fromName(visitor_failure_policy));
        }
        builder.debugLimit(
                resolveDebugLimit(
                        System.getProperty(DEBUG_LIMIT_PROPERTY),
                        System.getenv(DEBUG_LIMIT_ENV),
                        debug_limit));
        return builder;
    }

    /** System property wins, then the environment variable, then the settings file. */
    static Integer resolveDebugLimit(String sysProp, String envVar, Integer fromSettings) {
        if (sysProp != null && !sysProp.isBlank()) {
            return parseLimit(sysProp, "-D" + DEBUG_LIMIT_PROPERTY);
        }
        if (envVar != null && !envVar.isBlank()) {
            return parseLimit(envVar, DEBUG_LIMIT_ENV);
        }
        return fromSettings;
    }

    private static Integer parseLimit(String value, String source) {
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Invalid debug limit '" + value + "' from " + source, e);
        }
    }

    static LanguageLevel parseLanguageLevel(String name) {
        String normalized = name.trim().toUpperCase().replace('.', '_');
        if (normalized.matches("\\d+(_\\d+)?")) {
            normalized = "JAVA_" + normalized;
        }
        try {
            return LanguageLevel.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown language level: " + name, e);
        }
    }
}
