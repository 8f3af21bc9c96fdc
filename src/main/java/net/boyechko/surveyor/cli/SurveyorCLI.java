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

import ch.qos.logback.classic.Level;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import net.boyechko.surveyor.core.Driver;
import net.boyechko.surveyor.core.RunConfiguration;
import net.boyechko.surveyor.core.SurveyDefaults;
import net.boyechko.surveyor.core.SurveyorSettings;
import net.boyechko.surveyor.core.VerbosityLevel;
import net.boyechko.surveyor.core.VisitorException;
import net.boyechko.surveyor.core.VisitorFailurePolicy;
import net.boyechko.surveyor.report.RunSummary;
import net.boyechko.surveyor.report.SurveyReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.error.YAMLException;

public class SurveyorCLI {
    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_ABORTED = 2;

    private static final String APP_LOGGER = "net.boyechko.surveyor";

    private static Logger logger;

    /**
     * Parsed command line. The boxed flags are null when not given on the command line, so that
     * the defaults of the selected visitors apply.
     */
    public record CLIConfig(
            List<Path> inputPaths,
            List<String> visitors,
            Boolean showErrors,
            Boolean resolveUnits,
            Boolean skipInstall,
            Set<String> excludedPaths,
            Integer limit,
            Set<String> identifiers,
            Path configPath,
            VisitorFailurePolicy onVisitorError,
            boolean noNested,
            Path reportPath,
            VerbosityLevel verbosity) {
        public CLIConfig {
            if (inputPaths == null || inputPaths.isEmpty()) {
                throw new IllegalArgumentException("At least one input path is required");
            }
            if (visitors == null || visitors.isEmpty()) {
                throw new IllegalArgumentException("At least one visitor is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }

        public CLIException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments. */
    static class CLIConfigBuilder {
        List<Path> inputPaths = new ArrayList<>();
        List<String> visitors = List.of(SurveyDefaults.ERRORS);
        Boolean showErrors;
        Boolean resolveUnits;
        Boolean skipInstall;
        Set<String> excludedPaths = Set.of();
        Integer limit;
        Set<String> identifiers = Set.of();
        Path configPath;
        VisitorFailurePolicy onVisitorError;
        boolean noNested;
        Path reportPath;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        CLIConfig build() throws CLIException {
            if (inputPaths.isEmpty()) {
                throw new CLIException("No input directory specified");
            }
            for (String visitor : visitors) {
                if (!SurveyDefaults.VISITOR_NAMES.contains(visitor)) {
                    throw new CLIException(
                            "Unknown visitor '"
                                    + visitor
                                    + "'; expected one of "
                                    + SurveyDefaults.VISITOR_NAMES);
                }
            }
            if (configPath != null && !Files.isRegularFile(configPath)) {
                throw new CLIException("Config file not found: " + configPath);
            }
            return new CLIConfig(
                    inputPaths,
                    visitors,
                    showErrors,
                    resolveUnits,
                    skipInstall,
                    excludedPaths,
                    limit,
                    identifiers,
                    configPath,
                    onVisitorError,
                    noNested,
                    reportPath,
                    verbosity);
        }
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Runs the command line and returns the process exit code. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (isHelpRequested(args)) {
            out.println(usageMessage());
            return EXIT_OK;
        }

        CLIConfig config;
        RunConfiguration runConfig;
        try {
            config = parseArguments(args);
            runConfig = buildRunConfiguration(config, loadSettings(config));
        } catch (CLIException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }

        configureLogging(config.verbosity());
        logger().info(
                        "Surveying {} with visitors {} and verbosity level {}",
                        config.inputPaths(),
                        config.visitors(),
                        config.verbosity());
        return survey(config, runConfig, out, err);
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No input directory specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();

        for (String arg : args) {
            if (arg.startsWith("--visitor=")) {
                b.visitors = new ArrayList<>(parseCommaSeparated(valueOf(arg, "--visitor=")));
            } else if (arg.startsWith("--exclude=")) {
                b.excludedPaths = parseCommaSeparated(valueOf(arg, "--exclude="));
            } else if (arg.startsWith("--limit=")) {
                b.limit = parseLimit(valueOf(arg, "--limit="));
            } else if (arg.startsWith("--identifiers=")) {
                b.identifiers = parseCommaSeparated(valueOf(arg, "--identifiers="));
            } else if (arg.startsWith("--config=")) {
                b.configPath = Paths.get(valueOf(arg, "--config="));
            } else if (arg.startsWith("--on-visitor-error=")) {
                b.onVisitorError = parsePolicy(valueOf(arg, "--on-visitor-error="));
            } else if (arg.startsWith("--report=")) {
                b.reportPath = Paths.get(valueOf(arg, "--report="));
            } else if (arg.startsWith("-r=")) {
                b.reportPath = Paths.get(valueOf(arg, "-r="));
            } else {
                switch (arg) {
                    case "--show-errors" -> b.showErrors = true;
                    case "--no-show-errors" -> b.showErrors = false;
                    case "--resolve" -> b.resolveUnits = true;
                    case "--no-resolve" -> b.resolveUnits = false;
                    case "--skip-install" -> b.skipInstall = true;
                    case "--install" -> b.skipInstall = false;
                    case "--no-nested" -> b.noNested = true;
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    default -> {
                        if (arg.startsWith("-")) {
                            throw new CLIException("Unknown option: " + arg);
                        }
                        b.inputPaths.add(Paths.get(arg));
                    }
                }
            }
        }

        return b.build();
    }

    private static SurveyorSettings loadSettings(CLIConfig config) throws CLIException {
        try {
            return config.configPath() != null
                    ? SurveyorSettings.fromFile(config.configPath())
                    : SurveyorSettings.loadDefault();
        } catch (IOException | YAMLException e) {
            throw new CLIException("Cannot read settings: " + e.getMessage(), e);
        }
    }

    /**
     * Layers the command line over the settings. A flag that was not given falls back to the
     * defaults of the selected visitors: {@code errors} reports findings, {@code identifiers}
     * resolves units and skips the install step.
     */
    static RunConfiguration buildRunConfiguration(CLIConfig config, SurveyorSettings settings)
            throws CLIException {
        boolean errors = config.visitors().contains(SurveyDefaults.ERRORS);
        boolean identifiers = config.visitors().contains(SurveyDefaults.IDENTIFIERS);
        try {
            RunConfiguration.Builder builder = settings.toBuilder();
            builder.rootPaths(config.inputPaths())
                    .showErrors(orDefault(config.showErrors(), errors))
                    .resolveUnits(orDefault(config.resolveUnits(), identifiers))
                    .forceSkipInstall(orDefault(config.skipInstall(), identifiers));
            if (!config.excludedPaths().isEmpty()) {
                Set<String> excluded = new LinkedHashSet<>(builder.build().excludedPaths());
                excluded.addAll(config.excludedPaths());
                builder.excludedPaths(excluded);
            }
            if (config.limit() != null) {
                builder.debugLimit(config.limit());
            }
            if (config.onVisitorError() != null) {
                builder.visitorFailurePolicy(config.onVisitorError());
            }
            if (config.noNested()) {
                builder.splitNestedRoots(false);
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new CLIException(e.getMessage(), e);
        }
    }

    private static boolean orDefault(Boolean flag, boolean fallback) {
        return flag != null ? flag : fallback;
    }

    private static void configureLogging(VerbosityLevel verbosity) {
        Level level =
                switch (verbosity) {
                    case QUIET -> Level.ERROR;
                    case NORMAL -> Level.WARN;
                    case VERBOSE -> Level.INFO;
                    case DEBUG -> Level.DEBUG;
                };
        if (LoggerFactory.getLogger(APP_LOGGER) instanceof ch.qos.logback.classic.Logger appLogger) {
            appLogger.setLevel(level);
        }
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(SurveyorCLI.class);
        }
        return logger;
    }

    private static int survey(
            CLIConfig config, RunConfiguration runConfig, PrintStream out, PrintStream err) {
        OutputStream reportFile = null;
        PrintStream output = out;

        try {
            reportFile = openReportStream(config);
            if (reportFile != null) {
                output =
                        new PrintStream(
                                new TeeOutputStream(out, reportFile), true, StandardCharsets.UTF_8);
            }

            Driver driver =
                    new Driver.DriverBuilder()
                            .withConfiguration(runConfig)
                            .withListener(new SurveyReporter(output, config.verbosity()))
                            .addVisitors(
                                    SurveyDefaults.visitors(
                                            config.visitors(), output, config.identifiers()))
                            .build();

            RunSummary summary = driver.analyze();
            return summary.rootsDiscovered() == 0 ? EXIT_USAGE : EXIT_OK;
        } catch (VisitorException e) {
            err.println("✗ Run aborted: " + e.getMessage());
            return EXIT_ABORTED;
        } catch (IOException e) {
            err.println("Error: cannot write report " + config.reportPath() + ": " + e.getMessage());
            return EXIT_USAGE;
        } finally {
            output.flush();
            if (reportFile != null) {
                try {
                    reportFile.close();
                } catch (IOException e) {
                    logger().warn("Failed to close report file", e);
                }
            }
        }
    }

    private static OutputStream openReportStream(CLIConfig config) throws IOException {
        if (config.reportPath() == null) {
            return null;
        }
        Path reportParent = config.reportPath().toAbsolutePath().getParent();
        if (reportParent != null) {
            Files.createDirectories(reportParent);
        }
        logger().info("Saving report to {}", config.reportPath());
        return Files.newOutputStream(config.reportPath());
    }

    /** Writes to two output streams simultaneously, like the Unix tee command. */
    private static class TeeOutputStream extends OutputStream {
        private final OutputStream out1;
        private final OutputStream out2;

        TeeOutputStream(OutputStream out1, OutputStream out2) {
            this.out1 = out1;
            this.out2 = out2;
        }

        @Override
        public void write(int b) throws IOException {
            out1.write(b);
            out2.write(b);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out1.write(b, off, len);
            out2.write(b, off, len);
        }

        @Override
        public void flush() throws IOException {
            out1.flush();
            out2.flush();
        }
    }

    private static String valueOf(String arg, String prefix) throws CLIException {
        String value = arg.substring(prefix.length());
        if (value.isBlank()) {
            throw new CLIException("No value given for " + prefix.substring(0, prefix.length() - 1));
        }
        return value;
    }

    private static Integer parseLimit(String value) throws CLIException {
        try {
            int limit = Integer.parseInt(value.trim());
            if (limit < 0) {
                throw new CLIException("Limit must not be negative: " + value);
            }
            return limit;
        } catch (NumberFormatException e) {
            throw new CLIException("Invalid limit: " + value);
        }
    }

    private static VisitorFailurePolicy parsePolicy(String value) throws CLIException {
        try {
            return VisitorFailurePolicy.fromName(value);
        } catch (IllegalArgumentException e) {
            throw new CLIException(e.getMessage() + " (expected abort or disable)");
        }
    }

    private static Set<String> parseCommaSeparated(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    static String usageMessage() {
        return "Usage: java SurveyorCLI [options] <dir>...\n"
                + "  A single directory without a build file is expanded into its subdirectories.\n"
                + "  -h, --help                 Show this help message\n"
                + "  --visitor=<names>          Visitors to run, comma-separated: errors, identifiers\n"
                + "                             (default: errors)\n"
                + "  --show-errors              Report findings to visitors (on for errors)\n"
                + "  --no-show-errors           Do not report findings\n"
                + "  --resolve                  Full language-level analysis and node traversal\n"
                + "                             (on for identifiers)\n"
                + "  --no-resolve               Syntax-only analysis, no node traversal\n"
                + "  --skip-install             Skip the install command (on for identifiers)\n"
                + "  --install                  Run the install command before each root\n"
                + "  --exclude=<segments>       Skip files under these path segments\n"
                + "  --limit=<n>                Process at most n roots\n"
                + "  --identifiers=<ids>        Identifiers counted by the identifiers visitor\n"
                + "  --config=<file>            Read settings from a YAML file\n"
                + "  --on-visitor-error=<mode>  abort (default) or disable the failing visitor\n"
                + "  --no-nested                Do not split nested projects into their own roots\n"
                + "  -r=<file>, --report=<file> Also write the output to a file\n"
                + "  -q, --quiet                Only show errors and the summary\n"
                + "  -v, --verbose              Show per-root progress\n"
                + "  -vv, --debug               Show all debug information\n"
                + "Examples:\n"
                + "  java SurveyorCLI ~/src/projects\n"
                + "  java SurveyorCLI --visitor=identifiers --identifiers=record,sealed ~/src/projects\n"
                + "  java SurveyorCLI --limit=5 -r=survey.txt app lib";
    }
}
