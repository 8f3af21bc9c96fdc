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
package net.boyechko.surveyor.analysis;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.boyechko.surveyor.core.RunConfiguration;
import net.boyechko.surveyor.discovery.AnalysisRoot;
import net.boyechko.surveyor.discovery.ProjectLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AnalysisEngine} backed by JavaParser.
 *
 * <p>With {@code resolveUnits} off, files are parsed at {@code LanguageLevel.RAW}, which skips
 * JavaParser's validators and reports syntax errors only. With it on, the configured language
 * level is used and validator problems are reported as well.
 */
public class JavaParserEngine implements AnalysisEngine {
    private static final Logger logger = LoggerFactory.getLogger(JavaParserEngine.class);

    private final InstallStep installStep;

    /** Uses the install command from the run configuration, if any. */
    public JavaParserEngine() {
        this(null);
    }

    public JavaParserEngine(InstallStep installStep) {
        this.installStep = installStep;
    }

    @Override
    public AnalysisContextHandle open(AnalysisRoot root, RunConfiguration config)
            throws AnalysisException {
        Path dir = root.path();
        if (!Files.isDirectory(dir)) {
            throw new AnalysisException("Not a directory: " + dir);
        }

        if (!config.forceSkipInstall()) {
            InstallStep step =
                    installStep != null ? installStep : CommandInstallStep.of(config.installCommand());
            step.install(root);
        }

        SourceFileLister lister =
                new SourceFileLister(
                        ProjectLayout.from(config),
                        config.sourceExtensions(),
                        config.splitNestedRoots());
        List<Path> files;
        try {
            files = lister.list(dir);
        } catch (IOException e) {
            throw new AnalysisException(
                    "Failed to list source files of " + root.displayName() + ": " + e.getMessage(),
                    e);
        }
        logger.debug("Opened {} with {} source files", root.displayName(), files.size());

        return new JavaParserContextHandle(root, new JavaParser(parserConfiguration(config)), files);
    }

    static ParserConfiguration parserConfiguration(RunConfiguration config) {
        ParserConfiguration parserConfig = new ParserConfiguration();
        parserConfig.setLanguageLevel(
                config.resolveUnits()
                        ? config.languageLevel()
                        : ParserConfiguration.LanguageLevel.RAW);
        return parserConfig;
    }
}
