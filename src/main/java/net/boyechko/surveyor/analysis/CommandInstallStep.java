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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import net.boyechko.surveyor.discovery.AnalysisRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an external command (for example {@code mvn -q -o dependency:resolve}) inside the root
 * directory. A failing command is logged and the root is analyzed anyway.
 */
public class CommandInstallStep implements InstallStep {
    private static final Logger logger = LoggerFactory.getLogger(CommandInstallStep.class);

    private final List<String> command;

    public CommandInstallStep(List<String> command) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Install command must not be empty");
        }
        this.command = List.copyOf(command);
    }

    /** Returns {@link InstallStep#NONE} when no command is configured. */
    public static InstallStep of(List<String> command) {
        return command == null || command.isEmpty() ? NONE : new CommandInstallStep(command);
    }

    @Override
    public void install(AnalysisRoot root) {
        logger.info("Running install step in {}: {}", root.displayName(), String.join(" ", command));
        ProcessBuilder builder =
                new ProcessBuilder(command).directory(root.path().toFile()).redirectErrorStream(true);
        Process process = null;
        try {
            process = builder.start();
            try (BufferedReader reader =
                    new BufferedReader(
                            new InputStreamReader(
                                    process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    logger.debug("[{}] {}", root.name(), line);
                }
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                logger.warn(
                        "Install step for {} exited with code {}; analyzing anyway",
                        root.displayName(),
                        exitCode);
            }
        } catch (IOException e) {
            logger.warn("Install step for {} failed: {}", root.displayName(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Install step for {} interrupted", root.displayName());
        } finally {
            if (process != null && process.isAlive()) {
                logger.debug("Stopping install step for {}", root.displayName());
                process.destroy();
            }
        }
    }

    public List<String> command() {
        return command;
    }
}
