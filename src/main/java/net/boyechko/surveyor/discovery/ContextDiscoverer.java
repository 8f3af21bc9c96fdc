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
package net.boyechko.surveyor.discovery;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import net.boyechko.surveyor.core.RunConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the input paths into the fixed, ordered list of analysis roots for a run.
 *
 * <p>A single input directory without a manifest marker is treated as a container: its visible
 * subdirectories, sorted by name, become the roots. Otherwise the inputs are used as given. When
 * nested roots are enabled, each root is followed by the project directories found beneath it.
 * A directory reached more than once, through overlapping inputs or as a nested root, yields a
 * single root at its first position.
 */
public class ContextDiscoverer {
    private static final Logger logger = LoggerFactory.getLogger(ContextDiscoverer.class);

    private static final Comparator<Path> BY_NAME =
            Comparator.comparing(p -> p.getFileName().toString());

    private final ProjectLayout layout;
    private final boolean splitNestedRoots;

    public ContextDiscoverer(ProjectLayout layout, boolean splitNestedRoots) {
        this.layout = layout;
        this.splitNestedRoots = splitNestedRoots;
    }

    public static ContextDiscoverer from(RunConfiguration config) {
        return new ContextDiscoverer(ProjectLayout.from(config), config.splitNestedRoots());
    }

    public DiscoveryResult discover(List<Path> inputs) {
        List<DiscoveryError> errors = new ArrayList<>();
        List<Path> candidates = inputs;
        Path container = null;

        if (inputs.size() == 1) {
            Path dir = inputs.get(0);
            if (Files.isDirectory(dir) && !layout.isProjectRoot(dir)) {
                logger.info("Recursing into '{}'", dir);
                candidates = listSubdirectories(dir, errors);
                container = dir;
                logger.info("Found {} subdirectories", candidates.size());
            }
        }

        List<AnalysisRoot> roots = new ArrayList<>();
        Set<Path> seen = new HashSet<>();
        for (Path candidate : candidates) {
            if (!Files.exists(candidate)) {
                errors.add(new DiscoveryError(candidate, "path does not exist"));
                continue;
            }
            if (!Files.isDirectory(candidate)) {
                errors.add(new DiscoveryError(candidate, "not a directory"));
                continue;
            }
            if (!seen.add(key(candidate))) {
                logger.debug("Skipping duplicate root {}", candidate);
                continue;
            }
            AnalysisRoot root = AnalysisRoot.of(candidate, roots.size());
            roots.add(root);
            if (splitNestedRoots) {
                collectNestedRoots(root.path(), root.path(), root.name(), roots, seen, errors);
            }
        }

        for (DiscoveryError error : errors) {
            logger.warn(error.message());
        }
        return new DiscoveryResult(roots, errors, container);
    }

    private List<Path> listSubdirectories(Path dir, List<DiscoveryError> errors) {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(p -> !layout.isHidden(p))
                    .filter(Files::isDirectory)
                    .sorted(BY_NAME)
                    .toList();
        } catch (IOException e) {
            errors.add(new DiscoveryError(dir, "cannot list directory: " + e.getMessage()));
            return List.of();
        }
    }

    /** Depth-first, name-ordered search for project directories below {@code dir}. */
    private void collectNestedRoots(
            Path top,
            Path dir,
            String enclosingName,
            List<AnalysisRoot> roots,
            Set<Path> seen,
            List<DiscoveryError> errors) {
        List<Path> children;
        try (Stream<Path> entries = Files.list(dir)) {
            children =
                    entries.filter(p -> Files.isDirectory(p, LinkOption.NOFOLLOW_LINKS))
                            .filter(p -> !layout.isHidden(p))
                            .filter(p -> !layout.isExcluded(top.relativize(p)))
                            .sorted(BY_NAME)
                            .toList();
        } catch (IOException e) {
            errors.add(new DiscoveryError(dir, "cannot list directory: " + e.getMessage()));
            return;
        }

        for (Path child : children) {
            if (seen.contains(key(child))) {
                continue;
            }
            if (layout.isProjectRoot(child)) {
                seen.add(key(child));
                AnalysisRoot nested = new AnalysisRoot(child, enclosingName, roots.size());
                logger.debug("Found nested root {}", nested.displayName());
                roots.add(nested);
                collectNestedRoots(top, child, nested.name(), roots, seen, errors);
            } else {
                collectNestedRoots(top, child, enclosingName, roots, seen, errors);
            }
        }
    }

    private static Path key(Path dir) {
        return dir.toAbsolutePath().normalize();
    }
}
