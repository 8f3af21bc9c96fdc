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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import net.boyechko.surveyor.discovery.ProjectLayout;

/**
 * Lists the source files of a root in a deterministic order: depth-first, with the entries of
 * each directory sorted by name. Hidden entries, excluded segments and nested project directories
 * are skipped.
 */
public class SourceFileLister {
    private static final Comparator<Path> BY_NAME =
            Comparator.comparing(p -> p.getFileName().toString());

    private final ProjectLayout layout;
    private final Set<String> sourceExtensions;
    private final boolean skipNestedRoots;

    public SourceFileLister(ProjectLayout layout, Set<String> sourceExtensions, boolean skipNestedRoots) {
        this.layout = layout;
        this.sourceExtensions = Set.copyOf(sourceExtensions);
        this.skipNestedRoots = skipNestedRoots;
    }

    public List<Path> list(Path root) throws IOException {
        List<Path> files = new ArrayList<>();
        collect(root, root, files);
        return files;
    }

    private void collect(Path root, Path dir, List<Path> files) throws IOException {
        List<Path> entries;
        try (Stream<Path> stream = Files.list(dir)) {
            entries = stream.sorted(BY_NAME).toList();
        }
        for (Path entry : entries) {
            if (layout.isHidden(entry) || layout.isExcluded(root.relativize(entry))) {
                continue;
            }
            if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                if (skipNestedRoots && layout.isProjectRoot(entry)) {
                    continue;
                }
                collect(root, entry, files);
            } else if (isSource(entry)) {
                files.add(entry);
            }
        }
    }

    private boolean isSource(Path file) {
        String name = file.getFileName().toString();
        for (String extension : sourceExtensions) {
            if (name.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }
}
