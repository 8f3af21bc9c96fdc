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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import net.boyechko.surveyor.core.RunConfiguration;

/**
 * Answers the layout questions shared by discovery and file iteration: what marks a project
 * directory, which entries are hidden, and which path segments are excluded.
 */
public final class ProjectLayout {
    private final Set<String> manifestMarkers;
    private final String hiddenPrefix;
    private final Set<String> excludedSegments;

    public ProjectLayout(Set<String> manifestMarkers, String hiddenPrefix, Set<String> excludedSegments) {
        if (manifestMarkers.isEmpty()) {
            throw new IllegalArgumentException("At least one manifest marker is required");
        }
        this.manifestMarkers = Set.copyOf(manifestMarkers);
        this.hiddenPrefix = hiddenPrefix;
        this.excludedSegments = Set.copyOf(excludedSegments);
    }

    public static ProjectLayout from(RunConfiguration config) {
        return new ProjectLayout(
                config.manifestMarkers(), config.hiddenPrefix(), config.excludedPaths());
    }

    /** True if the directory directly contains one of the manifest marker files. */
    public boolean isProjectRoot(Path dir) {
        for (String marker : manifestMarkers) {
            if (Files.isRegularFile(dir.resolve(marker))) {
                return true;
            }
        }
        return false;
    }

    public boolean isHidden(Path entry) {
        Path fileName = entry.getFileName();
        return fileName != null
                && !hiddenPrefix.isEmpty()
                && fileName.toString().startsWith(hiddenPrefix);
    }

    /** True if any segment of the given (root-relative) path is an excluded segment. */
    public boolean isExcluded(Path relativePath) {
        if (excludedSegments.isEmpty()) return false;
        for (Path segment : relativePath) {
            if (excludedSegments.contains(segment.toString())) {
                return true;
            }
        }
        return false;
    }

    public Set<String> manifestMarkers() {
        return manifestMarkers;
    }
}
