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

import java.nio.file.Path;
import java.util.Objects;

/**
 * A directory that is analyzed as one self-contained project.
 *
 * @param path absolute, normalized directory path
 * @param parentName name of the enclosing root when this root is nested inside another one, null
 *     for top-level roots
 * @param ordinal 0-based position in the run's root list
 */
public record AnalysisRoot(Path path, String parentName, int ordinal) {

    public AnalysisRoot {
        Objects.requireNonNull(path, "path");
        if (ordinal < 0) {
            throw new IllegalArgumentException("Ordinal must not be negative: " + ordinal);
        }
        path = path.toAbsolutePath().normalize();
    }

    public static AnalysisRoot of(Path path, int ordinal) {
        return new AnalysisRoot(path, null, ordinal);
    }

    public String name() {
        Path fileName = path.getFileName();
        return fileName != null ? fileName.toString() : path.toString();
    }

    public boolean isSubRoot() {
        return parentName != null;
    }

    /** Returns the name qualified with its parent for nested roots, e.g. {@code app/core}. */
    public String displayName() {
        return isSubRoot() ? parentName + "/" + name() : name();
    }
}
