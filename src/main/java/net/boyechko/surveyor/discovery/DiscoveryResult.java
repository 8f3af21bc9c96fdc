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
import java.util.List;

/**
 * Ordered output of a discovery pass.
 *
 * @param roots roots to analyze, in processing order
 * @param errors paths that were excluded, in the order they were encountered
 * @param container the single input directory that was expanded into its subdirectories, or null
 *     when the inputs were used as given
 */
public record DiscoveryResult(List<AnalysisRoot> roots, List<DiscoveryError> errors, Path container) {

    public DiscoveryResult {
        roots = List.copyOf(roots);
        errors = List.copyOf(errors);
    }

    public int total() {
        return roots.size();
    }

    public boolean isEmpty() {
        return roots.isEmpty();
    }

    public boolean wasExpanded() {
        return container != null;
    }

    public long nestedCount() {
        return roots.stream().filter(AnalysisRoot::isSubRoot).count();
    }
}
