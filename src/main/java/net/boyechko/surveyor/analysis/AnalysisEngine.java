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

import net.boyechko.surveyor.core.RunConfiguration;
import net.boyechko.surveyor.discovery.AnalysisRoot;

/** Produces parsed units and findings for the files of one analysis root. */
public interface AnalysisEngine {

    /**
     * Opens a context bound to the given root. Blocks until the context is ready, including any
     * install step the configuration asks for.
     *
     * @throws AnalysisException if the root cannot be analyzed at all
     */
    AnalysisContextHandle open(AnalysisRoot root, RunConfiguration config) throws AnalysisException;
}
