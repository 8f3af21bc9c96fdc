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

import java.util.Iterator;
import net.boyechko.surveyor.discovery.AnalysisRoot;

/**
 * An open analysis context for a single root.
 *
 * <p>{@link #iterateFiles()} yields one result per source file, lazily and in an order that is
 * stable across runs. The iterator can be obtained only once. A per-file failure is returned as
 * {@link FileResult.Failed} and never ends the iteration.
 */
public interface AnalysisContextHandle extends AutoCloseable {

    AnalysisRoot root();

    Iterator<FileResult> iterateFiles();

    @Override
    void close();
}
