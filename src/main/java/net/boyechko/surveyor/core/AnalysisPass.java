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
package net.boyechko.surveyor.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.boyechko.surveyor.analysis.FileResult;
import net.boyechko.surveyor.discovery.AnalysisRoot;
import net.boyechko.surveyor.visitor.Progress;

/** Transient state of the pass over a single root. Never outlives the root it was made for. */
public final class AnalysisPass {
    private final AnalysisRoot root;
    private final Progress progress;
    private final List<FileResult.Failed> failures = new ArrayList<>();
    private int filesAnalyzed;

    AnalysisPass(AnalysisRoot root, Progress progress) {
        this.root = root;
        this.progress = progress;
    }

    void analyzed() {
        filesAnalyzed++;
    }

    void failed(FileResult.Failed failure) {
        failures.add(failure);
    }

    public AnalysisRoot root() {
        return root;
    }

    public Progress progress() {
        return progress;
    }

    public int filesAnalyzed() {
        return filesAnalyzed;
    }

    public List<FileResult.Failed> failures() {
        return Collections.unmodifiableList(failures);
    }
}
