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
package net.boyechko.surveyor.visitors;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/** Hits of one identifier across the run. */
public final class Occurrences {
    private int declarations;
    private int references;
    private final Set<String> projects = new TreeSet<>();

    void record(String project, boolean declaration) {
        if (declaration) {
            declarations++;
        } else {
            references++;
        }
        projects.add(project);
    }

    public int declarations() {
        return declarations;
    }

    public int references() {
        return references;
    }

    public int total() {
        return declarations + references;
    }

    /** Names of the projects with at least one hit, sorted. */
    public Set<String> projects() {
        return Collections.unmodifiableSet(projects);
    }
}
