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

/**
 * Driver-owned counters for one run. Only the driver mutates them, and only between roots.
 */
final class RunState {
    private final Integer debugLimit;
    private int processedRoots;

    RunState(Integer debugLimit) {
        this.debugLimit = debugLimit;
    }

    /** Whether the processed-root counter has reached the debug limit, if one is set. */
    boolean limitReached() {
        return debugLimit != null && processedRoots >= debugLimit;
    }

    void markProcessed() {
        processedRoots++;
    }

    Integer debugLimit() {
        return debugLimit;
    }
}
