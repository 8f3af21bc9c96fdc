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
package net.boyechko.surveyor.report;

import java.time.Duration;

/**
 * Immutable end-of-run snapshot of {@link RunStatistics}.
 *
 * @param rootsSkipped discovery errors plus roots whose analysis context could not be opened
 * @param findingsReported records delivered to error reporters after each visitor's own filtering
 * @param stopped a visitor asked to stop before all roots were processed
 * @param limitReached the debug limit cut the run short
 * @param aborted a visitor failure aborted the run
 */
public record RunSummary(
        int rootsDiscovered,
        int rootsProcessed,
        int rootsSkipped,
        int filesAnalyzed,
        int filesFailed,
        int findingsReported,
        int visitorsDisabled,
        Duration elapsed,
        boolean stopped,
        boolean limitReached,
        boolean aborted) {

    public boolean completed() {
        return !stopped && !limitReached && !aborted;
    }
}
