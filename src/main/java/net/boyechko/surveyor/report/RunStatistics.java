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

/** Counters for one run. Mutated by the driver only, read once through {@link #snapshot()}. */
public class RunStatistics {
    private final long startNanos;

    private int rootsDiscovered;
    private int rootsProcessed;
    private int rootsSkipped;
    private int filesAnalyzed;
    private int filesFailed;
    private int findingsReported;
    private int visitorsDisabled;
    private boolean stopped;
    private boolean limitReached;
    private boolean aborted;

    public RunStatistics() {
        this.startNanos = System.nanoTime();
    }

    public void rootsDiscovered(int count) {
        rootsDiscovered += count;
    }

    public void rootProcessed() {
        rootsProcessed++;
    }

    public void rootSkipped() {
        rootsSkipped++;
    }

    public void rootsSkipped(int count) {
        rootsSkipped += count;
    }

    public void fileAnalyzed() {
        filesAnalyzed++;
    }

    public void fileFailed() {
        filesFailed++;
    }

    public void findingsReported(int count) {
        findingsReported += count;
    }

    public void visitorDisabled() {
        visitorsDisabled++;
    }

    public void markStopped() {
        stopped = true;
    }

    public void markLimitReached() {
        limitReached = true;
    }

    public void markAborted() {
        aborted = true;
    }

    public int rootsProcessed() {
        return rootsProcessed;
    }

    public int findingsReported() {
        return findingsReported;
    }

    public RunSummary snapshot() {
        return new RunSummary(
                rootsDiscovered,
                rootsProcessed,
                rootsSkipped,
                filesAnalyzed,
                filesFailed,
                findingsReported,
                visitorsDisabled,
                Duration.ofNanos(System.nanoTime() - startNanos),
                stopped,
                limitReached,
                aborted);
    }
}
