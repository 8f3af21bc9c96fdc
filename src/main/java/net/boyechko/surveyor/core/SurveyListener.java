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

import net.boyechko.surveyor.analysis.FileResult;
import net.boyechko.surveyor.discovery.AnalysisRoot;
import net.boyechko.surveyor.discovery.DiscoveryError;
import net.boyechko.surveyor.discovery.DiscoveryResult;
import net.boyechko.surveyor.report.RunSummary;
import net.boyechko.surveyor.visitor.Progress;

/** Receives the progress and results of a survey run. */
public interface SurveyListener {
    void onDiscovery(DiscoveryResult result);

    void onRootSkipped(AnalysisRoot root, String reason);

    void onFileFailed(FileResult.Failed failure);

    void onSummary(RunSummary summary);

    default void onDiscoveryError(DiscoveryError error) {
        onError(error.message());
    }

    default void onRootStart(AnalysisRoot root, Progress progress) {}

    default void onRootFinished(AnalysisPass pass) {}

    default void onLimitReached(int limit) {
        onInfo("Debug limit of " + limit + " roots reached");
    }

    default void onStopRequested(AnalysisRoot root) {
        onInfo("Stop requested after " + root.displayName());
    }

    default void onVisitorDisabled(String visitorName, String hook, Throwable cause) {
        onError("Disabled visitor " + visitorName + " after failure in " + hook);
    }

    default void onError(String message) {}

    default void onInfo(String message) {}
}
