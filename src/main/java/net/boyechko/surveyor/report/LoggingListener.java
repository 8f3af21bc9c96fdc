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

import net.boyechko.surveyor.analysis.FileResult;
import net.boyechko.surveyor.core.AnalysisPass;
import net.boyechko.surveyor.core.SurveyListener;
import net.boyechko.surveyor.discovery.AnalysisRoot;
import net.boyechko.surveyor.discovery.DiscoveryError;
import net.boyechko.surveyor.discovery.DiscoveryResult;
import net.boyechko.surveyor.visitor.Progress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A {@link SurveyListener} that routes all events through SLF4J. */
public class LoggingListener implements SurveyListener {

    private static final Logger logger = LoggerFactory.getLogger("net.boyechko.surveyor.run");

    @Override
    public void onDiscovery(DiscoveryResult result) {
        logger.info(
                "DISCOVERED roots={} nested={} errors={}",
                result.total(),
                result.nestedCount(),
                result.errors().size());
    }

    @Override
    public void onDiscoveryError(DiscoveryError error) {
        logger.warn("{}", error.message());
    }

    @Override
    public void onRootStart(AnalysisRoot root, Progress progress) {
        logger.info("ROOT {} {}", root.displayName(), progress);
    }

    @Override
    public void onRootFinished(AnalysisPass pass) {
        logger.info(
                "DONE {} files={} failed={}",
                pass.root().displayName(),
                pass.filesAnalyzed(),
                pass.failures().size());
    }

    @Override
    public void onRootSkipped(AnalysisRoot root, String reason) {
        logger.warn("SKIPPED {}: {}", root.displayName(), reason);
    }

    @Override
    public void onFileFailed(FileResult.Failed failure) {
        logger.warn("FAILED {}: {}", failure.relativePath(), failure.reason());
    }

    @Override
    public void onVisitorDisabled(String visitorName, String hook, Throwable cause) {
        logger.error("DISABLED {} in {}: {}", visitorName, hook, cause.toString());
    }

    @Override
    public void onError(String message) {
        logger.error("{}", message);
    }

    @Override
    public void onInfo(String message) {
        logger.info("{}", message);
    }

    @Override
    public void onSummary(RunSummary summary) {
        logger.info(
                "SUMMARY processed={} skipped={} findings={} files={} failed={} elapsed={}ms",
                summary.rootsProcessed(),
                summary.rootsSkipped(),
                summary.findingsReported(),
                summary.filesAnalyzed(),
                summary.filesFailed(),
                summary.elapsed().toMillis());
    }
}
