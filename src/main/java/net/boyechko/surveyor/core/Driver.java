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

import com.github.javaparser.ast.visitor.VoidVisitor;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;
import net.boyechko.surveyor.analysis.AnalysisContextHandle;
import net.boyechko.surveyor.analysis.AnalysisEngine;
import net.boyechko.surveyor.analysis.AnalysisException;
import net.boyechko.surveyor.analysis.DiagnosticRecord;
import net.boyechko.surveyor.analysis.FileResult;
import net.boyechko.surveyor.analysis.JavaParserEngine;
import net.boyechko.surveyor.discovery.AnalysisRoot;
import net.boyechko.surveyor.discovery.ContextDiscoverer;
import net.boyechko.surveyor.discovery.DiscoveryError;
import net.boyechko.surveyor.discovery.DiscoveryResult;
import net.boyechko.surveyor.report.LoggingListener;
import net.boyechko.surveyor.report.RunStatistics;
import net.boyechko.surveyor.report.RunSummary;
import net.boyechko.surveyor.visitor.Continuation;
import net.boyechko.surveyor.visitor.ErrorReporter;
import net.boyechko.surveyor.visitor.FileContextAware;
import net.boyechko.surveyor.visitor.PostAnalysisCallback;
import net.boyechko.surveyor.visitor.PreAnalysisCallback;
import net.boyechko.surveyor.visitor.Progress;
import net.boyechko.surveyor.visitor.SurveyVisitor;
import net.boyechko.surveyor.visitor.VisitorRegistration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a survey: discovers the roots, then processes them one at a time, dispatching each root's
 * results to the registered visitors.
 *
 * <p>Hooks fire in a fixed global order: pre-analysis, then per file (file context, node traversal,
 * error report), then post-analysis, and run-finished once at the end. At every hook point
 * visitors are called in registration order. A driver instance runs once.
 */
public class Driver {
    private static final Logger logger = LoggerFactory.getLogger(Driver.class);

    private final RunConfiguration config;
    private final AnalysisEngine engine;
    private final ContextDiscoverer discoverer;
    private final SurveyListener listener;
    private final List<VisitorRegistration> registrations;

    private DriverState state = DriverState.IDLE;
    private RunSummary summary;

    public static class DriverBuilder {
        private RunConfiguration config;
        private AnalysisEngine engine;
        private ContextDiscoverer discoverer;
        private SurveyListener listener;
        private final List<SurveyVisitor> visitors = new ArrayList<>();

        public DriverBuilder withConfiguration(RunConfiguration config) {
            this.config = config;
            return this;
        }

        public DriverBuilder withEngine(AnalysisEngine engine) {
            this.engine = engine;
            return this;
        }

        public DriverBuilder withDiscoverer(ContextDiscoverer discoverer) {
            this.discoverer = discoverer;
            return this;
        }

        public DriverBuilder withListener(SurveyListener listener) {
            this.listener = listener;
            return this;
        }

        public DriverBuilder addVisitor(SurveyVisitor visitor) {
            visitors.add(visitor);
            return this;
        }

        public DriverBuilder addVisitors(List<? extends SurveyVisitor> visitors) {
            this.visitors.addAll(visitors);
            return this;
        }

        public Driver build() {
            if (config == null) {
                throw new IllegalStateException(
                        "RunConfiguration must be provided via withConfiguration(...) before building Driver");
            }
            return new Driver(this);
        }
    }

    private Driver(DriverBuilder builder) {
        this.config = builder.config;
        this.engine = builder.engine != null ? builder.engine : new JavaParserEngine();
        this.discoverer =
                builder.discoverer != null ? builder.discoverer : ContextDiscoverer.from(config);
        this.listener = builder.listener != null ? builder.listener : new LoggingListener();

        List<VisitorRegistration> probed = new ArrayList<>();
        for (SurveyVisitor visitor : builder.visitors) {
            VisitorRegistration registration = VisitorRegistration.probe(visitor);
            logger.debug("Registered visitor {}", registration);
            probed.add(registration);
        }
        this.registrations = List.copyOf(probed);
    }

    public DriverState state() {
        return state;
    }

    public List<VisitorRegistration> registrations() {
        return registrations;
    }

    /** Statistics of the finished run, or null before {@link #analyze()} has returned or thrown. */
    public RunSummary summary() {
        return summary;
    }

    /**
     * Runs the survey to completion.
     *
     * @return the run statistics; the summary is also passed to the listener, even when the run
     *     is aborted
     * @throws VisitorException if a visitor hook fails and the failure policy is {@code ABORT}
     */
    public RunSummary analyze() {
        if (state != DriverState.IDLE) {
            throw new IllegalStateException("Driver has already run (state " + state + ")");
        }
        RunStatistics stats = new RunStatistics();
        RunState runState = new RunState(config.debugLimit());
        try {
            transition(DriverState.DISCOVERING);
            DiscoveryResult discovery = discoverer.discover(config.rootPaths());
            stats.rootsDiscovered(discovery.total());
            stats.rootsSkipped(discovery.errors().size());
            for (DiscoveryError error : discovery.errors()) {
                listener.onDiscoveryError(error);
            }
            listener.onDiscovery(discovery);

            if (discovery.isEmpty()) {
                listener.onError("No analysis roots found");
            } else {
                processRoots(discovery, runState, stats);
            }

            transition(DriverState.FINISHED);
            for (VisitorRegistration registration : registrations) {
                registration
                        .runFinished()
                        .ifPresent(
                                c -> dispatch(registration, "onRunFinished", stats, c::onRunFinished));
            }
        } catch (VisitorException e) {
            stats.markAborted();
            state = DriverState.FINISHED;
            logger.error("Run aborted: {}", e.getMessage());
            throw e;
        } finally {
            summary = stats.snapshot();
            listener.onSummary(summary);
        }
        return summary;
    }

    private void processRoots(DiscoveryResult discovery, RunState runState, RunStatistics stats) {
        for (AnalysisRoot root : discovery.roots()) {
            if (runState.limitReached()) {
                stats.markLimitReached();
                listener.onLimitReached(runState.debugLimit());
                return;
            }
            Progress progress = new Progress(root.ordinal() + 1, discovery.total());
            Continuation next = processRoot(root, progress, runState, stats);
            if (next == Continuation.STOP) {
                stats.markStopped();
                listener.onStopRequested(root);
                return;
            }
        }
    }

    private Continuation processRoot(
            AnalysisRoot root, Progress progress, RunState runState, RunStatistics stats) {
        transition(DriverState.PRE_ROOT);
        AnalysisContextHandle opened = open(root, stats);
        if (opened == null) {
            return Continuation.CONTINUE;
        }

        try (AnalysisContextHandle handle = opened) {
            AnalysisPass pass = new AnalysisPass(root, progress);
            listener.onRootStart(root, progress);
            for (VisitorRegistration registration : registrations) {
                PreAnalysisCallback callback = registration.preAnalysis().orElse(null);
                if (callback != null) {
                    dispatch(
                            registration,
                            "preAnalysis",
                            stats,
                            () -> callback.preAnalysis(root, root.isSubRoot(), progress));
                }
            }

            transition(DriverState.ANALYZING);
            Iterator<FileResult> files = handle.iterateFiles();
            while (files.hasNext()) {
                FileResult result = files.next();
                if (result instanceof FileResult.Failed failed) {
                    logger.warn(
                            "Skipping {} in {}: {}",
                            failed.relativePath(),
                            root.displayName(),
                            failed.reason());
                    pass.failed(failed);
                    stats.fileFailed();
                    listener.onFileFailed(failed);
                } else if (result instanceof FileResult.Analyzed analyzed) {
                    analyzeFile(analyzed, stats);
                    pass.analyzed();
                    stats.fileAnalyzed();
                }
            }

            transition(DriverState.POST_ROOT);
            Continuation next = Continuation.CONTINUE;
            for (VisitorRegistration registration : registrations) {
                PostAnalysisCallback callback = registration.postAnalysis().orElse(null);
                if (callback != null) {
                    Continuation answer =
                            dispatch(
                                    registration,
                                    "postAnalysis",
                                    stats,
                                    () -> callback.postAnalysis(root, progress),
                                    Continuation.CONTINUE);
                    next = next.and(answer);
                }
            }
            runState.markProcessed();
            stats.rootProcessed();
            listener.onRootFinished(pass);
            return next;
        }
    }

    private AnalysisContextHandle open(AnalysisRoot root, RunStatistics stats) {
        try {
            return engine.open(root, config);
        } catch (AnalysisException e) {
            logger.warn("Cannot open {}: {}", root.displayName(), e.getMessage());
            stats.rootSkipped();
            listener.onRootSkipped(root, e.getMessage());
            return null;
        }
    }

    private void analyzeFile(FileResult.Analyzed file, RunStatistics stats) {
        for (VisitorRegistration registration : registrations) {
            FileContextAware context = registration.fileContext().orElse(null);
            if (context != null) {
                dispatch(
                        registration,
                        "setFilePath",
                        stats,
                        () -> {
                            context.setFilePath(file.path());
                            context.setLineInfo(file.lineInfo());
                        });
            }
        }

        if (config.resolveUnits() && file.hasUnit()) {
            for (VisitorRegistration registration : registrations) {
                VoidVisitor<Object> nodeVisitor = registration.nodeVisitor().orElse(null);
                if (nodeVisitor != null) {
                    dispatch(
                            registration,
                            "visit",
                            stats,
                            () -> file.unit().accept(nodeVisitor, null));
                }
            }
        }

        if (config.showErrors()) {
            for (VisitorRegistration registration : registrations) {
                ErrorReporter reporter = registration.errorReporter().orElse(null);
                if (reporter != null) {
                    dispatch(
                            registration,
                            "reportErrors",
                            stats,
                            () -> {
                                List<DiagnosticRecord> accepted =
                                        file.diagnostics().stream()
                                                .filter(reporter::showError)
                                                .toList();
                                reporter.reportErrors(file.withDiagnostics(accepted));
                                stats.findingsReported(accepted.size());
                            });
                }
            }
        }
    }

    private void dispatch(
            VisitorRegistration registration, String hook, RunStatistics stats, Runnable call) {
        dispatch(
                registration,
                hook,
                stats,
                () -> {
                    call.run();
                    return null;
                },
                null);
    }

    /**
     * Invokes one hook of one visitor under the configured failure policy. Returns {@code
     * fallback} when the visitor is disabled, before or by this call.
     */
    private <T> T dispatch(
            VisitorRegistration registration,
            String hook,
            RunStatistics stats,
            Supplier<T> call,
            T fallback) {
        if (!registration.isActive()) {
            return fallback;
        }
        try {
            return call.get();
        } catch (RuntimeException e) {
            if (config.visitorFailurePolicy() == VisitorFailurePolicy.ABORT) {
                throw new VisitorException(registration.name(), hook, e);
            }
            logger.warn("Disabling visitor {} after failure in {}", registration.name(), hook, e);
            registration.disable();
            stats.visitorDisabled();
            listener.onVisitorDisabled(registration.name(), hook, e);
            return fallback;
        }
    }

    private void transition(DriverState next) {
        logger.trace("{} -> {}", state, next);
        state = next;
    }
}
