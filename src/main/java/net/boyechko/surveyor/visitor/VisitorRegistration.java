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
package net.boyechko.surveyor.visitor;

import com.github.javaparser.ast.visitor.VoidVisitor;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A registered visitor together with the hooks it was found to implement. Capabilities are probed
 * once, at registration; the driver dispatches on them and never on the visitor's concrete type.
 */
public final class VisitorRegistration {

    public enum Capability {
        PRE_ANALYSIS,
        FILE_CONTEXT,
        NODE_TRAVERSAL,
        ERROR_REPORT,
        POST_ANALYSIS,
        RUN_FINISHED
    }

    private final SurveyVisitor visitor;
    private final PreAnalysisCallback preAnalysis;
    private final FileContextAware fileContext;
    private final VoidVisitor<Object> nodeVisitor;
    private final ErrorReporter errorReporter;
    private final PostAnalysisCallback postAnalysis;
    private final RunFinishedCallback runFinished;
    private final Set<Capability> capabilities;

    private boolean active = true;

    @SuppressWarnings("unchecked")
    private VisitorRegistration(SurveyVisitor visitor) {
        this.visitor = visitor;
        this.preAnalysis = visitor instanceof PreAnalysisCallback c ? c : null;
        this.fileContext = visitor instanceof FileContextAware c ? c : null;
        // Visitors are registered without an argument type; nodes are always visited with null.
        this.nodeVisitor = visitor instanceof VoidVisitor<?> v ? (VoidVisitor<Object>) v : null;
        this.errorReporter = visitor instanceof ErrorReporter c ? c : null;
        this.postAnalysis = visitor instanceof PostAnalysisCallback c ? c : null;
        this.runFinished = visitor instanceof RunFinishedCallback c ? c : null;

        EnumSet<Capability> found = EnumSet.noneOf(Capability.class);
        if (preAnalysis != null) found.add(Capability.PRE_ANALYSIS);
        if (fileContext != null) found.add(Capability.FILE_CONTEXT);
        if (nodeVisitor != null) found.add(Capability.NODE_TRAVERSAL);
        if (errorReporter != null) found.add(Capability.ERROR_REPORT);
        if (postAnalysis != null) found.add(Capability.POST_ANALYSIS);
        if (runFinished != null) found.add(Capability.RUN_FINISHED);
        this.capabilities = Collections.unmodifiableSet(found);
    }

    public static VisitorRegistration probe(SurveyVisitor visitor) {
        return new VisitorRegistration(Objects.requireNonNull(visitor, "visitor"));
    }

    public String name() {
        return visitor.name();
    }

    public Set<Capability> capabilities() {
        return capabilities;
    }

    public boolean has(Capability capability) {
        return capabilities.contains(capability);
    }

    public Optional<PreAnalysisCallback> preAnalysis() {
        return Optional.ofNullable(preAnalysis);
    }

    public Optional<FileContextAware> fileContext() {
        return Optional.ofNullable(fileContext);
    }

    public Optional<VoidVisitor<Object>> nodeVisitor() {
        return Optional.ofNullable(nodeVisitor);
    }

    public Optional<ErrorReporter> errorReporter() {
        return Optional.ofNullable(errorReporter);
    }

    public Optional<PostAnalysisCallback> postAnalysis() {
        return Optional.ofNullable(postAnalysis);
    }

    public Optional<RunFinishedCallback> runFinished() {
        return Optional.ofNullable(runFinished);
    }

    public boolean isActive() {
        return active;
    }

    /** Removes this visitor from dispatch for the rest of the run. */
    public void disable() {
        active = false;
    }

    @Override
    public String toString() {
        return name() + capabilities;
    }
}
