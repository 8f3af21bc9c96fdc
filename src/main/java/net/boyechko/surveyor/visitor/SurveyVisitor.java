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

/**
 * Base type of every pluggable visitor. A visitor opts into lifecycle hooks by also implementing
 * any subset of {@link PreAnalysisCallback}, {@link FileContextAware}, {@link ErrorReporter},
 * {@link PostAnalysisCallback} and {@link RunFinishedCallback}, and receives syntax nodes by being
 * a JavaParser {@code VoidVisitor} (usually by extending {@code VoidVisitorAdapter}).
 *
 * <p>A visitor owns its state. The driver never resets it between roots.
 */
public interface SurveyVisitor {

    default String name() {
        return getClass().getSimpleName();
    }
}
