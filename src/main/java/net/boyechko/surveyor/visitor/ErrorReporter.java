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

import net.boyechko.surveyor.analysis.DiagnosticRecord;
import net.boyechko.surveyor.analysis.FileResult;

/** Receives the findings of each analyzed file when error reporting is enabled. */
public interface ErrorReporter extends SurveyVisitor {

    /** Filtering policy: only records accepted here are passed to {@link #reportErrors}. */
    default boolean showError(DiagnosticRecord record) {
        return true;
    }

    /**
     * Called once per analyzed file. {@code result.diagnostics()} holds the accepted records only
     * and may be empty.
     */
    void reportErrors(FileResult.Analyzed result);
}
