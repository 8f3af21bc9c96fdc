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
package net.boyechko.surveyor.analysis;

import com.github.javaparser.ast.CompilationUnit;
import java.nio.file.Path;
import java.util.List;

/** Outcome of analyzing one source file: either a parsed unit with findings, or a failure. */
public sealed interface FileResult permits FileResult.Analyzed, FileResult.Failed {

    Path path();

    /** Path relative to the analysis root, with {@code /} separators. */
    String relativePath();

    /**
     * A file the engine could read and parse. The unit may be null if the parser could not
     * produce any tree; the diagnostics then say why.
     */
    record Analyzed(
            Path path,
            String relativePath,
            CompilationUnit unit,
            List<DiagnosticRecord> diagnostics,
            LineInfo lineInfo)
            implements FileResult {

        public Analyzed {
            diagnostics = List.copyOf(diagnostics);
        }

        public boolean hasUnit() {
            return unit != null;
        }

        public Analyzed withDiagnostics(List<DiagnosticRecord> subset) {
            return new Analyzed(path, relativePath, unit, subset, lineInfo);
        }
    }

    /** A file the engine could not analyze. */
    record Failed(Path path, String relativePath, Exception cause) implements FileResult {

        public String reason() {
            String message = cause.getMessage();
            return cause.getClass().getSimpleName() + (message != null ? ": " + message : "");
        }
    }
}
