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

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.Position;
import com.github.javaparser.Problem;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.comments.Comment;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.boyechko.surveyor.discovery.AnalysisRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Parses the files of one root on demand, one file per {@code next()} call. */
class JavaParserContextHandle implements AnalysisContextHandle {
    private static final Logger logger = LoggerFactory.getLogger(JavaParserContextHandle.class);

    private static final Pattern TASK_MARKER = Pattern.compile("\\b(TODO|FIXME)\\b[^\\r\\n]*");

    private final AnalysisRoot root;
    private final JavaParser parser;
    private final List<Path> files;

    private boolean iterated;
    private boolean closed;

    JavaParserContextHandle(AnalysisRoot root, JavaParser parser, List<Path> files) {
        this.root = root;
        this.parser = parser;
        this.files = List.copyOf(files);
    }

    @Override
    public AnalysisRoot root() {
        return root;
    }

    @Override
    public Iterator<FileResult> iterateFiles() {
        if (iterated) {
            throw new IllegalStateException("Files of " + root.displayName() + " already iterated");
        }
        iterated = true;

        return new Iterator<>() {
            private int index;

            @Override
            public boolean hasNext() {
                return !closed && index < files.size();
            }

            @Override
            public FileResult next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return analyze(files.get(index++));
            }
        };
    }

    @Override
    public void close() {
        closed = true;
    }

    private FileResult analyze(Path file) {
        String relativePath = root.path().relativize(file).toString().replace(File.separatorChar, '/');
        try {
            String text = Files.readString(file, StandardCharsets.UTF_8);
            ParseResult<CompilationUnit> result = parser.parse(text);
            LineInfo lineInfo = LineInfo.of(text);

            List<DiagnosticRecord> diagnostics = new ArrayList<>();
            for (Problem problem : result.getProblems()) {
                diagnostics.add(toRecord(problem, lineInfo));
            }

            CompilationUnit unit = result.getResult().orElse(null);
            if (unit != null) {
                unit.setStorage(file, StandardCharsets.UTF_8);
                for (Comment comment : unit.getAllComments()) {
                    collectTaskMarkers(comment, lineInfo, diagnostics);
                }
            }

            diagnostics.sort(DiagnosticRecord.BY_POSITION);
            return new FileResult.Analyzed(file, relativePath, unit, diagnostics, lineInfo);
        } catch (IOException | RuntimeException e) {
            logger.debug("Failed to analyze {}", file, e);
            return new FileResult.Failed(file, relativePath, e);
        }
    }

    private static DiagnosticRecord toRecord(Problem problem, LineInfo lineInfo) {
        int line = 1;
        int column = 1;
        Range range = problem.getLocation().flatMap(tokens -> tokens.toRange()).orElse(null);
        if (range != null) {
            line = range.begin.line;
            column = range.begin.column;
        }
        String message = problem.getMessage().replaceAll("\\s*\\R\\s*", " ").trim();
        return new DiagnosticRecord(line, column, Severity.ERROR, message, lineInfo);
    }

    /** Reports each TODO or FIXME in a comment at the position of the marker itself. */
    private static void collectTaskMarkers(
            Comment comment, LineInfo lineInfo, List<DiagnosticRecord> diagnostics) {
        Position begin = comment.getBegin().orElse(null);
        if (begin == null) return;

        // Content starts after the opening delimiter: "/**" for Javadoc, "//" or "/*" otherwise.
        int delimiter = comment.isJavadocComment() ? 3 : 2;
        int contentStart = lineInfo.getOffsetOfLine(begin.line) + begin.column - 1 + delimiter;

        Matcher matcher = TASK_MARKER.matcher(comment.getContent());
        while (matcher.find()) {
            String marker = matcher.group().trim();
            LineInfo.Location at = lineInfo.getLocation(contentStart + matcher.start());
            diagnostics.add(
                    new DiagnosticRecord(
                            at.lineNumber(), at.columnNumber(), Severity.TODO, marker, lineInfo));
        }
    }
}
