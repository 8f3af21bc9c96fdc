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
package net.boyechko.surveyor.visitors;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.type.TypeParameter;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import net.boyechko.surveyor.discovery.AnalysisRoot;
import net.boyechko.surveyor.visitor.Continuation;
import net.boyechko.surveyor.visitor.FileContextAware;
import net.boyechko.surveyor.visitor.PostAnalysisCallback;
import net.boyechko.surveyor.visitor.PreAnalysisCallback;
import net.boyechko.surveyor.visitor.Progress;
import net.boyechko.surveyor.visitor.RunFinishedCallback;

/**
 * Counts where a set of identifiers is used as a name, telling declarations from references, and
 * which projects use them.
 *
 * <p>Defaults to the restricted identifiers of recent Java releases, to measure how much code
 * would be affected if they became reserved.
 */
public class IdentifierOccurrenceCollector extends VoidVisitorAdapter<Void>
        implements PreAnalysisCallback,
                FileContextAware,
                PostAnalysisCallback,
                RunFinishedCallback {

    public static final Set<String> RESTRICTED_IDENTIFIERS =
            Set.of("var", "yield", "record", "sealed", "permits");

    private final PrintStream out;
    private final Map<String, Occurrences> occurrences = new LinkedHashMap<>();

    private AnalysisRoot currentRoot;
    private String currentProject;
    private String currentFile;

    public IdentifierOccurrenceCollector(PrintStream out) {
        this(out, RESTRICTED_IDENTIFIERS);
    }

    public IdentifierOccurrenceCollector(PrintStream out, Set<String> identifiers) {
        if (identifiers.isEmpty()) {
            throw new IllegalArgumentException("At least one identifier is required");
        }
        this.out = out;
        identifiers.stream().sorted().forEach(id -> occurrences.put(id, new Occurrences()));
    }

    @Override
    public String name() {
        return "identifiers";
    }

    @Override
    public void preAnalysis(AnalysisRoot root, boolean isSubRoot, Progress progress) {
        currentRoot = root;
        currentProject = projectName(root.name());
        String name = isSubRoot ? root.displayName() : root.name();
        out.println("Analyzing '" + name + "' • " + progress + "...");
    }

    @Override
    public void setFilePath(Path filePath) {
        Path relative =
                currentRoot != null && filePath.startsWith(currentRoot.path())
                        ? currentRoot.path().relativize(filePath)
                        : filePath;
        String prefix = currentRoot != null ? currentRoot.displayName() + "/" : "";
        currentFile = prefix + relative.toString().replace('\\', '/');
    }

    @Override
    public void visit(SimpleName n, Void arg) {
        Occurrences hits = occurrences.get(n.getIdentifier());
        if (hits != null) {
            boolean declaration = isDeclaration(n);
            hits.record(currentProject, declaration);
            String where =
                    n.getBegin().map(p -> p.line + ":" + p.column).orElse("1:1");
            out.println(
                    "found '"
                            + n.getIdentifier()
                            + "' "
                            + (declaration ? "(decl) " : "")
                            + "• "
                            + currentFile
                            + ":"
                            + where);
        }
        super.visit(n, arg);
    }

    @Override
    public Continuation postAnalysis(AnalysisRoot root, Progress progress) {
        currentRoot = null;
        currentFile = null;
        return Continuation.CONTINUE;
    }

    @Override
    public void onRunFinished() {
        for (Map.Entry<String, Occurrences> entry : occurrences.entrySet()) {
            Occurrences hits = entry.getValue();
            out.println(
                    "'"
                            + entry.getKey()
                            + "': "
                            + hits.declarations()
                            + " declarations, "
                            + hits.references()
                            + " references in "
                            + hits.projects().size()
                            + " projects"
                            + (hits.projects().isEmpty()
                                    ? ""
                                    : " (" + String.join(", ", hits.projects()) + ")"));
        }
        out.flush();
    }

    public Map<String, Occurrences> occurrences() {
        return Collections.unmodifiableMap(occurrences);
    }

    /** A name declares something when it is the name of the declaring node itself. */
    static boolean isDeclaration(SimpleName name) {
        Node parent = name.getParentNode().orElse(null);
        return parent instanceof BodyDeclaration<?>
                || parent instanceof VariableDeclarator
                || parent instanceof Parameter
                || parent instanceof TypeParameter;
    }

    /** Project name of a root directory: everything before the first '-', e.g. a version. */
    static String projectName(String directoryName) {
        int dash = directoryName.indexOf('-');
        return dash > 0 ? directoryName.substring(0, dash) : directoryName;
    }
}
