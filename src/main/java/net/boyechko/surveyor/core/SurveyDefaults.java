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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import net.boyechko.surveyor.visitor.SurveyVisitor;
import net.boyechko.surveyor.visitors.ErrorSurveyor;
import net.boyechko.surveyor.visitors.IdentifierOccurrenceCollector;

/** The built-in visitors, by the names the command line uses. */
public final class SurveyDefaults {
    private SurveyDefaults() {}

    public static final String ERRORS = "errors";
    public static final String IDENTIFIERS = "identifiers";

    public static final List<String> VISITOR_NAMES = List.of(ERRORS, IDENTIFIERS);

    /**
     * Creates the named visitors in the given order.
     *
     * @param identifiers identifiers for the {@code identifiers} visitor; empty for its defaults
     * @throws IllegalArgumentException for an unknown name
     */
    public static List<SurveyVisitor> visitors(
            Collection<String> names, PrintStream out, Set<String> identifiers) {
        List<SurveyVisitor> visitors = new ArrayList<>();
        for (String name : names) {
            visitors.add(visitor(name, out, identifiers));
        }
        return visitors;
    }

    public static SurveyVisitor visitor(String name, PrintStream out, Set<String> identifiers) {
        return switch (name) {
            case ERRORS -> new ErrorSurveyor(out);
            case IDENTIFIERS ->
                    identifiers.isEmpty()
                            ? new IdentifierOccurrenceCollector(out)
                            : new IdentifierOccurrenceCollector(out, identifiers);
            default ->
                    throw new IllegalArgumentException(
                            "Unknown visitor '" + name + "'; expected one of " + VISITOR_NAMES);
        };
    }
}
