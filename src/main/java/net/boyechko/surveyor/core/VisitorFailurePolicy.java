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

/** What the driver does when a visitor hook throws. */
public enum VisitorFailurePolicy {
    /** Abort the whole run with a {@link VisitorException}. */
    ABORT,

    /** Log the failure and stop dispatching to that visitor for the rest of the run. */
    DISABLE_VISITOR;

    public static VisitorFailurePolicy fromName(String name) {
        return switch (name.trim().toLowerCase()) {
            case "abort" -> ABORT;
            case "disable", "disable_visitor", "disable-visitor" -> DISABLE_VISITOR;
            default -> throw new IllegalArgumentException("Unknown visitor failure policy: " + name);
        };
    }
}
