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

/** A visitor hook threw; the run cannot trust that visitor's output any more. */
public class VisitorException extends RuntimeException {
    private final String visitorName;
    private final String hook;

    public VisitorException(String visitorName, String hook, Throwable cause) {
        super("Visitor " + visitorName + " failed in " + hook + ": " + cause.getMessage(), cause);
        this.visitorName = visitorName;
        this.hook = hook;
    }

    public String visitorName() {
        return visitorName;
    }

    public String hook() {
        return hook;
    }
}
