/*
 * PDF-Semantics - Accessible roles and MathML from tagged PDFs
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
package net.boyechko.pdf.semantics.core;

/** How much the command-line front end prints, and how much the logs show. */
public enum VerbosityLevel {
    /** Errors and the formula listing only */
    QUIET(0, "ERROR"),

    /** Role summary and formulas (default) */
    NORMAL(1, "WARN"),

    /** Every classified element */
    VERBOSE(2, "INFO"),

    /** Everything, including debug logs */
    DEBUG(3, "DEBUG");

    private final int level;
    private final String logLevel;

    VerbosityLevel(int level, String logLevel) {
        this.level = level;
        this.logLevel = logLevel;
    }

    public int getLevel() {
        return level;
    }

    /** Name of the root logger level that matches this verbosity. */
    public String logLevel() {
        return logLevel;
    }

    public boolean isAtLeast(VerbosityLevel other) {
        return this.level >= other.level;
    }
}
