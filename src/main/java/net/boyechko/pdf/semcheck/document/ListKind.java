/*
 * PDF-SemCheck - Semantic Structure Validation for Tagged PDFs
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
package net.boyechko.pdf.semcheck.document;

/** Numbering style of a list, as detected from its labels. */
public enum ListKind {
    UNORDERED,
    ORDERED_ARABIC,
    ORDERED_ROMAN_UPPER,
    ORDERED_ROMAN_LOWER,
    ORDERED_ALPHA_UPPER,
    ORDERED_ALPHA_LOWER,
    ORDERED_CIRCLED,
    UNKNOWN;

    public boolean isOrdered() {
        return this != UNORDERED && this != UNKNOWN;
    }
}
