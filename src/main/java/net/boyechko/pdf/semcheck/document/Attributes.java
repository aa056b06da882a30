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

/** Reserved attribute keys read by the analyzers. */
public final class Attributes {
    public static final String ALT = "Alt";
    public static final String ACTUAL_TEXT = "ActualText";
    public static final String LANG = "Lang";
    public static final String TITLE = "Title";
    public static final String LEVEL = "Level";
    public static final String SUMMARY = "Summary";
    public static final String ROLE_MAP = "RoleMap";

    private Attributes() {}
}
