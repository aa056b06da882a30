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

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/** The closed set of standard structure roles a node can carry. */
public enum Role {
    // Grouping
    DOCUMENT("Document"),
    PART("Part"),
    ART("Art"),
    SECT("Sect"),
    DIV("Div"),

    // Block text
    P("P"),
    SPAN("Span"),
    BLOCK_QUOTE("BlockQuote"),
    INDEX("Index"),

    // Headings
    H("H"),
    H1("H1"),
    H2("H2"),
    H3("H3"),
    H4("H4"),
    H5("H5"),
    H6("H6"),

    // Lists
    L("L"),
    LI("LI"),
    LBL("Lbl"),
    LBODY("LBody"),

    // Tables
    TABLE("Table"),
    TR("TR"),
    TH("TH"),
    TD("TD"),
    THEAD("THead"),
    TBODY("TBody"),
    TFOOT("TFoot"),

    // Illustrations and special blocks
    FIGURE("Figure"),
    CAPTION("Caption"),
    FORMULA("Formula"),
    FORM("Form"),
    CODE("Code"),
    TITLE("Title"),

    // Inline
    LINK("Link"),
    ANNOT("Annot"),
    REFERENCE("Reference"),
    NOTE("Note"),

    // Navigation
    TOC("TOC"),
    TOCI("TOCI"),
    BIB_ENTRY("BibEntry"),
    QUOTE("Quote"),

    // Ruby and Warichu
    RUBY("Ruby"),
    RB("RB"),
    RT("RT"),
    RP("RP"),
    WARICHU("Warichu"),
    WT("WT"),
    WP("WP"),

    // Presentational
    ARTIFACT("Artifact"),
    NON_STRUCT("NonStruct"),
    PRIVATE("Private"),
    HEADER("Header"),
    FOOTER("Footer");

    private static final Set<Role> HEADINGS = EnumSet.of(H, H1, H2, H3, H4, H5, H6);
    private static final Set<Role> LIST_ROLES = EnumSet.of(L, LI, LBL, LBODY);
    private static final Set<Role> TABLE_ROLES = EnumSet.of(TABLE, TR, TH, TD, THEAD, TBODY, TFOOT);
    private static final Set<Role> BLOCK_LEVEL =
            EnumSet.of(
                    DOCUMENT, PART, ART, SECT, DIV, P, BLOCK_QUOTE, INDEX, H, H1, H2, H3, H4, H5,
                    H6, L, LI, LBODY, TABLE, TR, THEAD, TBODY, TFOOT, FIGURE, FORMULA, FORM, CODE,
                    TOC, TOCI, BIB_ENTRY);
    private static final Set<Role> INLINE =
            EnumSet.of(
                    SPAN, LINK, ANNOT, REFERENCE, NOTE, QUOTE, LBL, TH, TD, RUBY, RB, RT, RP,
                    WARICHU, WT, WP);
    private static final Set<Role> PRESENTATIONAL =
            EnumSet.of(ARTIFACT, NON_STRUCT, PRIVATE, HEADER, FOOTER);
    private static final Set<Role> NEEDS_ALTERNATIVE = EnumSet.of(FIGURE, FORMULA);
    private static final Set<Role> GROUPING =
            EnumSet.of(
                    DOCUMENT, PART, ART, SECT, DIV, L, LI, TABLE, TR, THEAD, TBODY, TFOOT, TOC,
                    RUBY, WARICHU, FORM);

    private final String structureType;

    Role(String structureType) {
        this.structureType = structureType;
    }

    /** The standard structure type name, e.g. {@code "BlockQuote"}. */
    public String structureType() {
        return structureType;
    }

    public boolean isHeading() {
        return HEADINGS.contains(this);
    }

    /** 1..6 for H1..H6; empty for every other role, including the generic H. */
    public OptionalInt headingLevel() {
        return switch (this) {
            case H1 -> OptionalInt.of(1);
            case H2 -> OptionalInt.of(2);
            case H3 -> OptionalInt.of(3);
            case H4 -> OptionalInt.of(4);
            case H5 -> OptionalInt.of(5);
            case H6 -> OptionalInt.of(6);
            default -> OptionalInt.empty();
        };
    }

    public boolean isList() {
        return LIST_ROLES.contains(this);
    }

    public boolean isTable() {
        return TABLE_ROLES.contains(this);
    }

    public boolean isBlockLevel() {
        return BLOCK_LEVEL.contains(this);
    }

    public boolean isInline() {
        return INLINE.contains(this);
    }

    public boolean isPresentational() {
        return PRESENTATIONAL.contains(this);
    }

    public boolean requiresAlternativeText() {
        return NEEDS_ALTERNATIVE.contains(this);
    }

    public boolean isGrouping() {
        return GROUPING.contains(this);
    }

    public boolean isTableCell() {
        return this == TH || this == TD;
    }

    /**
     * Resolves a structure type name. Exact names win, then case-insensitive matches, then the
     * lowercase aliases {@code header}, {@code footer} and {@code nonstruct}.
     */
    public static Optional<Role> fromStructureType(String name) {
        if (name == null) return Optional.empty();
        for (Role r : values()) {
            if (r.structureType.equals(name)) return Optional.of(r);
        }
        for (Role r : values()) {
            if (r.structureType.equalsIgnoreCase(name)) return Optional.of(r);
        }
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "header" -> Optional.of(HEADER);
            case "footer" -> Optional.of(FOOTER);
            case "nonstruct" -> Optional.of(NON_STRUCT);
            default -> Optional.empty();
        };
    }

    @Override
    public String toString() {
        return structureType;
    }
}
