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
package net.boyechko.pdf.semcheck.issue;

import net.boyechko.pdf.semcheck.document.ErrorCode;

/** The kind of a finding, with its category and the error code recorded against the node. */
public enum IssueType {
    // Structure
    NESTING_VIOLATION(
            IssueCategory.STRUCTURE,
            ErrorCode.UNEXPECTED_CHILD,
            "children not allowed under their parent"),
    MISSING_REQUIRED_CHILD(
            IssueCategory.STRUCTURE,
            ErrorCode.MISSING_REQUIRED_CHILD,
            "elements missing a required child"),
    EMPTY_ELEMENT(IssueCategory.STRUCTURE, ErrorCode.EMPTY_ELEMENT, "empty structure elements"),
    DUPLICATE_ID(IssueCategory.STRUCTURE, ErrorCode.DUPLICATE_ID, "duplicate element ids"),
    MAX_DEPTH_EXCEEDED(
            IssueCategory.STRUCTURE,
            ErrorCode.INVALID_NESTING,
            "elements nested too deeply"),
    FIGURE_MISSING_ALT(
            IssueCategory.STRUCTURE,
            ErrorCode.MISSING_ALT_TEXT,
            "figures missing alt text"),
    LINK_MISSING_CONTENT(
            IssueCategory.STRUCTURE,
            ErrorCode.MISSING_ATTRIBUTE,
            "links with no content or alternative"),

    // Headings
    HEADING_MULTIPLE_H1(
            IssueCategory.HEADING,
            ErrorCode.MULTIPLE_H1_HEADINGS,
            "more than one H1 heading"),
    HEADING_NO_H1(IssueCategory.HEADING, ErrorCode.HEADING_HIERARCHY_INVALID, "no H1 heading"),
    HEADING_FIRST_NOT_H1(
            IssueCategory.HEADING,
            ErrorCode.HEADING_HIERARCHY_INVALID,
            "first heading is not H1"),
    HEADING_LEVEL_SKIPPED(
            IssueCategory.HEADING,
            ErrorCode.HEADING_LEVEL_SKIPPED,
            "skipped heading levels"),
    HEADING_EMPTY(IssueCategory.HEADING, ErrorCode.EMPTY_HEADING, "empty headings"),
    HEADING_TEXT_NOT_MEANINGFUL(
            IssueCategory.HEADING,
            ErrorCode.HEADING_HIERARCHY_INVALID,
            "headings with generic or too-short text"),
    HEADING_LEVEL_TOO_DEEP(
            IssueCategory.HEADING,
            ErrorCode.HEADING_HIERARCHY_INVALID,
            "headings deeper than the allowed level"),

    // Reading order
    READING_OUT_OF_ORDER(
            IssueCategory.READING_ORDER,
            ErrorCode.READING_ORDER_OUT_OF_ORDER,
            "content read out of vertical order"),
    READING_REVERSE_DIRECTION(
            IssueCategory.READING_ORDER,
            ErrorCode.READING_ORDER_REVERSED,
            "content read against the line direction"),
    READING_OVERLAP(
            IssueCategory.READING_ORDER,
            ErrorCode.READING_ORDER_OVERLAP,
            "overlapping content"),
    READING_COLUMN_JUMP(
            IssueCategory.READING_ORDER,
            ErrorCode.READING_ORDER_COLUMN_JUMP,
            "reading order jumping back a column"),

    // Tables
    TABLE_MISSING_HEADERS(
            IssueCategory.TABLE,
            ErrorCode.TABLE_MISSING_HEADERS,
            "tables without header cells"),
    TABLE_COLUMN_COUNT_MISMATCH(
            IssueCategory.TABLE,
            ErrorCode.TABLE_COLUMN_COUNT_MISMATCH,
            "tables with rows of different lengths"),
    TABLE_EMPTY_ROW(
            IssueCategory.TABLE,
            ErrorCode.TABLE_IRREGULAR_STRUCTURE,
            "table rows without cells"),
    TABLE_VISUAL_ROW_MISMATCH(
            IssueCategory.TABLE,
            ErrorCode.TABLE_ROW_COUNT_MISMATCH,
            "drawn and tagged row counts differ"),
    TABLE_VISUAL_COLUMN_MISMATCH(
            IssueCategory.TABLE,
            ErrorCode.TABLE_COLUMN_COUNT_MISMATCH,
            "drawn and tagged column counts differ"),
    TABLE_INVALID_CELL(
            IssueCategory.TABLE,
            ErrorCode.TABLE_IRREGULAR_STRUCTURE,
            "table rows with non-cell children"),
    TABLE_HEADERS_OUTSIDE_HEAD(IssueCategory.TABLE, null, "header cells without a THead group"),
    TABLE_MIXED_CELL_ROW(IssueCategory.TABLE, null, "rows mixing header and data cells");

    private final IssueCategory category;
    private final ErrorCode errorCode;
    private final String groupLabel;

    IssueType(IssueCategory category, ErrorCode errorCode, String groupLabel) {
        this.category = category;
        this.errorCode = errorCode;
        this.groupLabel = groupLabel;
    }

    public IssueCategory category() {
        return category;
    }

    /** The code recorded in the error ledger, or null for informational notes. */
    public ErrorCode errorCode() {
        return errorCode;
    }

    public String groupLabel() {
        return groupLabel;
    }
}
