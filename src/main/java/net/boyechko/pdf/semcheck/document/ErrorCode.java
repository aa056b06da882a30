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

/** Numeric defect codes recorded against nodes, grouped by the hundreds. */
public enum ErrorCode {
    // Structure
    MISSING_ALT_TEXT(1000),
    EMPTY_ELEMENT(1001),
    INVALID_NESTING(1002),
    MISSING_REQUIRED_CHILD(1003),
    UNEXPECTED_CHILD(1004),
    INVALID_ATTRIBUTE(1005),
    MISSING_ATTRIBUTE(1006),
    DUPLICATE_ID(1007),

    // Tables
    TABLE_CELL_BELOW_NEXT_ROW(1100),
    TABLE_CELL_ABOVE_PREVIOUS_ROW(1101),
    TABLE_CELL_RIGHT_OF_NEXT_COLUMN(1102),
    TABLE_CELL_LEFT_OF_PREVIOUS_COLUMN(1103),
    TABLE_ROW_COUNT_MISMATCH(1104),
    TABLE_COLUMN_COUNT_MISMATCH(1105),
    TABLE_ROW_SPAN_MISMATCH(1106),
    TABLE_COL_SPAN_MISMATCH(1107),
    TABLE_MISSING_HEADERS(1108),
    TABLE_IRREGULAR_STRUCTURE(1109),

    // Lists
    LIST_ITEM_MISSING_LABEL(1200),
    LIST_ITEM_MISSING_BODY(1201),
    LIST_INCONSISTENT_LABELS(1202),
    LIST_LABELS_OUT_OF_SEQUENCE(1203),
    LIST_NESTING_TOO_DEEP(1204),

    // Headings
    HEADING_LEVEL_SKIPPED(1300),
    MULTIPLE_H1_HEADINGS(1301),
    EMPTY_HEADING(1302),
    HEADING_HIERARCHY_INVALID(1303),

    // Figures
    FIGURE_MISSING_ALT_TEXT(1400),
    FIGURE_CAPTION_NOT_ASSOCIATED(1401),
    DECORATIVE_FIGURE_NOT_ARTIFACT(1402),
    FIGURE_INSUFFICIENT_CONTRAST(1403),

    // Reading order
    READING_ORDER_OUT_OF_ORDER(1500),
    READING_ORDER_REVERSED(1501),
    READING_ORDER_OVERLAP(1502),
    READING_ORDER_COLUMN_JUMP(1503);

    private final int code;

    ErrorCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ErrorCode fromCode(int code) {
        for (ErrorCode e : values()) {
            if (e.code == code) return e;
        }
        throw new IllegalArgumentException("Unknown error code: " + code);
    }
}
