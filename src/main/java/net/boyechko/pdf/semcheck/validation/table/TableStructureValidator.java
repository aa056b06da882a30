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
package net.boyechko.pdf.semcheck.validation.table;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import net.boyechko.pdf.semcheck.document.ErrorLedger;
import net.boyechko.pdf.semcheck.document.Node;
import net.boyechko.pdf.semcheck.document.Role;
import net.boyechko.pdf.semcheck.document.TableNode;
import net.boyechko.pdf.semcheck.issue.Issue;
import net.boyechko.pdf.semcheck.issue.IssueList;
import net.boyechko.pdf.semcheck.issue.IssueLoc;
import net.boyechko.pdf.semcheck.issue.IssueSev;
import net.boyechko.pdf.semcheck.issue.IssueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates one table: header cells present, rows of equal length, no empty rows, agreement with
 * the drawn grid when one is attached, and only TH/TD cells inside rows. Every check runs
 * regardless of the others. Row and column spans are not taken into account when comparing row
 * lengths.
 */
public class TableStructureValidator {
    private static final Logger logger = LoggerFactory.getLogger(TableStructureValidator.class);

    public record Options(
            boolean requireHeaders, boolean validateRegularity, boolean validateVisualMatch) {

        public static Options all() {
            return new Options(true, true, true);
        }

        /** Skips the comparison with the drawn grid. */
        public static Options semanticOnly() {
            return new Options(true, true, false);
        }
    }

    /** The findings for one table; it passes unless an error-severity finding exists. */
    public record TableAnalysis(IssueList errors, boolean passed) {
        static TableAnalysis of(IssueList errors) {
            boolean failed =
                    errors.stream()
                            .anyMatch(i -> i.severity().isAtLeast(IssueSev.ERROR));
            return new TableAnalysis(errors, !failed);
        }
    }

    private final Options options;

    public TableStructureValidator() {
        this(Options.all());
    }

    public TableStructureValidator(Options options) {
        this.options = options;
    }

    public TableAnalysis validate(Node node) {
        return validate(node, new ErrorLedger());
    }

    /** Validates a table node. Any other node yields an empty, passing analysis. */
    public TableAnalysis validate(Node node, ErrorLedger ledger) {
        if (!(node instanceof TableNode table)) {
            return TableAnalysis.of(new IssueList());
        }

        IssueList errors = new IssueList();
        if (options.requireHeaders()) {
            checkHeaders(table, errors);
        }
        if (options.validateRegularity()) {
            checkRegularity(table, errors);
            checkEmptyRows(table, errors);
        }
        if (options.validateVisualMatch() && table.hasVisualBorder()) {
            checkVisualMatch(table, errors);
        }
        checkCellTypes(table, errors);

        errors.recordInto(ledger);
        TableAnalysis analysis = TableAnalysis.of(errors);
        logger.debug(
                "Table {} with {} row(s): {} finding(s), passed={}",
                table.id(),
                table.rowCount(),
                errors.size(),
                analysis.passed());
        return analysis;
    }

    private void checkHeaders(TableNode table, IssueList errors) {
        int rows = table.rowCount();
        if (!table.hasHeaders()) {
            errors.add(
                    new Issue(
                            IssueType.TABLE_MISSING_HEADERS,
                            rows > 1 ? IssueSev.ERROR : IssueSev.WARNING,
                            IssueLoc.atNode(table),
                            "Table with " + rows + " row(s) has no header cells",
                            Map.of("rowCount", String.valueOf(rows))));
        } else if (table.tableHead().isEmpty()) {
            errors.add(
                    new Issue(
                            IssueType.TABLE_HEADERS_OUTSIDE_HEAD,
                            IssueSev.INFO,
                            IssueLoc.atNode(table),
                            "Table has header cells but no THead element"));
        }
    }

    private void checkRegularity(TableNode table, IssueList errors) {
        if (table.hasConsistentColumnCount()) return;
        List<Integer> counts =
                table.allRows().stream().map(r -> TableNode.cellsInRow(r).size()).toList();
        errors.add(
                new Issue(
                        IssueType.TABLE_COLUMN_COUNT_MISMATCH,
                        IssueSev.ERROR,
                        IssueLoc.atNode(table),
                        "Table has inconsistent column counts across rows",
                        Map.of(
                                "cellCounts",
                                counts.stream()
                                        .map(String::valueOf)
                                        .collect(Collectors.joining(",")))));
    }

    private void checkEmptyRows(TableNode table, IssueList errors) {
        for (Node row : table.allRows()) {
            if (TableNode.cellsInRow(row).isEmpty()) {
                errors.add(
                        new Issue(
                                IssueType.TABLE_EMPTY_ROW,
                                IssueSev.ERROR,
                                IssueLoc.atNode(row),
                                "Table row has no cells",
                                Map.of("tableId", table.id())));
            }
        }
    }

    private void checkVisualMatch(TableNode table, IssueList errors) {
        int visualRows = table.visualRowCount();
        int rows = table.rowCount();
        if (visualRows != rows) {
            errors.add(
                    new Issue(
                            IssueType.TABLE_VISUAL_ROW_MISMATCH,
                            IssueSev.WARNING,
                            IssueLoc.atNode(table),
                            "Visual table has "
                                    + visualRows
                                    + " rows but semantic table has "
                                    + rows
                                    + " rows",
                            Map.of(
                                    "visualRows", String.valueOf(visualRows),
                                    "semanticRows", String.valueOf(rows))));
        }

        int visualColumns = table.visualColumnCount();
        int columns = table.maxCellsPerRow();
        if (columns > 0 && visualColumns != columns) {
            errors.add(
                    new Issue(
                            IssueType.TABLE_VISUAL_COLUMN_MISMATCH,
                            IssueSev.WARNING,
                            IssueLoc.atNode(table),
                            "Visual table has "
                                    + visualColumns
                                    + " columns but semantic table has "
                                    + columns
                                    + " columns",
                            Map.of(
                                    "visualColumns", String.valueOf(visualColumns),
                                    "semanticColumns", String.valueOf(columns))));
        }
    }

    private void checkCellTypes(TableNode table, IssueList errors) {
        for (Node row : table.allRows()) {
            boolean hasHeader = false;
            boolean hasData = false;
            for (Node child : row.children()) {
                if (child.role() == Role.TH) {
                    hasHeader = true;
                } else if (child.role() == Role.TD) {
                    hasData = true;
                } else {
                    errors.add(
                            new Issue(
                                    IssueType.TABLE_INVALID_CELL,
                                    IssueSev.ERROR,
                                    IssueLoc.atNode(child),
                                    "Invalid cell type '"
                                            + child.role().structureType()
                                            + "' in table row (expected TH or TD)",
                                    Map.of(
                                            "childType", child.role().structureType(),
                                            "rowId", row.id())));
                }
            }
            if (hasHeader && hasData) {
                errors.add(
                        new Issue(
                                IssueType.TABLE_MIXED_CELL_ROW,
                                IssueSev.INFO,
                                IssueLoc.atNode(row),
                                "Table row contains both header cells (TH) and data cells (TD)"));
            }
        }
    }
}
