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

import static net.boyechko.pdf.semcheck.TreeFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.pdf.semcheck.document.ContentNode;
import net.boyechko.pdf.semcheck.document.ErrorCode;
import net.boyechko.pdf.semcheck.document.ErrorLedger;
import net.boyechko.pdf.semcheck.document.Role;
import net.boyechko.pdf.semcheck.document.TableNode;
import net.boyechko.pdf.semcheck.issue.IssueList;
import net.boyechko.pdf.semcheck.issue.IssueSev;
import net.boyechko.pdf.semcheck.issue.IssueType;
import net.boyechko.pdf.semcheck.validation.table.TableStructureValidator.Options;
import net.boyechko.pdf.semcheck.validation.table.TableStructureValidator.TableAnalysis;
import org.junit.jupiter.api.Test;

class TableStructureValidatorTest {

    private final TableStructureValidator validator = new TableStructureValidator();

    private static TableNode withHead(String id, int columns, int bodyRows) {
        TableNode.Builder table =
                TableNode.builder(id)
                        .child(ContentNode.builder(id + "-head", Role.THEAD).child(row(id + "h", Role.TH, columns)));
        ContentNode.Builder body = ContentNode.builder(id + "-body", Role.TBODY);
        for (int r = 0; r < bodyRows; r++) {
            body.child(row(id + "b" + r, Role.TD, columns));
        }
        return table.child(body).build();
    }

    @Test
    void regularTableWithHeadPassesCleanly() {
        TableAnalysis analysis = validator.validate(withHead("t", 3, 2));

        assertTrue(analysis.passed());
        assertTrue(analysis.errors().isEmpty(), () -> String.join("\n", analysis.errors().describe()));
    }

    @Test
    void consistentRowsHaveNoColumnMismatch() {
        TableAnalysis analysis = validator.validate(table("t", 2, 2, 2).build());

        assertTrue(analysis.errors().ofType(IssueType.TABLE_COLUMN_COUNT_MISMATCH).isEmpty());
        assertTrue(analysis.passed());
    }

    @Test
    void raggedRowsAreReportedOnce() {
        TableAnalysis analysis = validator.validate(table("t", 2, 2, 3).build());

        IssueList mismatch = analysis.errors().ofType(IssueType.TABLE_COLUMN_COUNT_MISMATCH);
        assertEquals(1, mismatch.size());
        assertEquals(IssueSev.ERROR, mismatch.get(0).severity());
        assertEquals("2,2,3", mismatch.get(0).contextValue("cellCounts"));
        assertEquals("t", mismatch.get(0).nodeId());
        assertFalse(analysis.passed());
    }

    @Test
    void headerCellsOutsideTheadAreNoted() {
        IssueList issues = validator.validate(table("t", 2, 2).build()).errors();

        IssueList noted = issues.ofType(IssueType.TABLE_HEADERS_OUTSIDE_HEAD);
        assertEquals(1, noted.size());
        assertEquals(IssueSev.INFO, noted.get(0).severity());
    }

    @Test
    void missingHeadersIsAnErrorForMultiRowTables() {
        TableNode table =
                TableNode.builder("t").child(row("r0", Role.TD, 2)).child(row("r1", Role.TD, 2)).build();

        TableAnalysis analysis = validator.validate(table);

        IssueList missing = analysis.errors().ofType(IssueType.TABLE_MISSING_HEADERS);
        assertEquals(1, missing.size());
        assertEquals(IssueSev.ERROR, missing.get(0).severity());
        assertEquals("2", missing.get(0).contextValue("rowCount"));
        assertFalse(analysis.passed());
    }

    @Test
    void missingHeadersIsAWarningForSingleRowTables() {
        TableAnalysis analysis = validator.validate(TableNode.builder("t").child(row("r0", Role.TD, 2)).build());

        IssueList missing = analysis.errors().ofType(IssueType.TABLE_MISSING_HEADERS);
        assertEquals(IssueSev.WARNING, missing.get(0).severity());
        assertTrue(analysis.passed());
    }

    @Test
    void rowWithoutCellsIsReportedAtTheRow() {
        TableNode table = table("t", 2, 2).child(ContentNode.builder("empty", Role.TR)).build();

        IssueList empty = validator.validate(table).errors().ofType(IssueType.TABLE_EMPTY_ROW);

        assertEquals(1, empty.size());
        assertEquals("empty", empty.get(0).nodeId());
        assertEquals("t", empty.get(0).contextValue("tableId"));
    }

    @Test
    void drawnGridMatchingTheTagsIsClean() {
        TableNode table = table("t", 2, 2, 2).build().withVisualBorder(lines(3, 50), lines(4, 10));

        IssueList issues = validator.validate(table).errors();

        assertTrue(issues.ofType(IssueType.TABLE_VISUAL_ROW_MISMATCH).isEmpty());
        assertTrue(issues.ofType(IssueType.TABLE_VISUAL_COLUMN_MISMATCH).isEmpty());
    }

    @Test
    void drawnGridWithFewerRowsIsWarned() {
        TableNode table = table("t", 2, 2, 2).build().withVisualBorder(lines(3, 50), lines(3, 10));

        TableAnalysis analysis = validator.validate(table);

        IssueList rows = analysis.errors().ofType(IssueType.TABLE_VISUAL_ROW_MISMATCH);
        assertEquals(1, rows.size());
        assertEquals(IssueSev.WARNING, rows.get(0).severity());
        assertEquals("2", rows.get(0).contextValue("visualRows"));
        assertEquals("3", rows.get(0).contextValue("semanticRows"));
        assertTrue(analysis.passed(), "visual disagreement alone does not fail a table");
    }

    @Test
    void drawnGridWithExtraColumnIsWarned() {
        TableNode table = table("t", 2, 2).build().withVisualBorder(lines(4, 50), lines(3, 10));

        IssueList columns = validator.validate(table).errors().ofType(IssueType.TABLE_VISUAL_COLUMN_MISMATCH);

        assertEquals(1, columns.size());
        assertEquals("3", columns.get(0).contextValue("visualColumns"));
        assertEquals("2", columns.get(0).contextValue("semanticColumns"));
    }

    @Test
    void gridWithoutVerticalLinesIsIgnored() {
        TableNode table = table("t", 2, 2, 2).build().withVisualBorder(List.of(), lines(2, 10));

        IssueList issues = validator.validate(table).errors();

        assertTrue(issues.ofType(IssueType.TABLE_VISUAL_ROW_MISMATCH).isEmpty());
    }

    @Test
    void semanticOnlySkipsGridComparison() {
        TableNode table = table("t", 2, 2, 2).build().withVisualBorder(lines(9, 50), lines(9, 10));

        IssueList issues = new TableStructureValidator(Options.semanticOnly()).validate(table).errors();

        assertTrue(issues.ofType(IssueType.TABLE_VISUAL_ROW_MISMATCH).isEmpty());
        assertTrue(issues.ofType(IssueType.TABLE_VISUAL_COLUMN_MISMATCH).isEmpty());
    }

    @Test
    void nonCellChildrenOfRowsAreInvalid() {
        ContentNode badRow =
                ContentNode.builder("r1", Role.TR)
                        .child(cell("r1c0", Role.TD))
                        .child(paragraph("stray", "note"))
                        .build();
        TableNode table = TableNode.builder("t").child(row("r0", Role.TH, 1)).child(badRow).build();

        IssueList invalid = validator.validate(table).errors().ofType(IssueType.TABLE_INVALID_CELL);

        assertEquals(1, invalid.size());
        assertEquals("stray", invalid.get(0).nodeId());
        assertEquals("P", invalid.get(0).contextValue("childType"));
        assertEquals("r1", invalid.get(0).contextValue("rowId"));
    }

    @Test
    void rowsMixingHeaderAndDataCellsAreNoted() {
        ContentNode mixed =
                ContentNode.builder("r0", Role.TR)
                        .child(cell("rh", Role.TH))
                        .child(cell("rd", Role.TD))
                        .build();

        IssueList issues = validator.validate(TableNode.builder("t").child(mixed).build()).errors();

        IssueList noted = issues.ofType(IssueType.TABLE_MIXED_CELL_ROW);
        assertEquals(1, noted.size());
        assertEquals("r0", noted.get(0).nodeId());
        assertEquals(IssueSev.INFO, noted.get(0).severity());
    }

    @Test
    void nonTableNodesPassTrivially() {
        TableAnalysis analysis = validator.validate(paragraph("p", "not a table"));

        assertTrue(analysis.passed());
        assertTrue(analysis.errors().isEmpty());
    }

    @Test
    void findingsAreRecordedInTheLedger() {
        ErrorLedger ledger = new ErrorLedger();

        validator.validate(table("t", 2, 3).build(), ledger);

        assertTrue(ledger.codesFor("t").contains(ErrorCode.TABLE_COLUMN_COUNT_MISMATCH));
    }
}
