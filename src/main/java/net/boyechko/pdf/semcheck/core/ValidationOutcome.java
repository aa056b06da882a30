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
package net.boyechko.pdf.semcheck.core;

import java.util.List;
import net.boyechko.pdf.semcheck.document.ErrorLedger;
import net.boyechko.pdf.semcheck.issue.IssueList;
import net.boyechko.pdf.semcheck.validation.heading.HeadingHierarchyChecker.HeadingAnalysis;
import net.boyechko.pdf.semcheck.validation.order.ReadingOrderValidator.ReadingOrderAnalysis;
import net.boyechko.pdf.semcheck.validation.structure.StructureAnalyzer.StructureAnalysis;
import net.boyechko.pdf.semcheck.validation.table.TableStructureValidator.TableAnalysis;

/**
 * Results of one engine run. Analyzers that were switched off report empty results. Table
 * analyses follow document order, one per table even when tables share an id.
 */
public record ValidationOutcome(
        StructureAnalysis structure,
        HeadingAnalysis headings,
        ReadingOrderAnalysis readingOrder,
        List<TableResult> tables,
        ErrorLedger ledger) {

    /** The analysis of one table, with the id of the table it describes. */
    public record TableResult(String tableId, TableAnalysis analysis) {}

    public ValidationOutcome {
        tables = List.copyOf(tables);
    }

    /** Table ids in document order, repeated when tables share an id. */
    public List<String> tableIds() {
        return tables.stream().map(TableResult::tableId).toList();
    }

    /** Every finding, grouped by analyzer: structure, headings, reading order, then tables. */
    public IssueList allIssues() {
        IssueList all = new IssueList();
        all.addAll(structure.errors());
        all.addAll(headings.issues());
        all.addAll(readingOrder.issues());
        for (TableResult t : tables) {
            all.addAll(t.analysis().errors());
        }
        return all;
    }

    /** True unless some finding has CRITICAL or ERROR severity. */
    public boolean passed() {
        return !allIssues().hasBlockingIssues();
    }
}
