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

import net.boyechko.pdf.semcheck.validation.heading.HeadingHierarchyChecker;
import net.boyechko.pdf.semcheck.validation.order.ReadingOrderValidator;
import net.boyechko.pdf.semcheck.validation.structure.StructureAnalyzer;
import net.boyechko.pdf.semcheck.validation.table.TableStructureValidator;

/** Which analyzers the engine runs, and the options each one runs with. */
public record ValidationOptions(
        boolean runStructure,
        boolean runHeadings,
        boolean runReadingOrder,
        boolean runTables,
        StructureAnalyzer.Options structure,
        HeadingHierarchyChecker.Options headings,
        ReadingOrderValidator.Options readingOrder,
        TableStructureValidator.Options tables) {

    public ValidationOptions {
        if (structure == null) structure = StructureAnalyzer.Options.all();
        if (headings == null) headings = HeadingHierarchyChecker.Options.all();
        if (readingOrder == null) readingOrder = ReadingOrderValidator.Options.standard();
        if (tables == null) tables = TableStructureValidator.Options.all();
    }

    public static ValidationOptions defaults() {
        return new ValidationOptions(true, true, true, true, null, null, null, null);
    }

    /** Every analyzer with its strictest preset. */
    public static ValidationOptions strict() {
        return new ValidationOptions(
                true,
                true,
                true,
                true,
                StructureAnalyzer.Options.all(),
                HeadingHierarchyChecker.Options.strict(),
                ReadingOrderValidator.Options.strict(),
                TableStructureValidator.Options.all());
    }

    public ValidationOptions withReadingOrder(ReadingOrderValidator.Options readingOrder) {
        return new ValidationOptions(
                runStructure,
                runHeadings,
                runReadingOrder,
                runTables,
                structure,
                headings,
                readingOrder,
                tables);
    }

    public ValidationOptions onlyStructureAndTables() {
        return new ValidationOptions(
                true, false, false, true, structure, headings, readingOrder, tables);
    }
}
