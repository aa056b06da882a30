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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;
import net.boyechko.pdf.semcheck.document.ErrorLedger;
import net.boyechko.pdf.semcheck.document.Node;
import net.boyechko.pdf.semcheck.document.TableNode;
import net.boyechko.pdf.semcheck.core.ValidationOutcome.TableResult;
import net.boyechko.pdf.semcheck.issue.IssueList;
import net.boyechko.pdf.semcheck.validation.NestingSchema;
import net.boyechko.pdf.semcheck.validation.heading.HeadingHierarchyChecker;
import net.boyechko.pdf.semcheck.validation.heading.HeadingHierarchyChecker.HeadingAnalysis;
import net.boyechko.pdf.semcheck.validation.order.ReadingOrderValidator;
import net.boyechko.pdf.semcheck.validation.order.ReadingOrderValidator.ReadingOrderAnalysis;
import net.boyechko.pdf.semcheck.validation.structure.StructureAnalyzer;
import net.boyechko.pdf.semcheck.validation.structure.StructureAnalyzer.StructureAnalysis;
import net.boyechko.pdf.semcheck.validation.table.TableStructureValidator;
import net.boyechko.pdf.semcheck.validation.table.TableStructureValidator.TableAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the four analyzers over one tree and gathers their findings. The analyzers share nothing
 * but the error ledger, so they can run one after another or side by side on an executor.
 */
public class ValidationEngine {
    private static final Logger logger = LoggerFactory.getLogger(ValidationEngine.class);

    static final String STRUCTURE_PHASE = "Structure";
    static final String HEADING_PHASE = "Headings";
    static final String READING_ORDER_PHASE = "Reading order";
    static final String TABLE_PHASE = "Tables";

    private final ValidationOptions options;
    private final ValidationListener listener;
    private final StructureAnalyzer structureAnalyzer;
    private final HeadingHierarchyChecker headingChecker;
    private final ReadingOrderValidator readingOrderValidator;
    private final TableStructureValidator tableValidator;

    public ValidationEngine() {
        this(ValidationOptions.defaults());
    }

    public ValidationEngine(ValidationOptions options) {
        this(options, NestingSchema.loadDefault(), ValidationListener.NONE);
    }

    public ValidationEngine(
            ValidationOptions options, NestingSchema schema, ValidationListener listener) {
        this.options = options;
        this.listener = listener != null ? listener : ValidationListener.NONE;
        this.structureAnalyzer = new StructureAnalyzer(options.structure(), schema);
        this.headingChecker = new HeadingHierarchyChecker(options.headings());
        this.readingOrderValidator = new ReadingOrderValidator(options.readingOrder());
        this.tableValidator = new TableStructureValidator(options.tables());
    }

    public ValidationOptions options() {
        return options;
    }

    /** Runs the enabled analyzers one after another on the calling thread. */
    public ValidationOutcome validate(Node root) {
        ErrorLedger ledger = new ErrorLedger();
        ValidationOutcome outcome =
                new ValidationOutcome(
                        runStructure(root, ledger),
                        runHeadings(root, ledger),
                        runReadingOrder(root, ledger),
                        runTables(root, ledger),
                        ledger);
        return finish(outcome);
    }

    /**
     * Runs the enabled analyzers concurrently on {@code executor}. The executor is not shut down.
     *
     * @throws IllegalStateException if an analyzer fails
     */
    public ValidationOutcome validate(Node root, ExecutorService executor) {
        ErrorLedger ledger = new ErrorLedger();
        CompletableFuture<StructureAnalysis> structure =
                submit(() -> runStructure(root, ledger), executor);
        CompletableFuture<HeadingAnalysis> headings =
                submit(() -> runHeadings(root, ledger), executor);
        CompletableFuture<ReadingOrderAnalysis> readingOrder =
                submit(() -> runReadingOrder(root, ledger), executor);
        CompletableFuture<List<TableResult>> tables =
                submit(() -> runTables(root, ledger), executor);

        try {
            CompletableFuture.allOf(structure, headings, readingOrder, tables).join();
            return finish(
                    new ValidationOutcome(
                            structure.join(),
                            headings.join(),
                            readingOrder.join(),
                            tables.join(),
                            ledger));
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Parallel validation failed: {}", cause.getMessage());
            throw new IllegalStateException("Validation failed: " + cause.getMessage(), cause);
        }
    }

    private static <T> CompletableFuture<T> submit(Supplier<T> task, ExecutorService executor) {
        return CompletableFuture.supplyAsync(task, executor);
    }

    private ValidationOutcome finish(ValidationOutcome outcome) {
        IssueList all = outcome.allIssues();
        listener.onSummary(all);
        logger.debug(
                "Validation finished with {} finding(s), passed={}",
                all.size(),
                !all.hasBlockingIssues());
        return outcome;
    }

    private StructureAnalysis runStructure(Node root, ErrorLedger ledger) {
        if (!options.runStructure()) {
            return new StructureAnalysis(new IssueList(), 0, 0);
        }
        listener.onPhaseStart(STRUCTURE_PHASE);
        StructureAnalysis result = structureAnalyzer.analyze(root, ledger);
        listener.onPhaseComplete(STRUCTURE_PHASE, result.errors());
        return result;
    }

    private HeadingAnalysis runHeadings(Node root, ErrorLedger ledger) {
        if (!options.runHeadings()) {
            return new HeadingAnalysis(new IssueList(), 0, Map.of());
        }
        listener.onPhaseStart(HEADING_PHASE);
        HeadingAnalysis result = headingChecker.validate(root, ledger);
        listener.onPhaseComplete(HEADING_PHASE, result.issues());
        return result;
    }

    private ReadingOrderAnalysis runReadingOrder(Node root, ErrorLedger ledger) {
        if (!options.runReadingOrder()) {
            return new ReadingOrderAnalysis(new IssueList(), 0, 0);
        }
        listener.onPhaseStart(READING_ORDER_PHASE);
        ReadingOrderAnalysis result = readingOrderValidator.validate(root, ledger);
        listener.onPhaseComplete(READING_ORDER_PHASE, result.issues());
        return result;
    }

    private List<TableResult> runTables(Node root, ErrorLedger ledger) {
        List<TableResult> results = new ArrayList<>();
        if (!options.runTables() || root == null) {
            return results;
        }
        listener.onPhaseStart(TABLE_PHASE);
        IssueList found = new IssueList();
        for (TableNode table : tablesIn(root)) {
            TableAnalysis analysis = tableValidator.validate(table, ledger);
            results.add(new TableResult(table.id(), analysis));
            found.addAll(analysis.errors());
        }
        listener.onPhaseComplete(TABLE_PHASE, found);
        return results;
    }

    static List<TableNode> tablesIn(Node root) {
        return root.descendants().stream()
                .filter(TableNode.class::isInstance)
                .map(TableNode.class::cast)
                .toList();
    }
}
