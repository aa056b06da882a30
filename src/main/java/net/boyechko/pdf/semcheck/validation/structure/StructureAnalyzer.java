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
package net.boyechko.pdf.semcheck.validation.structure;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.semcheck.document.ErrorLedger;
import net.boyechko.pdf.semcheck.document.Node;
import net.boyechko.pdf.semcheck.issue.IssueList;
import net.boyechko.pdf.semcheck.validation.NestingSchema;
import net.boyechko.pdf.semcheck.validation.SemanticTreeVisitor;
import net.boyechko.pdf.semcheck.validation.SemanticTreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks general structural rules in one depth-first walk: duplicate ids, maximum depth, empty
 * elements, parent/child nesting, required children and role-specific attributes. Each rule runs
 * as its own visitor, so no rule can hide another's findings. Findings are raw facts and all carry
 * ERROR severity.
 */
public class StructureAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(StructureAnalyzer.class);

    /**
     * Which rules to run. {@code maxDepth} of 0 means no depth limit.
     */
    public record Options(
            boolean validateNesting,
            boolean validateRequiredChildren,
            boolean validateAttributes,
            boolean checkEmptyElements,
            boolean checkDuplicateIds,
            int maxDepth) {

        public Options {
            if (maxDepth < 0) {
                throw new IllegalArgumentException("maxDepth must be >= 0, got " + maxDepth);
            }
        }

        public static Options all() {
            return new Options(true, true, true, true, true, 0);
        }

        public static Options nestingOnly() {
            return new Options(true, false, false, false, false, 0);
        }

        public static Options attributesOnly() {
            return new Options(false, false, true, false, false, 0);
        }

        public Options withMaxDepth(int maxDepth) {
            return new Options(
                    validateNesting,
                    validateRequiredChildren,
                    validateAttributes,
                    checkEmptyElements,
                    checkDuplicateIds,
                    maxDepth);
        }
    }

    /** Result of one analysis: the findings, how many nodes were visited, and the deepest depth. */
    public record StructureAnalysis(IssueList errors, int totalNodeCount, int maxDepth) {
        public boolean isValid() {
            return errors.isEmpty();
        }
    }

    private final Options options;
    private final NestingSchema schema;

    public StructureAnalyzer() {
        this(Options.all());
    }

    public StructureAnalyzer(Options options) {
        this(options, NestingSchema.loadDefault());
    }

    public StructureAnalyzer(Options options, NestingSchema schema) {
        this.options = options;
        this.schema = schema;
    }

    public Options options() {
        return options;
    }

    public StructureAnalysis analyze(Node root) {
        return analyze(root, new ErrorLedger());
    }

    /** Analyzes the tree under {@code root}, recording error codes in {@code ledger}. */
    public StructureAnalysis analyze(Node root, ErrorLedger ledger) {
        if (root == null) {
            return new StructureAnalysis(new IssueList(), 0, 0);
        }

        SemanticTreeWalker walker = new SemanticTreeWalker(schema);
        for (SemanticTreeVisitor visitor : buildVisitors()) {
            walker.addVisitor(visitor);
        }
        IssueList errors = walker.walk(root);
        errors.recordInto(ledger);

        StructureAnalysis analysis =
                new StructureAnalysis(errors, walker.visitedCount(), root.maxDepth());
        logger.debug(
                "Structure analysis of {} nodes (max depth {}) found {} issue(s)",
                analysis.totalNodeCount(),
                analysis.maxDepth(),
                errors.size());
        return analysis;
    }

    private List<SemanticTreeVisitor> buildVisitors() {
        List<SemanticTreeVisitor> visitors = new ArrayList<>();
        if (options.maxDepth() > 0) {
            visitors.add(new MaxDepthVisitor(options.maxDepth()));
        }
        if (options.checkDuplicateIds()) {
            visitors.add(new DuplicateIdVisitor());
        }
        if (options.checkEmptyElements()) {
            visitors.add(new EmptyElementVisitor());
        }
        if (options.validateNesting()) {
            visitors.add(new NestingVisitor());
        }
        if (options.validateRequiredChildren()) {
            visitors.add(new RequiredChildrenVisitor());
        }
        if (options.validateAttributes()) {
            visitors.add(new AttributeVisitor());
        }
        return visitors;
    }
}
