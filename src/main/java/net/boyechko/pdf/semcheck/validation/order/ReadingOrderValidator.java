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
package net.boyechko.pdf.semcheck.validation.order;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import net.boyechko.pdf.semcheck.document.Box;
import net.boyechko.pdf.semcheck.document.ErrorLedger;
import net.boyechko.pdf.semcheck.document.Node;
import net.boyechko.pdf.semcheck.issue.Issue;
import net.boyechko.pdf.semcheck.issue.IssueList;
import net.boyechko.pdf.semcheck.issue.IssueLoc;
import net.boyechko.pdf.semcheck.issue.IssueSev;
import net.boyechko.pdf.semcheck.issue.IssueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that document order agrees with the spatial layout of each page. Only consecutive
 * positioned nodes on the same page are compared; nodes on different pages never are.
 *
 * <p>Coordinates follow PDF user space, so y grows upward and a node read after another should
 * not start above the other's bottom edge.
 */
public class ReadingOrderValidator {
    private static final Logger logger = LoggerFactory.getLogger(ReadingOrderValidator.class);

    /**
     * Tolerances are in points. {@code overlapThreshold} is a fraction of the smaller box and is
     * compared strictly. Every node with a box is compared, containers included. Clearing {@code
     * includeContainers} skips grouping roles that have children.
     */
    public record Options(
            ReadingDirection readingDirection,
            boolean validateColumns,
            boolean checkOverlaps,
            float verticalTolerance,
            float horizontalTolerance,
            double overlapThreshold,
            float columnGapThreshold,
            boolean includeContainers) {

        public Options {
            if (readingDirection == null) {
                readingDirection = ReadingDirection.LEFT_TO_RIGHT;
            }
            if (verticalTolerance < 0 || horizontalTolerance < 0 || columnGapThreshold < 0) {
                throw new IllegalArgumentException("Tolerances must be >= 0");
            }
            if (overlapThreshold < 0 || overlapThreshold > 1) {
                throw new IllegalArgumentException(
                        "overlapThreshold must be in [0, 1], got " + overlapThreshold);
            }
        }

        public static Options standard() {
            return new Options(
                    ReadingDirection.LEFT_TO_RIGHT, true, true, 5f, 10f, 0.1, 50f, true);
        }

        public static Options rightToLeft() {
            return new Options(
                    ReadingDirection.RIGHT_TO_LEFT, true, true, 5f, 10f, 0.1, 50f, true);
        }

        public static Options strict() {
            return new Options(
                    ReadingDirection.LEFT_TO_RIGHT, true, true, 2f, 5f, 0.05, 50f, true);
        }

        public Options withOverlapThreshold(double threshold) {
            return new Options(
                    readingDirection,
                    validateColumns,
                    checkOverlaps,
                    verticalTolerance,
                    horizontalTolerance,
                    threshold,
                    columnGapThreshold,
                    includeContainers);
        }

        public Options withContainers(boolean include) {
            return new Options(
                    readingDirection,
                    validateColumns,
                    checkOverlaps,
                    verticalTolerance,
                    horizontalTolerance,
                    overlapThreshold,
                    columnGapThreshold,
                    include);
        }
    }

    /** Findings, the number of positioned nodes compared, and how many pages they span. */
    public record ReadingOrderAnalysis(IssueList issues, int totalNodeCount, int pageCount) {
        public boolean isValid() {
            return issues.stream().noneMatch(i -> i.severity() == IssueSev.CRITICAL);
        }
    }

    private final Options options;

    public ReadingOrderValidator() {
        this(Options.standard());
    }

    public ReadingOrderValidator(Options options) {
        this.options = options;
    }

    public Options options() {
        return options;
    }

    public ReadingOrderAnalysis validate(Node root) {
        return validate(root, new ErrorLedger());
    }

    public ReadingOrderAnalysis validate(Node root, ErrorLedger ledger) {
        Map<Integer, List<Node>> byPage = new TreeMap<>();
        if (root != null) {
            collect(root, byPage);
        }

        IssueList issues = new IssueList();
        int nodeCount = 0;
        for (Map.Entry<Integer, List<Node>> page : byPage.entrySet()) {
            List<Node> nodes = page.getValue();
            validatePage(nodes, issues);
            nodeCount += nodes.size();
        }

        issues.recordInto(ledger);
        logger.debug(
                "Reading order over {} node(s) on {} page(s) found {} issue(s)",
                nodeCount,
                byPage.size(),
                issues.size());
        return new ReadingOrderAnalysis(issues, nodeCount, byPage.size());
    }

    private void collect(Node node, Map<Integer, List<Node>> byPage) {
        boolean container = node.role().isGrouping() && node.hasChildren();
        if (node.box() != null && (options.includeContainers() || !container)) {
            byPage.computeIfAbsent(node.box().pageIndex(), k -> new ArrayList<>()).add(node);
        }
        for (Node child : node.children()) {
            collect(child, byPage);
        }
    }

    private void validatePage(List<Node> nodes, IssueList issues) {
        if (nodes.size() < 2) return;

        for (int i = 0; i + 1 < nodes.size(); i++) {
            Node current = nodes.get(i);
            Node next = nodes.get(i + 1);
            Issue spatial = checkSpatialOrder(current, next);
            if (spatial != null) {
                issues.add(spatial);
            }
            if (options.checkOverlaps()) {
                Issue overlap = checkOverlap(current, next);
                if (overlap != null) {
                    issues.add(overlap);
                }
            }
        }

        if (options.validateColumns() && nodes.size() > 2) {
            checkColumnOrder(nodes, issues);
        }
    }

    private Issue checkSpatialOrder(Node current, Node next) {
        Box a = current.box();
        Box b = next.box();

        float verticalGap = b.top() - a.bottom();
        if (verticalGap > options.verticalTolerance()) {
            return new Issue(
                    IssueType.READING_OUT_OF_ORDER,
                    IssueSev.CRITICAL,
                    IssueLoc.between(current, next),
                    "Content appears out of vertical order",
                    Map.of(
                            "verticalGap", format(verticalGap),
                            "currentBottom", format(a.bottom()),
                            "nextTop", format(b.top())));
        }

        float sameLineThreshold = Math.min(a.height(), b.height()) * 0.5f;
        float verticalOverlap = Math.min(a.top(), b.top()) - Math.max(a.bottom(), b.bottom());
        if (verticalOverlap > sameLineThreshold) {
            float horizontalDistance =
                    options.readingDirection() == ReadingDirection.LEFT_TO_RIGHT
                            ? b.left() - a.right()
                            : a.left() - b.right();
            if (horizontalDistance < -options.horizontalTolerance()) {
                return new Issue(
                        IssueType.READING_REVERSE_DIRECTION,
                        IssueSev.WARNING,
                        IssueLoc.between(current, next),
                        "Content appears in reverse reading direction",
                        Map.of(
                                "horizontalDistance", format(horizontalDistance),
                                "readingDirection", options.readingDirection().code()));
            }
        }
        return null;
    }

    private Issue checkOverlap(Node current, Node next) {
        double overlap = current.box().overlapPercentage(next.box());
        if (overlap > options.overlapThreshold()) {
            return new Issue(
                    IssueType.READING_OVERLAP,
                    IssueSev.WARNING,
                    IssueLoc.between(current, next),
                    "Content overlaps in reading sequence",
                    Map.of(
                            "overlapPercentage",
                            String.format(Locale.ROOT, "%.1f%%", overlap * 100)));
        }
        return null;
    }

    private void checkColumnOrder(List<Node> nodes, IssueList issues) {
        List<Float> lefts = nodes.stream().map(n -> n.box().left()).toList();
        ColumnLayout columns = ColumnLayout.detect(lefts, options.columnGapThreshold());
        if (columns.columnCount() <= 1) return;

        for (int i = 0; i + 1 < nodes.size(); i++) {
            Node current = nodes.get(i);
            Node next = nodes.get(i + 1);
            int from = columns.columnOf(current.box().left());
            int to = columns.columnOf(next.box().left());
            boolean backward =
                    options.readingDirection() == ReadingDirection.LEFT_TO_RIGHT
                            ? to < from
                            : to > from;
            if (backward) {
                issues.add(
                        new Issue(
                                IssueType.READING_COLUMN_JUMP,
                                IssueSev.WARNING,
                                IssueLoc.between(current, next),
                                "Reading order jumps backward across columns",
                                Map.of(
                                        "fromColumn", String.valueOf(from),
                                        "toColumn", String.valueOf(to))));
            }
        }
    }

    private static String format(float value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
