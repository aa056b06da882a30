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
package net.boyechko.pdf.semcheck.validation.heading;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import net.boyechko.pdf.semcheck.document.AttributeValue;
import net.boyechko.pdf.semcheck.document.Attributes;
import net.boyechko.pdf.semcheck.document.ContentNode;
import net.boyechko.pdf.semcheck.document.ErrorLedger;
import net.boyechko.pdf.semcheck.document.Node;
import net.boyechko.pdf.semcheck.document.Role;
import net.boyechko.pdf.semcheck.issue.Issue;
import net.boyechko.pdf.semcheck.issue.IssueList;
import net.boyechko.pdf.semcheck.issue.IssueLoc;
import net.boyechko.pdf.semcheck.issue.IssueSev;
import net.boyechko.pdf.semcheck.issue.IssueType;
import net.boyechko.pdf.semcheck.validation.NodeContext;
import net.boyechko.pdf.semcheck.validation.SemanticTreeVisitor;
import net.boyechko.pdf.semcheck.validation.SemanticTreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates heading sequencing: a single H1, no skipped levels, and headings with meaningful
 * text. Headings are taken in document order; H1 to H6 carry their level, and a generic H reads
 * its {@code Level} attribute, defaulting to 1.
 */
public class HeadingHierarchyChecker {
    private static final Logger logger = LoggerFactory.getLogger(HeadingHierarchyChecker.class);

    public static final Set<String> DEFAULT_GENERIC_PHRASES =
            Set.of(
                    "heading",
                    "title",
                    "section",
                    "chapter",
                    "untitled",
                    "new heading",
                    "click here");

    public record Options(
            boolean requireSingleH1,
            boolean checkSkippedLevels,
            boolean checkEmptyHeadings,
            boolean validateHeadingText,
            boolean requireFirstH1,
            int maxHeadingLevel,
            int minHeadingTextLength,
            Set<String> genericPhrases) {

        public Options {
            if (maxHeadingLevel < 1) {
                throw new IllegalArgumentException(
                        "maxHeadingLevel must be >= 1, got " + maxHeadingLevel);
            }
            genericPhrases = Set.copyOf(genericPhrases);
        }

        public static Options all() {
            return new Options(true, true, true, true, true, 6, 1, DEFAULT_GENERIC_PHRASES);
        }

        /** Skipped levels and empty headings only. */
        public static Options basic() {
            return new Options(false, true, true, false, false, 6, 1, DEFAULT_GENERIC_PHRASES);
        }

        /** Every check, and headings must be at least three characters long. */
        public static Options strict() {
            return new Options(true, true, true, true, true, 6, 3, DEFAULT_GENERIC_PHRASES);
        }
    }

    /** Findings plus the number of headings seen at each level. */
    public record HeadingAnalysis(
            IssueList issues, int totalHeadingCount, Map<Integer, Integer> headingsByLevel) {

        public boolean isValid() {
            return issues.stream().noneMatch(i -> i.severity() == IssueSev.CRITICAL);
        }
    }

    record Heading(Node node, int level, String path) {}

    private final Options options;

    public HeadingHierarchyChecker() {
        this(Options.all());
    }

    public HeadingHierarchyChecker(Options options) {
        this.options = options;
    }

    public Options options() {
        return options;
    }

    public HeadingAnalysis validate(Node root) {
        return validate(root, new ErrorLedger());
    }

    public HeadingAnalysis validate(Node root, ErrorLedger ledger) {
        List<Heading> headings = collectHeadings(root);
        IssueList issues = new IssueList();

        Map<Integer, Integer> byLevel = new TreeMap<>();
        for (Heading h : headings) {
            byLevel.merge(h.level(), 1, Integer::sum);
        }

        if (options.requireSingleH1()) {
            checkSingleH1(headings, byLevel.getOrDefault(1, 0), issues);
        }
        if (options.requireFirstH1() && !headings.isEmpty()) {
            checkFirstIsH1(headings.get(0), issues);
        }

        Integer previousLevel = null;
        for (Heading h : headings) {
            if (options.checkEmptyHeadings()) {
                checkEmpty(h, issues);
            }
            if (options.validateHeadingText()) {
                checkText(h, issues);
            }
            if (options.checkSkippedLevels() && previousLevel != null) {
                checkSkipped(h, previousLevel, issues);
            }
            if (h.level() > options.maxHeadingLevel()) {
                issues.add(
                        new Issue(
                                IssueType.HEADING_LEVEL_TOO_DEEP,
                                IssueSev.WARNING,
                                IssueLoc.atNode(h.node(), h.path()),
                                "Heading level H"
                                        + h.level()
                                        + " exceeds maximum of H"
                                        + options.maxHeadingLevel(),
                                Map.of(
                                        "actualLevel", String.valueOf(h.level()),
                                        "maxLevel", String.valueOf(options.maxHeadingLevel()))));
            }
            // Updated even after a skip, so one bad heading doesn't flag the ones after it.
            previousLevel = h.level();
        }

        issues.recordInto(ledger);
        logger.debug("Checked {} heading(s), found {} issue(s)", headings.size(), issues.size());
        return new HeadingAnalysis(
                issues, headings.size(), Collections.unmodifiableMap(byLevel));
    }

    private void checkSingleH1(List<Heading> headings, int h1Count, IssueList issues) {
        if (h1Count > 1) {
            for (Heading h : headings) {
                if (h.level() != 1) continue;
                issues.add(
                        new Issue(
                                IssueType.HEADING_MULTIPLE_H1,
                                IssueSev.CRITICAL,
                                IssueLoc.atNode(h.node(), h.path()),
                                "Document contains multiple H1 headings (found " + h1Count + ")",
                                Map.of("h1Count", String.valueOf(h1Count))));
            }
        } else if (h1Count == 0 && !headings.isEmpty()) {
            Heading first = headings.get(0);
            issues.add(
                    new Issue(
                            IssueType.HEADING_NO_H1,
                            IssueSev.CRITICAL,
                            IssueLoc.atNode(first.node(), first.path()),
                            "Document has no H1 heading",
                            Map.of("firstLevel", String.valueOf(first.level()))));
        }
    }

    private void checkFirstIsH1(Heading first, IssueList issues) {
        if (first.level() == 1) return;
        issues.add(
                new Issue(
                        IssueType.HEADING_FIRST_NOT_H1,
                        IssueSev.WARNING,
                        IssueLoc.atNode(first.node(), first.path()),
                        "First heading is H" + first.level() + ", should be H1",
                        Map.of("actualLevel", String.valueOf(first.level()))));
    }

    private void checkSkipped(Heading h, int previousLevel, IssueList issues) {
        if (h.level() <= previousLevel + 1) return;
        issues.add(
                new Issue(
                        IssueType.HEADING_LEVEL_SKIPPED,
                        IssueSev.CRITICAL,
                        IssueLoc.atNode(h.node(), h.path()),
                        "Heading level skipped from H" + previousLevel + " to H" + h.level(),
                        Map.of(
                                "previousLevel", String.valueOf(previousLevel),
                                "currentLevel", String.valueOf(h.level()),
                                "skippedLevels", String.valueOf(h.level() - previousLevel - 1))));
    }

    private void checkEmpty(Heading h, IssueList issues) {
        if (h.node().hasContent()) return;
        issues.add(
                new Issue(
                        IssueType.HEADING_EMPTY,
                        IssueSev.CRITICAL,
                        IssueLoc.atNode(h.node(), h.path()),
                        "Heading H" + h.level() + " is empty"));
    }

    private void checkText(Heading h, IssueList issues) {
        String trimmed = headingText(h.node()).strip();
        if (trimmed.length() < options.minHeadingTextLength()) {
            issues.add(
                    new Issue(
                            IssueType.HEADING_TEXT_NOT_MEANINGFUL,
                            IssueSev.WARNING,
                            IssueLoc.atNode(h.node(), h.path()),
                            "Heading H" + h.level() + " text is too short to be meaningful",
                            Map.of(
                                    "textLength", String.valueOf(trimmed.length()),
                                    "minLength", String.valueOf(options.minHeadingTextLength()))));
        } else if (options.genericPhrases().contains(trimmed.toLowerCase(Locale.ROOT))) {
            issues.add(
                    new Issue(
                            IssueType.HEADING_TEXT_NOT_MEANINGFUL,
                            IssueSev.WARNING,
                            IssueLoc.atNode(h.node(), h.path()),
                            "Heading H" + h.level() + " text '" + trimmed + "' is not meaningful",
                            Map.of("headingText", trimmed)));
        }
    }

    /** The node's text description, falling back to its own text. */
    static String headingText(Node node) {
        String description = node.textDescription();
        if (description != null) return description;
        if (node instanceof ContentNode content) return content.text();
        return "";
    }

    /** Level of a heading node, or 0 for anything that is not a heading. */
    static int headingLevel(Node node) {
        if (node.role().headingLevel().isPresent()) {
            return node.role().headingLevel().getAsInt();
        }
        if (node.role() == Role.H) {
            AttributeValue level = node.attribute(Attributes.LEVEL);
            Integer parsed = level != null ? level.asInteger() : null;
            return parsed != null ? parsed : 1;
        }
        return 0;
    }

    private List<Heading> collectHeadings(Node root) {
        List<Heading> headings = new ArrayList<>();
        if (root == null) return headings;

        SemanticTreeWalker walker = new SemanticTreeWalker(null);
        walker.addVisitor(
                new SemanticTreeVisitor() {
                    private final IssueList none = new IssueList();

                    @Override
                    public String name() {
                        return "Heading Collector";
                    }

                    @Override
                    public String description() {
                        return "Collects headings in document order";
                    }

                    @Override
                    public boolean enterElement(NodeContext ctx) {
                        if (ctx.role().isHeading()) {
                            headings.add(
                                    new Heading(ctx.node(), headingLevel(ctx.node()), ctx.path()));
                        }
                        return true;
                    }

                    @Override
                    public IssueList getIssues() {
                        return none;
                    }
                });
        walker.walk(root);
        return headings;
    }
}
