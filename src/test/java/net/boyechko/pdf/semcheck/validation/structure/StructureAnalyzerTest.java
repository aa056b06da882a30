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

import static net.boyechko.pdf.semcheck.TreeFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import net.boyechko.pdf.semcheck.document.Box;
import net.boyechko.pdf.semcheck.document.ContentNode;
import net.boyechko.pdf.semcheck.document.ErrorCode;
import net.boyechko.pdf.semcheck.document.ErrorLedger;
import net.boyechko.pdf.semcheck.document.FigureNode;
import net.boyechko.pdf.semcheck.document.ListNode;
import net.boyechko.pdf.semcheck.document.Node;
import net.boyechko.pdf.semcheck.document.Role;
import net.boyechko.pdf.semcheck.document.TableNode;
import net.boyechko.pdf.semcheck.document.content.ImageChunk;
import net.boyechko.pdf.semcheck.issue.Issue;
import net.boyechko.pdf.semcheck.issue.IssueList;
import net.boyechko.pdf.semcheck.issue.IssueSev;
import net.boyechko.pdf.semcheck.issue.IssueType;
import net.boyechko.pdf.semcheck.validation.NestingSchema;
import net.boyechko.pdf.semcheck.validation.structure.StructureAnalyzer.Options;
import net.boyechko.pdf.semcheck.validation.structure.StructureAnalyzer.StructureAnalysis;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class StructureAnalyzerTest {

    private static final Options REQUIRED_ONLY = new Options(false, true, false, false, false, 0);

    private static ContentNode listItem(String id, String text) {
        return ContentNode.builder(id, Role.LI)
                .child(text(id + "-lbl", Role.LBL, "•"))
                .child(ContentNode.builder(id + "-body", Role.LBODY).child(paragraph(id + "-p", text)))
                .build();
    }

    private static Node parentWith(Role parentRole, Node child) {
        if (parentRole == Role.L) {
            return ListNode.builder("parent").child(child).build();
        }
        if (parentRole == Role.TABLE) {
            return TableNode.builder("parent").child(child).build();
        }
        return ContentNode.builder("parent", parentRole).child(child).build();
    }

    /** Every (parent, child) role pair the default schema rejects. */
    static Stream<Arguments> disallowedPairs() {
        NestingSchema schema = NestingSchema.loadDefault();
        return Arrays.stream(Role.values())
                .flatMap(
                        parent ->
                                Arrays.stream(Role.values())
                                        .filter(child -> !schema.isAllowedChild(parent, child))
                                        .map(child -> Arguments.of(parent, child)));
    }

    @Test
    void defaultSchemaRejectsSomePairs() {
        assertTrue(disallowedPairs().count() > 0);
        NestingSchema schema = NestingSchema.loadDefault();
        assertFalse(schema.isAllowedChild(Role.L, Role.P));
        assertFalse(schema.isAllowedChild(Role.DOCUMENT, Role.LBL));
        assertTrue(schema.isAllowedChild(Role.TR, Role.TD));
    }

    @ParameterizedTest(name = "{1} under {0}")
    @MethodSource("disallowedPairs")
    void reportsExactlyOneNestingViolationNamingBothRoles(Role parentRole, Role childRole) {
        Node root = parentWith(parentRole, text("child", childRole, "x").build());

        IssueList errors = new StructureAnalyzer(Options.nestingOnly()).analyze(root).errors();

        assertEquals(1, errors.size(), () -> String.join("\n", errors.describe()));
        Issue issue = errors.get(0);
        assertEquals(IssueType.NESTING_VIOLATION, issue.type());
        assertEquals(IssueSev.ERROR, issue.severity());
        assertEquals("child", issue.nodeId());
        assertEquals(parentRole.structureType(), issue.contextValue("parentType"));
        assertEquals(childRole.structureType(), issue.contextValue("childType"));
        assertTrue(issue.message().contains(parentRole.structureType()));
        assertTrue(issue.message().contains(childRole.structureType()));
    }

    @Test
    void wellFormedListPassesEveryRule() {
        Node root =
                document(
                        heading("h", 1, "Shopping"),
                        ListNode.builder("l")
                                .child(listItem("i1", "Milk"))
                                .child(listItem("i2", "Bread"))
                                .build());

        StructureAnalysis analysis = new StructureAnalyzer().analyze(root);

        assertTrue(analysis.isValid(), () -> String.join("\n", analysis.errors().describe()));
        assertEquals(root.descendants().size(), analysis.totalNodeCount());
        assertEquals(4, analysis.maxDepth());
    }

    @Test
    void listItemWithoutBodyIsMissingRequiredChild() {
        Node root =
                ListNode.builder("l")
                        .child(ContentNode.builder("li", Role.LI).child(text("lbl", Role.LBL, "1.")))
                        .build();

        IssueList errors = new StructureAnalyzer(REQUIRED_ONLY).analyze(root).errors();

        assertEquals(1, errors.size());
        assertEquals(IssueType.MISSING_REQUIRED_CHILD, errors.get(0).type());
        assertEquals("li", errors.get(0).nodeId());
        assertEquals("LBody", errors.get(0).contextValue("missingChild"));
    }

    @Test
    void rowWithoutCellsIsBelowMinimumChildren() {
        Node root = TableNode.builder("t").child(ContentNode.builder("tr", Role.TR)).build();

        IssueList errors = new StructureAnalyzer(REQUIRED_ONLY).analyze(root).errors();

        assertEquals(1, errors.size());
        assertEquals("tr", errors.get(0).nodeId());
        assertEquals("0", errors.get(0).contextValue("childCount"));
        assertEquals("1", errors.get(0).contextValue("minChildren"));
    }

    @Test
    void duplicateIdReportedOnceAndDeterministically() {
        Node root = document(paragraph("a", "one"), paragraph("a", "two"), paragraph("b", "three"));
        StructureAnalyzer analyzer = new StructureAnalyzer();

        List<String> first = analyzer.analyze(root).errors().describe();
        List<String> second = analyzer.analyze(root).errors().describe();

        IssueList duplicates = analyzer.analyze(root).errors().ofType(IssueType.DUPLICATE_ID);
        assertEquals(1, duplicates.size());
        assertEquals("a", duplicates.get(0).contextValue("id"));

        Patch<String> patch = DiffUtils.diff(first, second);
        assertTrue(
                patch.getDeltas().isEmpty(),
                () ->
                        String.join(
                                "\n",
                                UnifiedDiffUtils.generateUnifiedDiff(
                                        "first", "second", first, patch, 2)));
    }

    @Test
    void emptyElementsAreFlaggedUnlessAllowedEmpty() {
        Node root =
                document(
                        ContentNode.builder("p", Role.P).build(),
                        ContentNode.builder("sect", Role.SECT).build(),
                        ContentNode.builder("span", Role.SPAN).actualText("x").build());

        IssueList empty = new StructureAnalyzer().analyze(root).errors().ofType(IssueType.EMPTY_ELEMENT);

        assertEquals(List.of("p"), empty.stream().map(Issue::nodeId).toList());
    }

    @Test
    void figureNeedsAlternativeTextEvenWhenDrawn() {
        FigureNode drawn =
                FigureNode.builder("fig").image(ImageChunk.of(new Box(0, 0, 0, 10, 10))).build();
        FigureNode described = FigureNode.builder("ok").alt("Chart of sales").build();

        IssueList errors = new StructureAnalyzer().analyze(document(drawn, described)).errors();

        assertEquals(1, errors.size(), () -> String.join("\n", errors.describe()));
        assertEquals(IssueType.FIGURE_MISSING_ALT, errors.get(0).type());
        assertEquals("fig", errors.get(0).nodeId());
    }

    @Test
    void linkNeedsContentOrAlternative() {
        Node root =
                document(
                        ContentNode.builder("bare", Role.LINK).build(),
                        ContentNode.builder("labelled", Role.LINK).alt("Home page").build());

        IssueList errors = new StructureAnalyzer(Options.attributesOnly()).analyze(root).errors();

        assertEquals(1, errors.size());
        assertEquals(IssueType.LINK_MISSING_CONTENT, errors.get(0).type());
        assertEquals("bare", errors.get(0).nodeId());
    }

    @Test
    void nodesBelowDepthLimitAreReported() {
        Node root =
                document(
                        ContentNode.builder("sect", Role.SECT)
                                .child(
                                        ContentNode.builder("div", Role.DIV)
                                                .child(paragraph("p", "deep")))
                                .build());

        IssueList errors =
                new StructureAnalyzer(Options.nestingOnly().withMaxDepth(2)).analyze(root).errors();

        assertEquals(1, errors.size());
        assertEquals(IssueType.MAX_DEPTH_EXCEEDED, errors.get(0).type());
        assertEquals("3", errors.get(0).contextValue("depth"));
        assertEquals("2", errors.get(0).contextValue("maxDepth"));
    }

    @Test
    void findingsAreRecordedInTheLedger() {
        ErrorLedger ledger = new ErrorLedger();
        Node root = document(ContentNode.builder("p", Role.P).build());

        new StructureAnalyzer().analyze(root, ledger);

        assertEquals(Set.of(ErrorCode.EMPTY_ELEMENT), ledger.codesFor("p"));
        assertFalse(ledger.hasErrors("doc"));
    }

    @Test
    void nullRootYieldsEmptyAnalysis() {
        StructureAnalysis analysis = new StructureAnalyzer().analyze(null);

        assertTrue(analysis.isValid());
        assertEquals(0, analysis.totalNodeCount());
    }

    @Test
    void rejectsNegativeDepthLimit() {
        assertThrows(IllegalArgumentException.class, () -> Options.all().withMaxDepth(-1));
    }
}
