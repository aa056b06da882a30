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
package net.boyechko.pdf.semcheck.issue;

import static net.boyechko.pdf.semcheck.TreeFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import java.util.Set;
import net.boyechko.pdf.semcheck.document.ErrorCode;
import net.boyechko.pdf.semcheck.document.ErrorLedger;
import org.junit.jupiter.api.Test;

class IssueListTest {

    private IssueList sample() {
        IssueList issues = new IssueList();
        issues.add(
                new Issue(
                        IssueType.EMPTY_ELEMENT,
                        IssueSev.ERROR,
                        IssueLoc.atNode(positioned("p1", 2, 0, 0, 10, 10)),
                        "Element is empty"));
        issues.add(
                new Issue(
                        IssueType.HEADING_FIRST_NOT_H1,
                        IssueSev.WARNING,
                        IssueLoc.atNode(heading("h", 2, "Intro")),
                        "First heading is H2, should be H1"));
        issues.add(
                new Issue(
                        IssueType.TABLE_HEADERS_OUTSIDE_HEAD,
                        IssueSev.INFO,
                        IssueLoc.atNode(table("t", 2).build()),
                        "Table has header cells but no THead element"));
        return issues;
    }

    @Test
    void filtersBySeverityTypeCategoryAndNode() {
        IssueList issues = sample();

        assertEquals(1, issues.withSeverity(IssueSev.WARNING).size());
        assertEquals(1, issues.ofType(IssueType.EMPTY_ELEMENT).size());
        assertEquals(1, issues.inCategory(IssueCategory.TABLE).size());
        assertEquals("h", issues.inCategory(IssueCategory.HEADING).get(0).nodeId());
        assertEquals(1, issues.forNode("t").size());
        assertTrue(issues.forNode("missing").isEmpty());
    }

    @Test
    void blockingMeansCriticalOrError() {
        IssueList issues = sample();
        assertTrue(issues.hasBlockingIssues());

        issues.removeIf(i -> i.severity() == IssueSev.ERROR);
        assertFalse(issues.hasBlockingIssues());
        assertEquals(Map.of(IssueSev.WARNING, 1L, IssueSev.INFO, 1L), issues.countBySeverity());
    }

    @Test
    void recordsOnlyCodedFindingsIntoTheLedger() {
        ErrorLedger ledger = new ErrorLedger();
        sample().recordInto(ledger);

        assertEquals(Set.of(ErrorCode.EMPTY_ELEMENT), ledger.codesFor("p1"));
        assertEquals(Set.of(ErrorCode.HEADING_HIERARCHY_INVALID), ledger.codesFor("h"));
        assertFalse(ledger.hasErrors("t"), "header placement notes carry no error code");
    }

    @Test
    void describesFindingsWithLocationAndSortedContext() {
        Issue issue =
                new Issue(
                        IssueType.NESTING_VIOLATION,
                        IssueSev.ERROR,
                        IssueLoc.atNode(positioned("p", 1, 0, 0, 1, 1)),
                        "Invalid child",
                        Map.of("parentType", "L", "childType", "P"));

        assertEquals(
                "ERROR NESTING_VIOLATION @p p1: Invalid child {childType=P, parentType=L}",
                new IssueList(issue).describe().get(0));
        assertEquals(IssueCategory.STRUCTURE, issue.category());
        assertEquals(ErrorCode.UNEXPECTED_CHILD, issue.errorCode());
    }

    @Test
    void pairLocationsPointAtTheLaterNode() {
        IssueLoc loc =
                IssueLoc.between(positioned("a", 0, 0, 0, 1, 1), positioned("b", 4, 0, 0, 1, 1));

        assertEquals("b", loc.nodeId());
        assertEquals(4, loc.page());
        assertNull(IssueLoc.none().nodeId());
    }

    @Test
    void severityOrdering() {
        assertTrue(IssueSev.CRITICAL.isAtLeast(IssueSev.ERROR));
        assertTrue(IssueSev.ERROR.isAtLeast(IssueSev.ERROR));
        assertFalse(IssueSev.WARNING.isAtLeast(IssueSev.ERROR));
        assertFalse(IssueSev.INFO.isBlocking());
    }
}
