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

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import net.boyechko.pdf.semcheck.document.ErrorLedger;

/** List of findings, with filters by type, severity, category and node. */
public class IssueList extends ArrayList<Issue> {

    public IssueList() {
        super();
    }

    public IssueList(Collection<Issue> issues) {
        super(issues != null ? issues : new ArrayList<>());
    }

    public IssueList(Issue issue) {
        super();
        if (issue != null) {
            add(issue);
        }
    }

    public IssueList ofType(IssueType type) {
        return stream()
                .filter(i -> i.type() == type)
                .collect(Collectors.toCollection(IssueList::new));
    }

    public IssueList withSeverity(IssueSev sev) {
        return stream()
                .filter(i -> i.severity() == sev)
                .collect(Collectors.toCollection(IssueList::new));
    }

    public IssueList inCategory(IssueCategory category) {
        return stream()
                .filter(i -> i.category() == category)
                .collect(Collectors.toCollection(IssueList::new));
    }

    public IssueList forNode(String nodeId) {
        return stream()
                .filter(i -> Objects.equals(i.nodeId(), nodeId))
                .collect(Collectors.toCollection(IssueList::new));
    }

    /** Returns true if any finding has CRITICAL or ERROR severity. */
    public boolean hasBlockingIssues() {
        return stream().anyMatch(i -> i.severity().isBlocking());
    }

    public boolean hasSeverity(IssueSev sev) {
        return stream().anyMatch(i -> i.severity() == sev);
    }

    public Map<IssueSev, Long> countBySeverity() {
        Map<IssueSev, Long> counts = new EnumMap<>(IssueSev.class);
        for (Issue i : this) {
            counts.merge(i.severity(), 1L, Long::sum);
        }
        return counts;
    }

    /** One line per finding, in list order. */
    public List<String> describe() {
        return stream().map(Issue::toString).toList();
    }

    /** Records the error code of every finding that has one against the finding's node. */
    public void recordInto(ErrorLedger ledger) {
        for (Issue i : this) {
            if (i.errorCode() != null && i.nodeId() != null) {
                ledger.record(i.nodeId(), i.errorCode());
            }
        }
    }
}
