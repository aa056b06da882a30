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

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import net.boyechko.pdf.semcheck.issue.Issue;
import net.boyechko.pdf.semcheck.issue.IssueList;
import net.boyechko.pdf.semcheck.issue.IssueLoc;
import net.boyechko.pdf.semcheck.issue.IssueSev;
import net.boyechko.pdf.semcheck.issue.IssueType;
import net.boyechko.pdf.semcheck.validation.NodeContext;
import net.boyechko.pdf.semcheck.validation.SemanticTreeVisitor;

/** Reports every node reusing an id already seen earlier in the walk. */
public class DuplicateIdVisitor implements SemanticTreeVisitor {
    private final Set<String> seen = new HashSet<>();
    private final IssueList issues = new IssueList();

    @Override
    public String name() {
        return "Duplicate Id Visitor";
    }

    @Override
    public String description() {
        return "Node ids must be unique within the tree";
    }

    @Override
    public void beforeTraversal() {
        seen.clear();
    }

    @Override
    public boolean enterElement(NodeContext ctx) {
        String id = ctx.node().id();
        if (!seen.add(id)) {
            issues.add(
                    new Issue(
                            IssueType.DUPLICATE_ID,
                            IssueSev.ERROR,
                            IssueLoc.atNode(ctx.node(), ctx.path()),
                            "Duplicate node ID detected",
                            Map.of("id", id)));
        }
        return true;
    }

    @Override
    public IssueList getIssues() {
        return issues;
    }
}
