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

import net.boyechko.pdf.semcheck.document.Node;
import net.boyechko.pdf.semcheck.issue.Issue;
import net.boyechko.pdf.semcheck.issue.IssueList;
import net.boyechko.pdf.semcheck.issue.IssueLoc;
import net.boyechko.pdf.semcheck.issue.IssueSev;
import net.boyechko.pdf.semcheck.issue.IssueType;
import net.boyechko.pdf.semcheck.validation.NestingSchema;
import net.boyechko.pdf.semcheck.validation.NodeContext;
import net.boyechko.pdf.semcheck.validation.SemanticTreeVisitor;

/**
 * Detects elements with no content: no children, no text alternative, and for content and figure
 * nodes no text or drawing. Roles the schema marks {@code may_be_empty} are exempt.
 */
public class EmptyElementVisitor implements SemanticTreeVisitor {
    private final IssueList issues = new IssueList();

    @Override
    public String name() {
        return "Empty Element Visitor";
    }

    @Override
    public String description() {
        return "Structure elements should contain content";
    }

    @Override
    public void leaveElement(NodeContext ctx) {
        NestingSchema.Rule rule = ctx.schemaRule();
        if (rule != null && rule.mayBeEmpty()) return;

        Node node = ctx.node();
        if (!node.hasContent()) {
            issues.add(
                    new Issue(
                            IssueType.EMPTY_ELEMENT,
                            IssueSev.ERROR,
                            IssueLoc.atNode(node, ctx.path()),
                            "Element is empty (no children or text alternative)"));
        }
    }

    @Override
    public IssueList getIssues() {
        return issues;
    }
}
