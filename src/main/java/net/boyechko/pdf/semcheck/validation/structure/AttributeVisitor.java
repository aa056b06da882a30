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

import java.util.Map;
import net.boyechko.pdf.semcheck.document.Node;
import net.boyechko.pdf.semcheck.document.Role;
import net.boyechko.pdf.semcheck.issue.Issue;
import net.boyechko.pdf.semcheck.issue.IssueList;
import net.boyechko.pdf.semcheck.issue.IssueLoc;
import net.boyechko.pdf.semcheck.issue.IssueSev;
import net.boyechko.pdf.semcheck.issue.IssueType;
import net.boyechko.pdf.semcheck.validation.NodeContext;
import net.boyechko.pdf.semcheck.validation.SemanticTreeVisitor;

/** Checks role-specific attributes: alternative text on figures, and content on links. */
public class AttributeVisitor implements SemanticTreeVisitor {
    private final IssueList issues = new IssueList();

    @Override
    public String name() {
        return "Attribute Visitor";
    }

    @Override
    public String description() {
        return "Figures need Alt or ActualText; links need content or a text alternative";
    }

    @Override
    public boolean enterElement(NodeContext ctx) {
        Node node = ctx.node();
        if (ctx.hasRole(Role.FIGURE) && !node.hasTextAlternative()) {
            issues.add(
                    new Issue(
                            IssueType.FIGURE_MISSING_ALT,
                            IssueSev.ERROR,
                            IssueLoc.atNode(node, ctx.path()),
                            "Figure missing Alt or ActualText attribute",
                            Map.of("requiredAttribute", "Alt or ActualText")));
        } else if (ctx.hasRole(Role.LINK) && !node.hasChildren() && !node.hasTextAlternative()) {
            issues.add(
                    new Issue(
                            IssueType.LINK_MISSING_CONTENT,
                            IssueSev.ERROR,
                            IssueLoc.atNode(node, ctx.path()),
                            "Link has no content or Alt text",
                            Map.of("requiredAttribute", "Alt or content")));
        }
        return true;
    }

    @Override
    public IssueList getIssues() {
        return issues;
    }
}
