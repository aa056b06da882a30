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
import net.boyechko.pdf.semcheck.issue.Issue;
import net.boyechko.pdf.semcheck.issue.IssueList;
import net.boyechko.pdf.semcheck.issue.IssueLoc;
import net.boyechko.pdf.semcheck.issue.IssueSev;
import net.boyechko.pdf.semcheck.issue.IssueType;
import net.boyechko.pdf.semcheck.validation.NodeContext;
import net.boyechko.pdf.semcheck.validation.SemanticTreeVisitor;

/** Reports nodes whose depth exceeds a fixed limit. Descendants are still visited. */
public class MaxDepthVisitor implements SemanticTreeVisitor {
    private final int maxDepth;
    private final IssueList issues = new IssueList();

    public MaxDepthVisitor(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    @Override
    public String name() {
        return "Max Depth Visitor";
    }

    @Override
    public String description() {
        return "Structure should not nest deeper than " + maxDepth + " levels";
    }

    @Override
    public boolean enterElement(NodeContext ctx) {
        int depth = ctx.node().depth();
        if (depth > maxDepth) {
            issues.add(
                    new Issue(
                            IssueType.MAX_DEPTH_EXCEEDED,
                            IssueSev.ERROR,
                            IssueLoc.atNode(ctx.node(), ctx.path()),
                            "Node exceeds maximum depth of " + maxDepth,
                            Map.of(
                                    "depth", String.valueOf(depth),
                                    "maxDepth", String.valueOf(maxDepth))));
        }
        return true;
    }

    @Override
    public IssueList getIssues() {
        return issues;
    }
}
