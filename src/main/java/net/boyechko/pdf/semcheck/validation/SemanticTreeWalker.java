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
package net.boyechko.pdf.semcheck.validation;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.semcheck.document.Node;
import net.boyechko.pdf.semcheck.document.Role;
import net.boyechko.pdf.semcheck.issue.IssueList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Walks a semantic tree once, depth first, invoking multiple visitors at each node. */
public class SemanticTreeWalker {
    private static final Logger logger = LoggerFactory.getLogger(SemanticTreeWalker.class);

    private final NestingSchema schema;
    private final List<SemanticTreeVisitor> visitors = new ArrayList<>();

    private int globalIndex;

    public SemanticTreeWalker(NestingSchema schema) {
        this.schema = schema;
    }

    public SemanticTreeWalker addVisitor(SemanticTreeVisitor visitor) {
        visitors.add(visitor);
        return this;
    }

    /** Visits {@code root} and its whole subtree, returning the visitors' combined findings. */
    public IssueList walk(Node root) {
        this.globalIndex = 0;

        for (SemanticTreeVisitor visitor : visitors) {
            visitor.beforeTraversal();
        }

        if (root != null) {
            walkElement(root, "/", null, 0);
        }

        IssueList allIssues = new IssueList();
        for (SemanticTreeVisitor visitor : visitors) {
            visitor.afterTraversal();
            allIssues.addAll(visitor.getIssues());
        }
        return allIssues;
    }

    /** Number of nodes visited by the last walk. */
    public int visitedCount() {
        return globalIndex;
    }

    private void walkElement(Node node, String parentPath, Role parentRole, int depth) {
        globalIndex++;

        NodeContext ctx =
                NodeContext.fromNode(node, parentPath, parentRole, depth, globalIndex, schema);

        // Any visitor can veto descending, but every visitor still sees this node.
        boolean continueToChildren = true;
        for (SemanticTreeVisitor visitor : visitors) {
            try {
                if (!visitor.enterElement(ctx)) {
                    continueToChildren = false;
                }
            } catch (Exception e) {
                logger.error(
                        "Error in visitor {} at {}: {}",
                        visitor.name(),
                        ctx.path(),
                        e.getMessage());
            }
        }

        if (continueToChildren) {
            for (Node child : ctx.children()) {
                walkElement(child, ctx.path() + ".", ctx.role(), depth + 1);
            }
        }

        for (SemanticTreeVisitor visitor : visitors) {
            try {
                visitor.leaveElement(ctx);
            } catch (Exception e) {
                logger.error(
                        "Error in visitor {} leaving {}: {}",
                        visitor.name(),
                        ctx.path(),
                        e.getMessage());
            }
        }
    }
}
