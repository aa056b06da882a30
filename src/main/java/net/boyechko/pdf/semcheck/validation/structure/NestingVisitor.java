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
import net.boyechko.pdf.semcheck.issue.Issue;
import net.boyechko.pdf.semcheck.issue.IssueList;
import net.boyechko.pdf.semcheck.issue.IssueLoc;
import net.boyechko.pdf.semcheck.issue.IssueSev;
import net.boyechko.pdf.semcheck.issue.IssueType;
import net.boyechko.pdf.semcheck.validation.NestingSchema;
import net.boyechko.pdf.semcheck.validation.NodeContext;
import net.boyechko.pdf.semcheck.validation.SemanticTreeVisitor;

/** Reports children whose role is not allowed under their parent's role. */
public class NestingVisitor implements SemanticTreeVisitor {
    private final IssueList issues = new IssueList();

    @Override
    public String name() {
        return "Nesting Visitor";
    }

    @Override
    public String description() {
        return "Children must have a role their parent allows";
    }

    @Override
    public boolean enterElement(NodeContext ctx) {
        NestingSchema.Rule rule = ctx.schemaRule();
        if (rule == null) return true;

        for (Node child : ctx.children()) {
            if (rule.allows(child.role())) continue;
            issues.add(
                    new Issue(
                            IssueType.NESTING_VIOLATION,
                            IssueSev.ERROR,
                            IssueLoc.atNode(child),
                            "Invalid child type '"
                                    + child.role().structureType()
                                    + "' for parent '"
                                    + ctx.role().structureType()
                                    + "'",
                            Map.of(
                                    "parentType", ctx.role().structureType(),
                                    "childType", child.role().structureType())));
        }
        return true;
    }

    @Override
    public IssueList getIssues() {
        return issues;
    }
}
