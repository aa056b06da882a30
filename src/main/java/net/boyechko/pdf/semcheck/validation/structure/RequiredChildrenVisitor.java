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
import net.boyechko.pdf.semcheck.document.Role;
import net.boyechko.pdf.semcheck.issue.Issue;
import net.boyechko.pdf.semcheck.issue.IssueList;
import net.boyechko.pdf.semcheck.issue.IssueLoc;
import net.boyechko.pdf.semcheck.issue.IssueSev;
import net.boyechko.pdf.semcheck.issue.IssueType;
import net.boyechko.pdf.semcheck.validation.NestingSchema;
import net.boyechko.pdf.semcheck.validation.NodeContext;
import net.boyechko.pdf.semcheck.validation.SemanticTreeVisitor;

/**
 * Reports elements lacking a child role the schema requires (an LI without an LBody) or having
 * fewer children than the schema's minimum (a Table or TR with no children).
 */
public class RequiredChildrenVisitor implements SemanticTreeVisitor {
    private final IssueList issues = new IssueList();

    @Override
    public String name() {
        return "Required Children Visitor";
    }

    @Override
    public String description() {
        return "Elements must contain the children their role requires";
    }

    @Override
    public boolean enterElement(NodeContext ctx) {
        NestingSchema.Rule rule = ctx.schemaRule();
        if (rule == null) return true;

        for (Role required : rule.requiredChildren()) {
            if (!ctx.childRoles().contains(required)) {
                issues.add(
                        new Issue(
                                IssueType.MISSING_REQUIRED_CHILD,
                                IssueSev.ERROR,
                                IssueLoc.atNode(ctx.node(), ctx.path()),
                                ctx.role().structureType()
                                        + " missing required "
                                        + required.structureType()
                                        + " child",
                                Map.of("missingChild", required.structureType())));
            }
        }

        if (ctx.children().size() < rule.minChildren()) {
            issues.add(
                    new Issue(
                            IssueType.MISSING_REQUIRED_CHILD,
                            IssueSev.ERROR,
                            IssueLoc.atNode(ctx.node(), ctx.path()),
                            ctx.role().structureType()
                                    + " has "
                                    + ctx.children().size()
                                    + " children, needs at least "
                                    + rule.minChildren(),
                            Map.of(
                                    "childCount", String.valueOf(ctx.children().size()),
                                    "minChildren", String.valueOf(rule.minChildren()))));
        }
        return true;
    }

    @Override
    public IssueList getIssues() {
        return issues;
    }
}
