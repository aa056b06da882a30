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

import java.util.List;
import net.boyechko.pdf.semcheck.document.Node;
import net.boyechko.pdf.semcheck.document.Role;

/**
 * Immutable context passed to visitors during a tree walk. Carries the parent's role and the
 * node's path, since nodes themselves do not point at their parents.
 */
public record NodeContext(
        Node node,
        String path,
        Role role,
        NestingSchema.Rule schemaRule,
        Role parentRole,
        List<Node> children,
        List<Role> childRoles,
        /** Walk depth (0 = the node the walk started from). */
        int depth,
        /** Index in traversal order (1-based). */
        int globalIndex) {

    public static NodeContext fromNode(
            Node node,
            String parentPath,
            Role parentRole,
            int depth,
            int globalIndex,
            NestingSchema schema) {
        Role role = node.role();
        String path = parentPath + role.structureType() + "[" + globalIndex + "]";
        NestingSchema.Rule rule = schema != null ? schema.ruleFor(role) : null;
        List<Node> children = node.children();
        List<Role> childRoles = children.stream().map(Node::role).toList();
        return new NodeContext(
                node, path, role, rule, parentRole, children, childRoles, depth, globalIndex);
    }

    public boolean isRoot() {
        return parentRole == null;
    }

    public boolean hasRole(Role r) {
        return role == r;
    }

    public boolean hasAnyRole(Role... roles) {
        for (Role r : roles) {
            if (r == role) return true;
        }
        return false;
    }
}
