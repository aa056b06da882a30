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
package net.boyechko.pdf.semcheck.document;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An L element with its detected numbering style. {@code startNumber} is null for unordered or
 * undetected lists; {@code nestingLevel} is 0 for a top-level list.
 */
public record ListNode(
        String id,
        Box box,
        List<Node> children,
        Map<String, AttributeValue> attributes,
        int depth,
        ListKind kind,
        Integer startNumber,
        int nestingLevel)
        implements Node {

    public ListNode {
        Nodes.requireId(id);
        children = List.copyOf(children);
        attributes = Nodes.copyAttributes(attributes);
        kind = Objects.requireNonNullElse(kind, ListKind.UNKNOWN);
        if (nestingLevel < 0) {
            throw new IllegalArgumentException("Nesting level must be >= 0, got " + nestingLevel);
        }
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    @Override
    public Role role() {
        return Role.L;
    }

    @Override
    public ListNode atDepth(int depth) {
        return new ListNode(
                id,
                box,
                Nodes.atDepth(children, depth + 1),
                attributes,
                depth,
                kind,
                startNumber,
                nestingLevel);
    }

    /** Returns a copy with the numbering style reported by label detection. */
    public ListNode withDetectedKind(ListKind kind, Integer startNumber) {
        return new ListNode(
                id, box, children, attributes, depth, kind, startNumber, nestingLevel);
    }

    public boolean isOrdered() {
        return kind.isOrdered();
    }

    public List<Node> items() {
        return children.stream().filter(c -> c.role() == Role.LI).toList();
    }

    public int itemCount() {
        return items().size();
    }

    public static Optional<Node> label(Node item) {
        return item.children().stream().filter(c -> c.role() == Role.LBL).findFirst();
    }

    public static Optional<Node> body(Node item) {
        return item.children().stream().filter(c -> c.role() == Role.LBODY).findFirst();
    }

    /** Lists nested directly inside this list's items or item bodies. */
    public List<Node> nestedLists() {
        List<Node> nested = new ArrayList<>();
        for (Node item : items()) {
            for (Node c : item.children()) {
                if (c.role() == Role.L) {
                    nested.add(c);
                } else if (c.role() == Role.LBODY) {
                    c.children().stream().filter(g -> g.role() == Role.L).forEach(nested::add);
                }
            }
        }
        return nested;
    }

    public static final class Builder extends NodeBuilder<Builder, ListNode> {
        private ListKind kind = ListKind.UNKNOWN;
        private Integer startNumber;
        private int nestingLevel;

        private Builder(String id) {
            super(id);
        }

        public Builder kind(ListKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder startNumber(int startNumber) {
            this.startNumber = startNumber;
            return this;
        }

        public Builder nestingLevel(int nestingLevel) {
            this.nestingLevel = nestingLevel;
            return this;
        }

        @Override
        public ListNode build(int depth) {
            return new ListNode(
                    id,
                    box,
                    Nodes.atDepth(children, depth + 1),
                    attributes,
                    depth,
                    kind,
                    startNumber,
                    nestingLevel);
        }
    }
}
