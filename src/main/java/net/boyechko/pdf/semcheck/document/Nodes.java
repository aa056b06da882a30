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

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Shared helpers for node construction and traversal. */
final class Nodes {
    private Nodes() {}

    static void collect(Node node, List<Node> out) {
        out.add(node);
        for (Node child : node.children()) {
            collect(child, out);
        }
    }

    static List<Node> atDepth(List<Node> children, int depth) {
        return children.stream().map(c -> c.atDepth(depth)).toList();
    }

    static String requireId(String id) {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Node id must not be blank");
        }
        return id;
    }

    static Map<String, AttributeValue> copyAttributes(Map<String, AttributeValue> attributes) {
        if (attributes == null || attributes.isEmpty()) return Map.of();
        Map<String, AttributeValue> copy = new HashMap<>();
        attributes.forEach((k, v) -> copy.put(k, v != null ? v : AttributeValue.nullValue()));
        return Map.copyOf(copy);
    }
}
