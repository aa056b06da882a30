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
import java.util.Optional;

/**
 * A node of the semantic structure tree. The variant set is closed: generic content, figures,
 * tables and lists. Nodes are immutable and hold no reference to their parent; a child's depth
 * is always one greater than its parent's.
 */
public sealed interface Node permits ContentNode, FigureNode, TableNode, ListNode {

    String id();

    Role role();

    /** Bounding box, or null if the node has no known position. */
    Box box();

    List<Node> children();

    Map<String, AttributeValue> attributes();

    int depth();

    /** Returns a copy of this subtree rooted at {@code depth}. */
    Node atDepth(int depth);

    /** Page index of the bounding box, or null when the node has no box. */
    default Integer pageIndex() {
        return box() != null ? box().pageIndex() : null;
    }

    default boolean hasChildren() {
        return !children().isEmpty();
    }

    default boolean hasRole(Role role) {
        return role() == role;
    }

    default AttributeValue attribute(String key) {
        return attributes().get(key);
    }

    default String stringAttribute(String key) {
        AttributeValue value = attributes().get(key);
        return value != null ? value.asString() : null;
    }

    default String altText() {
        return stringAttribute(Attributes.ALT);
    }

    default String actualText() {
        return stringAttribute(Attributes.ACTUAL_TEXT);
    }

    default String language() {
        return stringAttribute(Attributes.LANG);
    }

    default String title() {
        return stringAttribute(Attributes.TITLE);
    }

    /** True when a non-empty Alt or ActualText is present. */
    default boolean hasTextAlternative() {
        return !isNullOrEmpty(altText()) || !isNullOrEmpty(actualText());
    }

    /** Best available description: Alt, then ActualText, then Title; null if none is non-empty. */
    default String textDescription() {
        if (!isNullOrEmpty(altText())) return altText();
        if (!isNullOrEmpty(actualText())) return actualText();
        if (!isNullOrEmpty(title())) return title();
        return null;
    }

    /** True when the node has children or a text alternative. Variants widen this. */
    default boolean hasContent() {
        return hasChildren() || hasTextAlternative();
    }

    /** This node and every descendant in depth-first pre-order. */
    default List<Node> descendants() {
        List<Node> out = new ArrayList<>();
        Nodes.collect(this, out);
        return out;
    }

    default List<Node> descendantsWithRole(Role role) {
        return descendants().stream().filter(n -> n.role() == role).toList();
    }

    default Optional<Node> firstDescendant(Role role) {
        return descendants().stream().filter(n -> n.role() == role).findFirst();
    }

    /** Number of nodes below this one. */
    default int descendantCount() {
        return descendants().size() - 1;
    }

    /** Deepest depth reached anywhere in this subtree. */
    default int maxDepth() {
        int max = depth();
        for (Node child : children()) {
            max = Math.max(max, child.maxDepth());
        }
        return max;
    }

    private static boolean isNullOrEmpty(String s) {
        return s == null || s.isEmpty();
    }
}
