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
package net.boyechko.pdf.semcheck.issue;

import net.boyechko.pdf.semcheck.document.Node;
import net.boyechko.pdf.semcheck.document.Role;

/** Where in the tree a finding was made. */
public sealed interface IssueLoc {
    record None() implements IssueLoc {}

    record AtNode(String nodeId, Role role, Integer pageIndex, String path) implements IssueLoc {}

    /** A finding about two consecutive nodes; {@code nodeId} is the later one. */
    record AtPair(String previousId, String nodeId, Integer pageIndex) implements IssueLoc {}

    static IssueLoc none() {
        return new None();
    }

    static IssueLoc atNode(Node node) {
        return atNode(node, null);
    }

    static IssueLoc atNode(Node node, String path) {
        if (node == null) return none();
        return new AtNode(node.id(), node.role(), node.pageIndex(), path);
    }

    static IssueLoc between(Node previous, Node next) {
        return new AtPair(previous.id(), next.id(), next.pageIndex());
    }

    /** Id of the node the finding is attached to, or null. */
    default String nodeId() {
        if (this instanceof AtNode n) return n.nodeId();
        if (this instanceof AtPair p) return p.nodeId();
        return null;
    }

    /** Page index if known, null otherwise. */
    default Integer page() {
        if (this instanceof AtNode n) return n.pageIndex();
        if (this instanceof AtPair p) return p.pageIndex();
        return null;
    }
}
