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
 * A Table element. Rows are recovered from the THead, TBody and TFoot groups and from TR children
 * placed directly under the table. A visual border, when attached, is the grid inferred from the
 * table's drawn rulings.
 */
public record TableNode(
        String id,
        Box box,
        List<Node> children,
        Map<String, AttributeValue> attributes,
        int depth,
        VisualBorder visualBorder)
        implements Node {

    public TableNode {
        Nodes.requireId(id);
        children = List.copyOf(children);
        attributes = Nodes.copyAttributes(attributes);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    @Override
    public Role role() {
        return Role.TABLE;
    }

    @Override
    public TableNode atDepth(int depth) {
        return new TableNode(
                id, box, Nodes.atDepth(children, depth + 1), attributes, depth, visualBorder);
    }

    /** Returns a copy carrying the given border line positions. */
    public TableNode withVisualBorder(List<Double> xCoordinates, List<Double> yCoordinates) {
        return withVisualBorder(new VisualBorder(xCoordinates, yCoordinates));
    }

    public TableNode withVisualBorder(VisualBorder border) {
        return new TableNode(id, box, children, attributes, depth, border);
    }

    public boolean hasVisualBorder() {
        return visualBorder != null && visualBorder.isPresent();
    }

    public int visualRowCount() {
        return visualBorder != null ? visualBorder.rowCount() : 0;
    }

    public int visualColumnCount() {
        return visualBorder != null ? visualBorder.columnCount() : 0;
    }

    public String summary() {
        return stringAttribute(Attributes.SUMMARY);
    }

    public Optional<Node> tableHead() {
        return children.stream().filter(c -> c.role() == Role.THEAD).findFirst();
    }

    public List<Node> tableBodies() {
        return children.stream().filter(c -> c.role() == Role.TBODY).toList();
    }

    public Optional<Node> tableFoot() {
        return children.stream().filter(c -> c.role() == Role.TFOOT).findFirst();
    }

    public boolean hasExplicitRowGroups() {
        return tableHead().isPresent() || !tableBodies().isEmpty() || tableFoot().isPresent();
    }

    /** Rows in order: THead, each TBody, TFoot, then direct TR children. */
    public List<Node> allRows() {
        List<Node> rows = new ArrayList<>();
        tableHead().ifPresent(head -> rows.addAll(rowsOf(head)));
        for (Node body : tableBodies()) {
            rows.addAll(rowsOf(body));
        }
        tableFoot().ifPresent(foot -> rows.addAll(rowsOf(foot)));
        rows.addAll(rowsOf(this));
        return rows;
    }

    public List<Node> headRows() {
        return tableHead().map(TableNode::rowsOf).orElse(List.of());
    }

    private static List<Node> rowsOf(Node group) {
        return group.children().stream().filter(c -> c.role() == Role.TR).toList();
    }

    public int rowCount() {
        return allRows().size();
    }

    /** TH and TD children of a row; empty for anything that is not a TR. */
    public static List<Node> cellsInRow(Node row) {
        if (row.role() != Role.TR) return List.of();
        return row.children().stream().filter(c -> c.role().isTableCell()).toList();
    }

    public List<Node> allCells() {
        return allRows().stream().flatMap(r -> cellsInRow(r).stream()).toList();
    }

    public List<Node> headerCells() {
        return allCells().stream().filter(c -> c.role() == Role.TH).toList();
    }

    public List<Node> dataCells() {
        return allCells().stream().filter(c -> c.role() == Role.TD).toList();
    }

    public boolean hasHeaders() {
        return !headerCells().isEmpty();
    }

    public int maxCellsPerRow() {
        return allRows().stream().mapToInt(r -> cellsInRow(r).size()).max().orElse(0);
    }

    public boolean hasConsistentColumnCount() {
        return allRows().stream().mapToInt(r -> cellsInRow(r).size()).distinct().count() <= 1;
    }

    public static final class Builder extends NodeBuilder<Builder, TableNode> {
        private VisualBorder border;

        private Builder(String id) {
            super(id);
        }

        public Builder summary(String summary) {
            return attribute(Attributes.SUMMARY, summary);
        }

        public Builder visualBorder(VisualBorder border) {
            this.border = border;
            return this;
        }

        @Override
        public TableNode build(int depth) {
            return new TableNode(
                    id, box, Nodes.atDepth(children, depth + 1), attributes, depth, border);
        }
    }
}
