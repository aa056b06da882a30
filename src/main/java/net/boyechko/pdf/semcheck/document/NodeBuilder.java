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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for the variant builders. Children are added as built nodes and re-rooted at the right
 * depth when the parent is built, so a finished tree always starts at depth 0.
 */
public abstract class NodeBuilder<B extends NodeBuilder<B, N>, N extends Node> {
    protected final String id;
    protected Box box;
    protected final List<Node> children = new ArrayList<>();
    protected final Map<String, AttributeValue> attributes = new LinkedHashMap<>();

    protected NodeBuilder(String id) {
        this.id = Nodes.requireId(id);
    }

    @SuppressWarnings("unchecked")
    private B self() {
        return (B) this;
    }

    public B box(Box box) {
        this.box = box;
        return self();
    }

    public B box(int pageIndex, float x, float y, float width, float height) {
        return box(new Box(pageIndex, x, y, width, height));
    }

    public B child(Node child) {
        children.add(child);
        return self();
    }

    public B child(NodeBuilder<?, ?> child) {
        return child(child.build());
    }

    public B children(List<? extends Node> nodes) {
        children.addAll(nodes);
        return self();
    }

    public B attribute(String key, AttributeValue value) {
        attributes.put(key, value);
        return self();
    }

    public B attribute(String key, String value) {
        return attribute(key, AttributeValue.of(value));
    }

    public B alt(String alt) {
        return attribute(Attributes.ALT, alt);
    }

    public B actualText(String actualText) {
        return attribute(Attributes.ACTUAL_TEXT, actualText);
    }

    public B title(String title) {
        return attribute(Attributes.TITLE, title);
    }

    public B lang(String lang) {
        return attribute(Attributes.LANG, lang);
    }

    /** Builds the node as a root at depth 0. */
    public N build() {
        return build(0);
    }

    public abstract N build(int depth);
}
