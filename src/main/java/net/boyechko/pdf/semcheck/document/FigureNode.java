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
import net.boyechko.pdf.semcheck.document.content.ImageChunk;
import net.boyechko.pdf.semcheck.document.content.LineArtChunk;

/** A Figure element with the raster images and vector drawings it covers. */
public record FigureNode(
        String id,
        Box box,
        List<Node> children,
        Map<String, AttributeValue> attributes,
        int depth,
        List<ImageChunk> imageChunks,
        List<LineArtChunk> lineArtChunks)
        implements Node {

    public FigureNode {
        Nodes.requireId(id);
        children = List.copyOf(children);
        attributes = Nodes.copyAttributes(attributes);
        imageChunks = List.copyOf(imageChunks);
        lineArtChunks = List.copyOf(lineArtChunks);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    @Override
    public Role role() {
        return Role.FIGURE;
    }

    @Override
    public FigureNode atDepth(int depth) {
        return new FigureNode(
                id,
                box,
                Nodes.atDepth(children, depth + 1),
                attributes,
                depth,
                imageChunks,
                lineArtChunks);
    }

    public boolean hasVisualContent() {
        return !imageChunks.isEmpty() || !lineArtChunks.isEmpty();
    }

    @Override
    public boolean hasContent() {
        return Node.super.hasContent() || hasVisualContent();
    }

    /** No alternative text, no children and nothing drawn. */
    public boolean appearsDecorative() {
        return !hasTextAlternative() && children.isEmpty() && !hasVisualContent();
    }

    /** The first child with the Caption role. */
    public Optional<Node> caption() {
        return children.stream().filter(c -> c.role() == Role.CAPTION).findFirst();
    }

    public String captionText() {
        return caption()
                .filter(ContentNode.class::isInstance)
                .map(c -> ((ContentNode) c).text())
                .filter(t -> !t.isEmpty())
                .orElse(null);
    }

    /** The explicit box, or the union of the chunk boxes on the first chunk's page. */
    public Box computedBox() {
        if (box != null) return box;
        Box union = null;
        List<Box> boxes = new ArrayList<>();
        imageChunks.forEach(i -> boxes.add(i.box()));
        lineArtChunks.forEach(l -> boxes.add(l.box()));
        for (Box b : boxes) {
            if (union == null) {
                union = b;
            } else if (union.samePage(b)) {
                union = union.union(b);
            }
        }
        return union;
    }

    /** The figure's own description, falling back to its caption text. */
    public String bestDescription() {
        String own = textDescription();
        return own != null ? own : captionText();
    }

    public static final class Builder extends NodeBuilder<Builder, FigureNode> {
        private final List<ImageChunk> images = new ArrayList<>();
        private final List<LineArtChunk> lineArt = new ArrayList<>();

        private Builder(String id) {
            super(id);
        }

        public Builder image(ImageChunk image) {
            images.add(image);
            return this;
        }

        public Builder lineArt(LineArtChunk chunk) {
            lineArt.add(chunk);
            return this;
        }

        @Override
        public FigureNode build(int depth) {
            return new FigureNode(
                    id,
                    box,
                    Nodes.atDepth(children, depth + 1),
                    attributes,
                    depth,
                    images,
                    lineArt);
        }
    }
}
