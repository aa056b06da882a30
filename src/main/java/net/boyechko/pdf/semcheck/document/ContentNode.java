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

import com.itextpdf.kernel.colors.Color;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import net.boyechko.pdf.semcheck.document.content.TextBlock;
import net.boyechko.pdf.semcheck.document.content.TextChunk;

/**
 * Generic node for text-bearing and grouping roles: paragraphs, headings, spans, list items, table
 * rows and cells, containers. Dominant font metrics are the most common values over all chunks and
 * are null when the node carries no text.
 */
public record ContentNode(
        String id,
        Role role,
        Box box,
        List<Node> children,
        Map<String, AttributeValue> attributes,
        int depth,
        List<TextBlock> textBlocks,
        Float dominantFontSize,
        Float dominantFontWeight,
        Color dominantColor)
        implements Node {

    static final float LARGE_TEXT_SIZE = 18f;
    static final float LARGE_BOLD_TEXT_SIZE = 14f;
    static final float LARGE_TEXT_BOLD_WEIGHT = 700f;

    public ContentNode {
        Nodes.requireId(id);
        Objects.requireNonNull(role, "role");
        children = List.copyOf(children);
        attributes = Nodes.copyAttributes(attributes);
        textBlocks = List.copyOf(textBlocks);
    }

    public static Builder builder(String id, Role role) {
        return new Builder(id, role);
    }

    @Override
    public ContentNode atDepth(int depth) {
        return new ContentNode(
                id,
                role,
                box,
                Nodes.atDepth(children, depth + 1),
                attributes,
                depth,
                textBlocks,
                dominantFontSize,
                dominantFontWeight,
                dominantColor);
    }

    /** Text of all blocks, separated by blank lines. */
    public String text() {
        return textBlocks.stream().map(TextBlock::text).collect(Collectors.joining("\n\n"));
    }

    public boolean hasTextContent() {
        return !textBlocks.isEmpty() && !text().isEmpty();
    }

    @Override
    public boolean hasContent() {
        return Node.super.hasContent() || hasTextContent();
    }

    public List<TextChunk> allChunks() {
        return textBlocks.stream().flatMap(b -> b.allChunks().stream()).toList();
    }

    /** 18pt and up, or 14pt and up when bold. */
    public boolean isLargeText() {
        if (dominantFontSize == null) return false;
        if (dominantFontSize >= LARGE_TEXT_SIZE) return true;
        boolean bold = dominantFontWeight != null && dominantFontWeight >= LARGE_TEXT_BOLD_WEIGHT;
        return bold && dominantFontSize >= LARGE_BOLD_TEXT_SIZE;
    }

    static <T> T mostCommon(List<TextChunk> chunks, Function<TextChunk, T> key) {
        Map<T, Integer> counts = new LinkedHashMap<>();
        for (TextChunk chunk : chunks) {
            T value = key.apply(chunk);
            if (value != null) {
                counts.merge(value, 1, Integer::sum);
            }
        }
        T best = null;
        int bestCount = 0;
        for (Map.Entry<T, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }

    public static final class Builder extends NodeBuilder<Builder, ContentNode> {
        private final Role role;
        private final List<TextBlock> textBlocks = new ArrayList<>();
        private Float fontSize;
        private Float fontWeight;
        private Color color;

        private Builder(String id, Role role) {
            super(id);
            this.role = Objects.requireNonNull(role, "role");
        }

        public Builder textBlock(TextBlock block) {
            textBlocks.add(block);
            return this;
        }

        public Builder dominantFontSize(float size) {
            this.fontSize = size;
            return this;
        }

        public Builder dominantFontWeight(float weight) {
            this.fontWeight = weight;
            return this;
        }

        public Builder dominantColor(Color color) {
            this.color = color;
            return this;
        }

        @Override
        public ContentNode build(int depth) {
            List<TextChunk> chunks =
                    textBlocks.stream().flatMap(b -> b.allChunks().stream()).toList();
            return new ContentNode(
                    id,
                    role,
                    box,
                    Nodes.atDepth(children, depth + 1),
                    attributes,
                    depth,
                    textBlocks,
                    fontSize != null ? fontSize : mostCommon(chunks, TextChunk::fontSize),
                    fontWeight != null ? fontWeight : mostCommon(chunks, TextChunk::fontWeight),
                    color != null ? color : mostCommon(chunks, TextChunk::color));
        }
    }
}
