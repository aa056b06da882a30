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
package net.boyechko.pdf.semcheck.document.content;

import java.util.List;
import java.util.stream.Collectors;
import net.boyechko.pdf.semcheck.document.Box;

/** Text chunks sharing a baseline, in drawing order. */
public record TextLine(List<TextChunk> chunks, Box box) {

    public TextLine {
        chunks = List.copyOf(chunks);
    }

    public static TextLine of(TextChunk... chunks) {
        Box box = null;
        for (TextChunk c : chunks) {
            if (c.box() == null) continue;
            box = box == null ? c.box() : box.union(c.box());
        }
        return new TextLine(List.of(chunks), box);
    }

    public String text() {
        return chunks.stream().map(TextChunk::value).collect(Collectors.joining());
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }
}
