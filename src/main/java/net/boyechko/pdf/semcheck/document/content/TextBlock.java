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

/** A paragraph-like group of lines. */
public record TextBlock(List<TextLine> lines, Box box) {

    public TextBlock {
        lines = List.copyOf(lines);
    }

    public static TextBlock of(TextLine... lines) {
        Box box = null;
        for (TextLine l : lines) {
            if (l.box() == null) continue;
            box = box == null ? l.box() : box.union(l.box());
        }
        return new TextBlock(List.of(lines), box);
    }

    /** Lines joined by newlines. */
    public String text() {
        return lines.stream().map(TextLine::text).collect(Collectors.joining("\n"));
    }

    public List<TextChunk> allChunks() {
        return lines.stream().flatMap(l -> l.chunks().stream()).toList();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
