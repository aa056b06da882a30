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
import java.util.Objects;
import net.boyechko.pdf.semcheck.document.Box;

/** Vector drawing made of straight line segments. */
public record LineArtChunk(Box box, List<LineChunk> lines) {

    public LineArtChunk {
        Objects.requireNonNull(box, "box");
        lines = List.copyOf(lines);
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public List<LineChunk> horizontalLines() {
        return lines.stream().filter(LineChunk::isHorizontal).toList();
    }

    public List<LineChunk> verticalLines() {
        return lines.stream().filter(LineChunk::isVertical).toList();
    }

    /** At least two rulings in each direction. */
    public boolean appearsGridLike() {
        return horizontalLines().size() >= 2 && verticalLines().size() >= 2;
    }
}
