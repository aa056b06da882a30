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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.pdf.semcheck.document.Box;
import org.junit.jupiter.api.Test;

class LinesCollectionTest {

    private final LinesCollection lines =
            new LinesCollection(
                    List.of(
                            LineChunk.of(0, 0, 0, 100, 0),
                            LineChunk.of(0, 0, 0, 0, 50),
                            LineChunk.of(1, 0, 10, 100, 10),
                            LineChunk.of(0, 300, 300, 400, 300)));

    @Test
    void filtersByPageAndOrientation() {
        assertEquals(3, lines.onPage(0).size());
        assertEquals(3, lines.horizontal().size());
        assertEquals(1, lines.vertical().size());
        assertEquals(List.of(0, 1), List.copyOf(lines.pageIndices()));
    }

    @Test
    void withinKeepsLinesInsideTheGrownBox() {
        LinesCollection inside = lines.within(new Box(0, 1, 1, 98, 48), 2f);

        assertEquals(2, inside.size());
        assertTrue(inside.pageIndices().contains(0));
    }

    @Test
    void totalLengthSumsSegments() {
        assertEquals(350.0, lines.totalLength(), 1e-9);
        assertEquals(5, lines.adding(LineChunk.of(0, 0, 0, 1, 0)).size());
        assertTrue(LinesCollection.empty().isEmpty());
    }
}
