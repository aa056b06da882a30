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

import com.itextpdf.kernel.geom.Point;
import org.junit.jupiter.api.Test;

class LineChunkTest {

    @Test
    void orientationAllowsSmallSlopes() {
        assertTrue(LineChunk.of(0, 0, 0, 200, 1).isHorizontal());
        assertFalse(LineChunk.of(0, 0, 0, 200, 5).isHorizontal());
        assertTrue(LineChunk.of(0, 10, 0, 10.3, 20).isVertical());
        assertFalse(LineChunk.of(0, 0, 0, 20, 20).isVertical());
    }

    @Test
    void distanceClampsToTheSegment() {
        LineChunk line = LineChunk.of(0, 0, 0, 10, 0);

        assertEquals(3.0, line.distance(new Point(5, 3)), 1e-9);
        assertEquals(5.0, line.distance(new Point(13, 4)), 1e-9);
        assertEquals(4.0, line.perpendicularDistance(new Point(13, 4)), 1e-9);
    }

    @Test
    void zeroLengthLineMeasuresFromItsStart() {
        LineChunk dot = LineChunk.of(0, 1, 1, 1, 1);

        assertEquals(0.0, dot.length());
        assertEquals(5.0, dot.distance(new Point(4, 5)), 1e-9);
    }

    @Test
    void collinearityRequiresTheSamePage() {
        LineChunk a = LineChunk.of(0, 0, 0, 10, 0);

        assertTrue(a.isCollinear(LineChunk.of(0, 20, 0.5, 30, 0.5)));
        assertFalse(a.isCollinear(LineChunk.of(0, 20, 3, 30, 3)));
        assertFalse(a.isCollinear(LineChunk.of(1, 20, 0, 30, 0)));
        assertTrue(a.isCollinear(LineChunk.of(0, 20, 3, 30, 3), 5.0));
    }
}
