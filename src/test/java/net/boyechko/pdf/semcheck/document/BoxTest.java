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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class BoxTest {

    @Test
    void edgesFollowPdfUserSpace() {
        Box box = new Box(0, 10, 20, 100, 50);

        assertEquals(10f, box.left());
        assertEquals(110f, box.right());
        assertEquals(20f, box.bottom());
        assertEquals(70f, box.top());
        assertEquals(5000.0, box.area(), 1e-9);
        assertEquals(60.0, box.center().getX(), 1e-9);
        assertEquals(45.0, box.center().getY(), 1e-9);
    }

    @Test
    void rejectsNegativePageIndex() {
        assertThrows(IllegalArgumentException.class, () -> new Box(-1, 0, 0, 10, 10));
    }

    @Test
    void fromCornersNormalizesCornerOrder() {
        Box box = Box.fromCorners(2, 100, 80, 20, 10);

        assertEquals(new Box(2, 20, 10, 80, 70), box);
    }

    @Test
    void boxesOnDifferentPagesNeverInteract() {
        Box a = new Box(0, 0, 0, 100, 100);
        Box b = new Box(1, 0, 0, 100, 100);

        assertNull(a.union(b));
        assertNull(a.intersection(b));
        assertFalse(a.intersects(b));
        assertFalse(a.contains(b));
        assertEquals(0.0, a.overlapPercentage(b));
    }

    @Test
    void overlapIsMeasuredAgainstTheSmallerBox() {
        Box big = new Box(0, 0, 0, 100, 100);
        Box small = new Box(0, 50, 50, 20, 20);
        Box half = new Box(0, 50, 50, 100, 100);

        assertEquals(1.0, big.overlapPercentage(small), 1e-9);
        assertEquals(0.25, big.overlapPercentage(half), 1e-9);
        assertEquals(big.overlapPercentage(half), half.overlapPercentage(big), 1e-9);
    }

    @Test
    void disjointAndDegenerateBoxesHaveNoOverlap() {
        Box a = new Box(0, 0, 0, 10, 10);

        assertEquals(0.0, a.overlapPercentage(new Box(0, 50, 50, 10, 10)));
        assertEquals(0.0, a.overlapPercentage(new Box(0, 5, 5, 0, 0)));
        assertNull(a.intersection(new Box(0, 50, 50, 10, 10)));
    }

    @Test
    void touchingEdgesDoNotIntersect() {
        Box a = new Box(0, 0, 0, 10, 10);
        Box b = new Box(0, 10, 0, 10, 10);

        assertFalse(a.intersects(b));
        assertTrue(a.intersects(new Box(0, 9, 9, 10, 10)));
    }

    @Test
    void containmentIsEdgeInclusive() {
        Box a = new Box(0, 0, 0, 10, 10);

        assertTrue(a.contains(a));
        assertTrue(a.contains(new Box(0, 0, 0, 5, 10)));
        assertFalse(a.contains(new Box(0, 5, 5, 10, 10)));
    }

    @Test
    void unionEnclosesBothBoxes() {
        Box union = new Box(3, 0, 0, 10, 10).union(new Box(3, 20, 5, 10, 10));

        assertEquals(new Box(3, 0, 0, 30, 15), union);
    }

    @Test
    void insetShrinksAndFloorsAtZero() {
        Box box = new Box(0, 0, 0, 10, 10);

        assertEquals(new Box(0, 2, 3, 6, 4), box.insetBy(2, 3));
        assertEquals(0.0, box.insetBy(6, 6).area());
        assertEquals(new Box(0, -1, -1, 12, 12), box.insetBy(-1, -1));
    }

    @Test
    void rectangleAccessorReturnsACopy() {
        Box box = new Box(0, 0, 0, 10, 10);
        box.rect().setWidth(500);

        assertEquals(10f, box.width());
    }
}
