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

import com.itextpdf.kernel.geom.Point;
import com.itextpdf.kernel.geom.Rectangle;
import java.util.Objects;

/**
 * An axis-aligned rectangle on a single page, in PDF user space (y axis points up). Boxes on
 * different pages never interact: union and intersection return {@code null}, containment and
 * intersection tests return false, and overlap is 0.
 */
public final class Box {
    private final int pageIndex;
    private final Rectangle rect;

    public Box(int pageIndex, float x, float y, float width, float height) {
        this(pageIndex, new Rectangle(x, y, width, height));
    }

    public Box(int pageIndex, Rectangle rect) {
        if (pageIndex < 0) {
            throw new IllegalArgumentException("Page index must be >= 0, got " + pageIndex);
        }
        Objects.requireNonNull(rect, "rect");
        this.pageIndex = pageIndex;
        this.rect = rect.clone();
    }

    /** Creates a box from its lower-left and upper-right corners, normalizing their order. */
    public static Box fromCorners(int pageIndex, float x1, float y1, float x2, float y2) {
        float llx = Math.min(x1, x2);
        float lly = Math.min(y1, y2);
        return new Box(pageIndex, llx, lly, Math.max(x1, x2) - llx, Math.max(y1, y2) - lly);
    }

    public int pageIndex() {
        return pageIndex;
    }

    /** Returns a copy of the underlying rectangle. */
    public Rectangle rect() {
        return rect.clone();
    }

    public float x() {
        return rect.getX();
    }

    public float y() {
        return rect.getY();
    }

    public float width() {
        return rect.getWidth();
    }

    public float height() {
        return rect.getHeight();
    }

    public float left() {
        return rect.getLeft();
    }

    public float right() {
        return rect.getRight();
    }

    public float bottom() {
        return rect.getBottom();
    }

    public float top() {
        return rect.getTop();
    }

    /** Area in square points; 0 for degenerate boxes. */
    public double area() {
        double w = Math.max(0.0, rect.getWidth());
        double h = Math.max(0.0, rect.getHeight());
        return w * h;
    }

    public Point center() {
        return new Point(
                rect.getX() + rect.getWidth() / 2.0, rect.getY() + rect.getHeight() / 2.0);
    }

    public boolean samePage(Box other) {
        return other != null && other.pageIndex == pageIndex;
    }

    /** Smallest box enclosing both, or null when the boxes are on different pages. */
    public Box union(Box other) {
        if (!samePage(other)) return null;
        return new Box(pageIndex, Rectangle.getCommonRectangle(rect, other.rect));
    }

    /** Overlapping region, or null when the boxes are disjoint or on different pages. */
    public Box intersection(Box other) {
        if (!samePage(other)) return null;
        Rectangle overlap = rect.getIntersection(other.rect);
        return overlap != null ? new Box(pageIndex, overlap) : null;
    }

    /** True when the boxes share a region of positive area on the same page. */
    public boolean intersects(Box other) {
        if (!samePage(other)) return false;
        return left() < other.right()
                && other.left() < right()
                && bottom() < other.top()
                && other.bottom() < top();
    }

    /** True when {@code other} lies entirely within this box (edges inclusive). */
    public boolean contains(Box other) {
        if (!samePage(other)) return false;
        return left() <= other.left()
                && right() >= other.right()
                && bottom() <= other.bottom()
                && top() >= other.top();
    }

    /**
     * Fraction of the smaller box covered by the overlap of the two boxes, in [0, 1]. Returns 0
     * for boxes on different pages, disjoint boxes, or when either box has no area.
     */
    public double overlapPercentage(Box other) {
        Box overlap = intersection(other);
        if (overlap == null) return 0.0;
        double smaller = Math.min(area(), other.area());
        if (smaller <= 0.0) return 0.0;
        return overlap.area() / smaller;
    }

    /**
     * Shrinks (positive) or grows (negative) the box on every side. Width and height floor at 0.
     */
    public Box insetBy(float dx, float dy) {
        float w = Math.max(0f, rect.getWidth() - 2 * dx);
        float h = Math.max(0f, rect.getHeight() - 2 * dy);
        return new Box(pageIndex, rect.getX() + dx, rect.getY() + dy, w, h);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Box other)) return false;
        return pageIndex == other.pageIndex
                && Float.compare(x(), other.x()) == 0
                && Float.compare(y(), other.y()) == 0
                && Float.compare(width(), other.width()) == 0
                && Float.compare(height(), other.height()) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(pageIndex, x(), y(), width(), height());
    }

    @Override
    public String toString() {
        return String.format(
                "Box[page=%d, x=%.1f, y=%.1f, w=%.1f, h=%.1f]",
                pageIndex, x(), y(), width(), height());
    }
}
