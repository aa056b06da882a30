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

import com.itextpdf.kernel.geom.Point;

/** A straight ruling segment on a page, such as a table border. */
public record LineChunk(int pageIndex, Point start, Point end, float lineWidth) {

    static final double DEFAULT_COLLINEAR_TOLERANCE = 1.0;
    private static final double AXIS_TOLERANCE_RATIO = 0.01;
    private static final double MIN_AXIS_TOLERANCE = 0.5;

    public static LineChunk of(int pageIndex, double x1, double y1, double x2, double y2) {
        return new LineChunk(pageIndex, new Point(x1, y1), new Point(x2, y2), 1f);
    }

    public double length() {
        return start.distance(end);
    }

    public boolean isHorizontal() {
        return Math.abs(end.getY() - start.getY()) <= axisTolerance();
    }

    public boolean isVertical() {
        return Math.abs(end.getX() - start.getX()) <= axisTolerance();
    }

    private double axisTolerance() {
        return Math.max(length() * AXIS_TOLERANCE_RATIO, MIN_AXIS_TOLERANCE);
    }

    /**
     * Distance from {@code p} to the nearest point of the segment. A zero-length line degrades to
     * the distance from its start point.
     */
    public double distance(Point p) {
        double dx = end.getX() - start.getX();
        double dy = end.getY() - start.getY();
        double lengthSq = dx * dx + dy * dy;
        if (lengthSq == 0.0) {
            return start.distance(p);
        }
        double t = ((p.getX() - start.getX()) * dx + (p.getY() - start.getY()) * dy) / lengthSq;
        t = Math.max(0.0, Math.min(1.0, t));
        return p.distance(start.getX() + t * dx, start.getY() + t * dy);
    }

    /** Distance from {@code p} to the infinite line through this segment. */
    public double perpendicularDistance(Point p) {
        double length = length();
        if (length == 0.0) {
            return start.distance(p);
        }
        double cross =
                (end.getX() - start.getX()) * (start.getY() - p.getY())
                        - (start.getX() - p.getX()) * (end.getY() - start.getY());
        return Math.abs(cross) / length;
    }

    public boolean isCollinear(LineChunk other) {
        return isCollinear(other, DEFAULT_COLLINEAR_TOLERANCE);
    }

    /**
     * True when both segments are on the same page and all four endpoints lie near the other line.
     */
    public boolean isCollinear(LineChunk other, double tolerance) {
        if (other == null || other.pageIndex != pageIndex) return false;
        return perpendicularDistance(other.start) <= tolerance
                && perpendicularDistance(other.end) <= tolerance
                && other.perpendicularDistance(start) <= tolerance
                && other.perpendicularDistance(end) <= tolerance;
    }
}
