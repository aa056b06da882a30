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
import java.util.Collections;
import java.util.List;
import net.boyechko.pdf.semcheck.document.content.LineChunk;
import net.boyechko.pdf.semcheck.document.content.LinesCollection;

/**
 * Grid lines inferred from drawn rulings around a table: sorted x positions of vertical borders
 * and sorted y positions of horizontal borders. n lines bound n - 1 columns or rows.
 */
public record VisualBorder(List<Double> xCoordinates, List<Double> yCoordinates) {
    static final double DEFAULT_MERGE_TOLERANCE = 2.0;

    public VisualBorder {
        xCoordinates = sorted(xCoordinates);
        yCoordinates = sorted(yCoordinates);
    }

    private static List<Double> sorted(List<Double> values) {
        List<Double> copy = new ArrayList<>(values);
        Collections.sort(copy);
        return List.copyOf(copy);
    }

    /** Both axes carry at least one line. */
    public boolean isPresent() {
        return !xCoordinates.isEmpty() && !yCoordinates.isEmpty();
    }

    public int columnCount() {
        return Math.max(0, xCoordinates.size() - 1);
    }

    public int rowCount() {
        return Math.max(0, yCoordinates.size() - 1);
    }

    /** Clusters the rulings of a collection into border positions. */
    public static VisualBorder fromLines(LinesCollection lines) {
        return fromLines(lines, DEFAULT_MERGE_TOLERANCE);
    }

    /**
     * Clusters the rulings of a collection into border positions: each vertical line contributes
     * its x, each horizontal line its y, and positions closer than {@code tolerance} collapse into
     * their first member.
     */
    public static VisualBorder fromLines(LinesCollection lines, double tolerance) {
        List<Double> xs = new ArrayList<>();
        List<Double> ys = new ArrayList<>();
        for (LineChunk line : lines.lines()) {
            if (line.isVertical()) {
                xs.add((line.start().getX() + line.end().getX()) / 2.0);
            } else if (line.isHorizontal()) {
                ys.add((line.start().getY() + line.end().getY()) / 2.0);
            }
        }
        return new VisualBorder(cluster(xs, tolerance), cluster(ys, tolerance));
    }

    private static List<Double> cluster(List<Double> values, double tolerance) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        List<Double> out = new ArrayList<>();
        for (double v : sorted) {
            if (out.isEmpty() || v - out.get(out.size() - 1) > tolerance) {
                out.add(v);
            }
        }
        return out;
    }
}
