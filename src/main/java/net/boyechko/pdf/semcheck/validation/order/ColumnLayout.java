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
package net.boyechko.pdf.semcheck.validation.order;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Columns of a page found by clustering the left edges of its content. A new column starts
 * wherever the gap between consecutive sorted left edges exceeds the gap threshold.
 */
final class ColumnLayout {
    private final List<Float> columnStarts;
    private final float gapThreshold;

    private ColumnLayout(List<Float> columnStarts, float gapThreshold) {
        this.columnStarts = List.copyOf(columnStarts);
        this.gapThreshold = gapThreshold;
    }

    static ColumnLayout detect(List<Float> leftEdges, float gapThreshold) {
        List<Float> sorted = new ArrayList<>(leftEdges);
        Collections.sort(sorted);

        List<Float> starts = new ArrayList<>();
        Float last = null;
        for (Float x : sorted) {
            if (last == null || x - last > gapThreshold) {
                starts.add(x);
            }
            last = x;
        }
        return new ColumnLayout(starts, gapThreshold);
    }

    int columnCount() {
        return columnStarts.size();
    }

    List<Float> columnStarts() {
        return columnStarts;
    }

    /**
     * Index of the column nearest to {@code x} among those starting within the gap threshold;
     * otherwise the column whose cluster contains {@code x}. -1 when there are no columns.
     */
    int columnOf(float x) {
        int nearest = -1;
        float best = Float.MAX_VALUE;
        for (int i = 0; i < columnStarts.size(); i++) {
            float d = Math.abs(x - columnStarts.get(i));
            if (d < gapThreshold && d < best) {
                best = d;
                nearest = i;
            }
        }
        if (nearest >= 0) return nearest;

        int containing = columnStarts.isEmpty() ? -1 : 0;
        for (int i = 0; i < columnStarts.size(); i++) {
            if (columnStarts.get(i) <= x) {
                containing = i;
            }
        }
        return containing;
    }
}
