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

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import net.boyechko.pdf.semcheck.document.Box;

/** Ruling lines extracted from one or more pages, with page and orientation filters. */
public final class LinesCollection {
    private final List<LineChunk> lines;

    public LinesCollection(List<LineChunk> lines) {
        this.lines = List.copyOf(lines);
    }

    public static LinesCollection empty() {
        return new LinesCollection(List.of());
    }

    public List<LineChunk> lines() {
        return lines;
    }

    public int size() {
        return lines.size();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public SortedSet<Integer> pageIndices() {
        SortedSet<Integer> pages = new TreeSet<>();
        lines.forEach(l -> pages.add(l.pageIndex()));
        return pages;
    }

    public LinesCollection onPage(int pageIndex) {
        return new LinesCollection(lines.stream().filter(l -> l.pageIndex() == pageIndex).toList());
    }

    public LinesCollection horizontal() {
        return new LinesCollection(lines.stream().filter(LineChunk::isHorizontal).toList());
    }

    public LinesCollection vertical() {
        return new LinesCollection(lines.stream().filter(LineChunk::isVertical).toList());
    }

    /** Lines whose extent falls inside {@code box} grown by {@code margin} on every side. */
    public LinesCollection within(Box box, float margin) {
        Box area = box.insetBy(-margin, -margin);
        List<LineChunk> inside = new ArrayList<>();
        for (LineChunk l : lines) {
            Box extent =
                    Box.fromCorners(
                            l.pageIndex(),
                            (float) l.start().getX(),
                            (float) l.start().getY(),
                            (float) l.end().getX(),
                            (float) l.end().getY());
            if (area.contains(extent)) {
                inside.add(l);
            }
        }
        return new LinesCollection(inside);
    }

    public LinesCollection adding(LineChunk line) {
        List<LineChunk> copy = new ArrayList<>(lines);
        copy.add(line);
        return new LinesCollection(copy);
    }

    public double totalLength() {
        return lines.stream().mapToDouble(LineChunk::length).sum();
    }
}
