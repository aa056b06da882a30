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
import java.util.Comparator;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/** A region made of boxes on one or more pages, kept sorted by page index. */
public final class MultiBox {
    private static final Comparator<Box> BY_PAGE = Comparator.comparingInt(Box::pageIndex);

    private final List<Box> boxes;

    public MultiBox(List<Box> boxes) {
        List<Box> sorted = new ArrayList<>(boxes);
        sorted.sort(BY_PAGE);
        this.boxes = List.copyOf(sorted);
    }

    public static MultiBox of(Box... boxes) {
        return new MultiBox(List.of(boxes));
    }

    public static MultiBox empty() {
        return new MultiBox(List.of());
    }

    public List<Box> boxes() {
        return boxes;
    }

    public boolean isEmpty() {
        return boxes.isEmpty();
    }

    public List<Box> boxesOnPage(int pageIndex) {
        return boxes.stream().filter(b -> b.pageIndex() == pageIndex).toList();
    }

    /** Union of every box on the page, or null if the region does not touch that page. */
    public Box unionOnPage(int pageIndex) {
        Box union = null;
        for (Box b : boxesOnPage(pageIndex)) {
            union = union == null ? b : union.union(b);
        }
        return union;
    }

    public SortedSet<Integer> pageIndices() {
        SortedSet<Integer> pages = new TreeSet<>();
        for (Box b : boxes) {
            pages.add(b.pageIndex());
        }
        return pages;
    }

    public int pageCount() {
        return pageIndices().size();
    }

    public boolean isMultiPage() {
        return pageCount() > 1;
    }

    public double totalArea() {
        return boxes.stream().mapToDouble(Box::area).sum();
    }

    public MultiBox adding(Box box) {
        List<Box> copy = new ArrayList<>(boxes);
        copy.add(box);
        return new MultiBox(copy);
    }

    /** Collapses the region into one union box per page. */
    public MultiBox merged() {
        List<Box> perPage = new ArrayList<>();
        for (int page : pageIndices()) {
            perPage.add(unionOnPage(page));
        }
        return new MultiBox(perPage);
    }

    public boolean intersects(Box box) {
        return boxes.stream().anyMatch(b -> b.intersects(box));
    }

    public boolean contains(Box box) {
        return boxes.stream().anyMatch(b -> b.contains(box));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MultiBox other && boxes.equals(other.boxes);
    }

    @Override
    public int hashCode() {
        return boxes.hashCode();
    }

    @Override
    public String toString() {
        return "MultiBox" + boxes;
    }
}
