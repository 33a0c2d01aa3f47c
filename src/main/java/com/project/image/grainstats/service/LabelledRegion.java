package com.project.image.grainstats.service;

/**
 * One labelled region, cropped to its bounding box.
 * Row and column maxima are exclusive.
 *
 * @param mask pixels of this label inside the bounding box, indexed {@code [row][col]}
 * @param area number of pixels carrying the label
 */
public record LabelledRegion(int label, int minRow, int minCol, int maxRow, int maxCol, boolean[][] mask, int area) {

    public int height() {
        return maxRow - minRow;
    }

    public int width() {
        return maxCol - minCol;
    }

    public int bboxArea() {
        return height() * width();
    }

    /** Length of the shorter bounding box side. */
    public int minSide() {
        return Math.min(height(), width());
    }
}
