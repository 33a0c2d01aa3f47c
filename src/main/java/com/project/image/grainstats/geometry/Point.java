package com.project.image.grainstats.geometry;

/**
 * A (row, column) coordinate in pixel space. Two points are equal when both coordinates are equal.
 */
public record Point(double row, double col) {

    public static Point of(int row, int col) {
        return new Point(row, col);
    }

    public Point minus(Point other) {
        return new Point(row - other.row, col - other.col);
    }

    public Point plus(Point other) {
        return new Point(row + other.row, col + other.col);
    }

    public double squaredDistanceTo(Point other) {
        double dr = row - other.row;
        double dc = col - other.col;
        return dr * dr + dc * dc;
    }

    public double distanceTo(Point other) {
        return Math.sqrt(squaredDistanceTo(other));
    }

    public double norm() {
        return Math.sqrt(row * row + col * col);
    }

    /** Element-wise mean of the given points. */
    public static Point centroid(Iterable<Point> points) {
        double sumRow = 0, sumCol = 0;
        int n = 0;
        for (Point p : points) {
            sumRow += p.row;
            sumCol += p.col;
            n++;
        }
        if (n == 0) {
            throw new IllegalArgumentException("Cannot compute the centroid of an empty point set");
        }
        return new Point(sumRow / n, sumCol / n);
    }
}
