package com.github.musiKk.quench.syntax;

/**
 * A 0-based row/column position. Columns count bytes, not characters.
 */
public record Point(int row, int column) implements Comparable<Point> {

    public static final Point ZERO = new Point(0, 0);

    @Override
    public int compareTo(Point other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(column, other.column);
    }

    /**
     * Position reached after walking over {@code bytes[from, to)} starting at
     * this point.
     */
    public Point advance(byte[] bytes, int from, int to) {
        int r = row;
        int c = column;
        for (int i = from; i < to; i++) {
            if (bytes[i] == '\n') {
                r++;
                c = 0;
            } else {
                c++;
            }
        }
        return new Point(r, c);
    }

    @Override
    public String toString() {
        return row + ":" + column;
    }
}
