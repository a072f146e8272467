package org.replikativ.chunkcache;

/**
 * An integer (x, y) coordinate, used both for world positions and for chunk
 * grid positions depending on context.
 */
public final class GridPoint {

    /** The origin (0, 0). */
    public static final GridPoint ORIGIN = new GridPoint(0, 0);

    private final int x;
    private final int y;

    public GridPoint(int x, int y) {
        this.x = x;
        this.y = y;
    }

    public static GridPoint of(int x, int y) {
        return new GridPoint(x, y);
    }

    public int getX() { return x; }
    public int getY() { return y; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GridPoint that = (GridPoint) o;
        return x == that.x && y == that.y;
    }

    @Override
    public int hashCode() {
        return 31 * x + y;
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
