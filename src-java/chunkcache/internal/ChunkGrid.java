package chunkcache.internal;

import org.replikativ.chunkcache.GridPoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Grid arithmetic for square (Chebyshev) neighbourhoods.
 *
 * <p><b>Internal API</b> - subject to change without notice.</p>
 */
public final class ChunkGrid {

    private ChunkGrid() {}

    /**
     * Map a world coordinate to the chunk coordinate containing it.
     * Rounds toward negative infinity, so -1 maps to chunk -1, not 0.
     */
    public static int toChunkCoordinate(int world, int chunkSize) {
        return Math.floorDiv(world, chunkSize);
    }

    public static GridPoint toChunkPosition(GridPoint world, int chunkSize) {
        return new GridPoint(toChunkCoordinate(world.getX(), chunkSize),
                             toChunkCoordinate(world.getY(), chunkSize));
    }

    /**
     * Chebyshev distance: the larger of the absolute x and y deltas.
     * Deltas are taken in long; distances beyond int range saturate at
     * {@link Integer#MAX_VALUE}.
     */
    public static int chebyshevDistance(GridPoint a, GridPoint b) {
        return chebyshevDistance((long) a.getX() - b.getX(), (long) a.getY() - b.getY());
    }

    public static int chebyshevDistance(long dx, long dy) {
        long d = Math.max(Math.abs(dx), Math.abs(dy));
        return (int) Math.min(d, Integer.MAX_VALUE);
    }

    /**
     * All points within the given Chebyshev radius of {@code center}, ordered ring
     * by ring (the center first), rows top to bottom within a ring.
     *
     * @param center center point
     * @param radius non-negative radius
     * @return (2r+1)^2 points
     */
    public static List<GridPoint> square(GridPoint center, int radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("radius must not be negative: " + radius);
        }
        int side = 2 * radius + 1;
        List<GridPoint> points = new ArrayList<>(side * side);
        points.add(center);
        for (int ring = 1; ring <= radius; ring++) {
            for (int dy = -ring; dy <= ring; dy++) {
                // Interior rows only contribute their two edge cells.
                int step = (dy == -ring || dy == ring) ? 1 : 2 * ring;
                for (int dx = -ring; dx <= ring; dx += step) {
                    points.add(new GridPoint(center.getX() + dx, center.getY() + dy));
                }
            }
        }
        return points;
    }
}
