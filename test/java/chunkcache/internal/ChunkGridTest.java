package chunkcache.internal;

import org.junit.jupiter.api.*;
import org.replikativ.chunkcache.GridPoint;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ChunkGrid")
class ChunkGridTest {

    @Test
    @DisplayName("world coordinates round toward negative infinity")
    void testFloorDiv() {
        assertEquals(0, ChunkGrid.toChunkCoordinate(0, 16));
        assertEquals(0, ChunkGrid.toChunkCoordinate(15, 16));
        assertEquals(1, ChunkGrid.toChunkCoordinate(16, 16));
        assertEquals(-1, ChunkGrid.toChunkCoordinate(-1, 16));
        assertEquals(-1, ChunkGrid.toChunkCoordinate(-16, 16));
        assertEquals(-2, ChunkGrid.toChunkCoordinate(-17, 16));
        assertEquals(GridPoint.of(-1, 2), ChunkGrid.toChunkPosition(GridPoint.of(-5, 40), 16));
    }

    @Test
    @DisplayName("Chebyshev distance is the larger axis delta")
    void testChebyshev() {
        assertEquals(0, ChunkGrid.chebyshevDistance(GridPoint.ORIGIN, GridPoint.ORIGIN));
        assertEquals(3, ChunkGrid.chebyshevDistance(GridPoint.of(3, -1), GridPoint.ORIGIN));
        assertEquals(4, ChunkGrid.chebyshevDistance(GridPoint.of(-2, 2), GridPoint.of(1, -2)));
    }

    @Test
    @DisplayName("distances between extreme coordinates saturate instead of wrapping")
    void testChebyshevExtremes() {
        assertEquals(Integer.MAX_VALUE,
                     ChunkGrid.chebyshevDistance(GridPoint.of(Integer.MIN_VALUE, 0), GridPoint.ORIGIN));
        assertEquals(Integer.MAX_VALUE,
                     ChunkGrid.chebyshevDistance(GridPoint.of(Integer.MAX_VALUE, 0), GridPoint.of(-1, 0)));
        assertEquals(Integer.MAX_VALUE,
                     ChunkGrid.chebyshevDistance(GridPoint.of(0, Integer.MIN_VALUE), GridPoint.of(0, Integer.MAX_VALUE)));
        assertEquals(Integer.MAX_VALUE - 1,
                     ChunkGrid.chebyshevDistance(GridPoint.of(Integer.MAX_VALUE, 0), GridPoint.of(1, 0)));
    }

    @Test
    @DisplayName("square() covers (2r+1)^2 distinct points, ring by ring")
    void testSquare() {
        GridPoint center = GridPoint.of(5, -5);
        for (int r = 0; r <= 4; r++) {
            List<GridPoint> points = ChunkGrid.square(center, r);
            int side = 2 * r + 1;
            assertEquals(side * side, points.size());
            assertEquals(points.size(), new HashSet<>(points).size());
            assertEquals(center, points.get(0));

            int previous = 0;
            for (GridPoint p : points) {
                int d = ChunkGrid.chebyshevDistance(p, center);
                assertTrue(d <= r);
                assertTrue(d >= previous, "rings must not go backwards");
                previous = d;
            }
        }
    }

    @Test
    @DisplayName("negative radius is rejected")
    void testNegativeRadius() {
        assertThrows(IllegalArgumentException.class, () -> ChunkGrid.square(GridPoint.ORIGIN, -1));
    }
}
