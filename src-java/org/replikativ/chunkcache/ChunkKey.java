package org.replikativ.chunkcache;

import java.util.Objects;

/**
 * Identity of a cached chunk: the owning context (for example a point of
 * interest or a session) plus integer chunk grid coordinates.
 *
 * <p>Immutable. Two keys are equal iff owner, x and y are all equal.
 * {@link #toString()} yields the canonical {@code "owner:x:y"} encoding.</p>
 */
public final class ChunkKey {

    private final String ownerId;
    private final int x;
    private final int y;

    /**
     * Create a chunk key.
     *
     * @param ownerId the owning context id (must not be null)
     * @param x chunk grid x coordinate
     * @param y chunk grid y coordinate
     */
    public ChunkKey(String ownerId, int x, int y) {
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.x = x;
        this.y = y;
    }

    public static ChunkKey of(String ownerId, int x, int y) {
        return new ChunkKey(ownerId, x, y);
    }

    /**
     * Parse the {@code "owner:x:y"} encoding. The owner id may itself contain colons;
     * the last two segments are the coordinates.
     *
     * @param encoded encoded key
     * @return parsed key
     * @throws IllegalArgumentException if the string is not a valid encoding
     */
    public static ChunkKey parse(String encoded) {
        int last = encoded.lastIndexOf(':');
        int middle = last > 0 ? encoded.lastIndexOf(':', last - 1) : -1;
        if (middle < 0) {
            throw new IllegalArgumentException("Not a chunk key: " + encoded);
        }
        try {
            int x = Integer.parseInt(encoded.substring(middle + 1, last));
            int y = Integer.parseInt(encoded.substring(last + 1));
            return new ChunkKey(encoded.substring(0, middle), x, y);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a chunk key: " + encoded, e);
        }
    }

    public String getOwnerId() { return ownerId; }
    public int getX() { return x; }
    public int getY() { return y; }

    /**
     * @return the chunk coordinate of this key as a grid point
     */
    public GridPoint position() {
        return new GridPoint(x, y);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChunkKey that = (ChunkKey) o;
        return x == that.x && y == that.y && ownerId.equals(that.ownerId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ownerId, x, y);
    }

    @Override
    public String toString() {
        return ownerId + ":" + x + ":" + y;
    }
}
