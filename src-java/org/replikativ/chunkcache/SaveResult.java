package org.replikativ.chunkcache;

import java.util.Objects;

/**
 * Per-key outcome of a write-back.
 *
 * <p>Bulk operations such as {@link ChunkCache#saveAllDirty()} return one result
 * per key so partial failures stay attributable.</p>
 */
public final class SaveResult {

    private final ChunkKey key;
    private final ChunkCacheException error;

    private SaveResult(ChunkKey key, ChunkCacheException error) {
        this.key = key;
        this.error = error;
    }

    public static SaveResult success(ChunkKey key) {
        return new SaveResult(key, null);
    }

    public static SaveResult failure(ChunkKey key, ChunkCacheException error) {
        return new SaveResult(key, Objects.requireNonNull(error, "error"));
    }

    public ChunkKey getKey() {
        return key;
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return the failure, or null on success
     */
    public ChunkCacheException getError() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SaveResult that = (SaveResult) o;
        return key.equals(that.key) && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, error);
    }

    @Override
    public String toString() {
        return isSuccess()
            ? "SaveResult{key=" + key + ", ok}"
            : "SaveResult{key=" + key + ", error=" + error.getMessage() + "}";
    }
}
