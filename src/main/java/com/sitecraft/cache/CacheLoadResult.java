package com.sitecraft.cache;

/**
 * Outcome of {@link CacheStore#load()}. Anything other than {@link Status#LOADED} carries an empty cache and
 * degrades the next cycle to a full rebuild.
 */
public record CacheLoadResult(BuildCache cache, Status status, String detail, boolean compressed, long decodeNanos) {

    public enum Status {
        LOADED,
        MISSING,
        CORRUPT,
        SCHEMA_MISMATCH
    }

    public boolean usable() {
        return status == Status.LOADED;
    }

    static CacheLoadResult degraded(Status status, String detail) {
        return new CacheLoadResult(BuildCache.empty(), status, detail, false, 0L);
    }
}
