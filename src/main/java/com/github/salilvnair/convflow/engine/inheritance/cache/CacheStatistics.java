package com.github.salilvnair.convflow.engine.inheritance.cache;

public record CacheStatistics(long hits, long misses, long requests, double hitRate) {

    public static CacheStatistics of(long hits, long misses) {
        long requests = hits + misses;
        return new CacheStatistics(hits, misses, requests, requests == 0 ? 0.0d : (double) hits / requests);
    }
}
