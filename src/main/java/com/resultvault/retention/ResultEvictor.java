package com.resultvault.retention;

/**
 * Destroys a whole result: catalog row first, then its blobs.
 */
@FunctionalInterface
public interface ResultEvictor {

    Eviction evict(String userId, String resultId);
}
