package com.resultvault.retention;

import java.time.Duration;
import java.util.Objects;

/**
 * Retention limits for one user's results. Each threshold is independently optional;
 * an absent threshold is not enforced.
 */
public final class RetentionPolicy {

    private static final long BYTES_PER_MEGABYTE = 1024L * 1024L;
    private static final RetentionPolicy UNLIMITED = new RetentionPolicy(null, null, null);

    private final Integer maxResults;
    private final Duration maxAge;
    private final Long maxTotalBytes;

    private RetentionPolicy(Integer maxResults, Duration maxAge, Long maxTotalBytes) {
        if (maxResults != null && maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be > 0.");
        }
        if (maxAge != null && (maxAge.isNegative() || maxAge.isZero())) {
            throw new IllegalArgumentException("maxAge must be positive.");
        }
        if (maxTotalBytes != null && maxTotalBytes <= 0) {
            throw new IllegalArgumentException("maxTotalBytes must be > 0.");
        }
        this.maxResults = maxResults;
        this.maxAge = maxAge;
        this.maxTotalBytes = maxTotalBytes;
    }

    public static RetentionPolicy unlimited() {
        return UNLIMITED;
    }

    /**
     * Builds a policy from the configured units: result count, days and megabytes.
     */
    public static RetentionPolicy of(Integer maxResults, Integer maxAgeDays, Integer maxStorageMb) {
        return new RetentionPolicy(
                maxResults,
                maxAgeDays != null ? Duration.ofDays(maxAgeDays) : null,
                maxStorageMb != null ? maxStorageMb * BYTES_PER_MEGABYTE : null);
    }

    public static RetentionPolicy ofLimits(Integer maxResults, Duration maxAge, Long maxTotalBytes) {
        return new RetentionPolicy(maxResults, maxAge, maxTotalBytes);
    }

    public Integer getMaxResults() {
        return maxResults;
    }

    public Duration getMaxAge() {
        return maxAge;
    }

    public Long getMaxTotalBytes() {
        return maxTotalBytes;
    }

    public boolean isEnforced() {
        return maxResults != null || maxAge != null || maxTotalBytes != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RetentionPolicy)) {
            return false;
        }
        RetentionPolicy that = (RetentionPolicy) o;
        return Objects.equals(maxResults, that.maxResults)
                && Objects.equals(maxAge, that.maxAge)
                && Objects.equals(maxTotalBytes, that.maxTotalBytes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxResults, maxAge, maxTotalBytes);
    }

    @Override
    public String toString() {
        return "RetentionPolicy{maxResults=" + maxResults + ", maxAge=" + maxAge
                + ", maxTotalBytes=" + maxTotalBytes + "}";
    }
}
