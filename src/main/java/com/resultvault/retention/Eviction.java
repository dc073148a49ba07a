package com.resultvault.retention;

/**
 * What happened when one result was evicted.
 */
public final class Eviction {

    private static final Eviction ABSENT = new Eviction(false, 0);

    private final boolean removed;
    private final int blobDeleteFailures;

    private Eviction(boolean removed, int blobDeleteFailures) {
        this.removed = removed;
        this.blobDeleteFailures = blobDeleteFailures;
    }

    /**
     * The catalog row was removed; {@code blobDeleteFailures} blobs were left behind.
     */
    public static Eviction removed(int blobDeleteFailures) {
        return new Eviction(true, blobDeleteFailures);
    }

    /**
     * Nothing to remove, another caller deleted the result first.
     */
    public static Eviction absent() {
        return ABSENT;
    }

    public boolean isRemoved() {
        return removed;
    }

    public int getBlobDeleteFailures() {
        return blobDeleteFailures;
    }

    @Override
    public String toString() {
        return "Eviction{removed=" + removed + ", blobDeleteFailures=" + blobDeleteFailures + "}";
    }
}
