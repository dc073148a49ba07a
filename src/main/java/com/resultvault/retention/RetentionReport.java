package com.resultvault.retention;

import java.util.List;

/**
 * Outcome of one retention pass for a user.
 */
public final class RetentionReport {

    private final String userId;
    private final int scanned;
    private final List<String> deletedResultIds;
    private final int blobDeleteFailures;
    private final long remainingBytes;

    /**
     * @param userId             user the pass ran for
     * @param scanned            results in the snapshot the pass acted on
     * @param deletedResultIds   evicted results, in deletion order
     * @param blobDeleteFailures blobs left behind as orphans because their delete failed
     * @param remainingBytes     catalog byte total after the pass, -1 when the pass was skipped
     */
    public RetentionReport(String userId, int scanned, List<String> deletedResultIds,
                           int blobDeleteFailures, long remainingBytes) {
        this.userId = userId;
        this.scanned = scanned;
        this.deletedResultIds = List.copyOf(deletedResultIds);
        this.blobDeleteFailures = blobDeleteFailures;
        this.remainingBytes = remainingBytes;
    }

    static RetentionReport skipped(String userId) {
        return new RetentionReport(userId, 0, List.of(), 0, -1L);
    }

    public String getUserId() {
        return userId;
    }

    public int getScanned() {
        return scanned;
    }

    public List<String> getDeletedResultIds() {
        return deletedResultIds;
    }

    public int getBlobDeleteFailures() {
        return blobDeleteFailures;
    }

    public long getRemainingBytes() {
        return remainingBytes;
    }

    public int getDeleted() {
        return deletedResultIds.size();
    }

    @Override
    public String toString() {
        return "RetentionReport{userId=" + userId + ", scanned=" + scanned + ", deleted=" + deletedResultIds.size()
                + ", blobDeleteFailures=" + blobDeleteFailures + ", remainingBytes=" + remainingBytes + "}";
    }
}
