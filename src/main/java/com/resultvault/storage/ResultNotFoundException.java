package com.resultvault.storage;

/**
 * Raised when an operation names a result that is not in the catalog,
 * or that belongs to a different user.
 */
public class ResultNotFoundException extends ResultStorageException {

    private final String resultId;

    public ResultNotFoundException(String resultId) {
        super("Result not found: " + resultId);
        this.resultId = resultId;
    }

    public String getResultId() {
        return resultId;
    }
}
