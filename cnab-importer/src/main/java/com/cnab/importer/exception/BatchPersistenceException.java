package com.cnab.importer.exception;

/**
 * Thrown when a decoded batch could not be stored. The transaction that wrote the batch
 * has already been rolled back when this is raised.
 */
public class BatchPersistenceException extends CnabImportException {

    private final int batchSize;

    public BatchPersistenceException(int batchSize, Throwable cause) {
        super("Failed to persist batch of " + batchSize + " transactions", cause);
        this.batchSize = batchSize;
    }

    public int getBatchSize() {
        return batchSize;
    }

    /**
     * Message of the innermost cause, e.g. the database constraint that was violated.
     */
    public String getRootCauseMessage() {
        Throwable root = this;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
