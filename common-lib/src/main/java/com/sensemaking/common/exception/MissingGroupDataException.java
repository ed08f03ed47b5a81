package com.sensemaking.common.exception;

/**
 * Thrown when an operation that compares opinion groups is given pooled vote data.
 *
 * <p>Pooled data is never treated as a one-group breakdown: any group comparison made
 * from it would be meaningless.
 */
public class MissingGroupDataException extends RuntimeException {

    private final String operation;

    public MissingGroupDataException(String operation) {
        super("[" + operation + "] Group information is required, but the vote data is pooled.");
        this.operation = operation;
    }

    public MissingGroupDataException(String operation, String commentId) {
        super("[" + operation + "] Group information is required, but comment "
            + commentId + " has pooled vote data.");
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
