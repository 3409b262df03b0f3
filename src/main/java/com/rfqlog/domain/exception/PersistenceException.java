package com.rfqlog.domain.exception;

/**
 * Raised when the revision log or the owning record cannot be read or written
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Wrap a storage failure, keeping domain exceptions as they are
     */
    public static Throwable wrap(String message, Throwable error) {
        if (error instanceof PersistenceException
                || error instanceof ValidationException
                || error instanceof NotFoundException) {
            return error;
        }
        return new PersistenceException(message + ": " + error.getMessage(), error);
    }
}
