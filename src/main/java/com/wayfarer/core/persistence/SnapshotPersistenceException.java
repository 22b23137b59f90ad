package com.wayfarer.core.persistence;

/**
 * A snapshot could not be written or read back.
 */
public class SnapshotPersistenceException extends RuntimeException {

    public SnapshotPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
