package com.colloquy.core.persistence;

/**
 * A database operation failed.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
