package com.example.mmocore.persistence;

/**
 * A profile store operation failed.
 */
public class ProfileStoreException extends RuntimeException {

    public ProfileStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
