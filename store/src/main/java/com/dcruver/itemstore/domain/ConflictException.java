package com.dcruver.itemstore.domain;

/**
 * A write would break a uniqueness rule (names, cell coordinates).
 */
public class ConflictException extends ItemStoreException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
