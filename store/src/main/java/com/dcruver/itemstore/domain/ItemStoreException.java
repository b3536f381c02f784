package com.dcruver.itemstore.domain;

/**
 * Base of every failure raised by the item store.
 */
public abstract class ItemStoreException extends RuntimeException {

    protected ItemStoreException(String message) {
        super(message);
    }

    protected ItemStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
