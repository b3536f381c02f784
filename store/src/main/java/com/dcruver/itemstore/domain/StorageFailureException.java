package com.dcruver.itemstore.domain;

/**
 * The database rejected an operation. Nothing from the operation was committed.
 */
public class StorageFailureException extends ItemStoreException {

    public StorageFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
