package com.dcruver.itemstore.domain;

/**
 * A required field is empty or a value is out of range.
 */
public class ValidationException extends ItemStoreException {

    public ValidationException(String message) {
        super(message);
    }
}
