package com.dcruver.itemstore.domain;

/**
 * A protected payload could not be decrypted.
 */
public class CorruptContentException extends ItemStoreException {

    public CorruptContentException(String message) {
        super(message);
    }

    public CorruptContentException(String message, Throwable cause) {
        super(message, cause);
    }
}
