package com.dcruver.itemstore.domain;

/**
 * A referenced collection, list, table, item or tag does not exist.
 */
public class NotFoundException extends ItemStoreException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String entity, Object id) {
        return new NotFoundException(entity + " not found: " + id);
    }
}
