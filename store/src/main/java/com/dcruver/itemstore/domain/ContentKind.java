package com.dcruver.itemstore.domain;

/**
 * Declared kind of an item's payload.
 */
public enum ContentKind {
    /**
     * Free text
     */
    TEXT,

    /**
     * Absolute http(s) link
     */
    URL,

    /**
     * Shell command or code fragment
     */
    CODE,

    /**
     * File or directory path
     */
    PATH;

    /**
     * Parse a stored or user supplied kind name, case-insensitively.
     */
    public static ContentKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Content kind must not be empty");
        }
        try {
            return ContentKind.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown content kind: " + value);
        }
    }
}
