package com.dcruver.itemstore.domain;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;
import java.util.Set;

/**
 * A whole table to be created in one go: header names plus a row-major grid of values.
 * Blank values are not stored.
 */
@Data
@Builder
public class TableImport {
    private final long collectionId;
    private final String name;
    private final String description;
    @Singular
    private final List<String> columns;
    @Singular
    private final List<List<String>> rows;
    @Singular
    private final Set<Integer> sensitiveColumns;
    @Singular
    private final Set<Integer> urlColumns;
    @Singular
    private final List<String> tags;
}
