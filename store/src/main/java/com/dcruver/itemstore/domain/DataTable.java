package com.dcruver.itemstore.domain;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Metadata of a table. Its cells are items placed as {@link ItemPlacement.TableCell}.
 */
@Data
@Builder
public class DataTable {
    private final long id;
    private final long collectionId;
    private final String name;
    private final String description;
    private final Instant createdAt;
    private final Instant updatedAt;
}
