package com.dcruver.itemstore.domain;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Top level container owning items, lists and tables.
 */
@Data
@Builder
public class ItemCollection {
    private final long id;
    private final String name;
    private final String description;
    private final Instant createdAt;
}
