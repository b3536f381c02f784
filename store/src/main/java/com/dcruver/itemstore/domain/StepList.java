package com.dcruver.itemstore.domain;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Metadata of an ordered list. Its steps are items placed as {@link ItemPlacement.ListStep}.
 */
@Data
@Builder
public class StepList {
    private final long id;
    private final long collectionId;
    private final String name;
    private final String description;
    private final int useCount;
    private final Instant lastUsed;
    private final Instant createdAt;
    private final Instant updatedAt;

    // Filled by summary queries only
    private final int stepCount;
}
