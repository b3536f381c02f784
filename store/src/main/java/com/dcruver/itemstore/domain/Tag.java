package com.dcruver.itemstore.domain;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class Tag {
    private final long id;
    private final String name;
    private final int usageCount;
    private final Instant lastUsed;
    private final Instant createdAt;
}
