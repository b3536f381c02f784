package com.dcruver.itemstore.domain;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Vocabulary-wide tag figures.
 */
@Data
@Builder
public class TagStatistics {
    private final int totalTags;
    private final int tagsInUse;
    private final int unusedTags;
    private final double averageTagsPerItem;
    private final List<Tag> topTags;
}
