package com.dcruver.itemstore.domain;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Partial update of an item. Null fields are left unchanged; an empty tag list clears all tags.
 */
@Data
@Builder
public class ItemUpdate {
    private final String label;
    private final String content;
    private final ContentKind kind;
    private final Boolean sensitive;
    private final Boolean favorite;
    private final String color;
    private final String description;
    private final Long fileSize;
    private final List<String> tags;

    public static ItemUpdate content(String content) {
        return ItemUpdate.builder().content(content).build();
    }
}
