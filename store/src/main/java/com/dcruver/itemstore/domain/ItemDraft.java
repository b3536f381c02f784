package com.dcruver.itemstore.domain;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

/**
 * Field values for a new item. A null kind is detected from the content.
 */
@Data
@Builder
public class ItemDraft {
    private final String label;
    private final String content;
    private final ContentKind kind;
    private final boolean sensitive;
    private final boolean favorite;
    private final String color;
    private final String description;
    private final Long fileSize;
    @Singular
    private final List<String> tags;

    public static ItemDraft of(String label, String content, ContentKind kind) {
        return ItemDraft.builder()
            .label(label)
            .content(content)
            .kind(kind)
            .build();
    }
}
