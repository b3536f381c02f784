package com.dcruver.itemstore.domain;

import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.time.Instant;
import java.util.List;

/**
 * The single stored unit of content.
 * Content is always plaintext here; encryption is a storage concern.
 */
@Data
@Builder
@With
public class Item {

    /**
     * Substituted for the content of a sensitive item whose payload cannot be decrypted.
     */
    public static final String CORRUPT_CONTENT_MARKER = "[DECRYPTION ERROR]";

    private final long id;
    private final long collectionId;
    private final String label;
    private final String content;
    private final ContentKind kind;
    private final boolean sensitive;
    private final boolean favorite;

    // Free attributes
    private final String color;
    private final String description;
    private final Long fileSize;

    private final ItemPlacement placement;

    // Only set for table cells: value of the row's key column
    private final String rowLabel;

    private final List<String> tags;

    private final int useCount;
    private final Instant lastUsed;
    private final Instant createdAt;
    private final Instant updatedAt;

    // True when content holds CORRUPT_CONTENT_MARKER instead of the real payload
    private final boolean contentCorrupt;

    public boolean isStandalone() {
        return placement instanceof ItemPlacement.Standalone;
    }

    public boolean isListStep() {
        return placement instanceof ItemPlacement.ListStep;
    }

    public boolean isTableCell() {
        return placement instanceof ItemPlacement.TableCell;
    }
}
