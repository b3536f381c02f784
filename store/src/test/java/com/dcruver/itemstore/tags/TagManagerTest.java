package com.dcruver.itemstore.tags;

import com.dcruver.itemstore.StoreFixture;
import com.dcruver.itemstore.domain.ContentKind;
import com.dcruver.itemstore.domain.ItemDraft;
import com.dcruver.itemstore.domain.NotFoundException;
import com.dcruver.itemstore.domain.Tag;
import com.dcruver.itemstore.domain.TagStatistics;
import com.dcruver.itemstore.domain.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for tag vocabulary, associations and usage counters.
 */
class TagManagerTest {

    @TempDir
    Path tempDir;

    private StoreFixture store;
    private TagManager tags;
    private long collectionId;

    @BeforeEach
    void setUp() throws Exception {
        store = new StoreFixture(tempDir);
        tags = store.tagManager;
        collectionId = store.repository.createCollection("General", null);
    }

    private long newItem(String label) {
        return store.repository.createStandaloneItem(collectionId, ItemDraft.of(label, "content of " + label, ContentKind.TEXT));
    }

    @Test
    void testNormalization() {
        assertEquals("python", TagManager.normalize("  Python "));
        assertThrows(ValidationException.class, () -> TagManager.normalize("   "));
        assertThrows(ValidationException.class, () -> tags.getOrCreateTag(""));

        long first = tags.getOrCreateTag("Docker");
        long second = tags.getOrCreateTag(" docker ");
        assertEquals(first, second);
        assertEquals(0, tags.findTag("docker").orElseThrow().getUsageCount());
    }

    @Test
    void testAssociateIsIdempotent() {
        long item = newItem("a");

        assertTrue(tags.associate(item, "work"));
        assertFalse(tags.associate(item, "WORK"));

        assertEquals(1, store.usageCount("work"));
        assertEquals(List.of("work"), tags.tagsForItem(item));
        assertNotNull(tags.findTag("work").orElseThrow().getLastUsed());
    }

    @Test
    void testAssociateMissingItem() {
        assertThrows(NotFoundException.class, () -> tags.associate(999, "work"));
        assertTrue(tags.findTag("work").isEmpty(), "Failed association leaves no tag behind");
    }

    @Test
    void testDissociateFloorsAtZero() {
        long item = newItem("a");
        tags.associate(item, "temp");

        assertTrue(tags.dissociate(item, "temp"));
        assertFalse(tags.dissociate(item, "temp"));
        assertFalse(tags.dissociate(item, "never-existed"));

        assertEquals(0, store.usageCount("temp"));
    }

    @Test
    void testReplaceItemTagsAppliesOnlyTheDifference() {
        long item = newItem("a");
        long other = newItem("b");
        tags.replaceItemTags(item, List.of("a", "b"));
        tags.associate(other, "a");
        tags.associate(other, "b");

        tags.replaceItemTags(item, List.of("b", "c"));

        assertEquals(1, store.usageCount("a"));
        assertEquals(2, store.usageCount("b"));
        assertEquals(1, store.usageCount("c"));
        assertEquals(List.of("b", "c"), tags.tagsForItem(item));
    }

    @Test
    void testReplaceWithSameSetLeavesCountersAndTimestamps() throws Exception {
        long item = newItem("a");
        tags.replaceItemTags(item, List.of("x", "y"));
        Tag before = tags.findTag("x").orElseThrow();

        Thread.sleep(5);
        tags.replaceItemTags(item, List.of("y", "X"));
        tags.replaceItemTags(item, List.of("x", "y"));

        Tag after = tags.findTag("x").orElseThrow();
        assertEquals(before.getUsageCount(), after.getUsageCount());
        assertEquals(before.getLastUsed(), after.getLastUsed());
        assertEquals(1, store.usageCount("y"));
    }

    @Test
    void testReplaceWithEmptyClearsTags() {
        long item = newItem("a");
        tags.replaceItemTags(item, List.of("x", "y"));

        tags.replaceItemTags(item, List.of());

        assertTrue(tags.tagsForItem(item).isEmpty());
        assertEquals(0, store.usageCount("x"));
        assertEquals(0, store.usageCount("y"));
    }

    @Test
    void testPruneUnusedTags() {
        long item = newItem("a");
        tags.associate(item, "kept");
        tags.getOrCreateTag("orphan");
        tags.associate(item, "dropped");
        tags.dissociate(item, "dropped");

        assertEquals(2, tags.pruneUnusedTags());
        assertTrue(tags.findTag("kept").isPresent());
        assertTrue(tags.findTag("orphan").isEmpty());
        assertTrue(tags.findTag("dropped").isEmpty());
    }

    @Test
    void testRecountRepairsDrift() {
        long item = newItem("a");
        tags.associate(item, "drifted");
        store.jdbc.update("UPDATE tags SET usage_count = 7 WHERE name = 'drifted'");

        long tagId = tags.findTag("drifted").orElseThrow().getId();
        assertEquals(1, tags.recountTag(tagId));
        assertEquals(1, store.usageCount("drifted"));

        store.jdbc.update("UPDATE tags SET usage_count = 0 WHERE name = 'drifted'");
        assertEquals(1, tags.recountAll());
        assertEquals(0, tags.recountAll());
        assertEquals(1, store.usageCount("drifted"));

        assertThrows(NotFoundException.class, () -> tags.recountTag(12345));
    }

    @Test
    void testCountersMatchAssociationsAfterMixedOperations() {
        long first = newItem("a");
        long second = newItem("b");
        long third = newItem("c");

        tags.replaceItemTags(first, List.of("x", "y", "z"));
        tags.replaceItemTags(second, List.of("x"));
        tags.associate(third, "y");
        tags.replaceItemTags(first, List.of("z"));
        tags.dissociate(third, "y");
        store.repository.deleteItem(second);

        for (String name : List.of("x", "y", "z")) {
            assertEquals(store.associationCount(name), store.usageCount(name), "Counter of " + name);
        }
    }

    @Test
    void testQueriesAndStatistics() {
        long first = newItem("a");
        long second = newItem("b");
        tags.replaceItemTags(first, List.of("java", "spring"));
        tags.replaceItemTags(second, List.of("java"));
        tags.getOrCreateTag("unused");

        assertEquals(List.of("java", "spring", "unused"),
            tags.listTags().stream().map(Tag::getName).toList());
        assertEquals(List.of("spring"), tags.searchTags("SPR").stream().map(Tag::getName).toList());
        assertEquals(List.of(first, second), tags.itemIdsWithTag("Java"));

        TagStatistics stats = tags.statistics(1);
        assertEquals(3, stats.getTotalTags());
        assertEquals(2, stats.getTagsInUse());
        assertEquals(1, stats.getUnusedTags());
        assertEquals(1.5, stats.getAverageTagsPerItem());
        assertEquals(1, stats.getTopTags().size());
        assertEquals("java", stats.getTopTags().get(0).getName());
    }

    @Test
    void testReleaseItemDecrementsEveryTag() {
        long item = newItem("a");
        tags.replaceItemTags(item, List.of("p", "q"));

        assertEquals(2, tags.releaseItem(item));

        assertEquals(0, store.usageCount("p"));
        assertEquals(0, store.usageCount("q"));
        assertTrue(tags.tagsForItem(item).isEmpty());
        Instant created = tags.findTag("p").orElseThrow().getCreatedAt();
        assertNotNull(created);
    }
}
