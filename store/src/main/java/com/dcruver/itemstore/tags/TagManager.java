package com.dcruver.itemstore.tags;

import com.dcruver.itemstore.domain.NotFoundException;
import com.dcruver.itemstore.domain.Tag;
import com.dcruver.itemstore.domain.TagStatistics;
import com.dcruver.itemstore.domain.ValidationException;
import com.dcruver.itemstore.store.JdbcRows;
import com.dcruver.itemstore.store.StoreTransactions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Owns the tag vocabulary and the item/tag associations.
 *
 * A tag's usage_count always equals the number of item_tags rows that reference it.
 * Every association change moves the counter in the same transaction; the count is
 * only recomputed from scratch by {@link #recountTag} and {@link #recountAll}.
 */
@Component
@Slf4j
public class TagManager {

    private final JdbcTemplate jdbcTemplate;
    private final StoreTransactions transactions;

    public TagManager(DataSource dataSource, StoreTransactions transactions) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactions = transactions;
    }

    /**
     * Trim and lower-case a tag name.
     */
    public static String normalize(String name) {
        if (name == null) {
            throw new ValidationException("Tag name cannot be empty");
        }
        String normalized = name.strip().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new ValidationException("Tag name cannot be empty");
        }
        return normalized;
    }

    /**
     * Normalize a batch of names, dropping duplicates and keeping first-seen order.
     */
    public static Set<String> normalizeAll(Collection<String> names) {
        Set<String> normalized = new LinkedHashSet<>();
        if (names != null) {
            for (String name : names) {
                normalized.add(normalize(name));
            }
        }
        return normalized;
    }

    public long getOrCreateTag(String name) {
        String normalized = normalize(name);
        return transactions.inTransaction("Get or create tag", () -> {
            Optional<Long> existing = findTagId(normalized);
            if (existing.isPresent()) {
                return existing.get();
            }
            long id = JdbcRows.insertReturningId(jdbcTemplate,
                "INSERT INTO tags (name, usage_count, created_at) VALUES (?, 0, ?)",
                normalized, JdbcRows.now());
            log.debug("Tag created: '{}' (ID: {})", normalized, id);
            return id;
        });
    }

    /**
     * Attach a tag to an item. Re-associating is a no-op.
     *
     * @return true if a new association was written
     */
    public boolean associate(long itemId, String tagName) {
        String normalized = normalize(tagName);
        return transactions.inTransaction("Associate tag", () -> {
            requireItem(itemId);
            long tagId = getOrCreateTag(normalized);

            int inserted = jdbcTemplate.update(
                "INSERT OR IGNORE INTO item_tags (item_id, tag_id, created_at) VALUES (?, ?, ?)",
                itemId, tagId, JdbcRows.now());
            if (inserted == 0) {
                log.debug("Tag '{}' already associated with item {}", normalized, itemId);
                return false;
            }

            jdbcTemplate.update(
                "UPDATE tags SET usage_count = usage_count + 1, last_used = ? WHERE id = ?",
                JdbcRows.now(), tagId);
            log.debug("Tag '{}' added to item {}", normalized, itemId);
            return true;
        });
    }

    /**
     * Detach a tag from an item. Unknown tags and missing associations are ignored.
     *
     * @return true if an association was removed
     */
    public boolean dissociate(long itemId, String tagName) {
        String normalized = normalize(tagName);
        return transactions.inTransaction("Dissociate tag", () -> {
            Optional<Long> tagId = findTagId(normalized);
            if (tagId.isEmpty()) {
                log.debug("Tag '{}' not found, nothing to remove from item {}", normalized, itemId);
                return false;
            }

            int removed = jdbcTemplate.update(
                "DELETE FROM item_tags WHERE item_id = ? AND tag_id = ?", itemId, tagId.get());
            if (removed == 0) {
                return false;
            }

            jdbcTemplate.update(
                "UPDATE tags SET usage_count = MAX(0, usage_count - 1) WHERE id = ?", tagId.get());
            log.debug("Tag '{}' removed from item {}", normalized, itemId);
            return true;
        });
    }

    /**
     * Make the item's tag set equal to the given names, touching only the difference.
     * Tags present before and after keep their counters and last-used times.
     */
    public void replaceItemTags(long itemId, Collection<String> tagNames) {
        Set<String> wanted = normalizeAll(tagNames);
        transactions.run("Replace item tags", () -> {
            requireItem(itemId);
            Set<String> current = new LinkedHashSet<>(tagsForItem(itemId));

            Set<String> toRemove = new LinkedHashSet<>(current);
            toRemove.removeAll(wanted);
            Set<String> toAdd = new LinkedHashSet<>(wanted);
            toAdd.removeAll(current);

            toRemove.forEach(name -> dissociate(itemId, name));
            toAdd.forEach(name -> associate(itemId, name));

            log.debug("Tags updated for item {}: {} added, {} removed", itemId, toAdd.size(), toRemove.size());
        });
    }

    /**
     * Drop every association of an item, decrementing each tag once.
     * Must run before the item row itself is deleted.
     */
    public int releaseItem(long itemId) {
        return releaseItems(List.of(itemId));
    }

    public int releaseItems(Collection<Long> itemIds) {
        if (itemIds.isEmpty()) {
            return 0;
        }
        return transactions.inTransaction("Release item tags", () -> {
            int released = 0;
            for (Long itemId : itemIds) {
                jdbcTemplate.update("""
                    UPDATE tags SET usage_count = MAX(0, usage_count - 1)
                    WHERE id IN (SELECT tag_id FROM item_tags WHERE item_id = ?)
                    """, itemId);
                released += jdbcTemplate.update("DELETE FROM item_tags WHERE item_id = ?", itemId);
            }
            if (released > 0) {
                log.debug("Released {} tag associations from {} items", released, itemIds.size());
            }
            return released;
        });
    }

    /**
     * Delete every tag no item uses.
     *
     * @return number of tags deleted
     */
    public int pruneUnusedTags() {
        return transactions.inTransaction("Prune unused tags", () -> {
            int deleted = jdbcTemplate.update("DELETE FROM tags WHERE usage_count <= 0");
            log.info("Pruned {} unused tags", deleted);
            return deleted;
        });
    }

    /**
     * Recompute one tag's counter from its associations.
     *
     * @return the corrected counter
     */
    public int recountTag(long tagId) {
        return transactions.inTransaction("Recount tag", () -> {
            Tag tag = findTag(tagId).orElseThrow(() -> NotFoundException.of("Tag", tagId));
            Integer actual = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM item_tags WHERE tag_id = ?", Integer.class, tagId);
            int count = actual == null ? 0 : actual;
            if (count != tag.getUsageCount()) {
                log.warn("Tag '{}' counter drifted: stored {}, actual {}", tag.getName(), tag.getUsageCount(), count);
                jdbcTemplate.update("UPDATE tags SET usage_count = ? WHERE id = ?", count, tagId);
            }
            return count;
        });
    }

    /**
     * Recompute every counter.
     *
     * @return number of tags whose counter was wrong
     */
    public int recountAll() {
        return transactions.inTransaction("Recount all tags", () -> {
            int repaired = jdbcTemplate.update("""
                UPDATE tags SET usage_count = (SELECT COUNT(*) FROM item_tags it WHERE it.tag_id = tags.id)
                WHERE usage_count != (SELECT COUNT(*) FROM item_tags it WHERE it.tag_id = tags.id)
                """);
            if (repaired > 0) {
                log.warn("Repaired usage counters of {} tags", repaired);
            }
            return repaired;
        });
    }

    /**
     * Tag names of an item, sorted alphabetically.
     */
    public List<String> tagsForItem(long itemId) {
        return jdbcTemplate.queryForList("""
            SELECT t.name FROM item_tags it
            JOIN tags t ON it.tag_id = t.id
            WHERE it.item_id = ?
            ORDER BY t.name
            """, String.class, itemId);
    }

    public Optional<Tag> findTag(String name) {
        List<Tag> results = jdbcTemplate.query(
            "SELECT * FROM tags WHERE name = ?", new TagRowMapper(), normalize(name));
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public Optional<Tag> findTag(long tagId) {
        List<Tag> results = jdbcTemplate.query("SELECT * FROM tags WHERE id = ?", new TagRowMapper(), tagId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * All tags, most used first.
     */
    public List<Tag> listTags() {
        return jdbcTemplate.query("SELECT * FROM tags ORDER BY usage_count DESC, name ASC", new TagRowMapper());
    }

    public List<Tag> searchTags(String query) {
        String pattern = "%" + query.strip().toLowerCase(Locale.ROOT) + "%";
        return jdbcTemplate.query(
            "SELECT * FROM tags WHERE name LIKE ? ORDER BY usage_count DESC, name ASC",
            new TagRowMapper(), pattern);
    }

    public List<Long> itemIdsWithTag(String name) {
        return jdbcTemplate.queryForList("""
            SELECT it.item_id FROM item_tags it
            JOIN tags t ON it.tag_id = t.id
            WHERE t.name = ?
            ORDER BY it.item_id
            """, Long.class, normalize(name));
    }

    public TagStatistics statistics(int topLimit) {
        Integer total = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM tags", Integer.class);
        Integer inUse = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM tags WHERE usage_count > 0", Integer.class);
        Double average = jdbcTemplate.queryForObject("""
            SELECT AVG(tag_count) FROM (
                SELECT item_id, COUNT(*) AS tag_count FROM item_tags GROUP BY item_id
            )
            """, Double.class);
        List<Tag> top = jdbcTemplate.query(
            "SELECT * FROM tags WHERE usage_count > 0 ORDER BY usage_count DESC, name ASC LIMIT ?",
            new TagRowMapper(), topLimit);

        int totalTags = total == null ? 0 : total;
        int tagsInUse = inUse == null ? 0 : inUse;
        return TagStatistics.builder()
            .totalTags(totalTags)
            .tagsInUse(tagsInUse)
            .unusedTags(totalTags - tagsInUse)
            .averageTagsPerItem(average == null ? 0 : Math.round(average * 100) / 100.0)
            .topTags(top)
            .build();
    }

    private Optional<Long> findTagId(String normalized) {
        List<Long> ids = jdbcTemplate.queryForList("SELECT id FROM tags WHERE name = ?", Long.class, normalized);
        return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
    }

    private void requireItem(long itemId) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM items WHERE id = ?", Integer.class, itemId);
        if (count == null || count == 0) {
            throw NotFoundException.of("Item", itemId);
        }
    }

    private static class TagRowMapper implements RowMapper<Tag> {
        @Override
        public Tag mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Tag.builder()
                .id(rs.getLong("id"))
                .name(rs.getString("name"))
                .usageCount(rs.getInt("usage_count"))
                .lastUsed(JdbcRows.instant(rs, "last_used"))
                .createdAt(JdbcRows.instant(rs, "created_at"))
                .build();
        }
    }
}
