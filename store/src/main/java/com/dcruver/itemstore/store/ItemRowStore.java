package com.dcruver.itemstore.store;

import com.dcruver.itemstore.domain.ContentKind;
import com.dcruver.itemstore.domain.Item;
import com.dcruver.itemstore.domain.ItemPlacement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Rows of the items table, with content exactly as stored (possibly encrypted).
 * Callers are expected to hold a transaction for writes.
 */
@Component
@Slf4j
public class ItemRowStore {

    private static final Set<String> UPDATABLE_COLUMNS = Set.of(
        "label", "content", "kind", "is_sensitive", "is_favorite",
        "color", "description", "file_size");

    private final JdbcTemplate jdbcTemplate;

    public ItemRowStore(DataSource dataSource) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    /**
     * Insert a row for the item; id, tags and usage fields of the argument are ignored.
     */
    public long insert(Item item) {
        Long listId = null;
        Integer position = null;
        Long tableId = null;
        Integer row = null;
        Integer column = null;

        if (item.getPlacement() instanceof ItemPlacement.ListStep step) {
            listId = step.listId();
            position = step.position();
        } else if (item.getPlacement() instanceof ItemPlacement.TableCell cell) {
            tableId = cell.tableId();
            row = cell.row();
            column = cell.column();
        }

        long now = JdbcRows.now();
        long id = JdbcRows.insertReturningId(jdbcTemplate, """
                INSERT INTO items (collection_id, label, content, kind, is_sensitive, is_favorite,
                    color, description, file_size, list_id, position, table_id, cell_row, cell_col,
                    created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
            item.getCollectionId(), item.getLabel(), item.getContent(), item.getKind().name(),
            item.isSensitive() ? 1 : 0, item.isFavorite() ? 1 : 0,
            item.getColor(), item.getDescription(), item.getFileSize(),
            listId, position, tableId, row, column, now, now);

        log.debug("Inserted item {} ({})", id, item.getPlacement());
        return id;
    }

    public Optional<Item> find(long id) {
        List<Item> results = jdbcTemplate.query("SELECT * FROM items WHERE id = ?", new ItemRowMapper(), id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public boolean exists(long id) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM items WHERE id = ?", Integer.class, id);
        return count != null && count > 0;
    }

    public List<Item> findByCollection(long collectionId) {
        return jdbcTemplate.query(
            "SELECT * FROM items WHERE collection_id = ? ORDER BY created_at, id",
            new ItemRowMapper(), collectionId);
    }

    public List<Item> findByList(long listId) {
        return jdbcTemplate.query(
            "SELECT * FROM items WHERE list_id = ? ORDER BY position, created_at, id",
            new ItemRowMapper(), listId);
    }

    public List<Item> findByTable(long tableId) {
        return jdbcTemplate.query(
            "SELECT * FROM items WHERE table_id = ? ORDER BY cell_row, cell_col",
            new ItemRowMapper(), tableId);
    }

    public Optional<Item> findCell(long tableId, int row, int column) {
        List<Item> results = jdbcTemplate.query(
            "SELECT * FROM items WHERE table_id = ? AND cell_row = ? AND cell_col = ?",
            new ItemRowMapper(), tableId, row, column);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<Long> idsInList(long listId) {
        return jdbcTemplate.queryForList("SELECT id FROM items WHERE list_id = ?", Long.class, listId);
    }

    public List<Long> idsInTable(long tableId) {
        return jdbcTemplate.queryForList("SELECT id FROM items WHERE table_id = ?", Long.class, tableId);
    }

    public List<Long> idsInCollection(long collectionId) {
        return jdbcTemplate.queryForList("SELECT id FROM items WHERE collection_id = ?", Long.class, collectionId);
    }

    public int countInList(long listId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM items WHERE list_id = ?", Integer.class, listId);
        return count == null ? 0 : count;
    }

    public int countInTable(long tableId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM items WHERE table_id = ?", Integer.class, tableId);
        return count == null ? 0 : count;
    }

    /**
     * Update the given columns of one item and stamp updated_at.
     *
     * @param columns column name to new value, in SET order
     */
    public void update(long id, Map<String, Object> columns) {
        if (columns.isEmpty()) {
            return;
        }

        List<String> assignments = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        for (Map.Entry<String, Object> entry : columns.entrySet()) {
            if (!UPDATABLE_COLUMNS.contains(entry.getKey())) {
                throw new IllegalArgumentException("Column cannot be updated: " + entry.getKey());
            }
            assignments.add(entry.getKey() + " = ?");
            params.add(entry.getValue());
        }
        assignments.add("updated_at = ?");
        params.add(JdbcRows.now());
        params.add(id);

        jdbcTemplate.update("UPDATE items SET " + String.join(", ", assignments) + " WHERE id = ?", params.toArray());
        log.debug("Updated item {}: {}", id, columns.keySet());
    }

    public void recordUsage(long id) {
        jdbcTemplate.update(
            "UPDATE items SET use_count = use_count + 1, last_used = ? WHERE id = ?",
            JdbcRows.now(), id);
    }

    public int delete(long id) {
        return jdbcTemplate.update("DELETE FROM items WHERE id = ?", id);
    }

    public int deleteByList(long listId) {
        return jdbcTemplate.update("DELETE FROM items WHERE list_id = ?", listId);
    }

    public int deleteByTable(long tableId) {
        return jdbcTemplate.update("DELETE FROM items WHERE table_id = ?", tableId);
    }

    public int deleteByCollection(long collectionId) {
        return jdbcTemplate.update("DELETE FROM items WHERE collection_id = ?", collectionId);
    }

    /**
     * Column values for an update map, preserving insertion order.
     */
    public static Map<String, Object> columns() {
        return new LinkedHashMap<>();
    }

    private static class ItemRowMapper implements RowMapper<Item> {
        @Override
        public Item mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Item.builder()
                .id(rs.getLong("id"))
                .collectionId(rs.getLong("collection_id"))
                .label(rs.getString("label"))
                .content(rs.getString("content"))
                .kind(ContentKind.valueOf(rs.getString("kind")))
                .sensitive(rs.getInt("is_sensitive") != 0)
                .favorite(rs.getInt("is_favorite") != 0)
                .color(rs.getString("color"))
                .description(rs.getString("description"))
                .fileSize(JdbcRows.nullableLong(rs, "file_size"))
                .placement(placement(rs))
                .tags(List.of())
                .useCount(rs.getInt("use_count"))
                .lastUsed(JdbcRows.instant(rs, "last_used"))
                .createdAt(JdbcRows.instant(rs, "created_at"))
                .updatedAt(JdbcRows.instant(rs, "updated_at"))
                .build();
        }

        private ItemPlacement placement(ResultSet rs) throws SQLException {
            Long listId = JdbcRows.nullableLong(rs, "list_id");
            if (listId != null) {
                return ItemPlacement.listStep(listId, rs.getInt("position"));
            }
            Long tableId = JdbcRows.nullableLong(rs, "table_id");
            if (tableId != null) {
                return ItemPlacement.tableCell(tableId, rs.getInt("cell_row"), rs.getInt("cell_col"));
            }
            return ItemPlacement.standalone();
        }
    }
}
