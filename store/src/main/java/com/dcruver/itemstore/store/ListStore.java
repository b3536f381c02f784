package com.dcruver.itemstore.store;

import com.dcruver.itemstore.domain.StepList;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Rows of the lists table. Steps themselves live in the items table.
 */
@Component
@Slf4j
public class ListStore {

    private static final String SELECT_WITH_COUNT = """
        SELECT l.*, (SELECT COUNT(*) FROM items i WHERE i.list_id = l.id) AS step_count
        FROM lists l
        """;

    private final JdbcTemplate jdbcTemplate;

    public ListStore(DataSource dataSource) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    public long insert(long collectionId, String name, String description) {
        long now = JdbcRows.now();
        long id = JdbcRows.insertReturningId(jdbcTemplate,
            "INSERT INTO lists (collection_id, name, description, created_at, updated_at) VALUES (?, ?, ?, ?, ?)",
            collectionId, name, description, now, now);
        log.debug("Inserted list {} ({}) in collection {}", id, name, collectionId);
        return id;
    }

    public Optional<StepList> find(long id) {
        List<StepList> results = jdbcTemplate.query(
            SELECT_WITH_COUNT + " WHERE l.id = ?", new ListRowMapper(), id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<StepList> findByCollection(long collectionId) {
        return jdbcTemplate.query(
            SELECT_WITH_COUNT + " WHERE l.collection_id = ? ORDER BY l.name",
            new ListRowMapper(), collectionId);
    }

    /**
     * Check whether a name is free within a collection, ignoring one list (for renames).
     */
    public boolean isNameAvailable(long collectionId, String name, Long excludeListId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM lists WHERE collection_id = ? AND name = ? AND id != ?",
            Integer.class, collectionId, name, excludeListId == null ? -1L : excludeListId);
        return count == null || count == 0;
    }

    public void update(long id, String name, String description) {
        jdbcTemplate.update(
            "UPDATE lists SET name = COALESCE(?, name), description = COALESCE(?, description), updated_at = ? WHERE id = ?",
            name, description, JdbcRows.now(), id);
    }

    public void touch(long id) {
        jdbcTemplate.update("UPDATE lists SET updated_at = ? WHERE id = ?", JdbcRows.now(), id);
    }

    public void recordUsage(long id) {
        jdbcTemplate.update(
            "UPDATE lists SET use_count = use_count + 1, last_used = ? WHERE id = ?",
            JdbcRows.now(), id);
    }

    public int delete(long id) {
        return jdbcTemplate.update("DELETE FROM lists WHERE id = ?", id);
    }

    private static class ListRowMapper implements RowMapper<StepList> {
        @Override
        public StepList mapRow(ResultSet rs, int rowNum) throws SQLException {
            return StepList.builder()
                .id(rs.getLong("id"))
                .collectionId(rs.getLong("collection_id"))
                .name(rs.getString("name"))
                .description(rs.getString("description"))
                .useCount(rs.getInt("use_count"))
                .lastUsed(JdbcRows.instant(rs, "last_used"))
                .createdAt(JdbcRows.instant(rs, "created_at"))
                .updatedAt(JdbcRows.instant(rs, "updated_at"))
                .stepCount(rs.getInt("step_count"))
                .build();
        }
    }
}
