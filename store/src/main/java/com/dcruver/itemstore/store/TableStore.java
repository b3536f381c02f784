package com.dcruver.itemstore.store;

import com.dcruver.itemstore.domain.DataTable;
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
 * Rows of the data_tables table. Cells live in the items table.
 */
@Component
@Slf4j
public class TableStore {

    private final JdbcTemplate jdbcTemplate;

    public TableStore(DataSource dataSource) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    public long insert(long collectionId, String name, String description) {
        long now = JdbcRows.now();
        long id = JdbcRows.insertReturningId(jdbcTemplate,
            "INSERT INTO data_tables (collection_id, name, description, created_at, updated_at) VALUES (?, ?, ?, ?, ?)",
            collectionId, name, description, now, now);
        log.debug("Inserted table {} ({})", id, name);
        return id;
    }

    public Optional<DataTable> find(long id) {
        List<DataTable> results = jdbcTemplate.query(
            "SELECT * FROM data_tables WHERE id = ?", new TableRowMapper(), id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public Optional<DataTable> findByName(String name) {
        List<DataTable> results = jdbcTemplate.query(
            "SELECT * FROM data_tables WHERE name = ?", new TableRowMapper(), name);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<DataTable> findByCollection(long collectionId) {
        return jdbcTemplate.query(
            "SELECT * FROM data_tables WHERE collection_id = ? ORDER BY name",
            new TableRowMapper(), collectionId);
    }

    public boolean isNameAvailable(String name, Long excludeTableId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM data_tables WHERE name = ? AND id != ?",
            Integer.class, name, excludeTableId == null ? -1L : excludeTableId);
        return count == null || count == 0;
    }

    public void update(long id, String name, String description) {
        jdbcTemplate.update(
            "UPDATE data_tables SET name = COALESCE(?, name), description = COALESCE(?, description), updated_at = ? WHERE id = ?",
            name, description, JdbcRows.now(), id);
    }

    public void touch(long id) {
        jdbcTemplate.update("UPDATE data_tables SET updated_at = ? WHERE id = ?", JdbcRows.now(), id);
    }

    public int delete(long id) {
        return jdbcTemplate.update("DELETE FROM data_tables WHERE id = ?", id);
    }

    private static class TableRowMapper implements RowMapper<DataTable> {
        @Override
        public DataTable mapRow(ResultSet rs, int rowNum) throws SQLException {
            return DataTable.builder()
                .id(rs.getLong("id"))
                .collectionId(rs.getLong("collection_id"))
                .name(rs.getString("name"))
                .description(rs.getString("description"))
                .createdAt(JdbcRows.instant(rs, "created_at"))
                .updatedAt(JdbcRows.instant(rs, "updated_at"))
                .build();
        }
    }
}
