package com.dcruver.itemstore.store;

import com.dcruver.itemstore.domain.ItemCollection;
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
 * Rows of the collections table.
 */
@Component
@Slf4j
public class CollectionStore {

    private final JdbcTemplate jdbcTemplate;

    public CollectionStore(DataSource dataSource) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    public long insert(String name, String description) {
        long id = JdbcRows.insertReturningId(jdbcTemplate,
            "INSERT INTO collections (name, description, created_at) VALUES (?, ?, ?)",
            name, description, JdbcRows.now());
        log.debug("Inserted collection {} ({})", id, name);
        return id;
    }

    public Optional<ItemCollection> find(long id) {
        List<ItemCollection> results = jdbcTemplate.query(
            "SELECT * FROM collections WHERE id = ?", new CollectionRowMapper(), id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public Optional<ItemCollection> findByName(String name) {
        List<ItemCollection> results = jdbcTemplate.query(
            "SELECT * FROM collections WHERE name = ?", new CollectionRowMapper(), name);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<ItemCollection> findAll() {
        return jdbcTemplate.query("SELECT * FROM collections ORDER BY name", new CollectionRowMapper());
    }

    public int delete(long id) {
        return jdbcTemplate.update("DELETE FROM collections WHERE id = ?", id);
    }

    private static class CollectionRowMapper implements RowMapper<ItemCollection> {
        @Override
        public ItemCollection mapRow(ResultSet rs, int rowNum) throws SQLException {
            return ItemCollection.builder()
                .id(rs.getLong("id"))
                .name(rs.getString("name"))
                .description(rs.getString("description"))
                .createdAt(JdbcRows.instant(rs, "created_at"))
                .build();
        }
    }
}
