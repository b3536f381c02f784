package com.dcruver.itemstore.store;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;

/**
 * Creates the store's tables and indices if they do not exist yet.
 */
@Component
@Slf4j
public class SchemaInitializer {

    private final JdbcTemplate jdbcTemplate;

    public SchemaInitializer(DataSource dataSource) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    @PostConstruct
    public void init() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS collections (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                name TEXT NOT NULL UNIQUE,
                description TEXT,
                created_at INTEGER NOT NULL
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS lists (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                collection_id INTEGER NOT NULL REFERENCES collections(id) ON DELETE CASCADE,
                name TEXT NOT NULL,
                description TEXT,
                use_count INTEGER NOT NULL DEFAULT 0,
                last_used INTEGER,
                created_at INTEGER NOT NULL,
                updated_at INTEGER NOT NULL,
                UNIQUE (collection_id, name)
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS data_tables (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                collection_id INTEGER NOT NULL REFERENCES collections(id) ON DELETE CASCADE,
                name TEXT NOT NULL UNIQUE,
                description TEXT,
                created_at INTEGER NOT NULL,
                updated_at INTEGER NOT NULL
            )
            """);

        // One row per item whatever its placement; the CHECKs keep the placement pairs exclusive
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS items (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                collection_id INTEGER NOT NULL REFERENCES collections(id) ON DELETE CASCADE,
                label TEXT NOT NULL,
                content TEXT NOT NULL,
                kind TEXT NOT NULL CHECK (kind IN ('TEXT', 'URL', 'CODE', 'PATH')),
                is_sensitive INTEGER NOT NULL DEFAULT 0,
                is_favorite INTEGER NOT NULL DEFAULT 0,
                color TEXT,
                description TEXT,
                file_size INTEGER,
                use_count INTEGER NOT NULL DEFAULT 0,
                last_used INTEGER,
                list_id INTEGER REFERENCES lists(id) ON DELETE CASCADE,
                position INTEGER,
                table_id INTEGER REFERENCES data_tables(id) ON DELETE CASCADE,
                cell_row INTEGER,
                cell_col INTEGER,
                created_at INTEGER NOT NULL,
                updated_at INTEGER NOT NULL,
                CHECK ((list_id IS NULL) = (position IS NULL)),
                CHECK ((table_id IS NULL) = (cell_row IS NULL)),
                CHECK ((table_id IS NULL) = (cell_col IS NULL)),
                CHECK (list_id IS NULL OR table_id IS NULL)
            )
            """);

        jdbcTemplate.execute("""
            CREATE UNIQUE INDEX IF NOT EXISTS ux_items_cell
            ON items(table_id, cell_row, cell_col) WHERE table_id IS NOT NULL
            """);

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_items_list_position
            ON items(list_id, position) WHERE list_id IS NOT NULL
            """);

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_items_collection
            ON items(collection_id)
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS tags (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                name TEXT NOT NULL UNIQUE,
                usage_count INTEGER NOT NULL DEFAULT 0,
                last_used INTEGER,
                created_at INTEGER NOT NULL
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS item_tags (
                item_id INTEGER NOT NULL REFERENCES items(id) ON DELETE CASCADE,
                tag_id INTEGER NOT NULL REFERENCES tags(id) ON DELETE CASCADE,
                created_at INTEGER NOT NULL,
                PRIMARY KEY (item_id, tag_id)
            )
            """);

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_item_tags_tag
            ON item_tags(tag_id, item_id)
            """);

        log.info("Initialized item store schema");
    }
}
