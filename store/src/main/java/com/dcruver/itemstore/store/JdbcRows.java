package com.dcruver.itemstore.store;

import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;

/**
 * Small JDBC helpers shared by the stores. Times are stored as epoch milliseconds.
 */
public final class JdbcRows {

    private JdbcRows() {
    }

    /**
     * Run an INSERT and return the new row id. Both statements use the same connection.
     */
    public static long insertReturningId(JdbcTemplate jdbcTemplate, String sql, Object... args) {
        Long id = jdbcTemplate.execute((ConnectionCallback<Long>) connection -> {
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                new ArgumentPreparedStatementSetter(args).setValues(ps);
                ps.executeUpdate();
            }
            try (Statement statement = connection.createStatement();
                 ResultSet rs = statement.executeQuery("SELECT last_insert_rowid()")) {
                rs.next();
                return rs.getLong(1);
            }
        });
        if (id == null) {
            throw new IllegalStateException("No row id returned for insert");
        }
        return id;
    }

    public static long now() {
        return Instant.now().toEpochMilli();
    }

    public static Instant instant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    public static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
