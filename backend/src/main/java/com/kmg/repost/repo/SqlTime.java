package com.kmg.repost.repo;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

/**
 * Timestamps are stored as epoch milliseconds; NULL stays null.
 */
public final class SqlTime {
    private SqlTime() {
    }

    public static Long toMillis(Instant value) {
        return value == null ? null : value.toEpochMilli();
    }

    public static Instant readInstant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        if (rs.wasNull()) {
            return null;
        }
        return Instant.ofEpochMilli(millis);
    }
}
