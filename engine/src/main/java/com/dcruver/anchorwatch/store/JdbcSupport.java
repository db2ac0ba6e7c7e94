package com.dcruver.anchorwatch.store;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;

/**
 * Column conversions shared by the stores. Instants are stored as epoch milliseconds
 * and booleans as nullable integers.
 */
final class JdbcSupport {

    private JdbcSupport() {
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    static Boolean flag(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value != 0;
    }

    static Long millis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }

    static Integer flagValue(Boolean flag) {
        return flag == null ? null : (flag ? 1 : 0);
    }

    static boolean isEmpty(Collection<?> values) {
        return values == null || values.isEmpty();
    }
}
