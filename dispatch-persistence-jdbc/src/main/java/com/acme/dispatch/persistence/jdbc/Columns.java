package com.acme.dispatch.persistence.jdbc;

import com.acme.dispatch.core.Jsons;
import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/** Column conversions shared by the entity repositories. */
final class Columns {

    private Columns() {}

    static void setNullableString(PreparedStatement ps, int index, String value)
            throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }

    static void setNullableInstant(PreparedStatement ps, int index, Instant value)
            throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.TIMESTAMP);
        } else {
            ps.setTimestamp(index, Timestamp.from(value));
        }
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }

    static String json(Map<String, Object> metadata) {
        return Jsons.toJson(metadata != null ? metadata : Map.of());
    }

    static Map<String, Object> metadata(ResultSet rs, String column) throws SQLException {
        String json = rs.getString(column);
        if (json == null || json.isBlank()) {
            return new HashMap<>();
        }
        return Jsons.toMap(json);
    }

    /** Drop the padding a fixed-scale NUMERIC column adds, without going to exponent form. */
    static BigDecimal amount(ResultSet rs, String column) throws SQLException {
        BigDecimal amount = rs.getBigDecimal(column).stripTrailingZeros();
        return amount.scale() < 0 ? amount.setScale(0) : amount;
    }
}
