package com.snowman.balance.repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * Column representation of {@code past_balance.changed}. Both variants store the
 * time a history record was added; they differ only in the SQL type.
 */
public enum TimestampFormat {

    /** {@code BIGINT} holding milliseconds since the unix epoch. */
    EPOCH_MILLIS("db/schema-epoch.sql") {
        @Override
        public Object toColumn(Instant instant) {
            return instant.toEpochMilli();
        }

        @Override
        public Instant fromColumn(ResultSet rs, String column) throws SQLException {
            long value = rs.getLong(column);
            return rs.wasNull() ? null : Instant.ofEpochMilli(value);
        }
    },

    /** {@code TIMESTAMPTZ}. */
    TIMESTAMP("db/schema-timestamp.sql") {
        @Override
        public Object toColumn(Instant instant) {
            return Timestamp.from(instant);
        }

        @Override
        public Instant fromColumn(ResultSet rs, String column) throws SQLException {
            Timestamp ts = rs.getTimestamp(column);
            return ts == null ? null : ts.toInstant();
        }
    };

    private final String schemaResource;

    TimestampFormat(String schemaResource) {
        this.schemaResource = schemaResource;
    }

    public abstract Object toColumn(Instant instant);

    public abstract Instant fromColumn(ResultSet rs, String column) throws SQLException;

    public String schemaResource() {
        return schemaResource;
    }
}
