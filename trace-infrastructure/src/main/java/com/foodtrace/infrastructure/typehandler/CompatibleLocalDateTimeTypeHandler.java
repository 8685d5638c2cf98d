package com.foodtrace.infrastructure.typehandler;

import org.apache.ibatis.type.BaseTypeHandler;
import org.apache.ibatis.type.JdbcType;
import org.apache.ibatis.type.MappedTypes;

import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Plant timestamps ({@code decided_at}, {@code started_at}, {@code linked_at}, ...) are stored as
 * {@code TIMESTAMP WITHOUT TIME ZONE} in plant-local time.
 * <p>
 * Writes are truncated to microseconds, the PostgreSQL precision, so a value read back compares
 * equal to the one written and QC decision ordering stays stable. Reads accept whatever the driver
 * hands out for the column, including the text form produced by {@code ::text} casts.
 * </p>
 */
@MappedTypes(LocalDateTime.class)
public class CompatibleLocalDateTimeTypeHandler extends BaseTypeHandler<LocalDateTime> {

    @Override
    public void setNonNullParameter(PreparedStatement ps, int i, LocalDateTime parameter, JdbcType jdbcType) throws SQLException {
        ps.setTimestamp(i, Timestamp.valueOf(toStoragePrecision(parameter)));
    }

    @Override
    public LocalDateTime getNullableResult(ResultSet rs, String columnName) throws SQLException {
        return fromColumnValue(rs.getObject(columnName));
    }

    @Override
    public LocalDateTime getNullableResult(ResultSet rs, int columnIndex) throws SQLException {
        return fromColumnValue(rs.getObject(columnIndex));
    }

    @Override
    public LocalDateTime getNullableResult(CallableStatement cs, int columnIndex) throws SQLException {
        return fromColumnValue(cs.getObject(columnIndex));
    }

    public static LocalDateTime toStoragePrecision(LocalDateTime value) {
        return value == null ? null : value.truncatedTo(ChronoUnit.MICROS);
    }

    public static LocalDateTime fromColumnValue(Object value) throws SQLException {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime localDateTime) {
            return localDateTime;
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime();
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.atZoneSameInstant(ZoneId.systemDefault()).toLocalDateTime();
        }
        if (value instanceof String text) {
            try {
                return LocalDateTime.parse(text.trim().replace(' ', 'T'));
            } catch (DateTimeParseException ex) {
                throw new SQLException("Unparseable timestamp text: " + text, ex);
            }
        }
        throw new SQLException("Unsupported timestamp value type: " + value.getClass().getName());
    }
}
