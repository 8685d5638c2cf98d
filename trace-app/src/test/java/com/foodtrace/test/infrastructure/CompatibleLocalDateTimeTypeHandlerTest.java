package com.foodtrace.test.infrastructure;

import com.foodtrace.infrastructure.typehandler.CompatibleLocalDateTimeTypeHandler;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;

public class CompatibleLocalDateTimeTypeHandlerTest {

    private static final LocalDateTime DECIDED_AT = LocalDateTime.of(2026, 10, 19, 6, 45, 12, 123456000);

    @Test
    public void shouldReadDriverAndTextValues() throws SQLException {
        Assertions.assertNull(CompatibleLocalDateTimeTypeHandler.fromColumnValue(null));
        Assertions.assertEquals(DECIDED_AT, CompatibleLocalDateTimeTypeHandler.fromColumnValue(DECIDED_AT));
        Assertions.assertEquals(DECIDED_AT, CompatibleLocalDateTimeTypeHandler.fromColumnValue(Timestamp.valueOf(DECIDED_AT)));
        Assertions.assertEquals(DECIDED_AT, CompatibleLocalDateTimeTypeHandler.fromColumnValue("2026-10-19 06:45:12.123456"));
    }

    @Test
    public void shouldRejectUnknownValues() {
        Assertions.assertThrows(SQLException.class, () -> CompatibleLocalDateTimeTypeHandler.fromColumnValue(42L));
        Assertions.assertThrows(SQLException.class, () -> CompatibleLocalDateTimeTypeHandler.fromColumnValue("yesterday"));
    }

    @Test
    public void shouldTruncateToMicroseconds() {
        LocalDateTime nanos = DECIDED_AT.plusNanos(789);

        Assertions.assertEquals(DECIDED_AT, CompatibleLocalDateTimeTypeHandler.toStoragePrecision(nanos));
    }
}
