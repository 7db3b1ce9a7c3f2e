package com.example.filmarchive.infrastructure.persistence.handler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.LocalDateTime;
import org.apache.ibatis.type.JdbcType;
import org.junit.jupiter.api.Test;

class LocalDateTimeTextTypeHandlerTest {

    @Test
    void shouldWriteIsoText() throws SQLException {
        PreparedStatement ps = mock(PreparedStatement.class);

        new LocalDateTimeTextTypeHandler().setNonNullParameter(ps, 3,
                LocalDateTime.of(2024, 2, 10, 14, 32, 15), JdbcType.VARCHAR);

        verify(ps).setString(3, "2024-02-10T14:32:15");
    }

    @Test
    void shouldReadIsoAndSpaceSeparatedText() throws SQLException {
        LocalDateTime expected = LocalDateTime.of(2024, 2, 10, 14, 32, 15);

        assertEquals(expected, LocalDateTimeTextTypeHandler.parse("2024-02-10T14:32:15"));
        assertEquals(expected, LocalDateTimeTextTypeHandler.parse("2024-02-10 14:32:15"));
        assertNull(LocalDateTimeTextTypeHandler.parse(null));
        assertThrows(SQLException.class, () -> LocalDateTimeTextTypeHandler.parse("yesterday"));
    }
}
