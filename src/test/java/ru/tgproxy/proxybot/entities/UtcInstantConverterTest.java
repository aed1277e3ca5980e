package ru.tgproxy.proxybot.entities;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class UtcInstantConverterTest {

    private final UtcInstantConverter converter = new UtcInstantConverter();

    @Test
    void naiveTimestampIsReadAsUtc() {
        Instant instant = converter.convertToEntityAttribute(LocalDateTime.of(2024, 3, 1, 12, 0));

        assertEquals(Instant.parse("2024-03-01T12:00:00Z"), instant);
    }

    @Test
    void instantIsWrittenAsUtcWallClock() {
        assertEquals(LocalDateTime.of(2024, 3, 1, 12, 0),
                converter.convertToDatabaseColumn(Instant.parse("2024-03-01T12:00:00Z")));
    }

    @Test
    void nullsPassThrough() {
        assertNull(converter.convertToDatabaseColumn(null));
        assertNull(converter.convertToEntityAttribute(null));
    }
}
