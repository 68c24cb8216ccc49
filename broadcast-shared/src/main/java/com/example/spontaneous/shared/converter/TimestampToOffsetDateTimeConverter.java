package com.example.spontaneous.shared.converter;

import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

import java.sql.Timestamp;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * PostgreSQL hands timestamptz columns back as {@link Timestamp}; entities carry UTC offsets.
 */
@ReadingConverter
public class TimestampToOffsetDateTimeConverter implements Converter<Timestamp, OffsetDateTime> {

    @Override
    public OffsetDateTime convert(Timestamp source) {
        return source.toInstant().atOffset(ZoneOffset.UTC);
    }
}
