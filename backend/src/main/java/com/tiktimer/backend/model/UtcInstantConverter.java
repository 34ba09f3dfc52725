package com.tiktimer.backend.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Normalizes every persisted timestamp to UTC.
 * <p>
 * Entities work with {@link Instant}; the column is written as an offset timestamp pinned to UTC and read back
 * as an absolute instant regardless of the offset the driver reports, so comparisons elsewhere never see a
 * zone-naive value.
 */
@Converter
public class UtcInstantConverter implements AttributeConverter<Instant, OffsetDateTime> {

    @Override
    public OffsetDateTime convertToDatabaseColumn(Instant attribute) {
        if (attribute == null) {
            return null;
        }
        return attribute.atOffset(ZoneOffset.UTC);
    }

    @Override
    public Instant convertToEntityAttribute(OffsetDateTime dbData) {
        if (dbData == null) {
            return null;
        }
        return dbData.toInstant();
    }
}
