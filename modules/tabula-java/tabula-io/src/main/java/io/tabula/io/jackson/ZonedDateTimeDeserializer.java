/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.io.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;

import static java.time.format.DateTimeFormatter.ISO_ZONED_DATE_TIME;

/**
 * Reads the serializer's microsecond format and falls back to any ISO zoned timestamp.
 */
public class ZonedDateTimeDeserializer extends StdDeserializer<ZonedDateTime> {

    public ZonedDateTimeDeserializer() {
        super(ZonedDateTime.class);
    }

    @Override
    public ZonedDateTime deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        String value = p.getValueAsString();
        try {
            return ZonedDateTime.parse(value, ZonedDateTimeSerializer.FORMATTER);
        } catch (DateTimeParseException e) {
            return ZonedDateTime.parse(value, ISO_ZONED_DATE_TIME);
        }
    }
}
