/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.io.jackson;

import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;

/**
 * Registers the datetime cell serializers and deserializers.
 */
public class TabulaModule extends SimpleModule {

    public TabulaModule() {
        super("tabula");
        addSerializer(LocalDate.class, new LocalDateSerializer());
        addDeserializer(LocalDate.class, new LocalDateDeserializer());
        addSerializer(ZonedDateTime.class, new ZonedDateTimeSerializer());
        addDeserializer(ZonedDateTime.class, new ZonedDateTimeDeserializer());
        addSerializer(LocalDateTime.class, ToStringSerializer.instance);
    }
}
