/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.io.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.hamcrest.MatcherAssert.assertThat;

class ZonedDateTimeDeserializerTest {

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new TabulaModule());

    @Test
    public void testMicrosecondPattern() throws IOException {
        ZonedDateTime parsed = mapper.readValue("\"2022-01-02T03:04:05.000001+00:00\"", ZonedDateTime.class);
        assertThat("Wrong timestamp", parsed.toInstant(),
            Matchers.equalTo(ZonedDateTime.of(2022, 1, 2, 3, 4, 5, 1000, ZoneOffset.UTC).toInstant()));
    }

    @Test
    public void testIsoFallback() throws IOException {
        ZonedDateTime parsed = mapper.readValue("\"2022-01-02T03:04:05Z\"", ZonedDateTime.class);
        assertThat("Wrong timestamp", parsed.toInstant(),
            Matchers.equalTo(ZonedDateTime.of(2022, 1, 2, 3, 4, 5, 0, ZoneOffset.UTC).toInstant()));
    }

    @Test
    public void testLocalDate() throws IOException {
        assertThat("Wrong date", mapper.readValue("\"2022-01-02\"", LocalDate.class), Matchers.equalTo(LocalDate.of(2022, 1, 2)));
        assertThat("Wrong date output", mapper.writeValueAsString(LocalDate.of(2022, 1, 2)), Matchers.equalTo("\"2022-01-02\""));
    }
}
