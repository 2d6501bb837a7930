/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tabula.TabulaLog;
import io.tabula.core.DataFrame;
import io.tabula.core.Series;
import io.tabula.errors.InvalidTypeException;
import io.tabula.errors.TabulaException;
import io.tabula.io.jackson.TabulaModule;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * JSON text for series and frames, built from their toJson payloads.
 */
public final class JsonFrames {

    private static final TabulaLog LOG = new TabulaLog(LoggerFactory.getLogger(JsonFrames.class));
    private static final ObjectMapper MAPPER = new ObjectMapper().registerModule(new TabulaModule());

    private static final TypeReference<List<LinkedHashMap<String, Object>>> RECORDS =
        new TypeReference<List<LinkedHashMap<String, Object>>>() {
        };

    private JsonFrames() {
    }

    public static String write(Series series) {
        return writePayload(series.toJson());
    }

    public static String write(Series series, String orient) {
        return writePayload(series.toJson(orient));
    }

    public static String write(DataFrame df) {
        return writePayload(df.toJson());
    }

    public static String write(DataFrame df, String orient) {
        return writePayload(df.toJson(orient));
    }

    private static String writePayload(Object payload) {
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new TabulaException("Unable to serialize to JSON", e);
        }
    }

    /**
     * Build a frame from a JSON array of objects.
     */
    public static DataFrame readRecords(String json) {
        List<LinkedHashMap<String, Object>> records;
        try {
            records = MAPPER.readValue(json, RECORDS);
        } catch (JsonProcessingException e) {
            throw new InvalidTypeException("JSON must be an array of objects", e);
        }
        LOG.debug("Read {} records from JSON", records.size());
        return DataFrame.fromRecords(records);
    }
}
