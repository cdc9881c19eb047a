package com.mk.fx.qa.burst.rest;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;

/** Shared Jackson mapper plus helpers for compact and indented JSON. */
public final class JsonUtil {

    private static final ObjectMapper MAPPER =
            JsonMapper.builder()
                    .addModule(new JavaTimeModule())
                    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                    .build();

    private static final ObjectWriter PRETTY_WRITER = MAPPER.writer(new TwoSpacePrettyPrinter());

    private JsonUtil() {
        // Utility class, no instantiation
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(value);
    }

    /**
     * Serialises {@code value} with two-space indentation and {@code "field": value} separators.
     */
    public static String toPrettyJson(Object value) throws JsonProcessingException {
        return PRETTY_WRITER.writeValueAsString(value);
    }

    /**
     * Re-indents a raw JSON document.
     *
     * @param rawJson the document text
     * @return the indented document
     * @throws JsonProcessingException if {@code rawJson} is not valid JSON
     */
    public static String prettyPrint(String rawJson) throws JsonProcessingException {
        return PRETTY_WRITER.writeValueAsString(MAPPER.readTree(rawJson));
    }

    private static final class TwoSpacePrettyPrinter extends DefaultPrettyPrinter {

        TwoSpacePrettyPrinter() {
            _arrayIndenter = DefaultIndenter.SYSTEM_LINEFEED_INSTANCE;
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new TwoSpacePrettyPrinter();
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }
    }
}
