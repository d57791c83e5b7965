package io.trading.marketdata.dbn.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.trading.marketdata.dbn.error.FormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON representation of {@link Metadata}, with snake_case field names and ISO-8601 dates.
 * Thread-safe and reusable.
 */
public final class MetadataJson {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetadataJson.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private MetadataJson() {}

    public static String toJson(Metadata metadata) {
        try {
            return MAPPER.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            LOGGER.error("Failed to encode metadata to JSON: {}", e.getMessage(), e);
            throw new FormatException("Failed to encode metadata to JSON", e);
        }
    }

    /**
     * Parses metadata from JSON.
     *
     * @throws FormatException if the document is malformed or fails validation
     */
    public static Metadata fromJson(String json) {
        try {
            return MAPPER.readValue(json, Metadata.class);
        } catch (JsonProcessingException e) {
            throw new FormatException("Failed to parse metadata JSON: " + e.getOriginalMessage(), e);
        }
    }
}
