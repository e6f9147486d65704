package robotrader.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared Jackson mappers and JSON object encoding.
 */
public final class JsonCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() {
    };

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    /** Key-sorted output, so equal content always produces equal text. */
    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .build();

    private JsonCodec() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Serialize any value.
     *
     * @throws IllegalArgumentException if the value cannot be represented as JSON
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not JSON-serializable: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Serialize with sorted keys. Used for hashing.
     */
    public static String toCanonicalJson(Object value) {
        try {
            return CANONICAL.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not JSON-serializable: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parse a JSON object. {@code null} or blank input yields an empty map.
     *
     * @throws IllegalArgumentException if the input is not a JSON object
     */
    public static Map<String, Object> parseObject(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, Object> parsed = MAPPER.readValue(json, MAP_TYPE);
            if (parsed == null) {
                throw new IllegalArgumentException("JSON object expected but got null");
            }
            return parsed;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON object: " + e.getOriginalMessage(), e);
        }
    }

    public static List<String> parseStringList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return MAPPER.readValue(json, STRING_LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON array: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Convert a value (record, bean, map) into a plain map tree.
     */
    public static Map<String, Object> toMap(Object value) {
        return MAPPER.convertValue(value, MAP_TYPE);
    }
}
