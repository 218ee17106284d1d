package com.redline.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Utility class for working with JSON.
 * All request bodies and response values share one configured {@link ObjectMapper}.
 */
public class JsonUtil {
    private static final ObjectMapper mapper;

    static {
        mapper = new ObjectMapper();
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, true);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Converts an object to a JSON string.
     *
     * @param obj the object to convert
     * @return the JSON string
     * @throws JsonProcessingException if the conversion fails
     */
    public static String toJson(Object obj) throws JsonProcessingException {
        return mapper.writeValueAsString(obj);
    }

    /**
     * Converts an object to UTF-8 encoded JSON.
     *
     * @param obj the object to convert
     * @return the encoded JSON
     * @throws JsonProcessingException if the conversion fails
     */
    public static byte[] toJsonBytes(Object obj) throws JsonProcessingException {
        return mapper.writeValueAsBytes(obj);
    }

    /**
     * Parses a JSON stream into plain Java values ({@code Map}, {@code List}, {@code String},
     * numbers, booleans). Returns null for an empty stream.
     *
     * @param in the stream to read
     * @return the parsed value
     * @throws IOException if the stream is not valid JSON
     */
    public static Object parse(InputStream in) throws IOException {
        byte[] bytes = in.readAllBytes();
        if (bytes.length == 0) {
            return null;
        }
        return mapper.readValue(bytes, Object.class);
    }

    /**
     * Parses a JSON string into an object of the specified type.
     *
     * @param json the JSON string
     * @param clazz the class of the object
     * @param <T> the type of the object
     * @return the parsed object
     * @throws IOException if the parsing fails
     */
    public static <T> T fromJson(String json, Class<T> clazz) throws IOException {
        return mapper.readValue(json, clazz);
    }

    /**
     * Parses a JSON string into a map.
     *
     * @param json the JSON string
     * @return the parsed map
     * @throws IOException if the parsing fails
     */
    public static Map<String, Object> fromJsonMap(String json) throws IOException {
        return mapper.readValue(json, new TypeReference<Map<String, Object>>() {});
    }

    /**
     * Converts an already parsed value (for example a body map) into the given type.
     *
     * @param value the source value
     * @param type the target type
     * @param <T> the target type
     * @return the converted value
     * @throws IllegalArgumentException if the value cannot be converted
     */
    public static <T> T convert(Object value, Class<T> type) {
        return mapper.convertValue(value, type);
    }

    /**
     * Gets the ObjectMapper instance.
     *
     * @return the ObjectMapper instance
     */
    public static ObjectMapper getMapper() {
        return mapper;
    }
}
