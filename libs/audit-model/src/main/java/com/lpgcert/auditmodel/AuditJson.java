package com.lpgcert.auditmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON encoding of the semi-structured entry columns ({@code details}, {@code request_headers}).
 *
 * <p>Details are stored in their flattened form ({@link AuditDetails#toMap()}) and rebuilt into the
 * variant of the entry's log type on read.
 */
public final class AuditJson {

    private static final ObjectMapper MAPPER = createMapper();

    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_MAP =
            new TypeReference<>() {};

    private static final TypeReference<LinkedHashMap<String, String>> STRING_MAP =
            new TypeReference<>() {};

    private AuditJson() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Encodes a details payload as a JSON object.
     *
     * @return the JSON text, or null when {@code details} is null
     * @throws AuditJsonException if serialization fails
     */
    public static String writeDetails(AuditDetails details) {
        return details == null ? null : write(details.toMap());
    }

    /**
     * Decodes a JSON object into the details variant of {@code logType}.
     *
     * @return the payload, or null for null/blank input
     * @throws AuditJsonException if the JSON is malformed
     */
    public static AuditDetails readDetails(LogType logType, String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        return AuditDetails.fromMap(logType, read(json, OBJECT_MAP));
    }

    /** Encodes captured request headers, or returns null when there are none. */
    public static String writeHeaders(Map<String, String> headers) {
        return headers == null ? null : write(headers);
    }

    /** Decodes captured request headers, or returns null for null/blank input. */
    public static Map<String, String> readHeaders(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        return read(json, STRING_MAP);
    }

    /** Returns the shared ObjectMapper (for advanced use). */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new AuditJsonException("Failed to encode audit JSON column", e);
        }
    }

    private static <T> T read(String json, TypeReference<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new AuditJsonException("Failed to decode audit JSON column", e);
        }
    }

    /** Exception thrown when a JSON column cannot be encoded or decoded. */
    public static class AuditJsonException extends RuntimeException {
        public AuditJsonException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
