package com.lpgcert.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks sensitive values before they reach an audit entry or a log line.
 * <p>
 * Used for captured request headers and for settings changes whose key names a credential.
 * Default patterns: password, passwd, token, secret, authorization, apikey, api-key, api_key,
 * credential, cookie, private_key. Matching is a case-insensitive substring search on the name.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    /** Default set of field name patterns considered sensitive. */
    public static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "passwd", "token", "secret", "authorization",
            "apikey", "api-key", "api_key", "credential", "cookie", "private_key"
    );

    private final Set<String> sensitivePatterns;
    private final Pattern compiledPattern;

    /**
     * Creates a redactor with the default sensitive field patterns.
     */
    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * Creates a redactor with custom sensitive field patterns (case-insensitive).
     *
     * @param patterns field name patterns to treat as sensitive, must not be empty
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        this.sensitivePatterns = Set.copyOf(patterns);
        String regex = String.join("|", sensitivePatterns.stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a new map with sensitive field values replaced by {@value #REDACTED}.
     * Non-sensitive fields are copied as-is. Null input returns an empty map.
     *
     * @param data the data map (keys are field names, values are arbitrary)
     * @return a new insertion-ordered map with sensitive values redacted
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            result.put(entry.getKey(), isSensitive(entry.getKey()) ? REDACTED : entry.getValue());
        }
        return result;
    }

    /**
     * Header variant of {@link #redact(Map)}: string values in, string values out.
     */
    public Map<String, String> redactHeaders(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return Map.of();
        }
        Map<String, String> result = new LinkedHashMap<>(headers.size());
        headers.forEach((name, value) -> result.put(name, isSensitive(name) ? REDACTED : value));
        return result;
    }

    /**
     * Masks a single value when its field name is sensitive.
     *
     * @return {@value #REDACTED} for a sensitive name and a non-null value, otherwise the value
     */
    public String mask(String fieldName, String value) {
        return value != null && isSensitive(fieldName) ? REDACTED : value;
    }

    /**
     * Checks whether a field name matches any sensitive pattern (case-insensitive).
     *
     * @param fieldName the field name to check
     * @return true if the field name contains a sensitive pattern
     */
    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        return compiledPattern.matcher(fieldName).find();
    }

    /**
     * Returns the set of sensitive patterns this redactor uses.
     */
    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }
}
