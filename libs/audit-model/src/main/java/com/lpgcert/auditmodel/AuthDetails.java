package com.lpgcert.auditmodel;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Payload of {@code auth} events (login, logout, failed login, password changes).
 *
 * @param loginMethod how the user authenticated (e.g. "password", "magic_link"), nullable
 * @param failedReason why an attempt was rejected, nullable for successful events
 * @param extra extension fields
 */
public record AuthDetails(String loginMethod, String failedReason, Map<String, Object> extra)
        implements AuditDetails {

    public static final String LOGIN_METHOD = "login_method";
    public static final String FAILED_REASON = "failed_reason";

    private static final Set<String> TYPED_KEYS = Set.of(LOGIN_METHOD, FAILED_REASON);

    public AuthDetails {
        extra = DetailMaps.copyOf(extra);
    }

    public static AuthDetails of(String loginMethod) {
        return new AuthDetails(loginMethod, null, Map.of());
    }

    public static AuthDetails failed(String loginMethod, String failedReason) {
        return new AuthDetails(loginMethod, failedReason, Map.of());
    }

    /** Whether this payload describes a rejected attempt. */
    public boolean isFailure() {
        return failedReason != null && !failedReason.isBlank();
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        DetailMaps.putIfPresent(map, LOGIN_METHOD, loginMethod);
        DetailMaps.putIfPresent(map, FAILED_REASON, failedReason);
        return DetailMaps.withExtra(map, extra);
    }

    static AuthDetails fromMap(Map<String, Object> values) {
        return new AuthDetails(
                DetailMaps.string(values, LOGIN_METHOD),
                DetailMaps.string(values, FAILED_REASON),
                DetailMaps.remaining(values, TYPED_KEYS));
    }
}
