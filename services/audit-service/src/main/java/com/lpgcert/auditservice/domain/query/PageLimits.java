package com.lpgcert.auditservice.domain.query;

/**
 * Page size policy: a missing limit becomes {@code defaultLimit}, anything above {@code maxLimit}
 * is clamped down, anything below 1 is raised to 1. Negative offsets become 0.
 */
public record PageLimits(int defaultLimit, int maxLimit) {

    public static final PageLimits STANDARD = new PageLimits(50, 100);

    public PageLimits {
        if (maxLimit < 1) {
            throw new IllegalArgumentException("maxLimit must be >= 1");
        }
        if (defaultLimit < 1 || defaultLimit > maxLimit) {
            throw new IllegalArgumentException("defaultLimit must be between 1 and maxLimit");
        }
    }

    public int limit(Integer requested) {
        if (requested == null) {
            return defaultLimit;
        }
        return Math.max(1, Math.min(maxLimit, requested));
    }

    public int offset(Integer requested) {
        return requested == null ? 0 : Math.max(0, requested);
    }
}
