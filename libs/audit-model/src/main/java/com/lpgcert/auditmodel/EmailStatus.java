package com.lpgcert.auditmodel;

import java.util.Optional;

/** Delivery outcome recorded on email events. */
public enum EmailStatus {
    SENT("sent"),
    FAILED("failed"),
    PENDING("pending");

    private final String value;

    EmailStatus(String value) {
        this.value = value;
    }

    /** Canonical string representation stored in the entry details. */
    public String value() {
        return value;
    }

    /** Looks up a status by its canonical value. */
    public static Optional<EmailStatus> find(String value) {
        for (EmailStatus status : values()) {
            if (status.value.equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
