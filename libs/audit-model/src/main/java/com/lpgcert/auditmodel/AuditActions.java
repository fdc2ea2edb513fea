package com.lpgcert.auditmodel;

/**
 * Shared registry of conventional {@code action} values.
 *
 * <p>Actions stay free-form strings because new ones are added over time; emitters and callers
 * should still prefer these constants over literals.
 */
public final class AuditActions {

    private AuditActions() {
        // constants only
    }

    // ---- Authentication ----
    public static final String LOGIN = "LOGIN";
    public static final String LOGOUT = "LOGOUT";
    public static final String LOGIN_FAILED = "LOGIN_FAILED";
    public static final String PASSWORD_CHANGE = "PASSWORD_CHANGE";
    public static final String PASSWORD_RESET = "PASSWORD_RESET";

    // ---- User management ----
    public static final String USER_CREATE = "USER_CREATE";
    public static final String USER_UPDATE = "USER_UPDATE";
    public static final String USER_DELETE = "USER_DELETE";
    public static final String USER_ACTIVATE = "USER_ACTIVATE";
    public static final String USER_DEACTIVATE = "USER_DEACTIVATE";
    public static final String PROFILE_UPDATE = "PROFILE_UPDATE";

    // ---- Settings ----
    public static final String SETTINGS_UPDATE = "SETTINGS_UPDATE";
    public static final String BRANDING_UPDATE = "BRANDING_UPDATE";

    // ---- File operations ----
    public static final String FILE_UPLOAD = "FILE_UPLOAD";
    public static final String FILE_DELETE = "FILE_DELETE";
    public static final String FILE_DOWNLOAD = "FILE_DOWNLOAD";

    // ---- Reports ----
    public static final String REPORT_CREATE = "REPORT_CREATE";
    public static final String REPORT_UPDATE = "REPORT_UPDATE";
    public static final String REPORT_DELETE = "REPORT_DELETE";
    public static final String REPORT_APPROVE = "REPORT_APPROVE";
    public static final String REPORT_SUBMIT = "REPORT_SUBMIT";

    // ---- Email ----
    public static final String EMAIL_SENT = "EMAIL_SENT";
    public static final String EMAIL_FAILED = "EMAIL_FAILED";

    // ---- Security ----
    public static final String ACCESS_DENIED = "ACCESS_DENIED";
    public static final String SUSPICIOUS_ACTIVITY = "SUSPICIOUS_ACTIVITY";

    // ---- API ----
    public static final String API_REQUEST = "API_REQUEST";

    // ---- System ----
    public static final String SYSTEM_EVENT = "SYSTEM_EVENT";
    public static final String SYSTEM_STARTUP = "SYSTEM_STARTUP";
    public static final String SYSTEM_SHUTDOWN = "SYSTEM_SHUTDOWN";
    public static final String SYSTEM_ERROR = "SYSTEM_ERROR";
    public static final String DATABASE_BACKUP = "DATABASE_BACKUP";
    public static final String MAINTENANCE_START = "MAINTENANCE_START";
    public static final String MAINTENANCE_END = "MAINTENANCE_END";
    public static final String LOG_CLEANUP = "LOG_CLEANUP";
}
