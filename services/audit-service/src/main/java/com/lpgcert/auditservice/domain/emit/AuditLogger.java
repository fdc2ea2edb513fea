package com.lpgcert.auditservice.domain.emit;

import com.lpgcert.auditmodel.ApiRequestDetails;
import com.lpgcert.auditmodel.AuditActions;
import com.lpgcert.auditmodel.AuditDetails;
import com.lpgcert.auditmodel.AuditLogEntry;
import com.lpgcert.auditmodel.AuthDetails;
import com.lpgcert.auditmodel.EmailDetails;
import com.lpgcert.auditmodel.EmailStatus;
import com.lpgcert.auditmodel.FileOperationDetails;
import com.lpgcert.auditmodel.GenericDetails;
import com.lpgcert.auditmodel.LogLevel;
import com.lpgcert.auditmodel.LogType;
import com.lpgcert.auditmodel.SettingsChangeDetails;
import com.lpgcert.auditservice.domain.enrichment.RequestSnapshot;
import com.lpgcert.auditservice.domain.write.AuditDispatcher;
import com.lpgcert.observability.CorrelationContext;
import com.lpgcert.observability.CorrelationContextHolder;
import com.lpgcert.observability.SensitiveDataRedactor;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for recording audit events. One method per category.
 *
 * <p>Each method fixes the entry's {@code log_type}, applies the category's defaults and hands the
 * entry to the {@link AuditDispatcher}. The returned future completes with the stored id, or with
 * empty if the entry was dropped or could not be written; callers may ignore it. No method throws
 * because of a logging failure.
 */
public class AuditLogger {

    static final String RESOURCE_EMAIL = "email";
    static final String RESOURCE_FILE = "file";
    static final String RESOURCE_APP_SETTINGS = "app_settings";

    private final AuditDispatcher dispatcher;
    private final SensitiveDataRedactor redactor;

    public AuditLogger(AuditDispatcher dispatcher, SensitiveDataRedactor redactor) {
        this.dispatcher = dispatcher;
        this.redactor = redactor;
    }

    /**
     * Records something a user did. Level defaults to INFO.
     *
     * @param resource the object acted on, nullable
     * @param details extra payload, nullable
     */
    public CompletableFuture<Optional<String>> logUserActivity(
            String userId,
            String action,
            String message,
            ResourceRef resource,
            AuditDetails details,
            EmitOptions options) {
        EmitOptions opts = orNone(options);
        AuditLogEntry.Builder entry =
                base(LogType.USER_ACTIVITY, opts.levelOr(LogLevel.INFO), opts)
                        .userId(userId)
                        .action(action)
                        .message(message)
                        .details(details);
        if (resource != null) {
            entry.resourceType(resource.type())
                    .resourceId(resource.id())
                    .resourceName(resource.name());
        }
        return submit(entry, opts);
    }

    public CompletableFuture<Optional<String>> logUserActivity(
            String userId, String action, String message) {
        return logUserActivity(userId, action, message, null, null, EmitOptions.none());
    }

    /**
     * Records an automated event with no acting user.
     *
     * @param level defaults to INFO
     * @param action defaults to {@link AuditActions#SYSTEM_EVENT}
     * @param module emitting component, nullable
     */
    public CompletableFuture<Optional<String>> logSystemEvent(
            LogLevel level,
            String message,
            String action,
            String module,
            Map<String, ?> details,
            EmitOptions options) {
        EmitOptions opts = orNone(options);
        AuditLogEntry.Builder entry =
                base(LogType.SYSTEM, opts.levelOr(level != null ? level : LogLevel.INFO), opts)
                        .action(action != null ? action : AuditActions.SYSTEM_EVENT)
                        .message(message)
                        .module(module)
                        .details(details == null ? null : GenericDetails.of(details))
                        .systemGenerated(true);
        return submit(entry, opts);
    }

    public CompletableFuture<Optional<String>> logSystemEvent(LogLevel level, String message) {
        return logSystemEvent(level, message, null, null, null, EmitOptions.none());
    }

    /**
     * Records an authentication event. Failed attempts ({@link AuditActions#LOGIN_FAILED} or
     * details carrying a failed reason) default to WARNING, everything else to INFO.
     */
    public CompletableFuture<Optional<String>> logAuthEvent(
            String action, String message, String userId, AuthDetails details, EmitOptions options) {
        EmitOptions opts = orNone(options);
        boolean failure =
                AuditActions.LOGIN_FAILED.equals(action) || (details != null && details.isFailure());
        AuditLogEntry.Builder entry =
                base(LogType.AUTH, opts.levelOr(failure ? LogLevel.WARNING : LogLevel.INFO), opts)
                        .action(action)
                        .message(message)
                        .userId(userId)
                        .details(details);
        return submit(entry, opts);
    }

    /**
     * Records an email delivery. A {@code failed} status defaults to ERROR, anything else to INFO;
     * missing details mean a sent email.
     */
    public CompletableFuture<Optional<String>> logEmailEvent(
            String action, String message, String userId, EmailDetails details, EmitOptions options) {
        EmitOptions opts = orNone(options);
        EmailDetails email =
                details != null ? details : new EmailDetails(null, null, EmailStatus.SENT, null, null);
        LogLevel defaultLevel = email.status() == EmailStatus.FAILED ? LogLevel.ERROR : LogLevel.INFO;
        AuditLogEntry.Builder entry =
                base(LogType.EMAIL, opts.levelOr(defaultLevel), opts)
                        .action(action)
                        .message(message)
                        .userId(userId)
                        .resourceType(RESOURCE_EMAIL)
                        .details(email);
        return submit(entry, opts);
    }

    /**
     * Records an operation on a stored file. The message is {@code "File <action>: <name>"}.
     */
    public CompletableFuture<Optional<String>> logFileOperation(
            String userId, String action, FileOperationDetails details, EmitOptions options) {
        EmitOptions opts = orNone(options);
        String fileName = details == null ? null : details.fileName();
        AuditLogEntry.Builder entry =
                base(LogType.FILE_OPERATION, opts.levelOr(LogLevel.INFO), opts)
                        .userId(userId)
                        .action(action)
                        .message("File " + action + ": " + fileName)
                        .resourceType(RESOURCE_FILE)
                        .resourceName(fileName)
                        .details(details);
        return submit(entry, opts);
    }

    /**
     * Records a change to an application setting as a user activity.
     *
     * <p>When the key names a credential the old and new values are masked and the entry is
     * flagged sensitive.
     */
    public CompletableFuture<Optional<String>> logSettingsUpdate(
            String userId,
            String userEmail,
            String category,
            String key,
            String oldValue,
            String newValue,
            EmitOptions options) {
        EmitOptions opts = orNone(options);
        String settingCategory = orUnknown(category);
        String settingKey = orUnknown(key);
        boolean sensitive = redactor.isSensitive(settingKey);
        SettingsChangeDetails details =
                SettingsChangeDetails.of(
                        settingCategory,
                        settingKey,
                        sensitive ? redactor.mask(key, oldValue) : oldValue,
                        sensitive ? redactor.mask(key, newValue) : newValue);
        String qualifiedKey = details.qualifiedKey();
        AuditLogEntry.Builder entry =
                base(LogType.USER_ACTIVITY, opts.levelOr(LogLevel.INFO), opts)
                        .userId(userId)
                        .userEmail(userEmail)
                        .action(AuditActions.SETTINGS_UPDATE)
                        .message("Updated setting " + qualifiedKey)
                        .resourceType(RESOURCE_APP_SETTINGS)
                        .resourceId(qualifiedKey)
                        .resourceName(settingCategory + " - " + settingKey)
                        .details(details)
                        .sensitive(sensitive);
        return submit(entry, opts);
    }

    /** Records a security-relevant event, WARNING unless a level is given. Security entries are always sensitive. */
    public CompletableFuture<Optional<String>> logSecurityEvent(
            LogLevel level,
            String action,
            String message,
            String userId,
            Map<String, ?> details,
            EmitOptions options) {
        EmitOptions opts = orNone(options);
        AuditLogEntry.Builder entry =
                base(LogType.SECURITY, opts.levelOr(level != null ? level : LogLevel.WARNING), opts)
                        .action(action)
                        .message(message)
                        .userId(userId)
                        .details(details == null ? null : GenericDetails.of(details))
                        .sensitive(true);
        return submit(entry, opts);
    }

    /**
     * Records a served API request. 5xx responses default to ERROR, 4xx to WARNING.
     *
     * @param request the request that was served, nullable
     */
    public CompletableFuture<Optional<String>> logApiRequest(
            RequestSnapshot request, int responseStatus, long durationMs, String userId, EmitOptions options) {
        EmitOptions opts = orNone(options).withRequest(request);
        ApiRequestDetails details = ApiRequestDetails.of(responseStatus, durationMs);
        AuditLogEntry.Builder entry =
                base(LogType.API, opts.levelOr(details.impliedLevel()), opts)
                        .userId(userId)
                        .action(AuditActions.API_REQUEST)
                        .message(describe(request) + " -> " + responseStatus)
                        .details(details);
        return submit(entry, opts);
    }

    private static AuditLogEntry.Builder base(LogType type, LogLevel level, EmitOptions options) {
        Optional<CorrelationContext> context = CorrelationContextHolder.get();
        return AuditLogEntry.builder(type, level)
                .sensitive(type.sensitiveByDefault())
                .correlationId(
                        options.correlationId() != null
                                ? options.correlationId()
                                : context.map(CorrelationContext::correlationId).orElse(null))
                .tenantId(
                        options.tenantId() != null
                                ? options.tenantId()
                                : context.map(CorrelationContext::tenantId).orElse(null))
                .sessionId(options.sessionId());
    }

    private CompletableFuture<Optional<String>> submit(AuditLogEntry.Builder entry, EmitOptions options) {
        return dispatcher.submit(entry.build(), options.request());
    }

    private static String describe(RequestSnapshot request) {
        return request == null ? "API request" : request.method() + " " + request.path();
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? "unknown" : value;
    }

    private static EmitOptions orNone(EmitOptions options) {
        return options != null ? options : EmitOptions.none();
    }
}
