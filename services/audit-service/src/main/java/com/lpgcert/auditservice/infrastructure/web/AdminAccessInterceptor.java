package com.lpgcert.auditservice.infrastructure.web;

import com.lpgcert.auditmodel.AuditActions;
import com.lpgcert.auditmodel.LogLevel;
import com.lpgcert.auditservice.domain.emit.AuditLogger;
import com.lpgcert.auditservice.domain.emit.EmitOptions;
import com.lpgcert.security.AccessDeniedException;
import com.lpgcert.security.AuthenticationRequiredException;
import com.lpgcert.security.RoleChecker;
import com.lpgcert.security.UserDirectory;
import com.lpgcert.security.UserIdentity;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Restricts the audit log endpoints to administrators.
 *
 * <p>Tokens are verified upstream; the gateway forwards the authenticated user's id in {@code
 * X-User-Id}. A missing or unknown user is rejected with {@link AuthenticationRequiredException},
 * a user below {@code Admin} with {@link AccessDeniedException}, which is also recorded as an
 * {@code ACCESS_DENIED} security event.
 */
public class AdminAccessInterceptor implements HandlerInterceptor {

    /** Request attribute holding the resolved {@link UserIdentity}. */
    public static final String CURRENT_USER_ATTRIBUTE = AdminAccessInterceptor.class.getName() + ".user";

    private static final Logger log = LoggerFactory.getLogger(AdminAccessInterceptor.class);

    private final UserDirectory userDirectory;
    private final AuditLogger auditLogger;

    public AdminAccessInterceptor(UserDirectory userDirectory, AuditLogger auditLogger) {
        this.userDirectory = userDirectory;
        this.auditLogger = auditLogger;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String userId = request.getHeader(CorrelationIdFilter.USER_ID_HEADER);
        if (userId == null || userId.isBlank()) {
            throw new AuthenticationRequiredException("Authentication required");
        }
        UserIdentity user =
                userDirectory
                        .findById(userId.trim())
                        .orElseThrow(() -> new AuthenticationRequiredException("Unknown user"));
        if (!RoleChecker.isAdmin(user)) {
            log.warn("Denied audit log access to userId={} role={}", user.userId(), user.role());
            auditLogger.logSecurityEvent(
                    LogLevel.WARNING,
                    AuditActions.ACCESS_DENIED,
                    "Admin access denied to " + request.getRequestURI(),
                    user.userId(),
                    Map.of("required_role", "Admin", "path", request.getRequestURI()),
                    EmitOptions.of(ServletRequestSnapshots.from(request)));
        }
        RoleChecker.requireAdmin(user);
        request.setAttribute(CURRENT_USER_ATTRIBUTE, user);
        return true;
    }
}
