package com.lpgcert.auditservice.config;

import com.lpgcert.auditservice.domain.emit.AuditLogger;
import com.lpgcert.auditservice.infrastructure.web.AdminAccessInterceptor;
import com.lpgcert.security.UserDirectory;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS for the admin frontend and admin gating of the audit log endpoints.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    static final String AUDIT_LOG_PATHS = "/api/v1/audit-logs/**";

    private final UserDirectory userDirectory;
    private final AuditLogger auditLogger;

    public WebConfig(UserDirectory userDirectory, AuditLogger auditLogger) {
        this.userDirectory = userDirectory;
        this.auditLogger = auditLogger;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        // Local development frontends; production origins come from the gateway.
        registry.addMapping("/api/**")
                .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                .allowedMethods("GET", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true)
                .maxAge(3600);
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new AdminAccessInterceptor(userDirectory, auditLogger))
                .addPathPatterns("/api/v1/audit-logs", AUDIT_LOG_PATHS);
    }
}
