package com.lpgcert.auditservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

@DisplayName("ServletRequestSnapshots")
class ServletRequestSnapshotsTest {

    @Test
    @DisplayName("copies method, path and joined headers")
    void copiesRequest() {
        var request = new MockHttpServletRequest("PUT", "/api/v1/settings/email");
        request.setQueryString("dry_run=true");
        request.addHeader("X-Forwarded-For", "1.1.1.1");
        request.addHeader("X-Forwarded-For", "2.2.2.2");
        request.addHeader("User-Agent", "Mozilla/5.0");

        var snapshot = ServletRequestSnapshots.from(request);

        assertThat(snapshot.method()).isEqualTo("PUT");
        assertThat(snapshot.path()).isEqualTo("/api/v1/settings/email");
        assertThat(snapshot.header("x-forwarded-for")).isEqualTo("1.1.1.1, 2.2.2.2");
        assertThat(snapshot.header("USER-AGENT")).isEqualTo("Mozilla/5.0");
    }

    @Test
    @DisplayName("null request yields null")
    void nullRequest() {
        assertThat(ServletRequestSnapshots.from(null)).isNull();
    }
}
