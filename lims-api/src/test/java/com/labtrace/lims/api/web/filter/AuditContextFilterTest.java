package com.labtrace.lims.api.web.filter;

import static org.assertj.core.api.Assertions.assertThat;

import com.labtrace.lims.api.service.audit.AuditContextHolder;
import com.labtrace.lims.api.service.audit.AuditContextResolver;
import com.labtrace.lims.common.audit.AuditContext;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

class AuditContextFilterTest {

    private final AuditContextFilter filter = new AuditContextFilter(new AuditContextResolver());

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
        AuditContextHolder.clear();
    }

    private static void authenticate() {
        Jwt jwt = Jwt.withTokenValue("token").header("alg", "none").subject("user-1").claim("email", "analyst@lab.test").build();
        SecurityContextHolder.getContext().setAuthentication(new JwtAuthenticationToken(jwt, List.of()));
    }

    @Test
    void bindsContextForTheRequestAndClearsAfterwards() throws Exception {
        authenticate();
        MockHttpServletRequest request = new MockHttpServletRequest("PATCH", "/api/samples/1");
        request.setRemoteAddr("10.0.0.7");
        AtomicReference<AuditContext> seenInChain = new AtomicReference<>();
        MockFilterChain chain = new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest req, ServletResponse res) {
                seenInChain.set(AuditContextHolder.current().orElse(null));
            }
        };

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(seenInChain.get()).isNotNull();
        assertThat(seenInChain.get().actorId()).isEqualTo("user-1");
        assertThat(request.getAttribute(AuditContextFilter.CONTEXT_ATTRIBUTE)).isEqualTo(seenInChain.get());
        assertThat(AuditContextHolder.current()).isEmpty();
    }

    @Test
    void anonymousRequestPassesWithoutContext() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/audit");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isSameAs(request);
        assertThat(request.getAttribute(AuditContextFilter.CONTEXT_ATTRIBUTE)).isNull();
    }

    @Test
    void managementEndpointsAreSkipped() throws Exception {
        authenticate();
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/management/health");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(request.getAttribute(AuditContextFilter.CONTEXT_ATTRIBUTE)).isNull();
        assertThat(chain.getRequest()).isSameAs(request);
    }
}
