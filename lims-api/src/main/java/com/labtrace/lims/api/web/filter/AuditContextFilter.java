package com.labtrace.lims.api.web.filter;

import com.labtrace.lims.api.service.audit.AuditContextHolder;
import com.labtrace.lims.api.service.audit.AuditContextResolver;
import com.labtrace.lims.common.audit.AuditContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the caller's {@link AuditContext} to the request thread once authentication has run, and exposes it as the
 * {@value #CONTEXT_ATTRIBUTE} request attribute for controllers. Anonymous requests get no context.
 * <p>
 * Registered by the security filter chain only, so it is not annotated as a component.
 */
public class AuditContextFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AuditContextFilter.class);

    public static final String CONTEXT_ATTRIBUTE = "lims.auditContext";

    private static final String[] EXCLUDED_PATH_PREFIXES = new String[] { "/management", "/actuator", "/v3/api-docs", "/swagger" };

    private final AuditContextResolver resolver;

    public AuditContextFilter(AuditContextResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        if (path == null) {
            return true;
        }
        for (String prefix : EXCLUDED_PATH_PREFIXES) {
            if (path.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
        throws ServletException, IOException {
        Optional<AuditContext> context = resolver.resolve(request, SecurityContextHolder.getContext().getAuthentication());
        context.ifPresent(ctx -> {
            AuditContextHolder.set(ctx);
            request.setAttribute(CONTEXT_ATTRIBUTE, ctx);
            log.trace("Bound audit context for actor {} from {}", ctx.actorId(), ctx.ip());
        });
        try {
            filterChain.doFilter(request, response);
        } finally {
            AuditContextHolder.clear();
        }
    }
}
