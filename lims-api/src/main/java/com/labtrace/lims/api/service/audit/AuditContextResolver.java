package com.labtrace.lims.api.service.audit;

import com.labtrace.lims.common.audit.AuditContext;
import com.labtrace.lims.common.net.IpAddressUtils;
import com.labtrace.lims.common.security.SecurityUtils;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

/**
 * Builds the {@link AuditContext} of an inbound request from the authenticated identity, the network origin and the
 * declared client agent.
 */
@Component
public class AuditContextResolver {

    static final String FORWARDED_FOR = "X-Forwarded-For";

    /**
     * @return empty when the caller is anonymous or its token lacks a subject or an email
     */
    public Optional<AuditContext> resolve(HttpServletRequest request, Authentication authentication) {
        if (!SecurityUtils.isAuthenticated(authentication)) {
            return Optional.empty();
        }
        String actorId = SecurityUtils.extractSubject(authentication).orElse(null);
        String actorEmail = SecurityUtils.extractEmail(authentication).orElse(null);
        if (StringUtils.isAnyBlank(actorId, actorEmail)) {
            return Optional.empty();
        }
        String ip = IpAddressUtils.resolveClientIp(request.getHeader(FORWARDED_FOR), request.getRemoteAddr());
        String userAgent = request.getHeader(HttpHeaders.USER_AGENT);
        return Optional.of(AuditContext.of(actorId, actorEmail, ip, userAgent));
    }
}
