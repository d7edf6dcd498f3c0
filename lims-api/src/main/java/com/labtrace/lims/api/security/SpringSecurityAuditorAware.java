package com.labtrace.lims.api.security;

import com.labtrace.lims.common.security.SecurityUtils;
import java.util.Optional;
import org.springframework.data.domain.AuditorAware;
import org.springframework.stereotype.Component;

/**
 * Fills {@code createdBy}/{@code lastModifiedBy} of auditing entities.
 */
@Component
public class SpringSecurityAuditorAware implements AuditorAware<String> {

    static final String SYSTEM = "system";

    @Override
    public Optional<String> getCurrentAuditor() {
        return Optional.of(SecurityUtils.getCurrentUserLogin().orElse(SYSTEM));
    }
}
