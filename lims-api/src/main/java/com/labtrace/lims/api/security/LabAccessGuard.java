package com.labtrace.lims.api.security;

import com.labtrace.lims.common.security.SecurityUtils;
import com.labtrace.lims.common.security.policy.AccessDecision;
import com.labtrace.lims.common.security.policy.LabAccessPolicy;
import com.labtrace.lims.common.security.policy.LabAction;
import com.labtrace.lims.common.security.policy.LabResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Component;

/**
 * Checks the current caller against the {@link LabAccessPolicy} before a core operation runs.
 */
@Component
public class LabAccessGuard {

    private static final Logger log = LoggerFactory.getLogger(LabAccessGuard.class);

    private final LabAccessPolicy policy;

    public LabAccessGuard(LabAccessPolicy policy) {
        this.policy = policy;
    }

    /**
     * @throws AccessDeniedException when the policy denies the action
     */
    public void check(LabAction action, LabResource resource) {
        AccessDecision decision = policy.authorize(SecurityUtils.getCurrentUserAuthorities(), action, resource);
        if (!decision.allowed()) {
            log.debug("Denied {} on {} for {}: {}", action, resource, SecurityUtils.getCurrentUserLogin().orElse("anonymous"), decision.reason());
            throw new AccessDeniedException(decision.reason());
        }
    }
}
