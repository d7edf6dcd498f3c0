package com.labtrace.lims.common.security.policy;

import java.util.Collection;

public interface LabAccessPolicy {
    /**
     * @param authorities granted authorities of the caller ({@code ROLE_*})
     */
    AccessDecision authorize(Collection<String> authorities, LabAction action, LabResource resource);
}
