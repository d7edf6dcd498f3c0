package com.labtrace.lims.common.security.policy;

import com.labtrace.lims.common.security.AuthoritiesConstants;
import java.util.Optional;

public enum LabRole {
    ADMIN(AuthoritiesConstants.ADMIN),
    LAB_MANAGER(AuthoritiesConstants.LAB_MANAGER),
    ANALYST(AuthoritiesConstants.ANALYST),
    SALES_ACCOUNTING(AuthoritiesConstants.SALES_ACCOUNTING),
    CLIENT(AuthoritiesConstants.CLIENT);

    private final String authority;

    LabRole(String authority) {
        this.authority = authority;
    }

    public String authority() {
        return authority;
    }

    public static Optional<LabRole> fromAuthority(String authority) {
        if (authority == null) {
            return Optional.empty();
        }
        for (LabRole role : values()) {
            if (role.authority.equals(authority)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
