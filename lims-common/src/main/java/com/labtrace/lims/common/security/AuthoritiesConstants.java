package com.labtrace.lims.common.security;

/**
 * Constants for Spring Security authorities.
 */
public final class AuthoritiesConstants {

    public static final String ADMIN = "ROLE_ADMIN";

    public static final String LAB_MANAGER = "ROLE_LAB_MANAGER";

    public static final String ANALYST = "ROLE_ANALYST";

    public static final String SALES_ACCOUNTING = "ROLE_SALES_ACCOUNTING";

    public static final String CLIENT = "ROLE_CLIENT";

    public static final String ANONYMOUS = "ROLE_ANONYMOUS";

    private AuthoritiesConstants() {}
}
