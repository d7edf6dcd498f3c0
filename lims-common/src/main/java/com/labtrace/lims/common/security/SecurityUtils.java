package com.labtrace.lims.common.security;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

/**
 * Utility class for Spring Security.
 */
public final class SecurityUtils {

    public static final String CLAIMS_NAMESPACE = "https://labtrace.com/";

    private SecurityUtils() {}

    /**
     * Get the login of the current user.
     *
     * @return the login of the current user.
     */
    public static Optional<String> getCurrentUserLogin() {
        return Optional.ofNullable(extractPrincipal(SecurityContextHolder.getContext().getAuthentication()));
    }

    private static String extractPrincipal(Authentication authentication) {
        if (authentication == null) {
            return null;
        } else if (authentication.getPrincipal() instanceof UserDetails springSecurityUser) {
            return springSecurityUser.getUsername();
        } else if (authentication instanceof JwtAuthenticationToken jwtToken) {
            Object username = jwtToken.getToken().getClaims().get("preferred_username");
            return username != null ? username.toString() : jwtToken.getToken().getSubject();
        } else if (authentication.getPrincipal() instanceof String s) {
            return s;
        }
        return null;
    }

    /**
     * Stable subject identifier of the caller ({@code sub} claim for JWT callers).
     */
    public static Optional<String> extractSubject(Authentication authentication) {
        if (authentication instanceof JwtAuthenticationToken jwtToken) {
            return Optional.ofNullable(jwtToken.getToken().getSubject());
        }
        return Optional.ofNullable(extractPrincipal(authentication));
    }

    /**
     * Email of the caller ({@code email} claim for JWT callers).
     */
    public static Optional<String> extractEmail(Authentication authentication) {
        if (authentication instanceof JwtAuthenticationToken jwtToken) {
            Object email = jwtToken.getToken().getClaims().get("email");
            return Optional.ofNullable(email).map(Object::toString);
        }
        return Optional.empty();
    }

    /**
     * Check if a user is authenticated.
     *
     * @return true if the user is authenticated, false otherwise.
     */
    public static boolean isAuthenticated() {
        return isAuthenticated(SecurityContextHolder.getContext().getAuthentication());
    }

    public static boolean isAuthenticated(Authentication authentication) {
        return (
            authentication != null &&
            authentication.isAuthenticated() &&
            getAuthorities(authentication).noneMatch(AuthoritiesConstants.ANONYMOUS::equals)
        );
    }

    /**
     * Authorities of the current caller, with JWT role claims normalized.
     */
    public static Set<String> getCurrentUserAuthorities() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null) {
            return Set.of();
        }
        return getAuthorities(authentication).collect(Collectors.toUnmodifiableSet());
    }

    private static Stream<String> getAuthorities(Authentication authentication) {
        Collection<? extends GrantedAuthority> authorities = authentication instanceof JwtAuthenticationToken jwtToken
            ? extractAuthorityFromClaims(jwtToken.getToken().getClaims())
            : authentication.getAuthorities();
        return authorities.stream().map(GrantedAuthority::getAuthority);
    }

    public static List<GrantedAuthority> extractAuthorityFromClaims(Map<String, Object> claims) {
        return getRolesFromClaims(claims)
            .stream()
            .map(SecurityUtils::normalizeRole)
            .filter(Objects::nonNull)
            .distinct()
            .map(SimpleGrantedAuthority::new)
            .collect(Collectors.toList());
    }

    private static Collection<String> getRolesFromClaims(Map<String, Object> claims) {
        List<String> roles = new ArrayList<>();
        collectRoles(claims.get("groups"), roles);
        collectRoles(claims.get("roles"), roles);
        collectRoles(claims.get("role"), roles);
        collectRoles(claims.get(CLAIMS_NAMESPACE + "roles"), roles);

        // Keycloak realm roles
        Object realmAccess = claims.get("realm_access");
        if (realmAccess instanceof Map<?, ?> realmMap) {
            collectRoles(realmMap.get("roles"), roles);
        }
        return roles;
    }

    private static void collectRoles(Object source, Collection<String> target) {
        if (source == null) return;
        if (source instanceof Collection<?> collection) {
            for (Object value : collection) {
                String s = String.valueOf(value == null ? "" : value).trim();
                if (!s.isEmpty()) target.add(s);
            }
        } else if (source instanceof String s && !s.isBlank()) {
            target.add(s.trim());
        }
    }

    private static final Map<String, String> ROLE_ALIASES = Map.ofEntries(
        Map.entry("QA", AuthoritiesConstants.LAB_MANAGER),
        Map.entry("REVIEWER", AuthoritiesConstants.LAB_MANAGER),
        Map.entry("LABMANAGER", AuthoritiesConstants.LAB_MANAGER),
        Map.entry("SALES", AuthoritiesConstants.SALES_ACCOUNTING),
        Map.entry("ACCOUNTING", AuthoritiesConstants.SALES_ACCOUNTING)
    );

    private static String normalizeRole(String role) {
        if (role == null) return null;
        String trimmed = role.trim();
        if (trimmed.isEmpty()) return null;

        String upper = trimmed.toUpperCase(Locale.ROOT).replace('-', '_');
        String noPrefix = upper.startsWith("ROLE_") ? upper.substring(5) : upper;
        String alias = ROLE_ALIASES.get(noPrefix);
        if (alias != null) return alias;
        return "ROLE_" + noPrefix;
    }
}
