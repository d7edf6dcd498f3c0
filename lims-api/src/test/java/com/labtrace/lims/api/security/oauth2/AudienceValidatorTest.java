package com.labtrace.lims.api.security.oauth2;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.Jwt;

class AudienceValidatorTest {

    private final AudienceValidator validator = new AudienceValidator(List.of("account", "lims-api"));

    private static Jwt.Builder token() {
        return Jwt.withTokenValue("token").header("alg", "none").subject("user-1");
    }

    @Test
    void acceptsMatchingAudience() {
        assertThat(validator.validate(token().audience(List.of("lims-api")).build()).hasErrors()).isFalse();
    }

    @Test
    void fallsBackToAuthorizedParty() {
        assertThat(validator.validate(token().claim("azp", "lims-api").build()).hasErrors()).isFalse();
    }

    @Test
    void rejectsForeignAudience() {
        assertThat(validator.validate(token().audience(List.of("billing")).claim("azp", "billing-ui").build()).getErrors())
            .extracting("errorCode")
            .containsExactly("invalid_token");
    }

    @Test
    void requiresConfiguredAudience() {
        assertThatThrownBy(() -> new AudienceValidator(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
