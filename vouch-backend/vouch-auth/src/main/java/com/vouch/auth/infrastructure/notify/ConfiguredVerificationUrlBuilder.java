package com.vouch.auth.infrastructure.notify;

import com.vouch.auth.config.TokenProperties;
import com.vouch.auth.domain.notify.VerificationUrlBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Appends the raw token as the {@code token} query parameter of the configured base URL.
 */
@Component
public class ConfiguredVerificationUrlBuilder implements VerificationUrlBuilder {

    private final TokenProperties properties;

    public ConfiguredVerificationUrlBuilder(TokenProperties properties) {
        this.properties = properties;
    }

    @Override
    public String buildVerificationUrl(String rawToken) {
        return UriComponentsBuilder.fromHttpUrl(properties.getEmailVerification().getBaseUrl())
                .queryParam("token", rawToken)
                .encode()
                .toUriString();
    }
}
