package com.keg.roster.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Session token settings, bound from {@code keg.jwt.*}.
 *
 * @param issuer            value of the {@code iss} claim, also required on inbound tokens
 * @param expiration        access token lifetime in minutes (default 15)
 * @param renewalExpiration renewal token lifetime in hours (default 720)
 */
@ConfigurationProperties(prefix = "keg.jwt")
@Validated
public record JwtProperties(@NotBlank String issuer, long expiration, long renewalExpiration) {

    public JwtProperties {
        if (expiration <= 0) {
            expiration = 15;
        }
        if (renewalExpiration <= 0) {
            renewalExpiration = 720;
        }
    }

    public Duration accessLifetime() {
        return Duration.ofMinutes(expiration);
    }

    public Duration renewalLifetime() {
        return Duration.ofHours(renewalExpiration);
    }
}
