package com.keg.roster.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of this service instance, bound from {@code keg.service.*}.
 *
 * @param name        service name used as the {@code service} tag on every meter
 * @param environment deployment environment (development, test, production)
 */
@ConfigurationProperties(prefix = "keg.service")
@Validated
public record KegServiceProperties(@NotBlank String name, String environment) {

    public KegServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
