package com.keg.roster.config;

import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Locations of the RSA key pair used for session tokens, bound from {@code keg.cert.*}.
 * <p>
 * Both are optional at startup: a missing key disables login and token validation instead
 * of failing the application.
 */
@ConfigurationProperties(prefix = "keg.cert")
public record CertProperties(Path privateKeyPath, Path publicKeyPath) {
}
