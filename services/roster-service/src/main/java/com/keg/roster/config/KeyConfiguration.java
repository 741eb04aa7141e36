package com.keg.roster.config;

import com.keg.roster.auth.TokenServices;
import com.keg.security.CredentialIssuer;
import com.keg.security.CredentialValidator;
import com.keg.security.KeyLoader;
import com.keg.security.KeyLoadingException;
import java.nio.file.Path;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.time.Clock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Loads the token key pair. A key that cannot be loaded is logged and left out: the service
 * still starts and serves anonymous requests.
 */
@Configuration
public class KeyConfiguration {

    private static final Logger log = LoggerFactory.getLogger(KeyConfiguration.class);

    @Bean
    public TokenServices tokenServices(CertProperties cert, JwtProperties jwt, Clock clock) {
        PrivateKey privateKey = load("private", cert.privateKeyPath(), KeyLoader::loadPrivateKey);
        PublicKey publicKey = load("public", cert.publicKeyPath(), KeyLoader::loadPublicKey);
        CredentialIssuer issuer = privateKey == null ? null
                : new CredentialIssuer(privateKey, jwt.issuer(), jwt.accessLifetime(), jwt.renewalLifetime(), clock);
        CredentialValidator validator = publicKey == null ? null
                : new CredentialValidator(publicKey, jwt.issuer(), clock);
        if (issuer == null) {
            log.warn("No private key loaded, login and token renewal are unavailable");
        }
        if (validator == null) {
            log.warn("No public key loaded, requests using authentication will not work");
        }
        return new TokenServices(issuer, validator);
    }

    private static <K> K load(String kind, Path path, Function<Path, K> loader) {
        if (path == null) {
            log.error("No {} key path configured", kind);
            return null;
        }
        try {
            K key = loader.apply(path);
            log.info("Loaded {} key from {}", kind, path);
            return key;
        } catch (KeyLoadingException e) {
            log.error("Unable to load {} key from {}", kind, path, e);
            return null;
        }
    }
}
