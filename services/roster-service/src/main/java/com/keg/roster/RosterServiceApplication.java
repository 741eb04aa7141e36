package com.keg.roster;

import com.keg.roster.config.CertProperties;
import com.keg.roster.config.JwtProperties;
import com.keg.roster.config.KegServiceProperties;
import com.keg.roster.config.LdapProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Roster service: serves the member list of the association from a cache that is periodically
 * synchronized with the LDAP directory, and issues session tokens after a directory bind.
 */
@SpringBootApplication
@EnableConfigurationProperties({
        KegServiceProperties.class,
        LdapProperties.class,
        JwtProperties.class,
        CertProperties.class
})
public class RosterServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(RosterServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(RosterServiceApplication.class, args);
        log.info("Roster service started");
    }
}
