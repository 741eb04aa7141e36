package com.keg.roster.config;

import com.keg.directory.DirectoryClient;
import com.keg.observability.MetricFactory;
import com.keg.roster.auth.AuthenticationService;
import com.keg.roster.auth.ExecutiveRoleAuthorizer;
import com.keg.roster.auth.TokenServices;
import com.keg.roster.infrastructure.web.AuthenticationInterceptor;
import com.keg.roster.member.MemberCache;
import com.keg.roster.sync.MemberSynchronizer;
import com.keg.roster.sync.SynchronizationScheduler;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the roster domain: directory access, the member cache, its synchronization and the
 * authentication flows.
 */
@Configuration
public class RosterConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, KegServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    @Bean
    public DirectoryClient directoryClient(LdapProperties ldap) {
        return new DirectoryClient(ldap.toDirectorySettings());
    }

    @Bean
    public MemberCache memberCache() {
        return new MemberCache();
    }

    @Bean
    public MemberSynchronizer memberSynchronizer(DirectoryClient directory, MemberCache cache, LdapProperties ldap,
                                                 MetricFactory metrics, Clock clock) {
        return new MemberSynchronizer(directory, cache, ldap, metrics, clock);
    }

    @Bean
    public SynchronizationScheduler synchronizationScheduler(MemberSynchronizer synchronizer, LdapProperties ldap) {
        return new SynchronizationScheduler(synchronizer, Duration.ofSeconds(ldap.synchronizationInterval()),
                ldap.synchronizationEnabled());
    }

    @Bean
    public ExecutiveRoleAuthorizer executiveRoleAuthorizer(MemberCache cache, LdapProperties ldap) {
        return new ExecutiveRoleAuthorizer(cache, ldap);
    }

    @Bean
    public AuthenticationService authenticationService(DirectoryClient directory, MemberCache cache,
                                                       TokenServices tokens, MetricFactory metrics) {
        return new AuthenticationService(directory, cache, tokens, metrics);
    }

    @Bean
    public AuthenticationInterceptor authenticationInterceptor(AuthenticationService authentication,
                                                               ExecutiveRoleAuthorizer authorizer) {
        return new AuthenticationInterceptor(authentication, authorizer);
    }
}
