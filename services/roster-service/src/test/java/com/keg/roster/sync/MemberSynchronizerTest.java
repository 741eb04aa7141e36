package com.keg.roster.sync;

import static com.keg.roster.config.TestLdapProperties.EXECUTIVE_BASE;
import static com.keg.roster.config.TestLdapProperties.HONORARY_BASE;
import static com.keg.roster.config.TestLdapProperties.MEMBER_BASE;
import static com.keg.roster.config.TestLdapProperties.REGISTER_BASE;
import static com.keg.roster.config.TestLdapProperties.SUTLER_BASE;
import static com.keg.roster.member.TestMembers.dn;
import static com.keg.roster.member.TestMembers.group;
import static com.keg.roster.member.TestMembers.member;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import com.keg.directory.DirectoryClient;
import com.keg.directory.DirectoryException;
import com.keg.directory.SessionException;
import com.keg.observability.MetricFactory;
import com.keg.roster.config.TestLdapProperties;
import com.keg.roster.member.CacheSnapshot;
import com.keg.roster.member.DirectorySnapshot;
import com.keg.roster.member.Group;
import com.keg.roster.member.Member;
import com.keg.roster.member.MemberCache;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("MemberSynchronizer")
class MemberSynchronizerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private final Member karli = member("karli", "Karl", "Steinscheisser", 1998)
            .withTitles(List.of("Archivar", "Ehrenzeichen", "Obmann"));
    private final Member anna = member("anna", "Anna", "Abel", 2005);
    private final Member sepp = member("sepp", "Sepp", "Huber", 1970);

    private DirectoryClient directory;
    private MemberCache cache;
    private SimpleMeterRegistry registry;
    private MemberSynchronizer synchronizer;

    @BeforeEach
    void setUp() throws Exception {
        directory = mock(DirectoryClient.class);
        cache = new MemberCache();
        registry = new SimpleMeterRegistry();
        synchronizer = new MemberSynchronizer(directory, cache, TestLdapProperties.create("ldap://localhost"),
                new MetricFactory(registry, "roster-service-test"), Clock.fixed(NOW, ZoneOffset.UTC));

        doReturn(List.of(karli, anna)).when(directory).searchTyped(eq(MEMBER_BASE), anyString(), any());
        doReturn(List.of(anna)).when(directory).searchTyped(eq(SUTLER_BASE), anyString(), any());
        doReturn(List.of(sepp)).when(directory).searchTyped(eq(HONORARY_BASE), anyString(), any());
        doReturn(List.of(group("Flöte", "Flöten", dn("anna"))))
                .when(directory).searchTyped(eq(REGISTER_BASE), anyString(), any());
        doReturn(List.of(group("Archivar", "Archivare", dn("karli"))))
                .when(directory).searchTyped(eq(EXECUTIVE_BASE), anyString(), any());
    }

    @Test
    @DisplayName("replaces the cache after fetching every category")
    void replacesCache() {
        assertThat(synchronizer.runOnce()).isTrue();

        CacheSnapshot snapshot = cache.snapshot();
        assertThat(snapshot.members()).extracting(Member::username).containsExactly("karli", "anna");
        assertThat(snapshot.sutlers()).extracting(Member::username).containsExactly("anna");
        assertThat(snapshot.honoraryMembers()).extracting(Member::username).containsExactly("sepp");
        assertThat(snapshot.membersByRegister().get(0).members()).extracting(Member::username)
                .containsExactly("anna");
        assertThat(snapshot.executives()).extracting(Group::namePlural).containsExactly("Archivare");
    }

    @Test
    @DisplayName("sorts titles by the configured precedence")
    void sortsTitles() {
        synchronizer.runOnce();

        assertThat(cache.find("karli").orElseThrow().titles())
                .containsExactly("Ehrenzeichen", "Obmann", "Archivar");
    }

    @Test
    @DisplayName("ranks unknown titles with the first listed title in directory order")
    void keepsUnknownTitleOrder() {
        assertThat(synchronizer.sortTitles(List.of("Archivar", "Beirat", "Obmann")))
                .containsExactly("Beirat", "Obmann", "Archivar");
        assertThat(synchronizer.sortTitles(List.of("Zeugwart", "Kapellmeister", "Beirat", "Obmann")))
                .containsExactly("Zeugwart", "Beirat", "Obmann", "Kapellmeister");
    }

    @ParameterizedTest(name = "failing {0} search leaves the cache untouched")
    @ValueSource(strings = {MEMBER_BASE, SUTLER_BASE, HONORARY_BASE, REGISTER_BASE, EXECUTIVE_BASE})
    @DisplayName("a failing category leaves the cache untouched")
    void failedFetchKeepsCache(String failingBase) throws Exception {
        cache.replaceAll(new DirectorySnapshot(List.of(sepp), List.of(), List.of(), List.of(), Set.of()));
        CacheSnapshot before = cache.snapshot();
        doThrow(new DirectoryException("search failed", null))
                .when(directory).searchTyped(eq(failingBase), anyString(), any());

        assertThat(synchronizer.runOnce()).isFalse();

        assertThat(cache.snapshot()).isEqualTo(before);
        assertThat(synchronizer.status().lastCycleFailed()).isTrue();
    }

    @Test
    @DisplayName("reports the category that failed")
    void reportsFailedCategory() throws Exception {
        doThrow(new SessionException("connection refused", null))
                .when(directory).searchTyped(eq(REGISTER_BASE), anyString(), any());

        FetchOutcome outcome = synchronizer.fetchAll();

        assertThat(outcome.successful()).isFalse();
        assertThat(outcome.category()).isEqualTo(MemberSynchronizer.REGISTERS);
        assertThat(outcome.cause()).isInstanceOf(SessionException.class);
    }

    @Test
    @DisplayName("a runtime failure while mapping counts as a failed fetch")
    void runtimeFailureIsAFailedFetch() throws Exception {
        doThrow(new IllegalArgumentException("dn must not be null"))
                .when(directory).searchTyped(eq(HONORARY_BASE), anyString(), any());

        assertThat(synchronizer.runOnce()).isFalse();
        assertThat(synchronizer.status().failedCategory()).isEqualTo(MemberSynchronizer.HONORARY);
    }

    @Test
    @DisplayName("tracks the last attempt and the last success")
    void tracksStatus() throws Exception {
        assertThat(synchronizer.status()).isEqualTo(SynchronizationStatus.NEVER_RUN);

        synchronizer.runOnce();
        assertThat(synchronizer.status().lastSuccess()).isEqualTo(NOW);
        assertThat(synchronizer.status().lastCycleFailed()).isFalse();

        doThrow(new DirectoryException("search failed", null))
                .when(directory).searchTyped(eq(MEMBER_BASE), anyString(), any());
        synchronizer.runOnce();
        assertThat(synchronizer.status().lastAttempt()).isEqualTo(NOW);
        assertThat(synchronizer.status().lastSuccess()).isEqualTo(NOW);
        assertThat(synchronizer.status().failedCategory()).isEqualTo(MemberSynchronizer.MEMBERS);
    }

    @Test
    @DisplayName("records cycle outcomes and the member count")
    void recordsMetrics() throws Exception {
        synchronizer.runOnce();
        doThrow(new DirectoryException("search failed", null))
                .when(directory).searchTyped(eq(SUTLER_BASE), anyString(), any());
        synchronizer.runOnce();

        assertThat(registry.get("keg.sync.cycles").tag("outcome", "success").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("keg.sync.cycles").tag("outcome", "failure").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("keg.sync.members").gauge().value()).isEqualTo(2.0);
        assertThat(registry.get("keg.sync.duration").timer().count()).isEqualTo(2);
    }
}
