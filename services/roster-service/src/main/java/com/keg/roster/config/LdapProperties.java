package com.keg.roster.config;

import com.keg.directory.DirectorySettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Directory server connection, search scopes and attribute mappings, bound from
 * {@code keg.ldap.*}.
 *
 * <pre>
 * keg:
 *   ldap:
 *     server: ldaps://ldap.example.org:636
 *     dn: uid=keg,ou=services,dc=mvl,dc=at
 *     password: ...
 *     synchronization-interval: 900
 *     member:
 *       base: ou=Mitglieder,dc=mvl,dc=at
 *       filter: (objectClass=mvlMember)
 *     executive-mapping:
 *       archive: Archivare
 * </pre>
 *
 * @param server                  {@code ldap://} or {@code ldaps://} URL
 * @param dn                      service account used for synchronization, anonymous if absent
 * @param password                service account password
 * @param connectTimeout          TCP connect timeout (default 5s)
 * @param readTimeout             per-response timeout (default 10s)
 * @param synchronizationInterval seconds between two synchronization cycles (default 900)
 * @param synchronizationEnabled  whether the periodic synchronization runs (default true)
 * @param titleOrdering           precedence of member titles, unknown titles sort last
 * @param executiveMapping        role key (e.g. {@code archive}) to the plural name of the group
 */
@ConfigurationProperties(prefix = "keg.ldap")
@Validated
public record LdapProperties(
        @NotBlank String server,
        String dn,
        String password,
        Duration connectTimeout,
        Duration readTimeout,
        long synchronizationInterval,
        Boolean synchronizationEnabled,
        @Valid SearchScope member,
        @Valid SearchScope sutler,
        @Valid SearchScope honorary,
        @Valid SearchScope register,
        @Valid SearchScope executives,
        List<String> titleOrdering,
        Map<String, String> executiveMapping,
        MemberMapping memberMapping,
        AddressMapping addressMapping,
        GroupMapping groupMapping
) {

    public static final long DEFAULT_SYNCHRONIZATION_INTERVAL = 900;

    public LdapProperties {
        if (connectTimeout == null) {
            connectTimeout = Duration.ofSeconds(5);
        }
        if (readTimeout == null) {
            readTimeout = Duration.ofSeconds(10);
        }
        if (synchronizationInterval <= 0) {
            synchronizationInterval = DEFAULT_SYNCHRONIZATION_INTERVAL;
        }
        if (synchronizationEnabled == null) {
            synchronizationEnabled = Boolean.TRUE;
        }
        member = SearchScope.orEmpty(member);
        sutler = SearchScope.orEmpty(sutler);
        honorary = SearchScope.orEmpty(honorary);
        register = SearchScope.orEmpty(register);
        executives = SearchScope.orEmpty(executives);
        titleOrdering = titleOrdering == null ? List.of() : List.copyOf(titleOrdering);
        Map<String, String> mapping = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (executiveMapping != null) {
            mapping.putAll(executiveMapping);
        }
        executiveMapping = mapping;
        memberMapping = memberMapping == null ? MemberMapping.defaults() : memberMapping;
        addressMapping = addressMapping == null ? AddressMapping.defaults() : addressMapping;
        groupMapping = groupMapping == null ? GroupMapping.defaults() : groupMapping;
    }

    /**
     * The configured plural group name for a role key, if any.
     */
    public Optional<String> executiveGroup(String roleKey) {
        return Optional.ofNullable(executiveMapping.get(roleKey));
    }

    public DirectorySettings toDirectorySettings() {
        return new DirectorySettings(server, dn, password, connectTimeout, readTimeout,
                Set.of(memberMapping.photo()));
    }

    @Override
    public String toString() {
        return "LdapProperties[server=" + server + ", dn=" + dn
                + ", synchronizationInterval=" + synchronizationInterval + "]";
    }

    /**
     * Base DN and filter of one category.
     */
    public record SearchScope(String base, String filter) {

        public static final String MATCH_ALL = "(objectClass=*)";

        public SearchScope {
            if (base == null) {
                base = "";
            }
            if (filter == null || filter.isBlank()) {
                filter = MATCH_ALL;
            }
        }

        static SearchScope orEmpty(SearchScope scope) {
            return scope == null ? new SearchScope("", MATCH_ALL) : scope;
        }
    }

    /**
     * Attribute names of a member entry.
     */
    public record MemberMapping(
            String username,
            String firstName,
            String lastName,
            String commonName,
            String whatsapp,
            String joining,
            String listed,
            String official,
            String gender,
            String active,
            String mobile,
            String birthday,
            String mail,
            String photo,
            String titles
    ) {

        public MemberMapping {
            username = or(username, "uid");
            firstName = or(firstName, "givenName");
            lastName = or(lastName, "sn");
            commonName = or(commonName, "cn");
            whatsapp = or(whatsapp, "mvlWhatsapp");
            joining = or(joining, "mvlJoining");
            listed = or(listed, "mvlListed");
            official = or(official, "mvlOfficial");
            gender = or(gender, "mvlGender");
            active = or(active, "mvlActive");
            mobile = or(mobile, "mobile");
            birthday = or(birthday, "mvlBirthday");
            mail = or(mail, "mail");
            photo = or(photo, "jpegPhoto");
            titles = or(titles, "title");
        }

        public static MemberMapping defaults() {
            return new MemberMapping(null, null, null, null, null, null, null, null, null, null, null,
                    null, null, null, null);
        }
    }

    /**
     * Attribute names of the six address fields of a member entry.
     */
    public record AddressMapping(
            String street,
            String houseNumber,
            String postalCode,
            String city,
            String state,
            String countryCode
    ) {

        public AddressMapping {
            street = or(street, "street");
            houseNumber = or(houseNumber, "mvlHouseNumber");
            postalCode = or(postalCode, "postalCode");
            city = or(city, "l");
            state = or(state, "st");
            countryCode = or(countryCode, "c");
        }

        public static AddressMapping defaults() {
            return new AddressMapping(null, null, null, null, null, null);
        }

        public String[] all() {
            return new String[] {street, houseNumber, postalCode, city, state, countryCode};
        }
    }

    /**
     * Attribute names of a group entry.
     */
    public record GroupMapping(String name, String namePlural, String description, String members) {

        public GroupMapping {
            name = or(name, "cn");
            namePlural = or(namePlural, "mvlNamePlural");
            description = or(description, "description");
            members = or(members, "member");
        }

        public static GroupMapping defaults() {
            return new GroupMapping(null, null, null, null);
        }
    }

    private static String or(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
