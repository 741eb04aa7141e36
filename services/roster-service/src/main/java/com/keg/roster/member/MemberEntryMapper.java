package com.keg.roster.member;

import com.keg.directory.DirectoryEntryMapper;
import com.keg.directory.RawEntry;
import com.keg.roster.config.LdapProperties.AddressMapping;
import com.keg.roster.config.LdapProperties.MemberMapping;
import java.util.Optional;

/**
 * Maps member entries through the configured attribute names.
 */
public class MemberEntryMapper implements DirectoryEntryMapper<Member> {

    private final MemberMapping mapping;
    private final AddressMapping addressMapping;

    public MemberEntryMapper(MemberMapping mapping, AddressMapping addressMapping) {
        this.mapping = mapping;
        this.addressMapping = addressMapping;
    }

    @Override
    public Member fromEntry(RawEntry entry) {
        String gender = entry.firstValue(mapping.gender());
        return new Member(
                entry.firstValue(mapping.username()),
                entry.dn(),
                entry.firstValue(mapping.firstName()),
                entry.firstValue(mapping.lastName()),
                entry.firstValue(mapping.commonName()),
                entry.values(mapping.titles()),
                entry.values(mapping.mobile()),
                entry.values(mapping.mail()),
                entry.number(mapping.joining()),
                entry.flag(mapping.listed()),
                entry.flag(mapping.official()),
                entry.flag(mapping.active()),
                entry.flag(mapping.whatsapp()),
                gender.isEmpty() ? Member.UNKNOWN_GENDER : gender.charAt(0),
                entry.firstValue(mapping.birthday()),
                entry.firstBinary(mapping.photo()),
                address(entry));
    }

    /**
     * All six address attributes or no address at all.
     */
    Optional<Address> address(RawEntry entry) {
        if (!entry.containsAll(addressMapping.all())) {
            return Optional.empty();
        }
        return Optional.of(new Address(
                entry.firstValue(addressMapping.street()),
                entry.firstValue(addressMapping.houseNumber()),
                entry.firstValue(addressMapping.postalCode()),
                entry.firstValue(addressMapping.city()),
                entry.firstValue(addressMapping.state()),
                entry.firstValue(addressMapping.countryCode())));
    }
}
