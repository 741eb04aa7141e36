package com.keg.roster.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.keg.roster.member.Address;
import com.keg.roster.member.Member;
import java.util.List;

/**
 * Public representation of a member. {@code sensitives} is only filled for authenticated
 * callers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MemberView(
        String username,
        String firstName,
        String lastName,
        int joining,
        char gender,
        boolean official,
        boolean active,
        List<String> titles,
        Sensitives sensitives
) {

    public static MemberView of(Member member, boolean sensitive) {
        return new MemberView(
                member.username(),
                member.firstName(),
                member.lastName(),
                member.joining(),
                member.gender(),
                member.official(),
                member.active(),
                member.titles(),
                sensitive ? Sensitives.of(member) : null);
    }

    /**
     * Contact data, only for authenticated callers.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Sensitives(
            String fullUsername,
            String commonName,
            List<String> mobile,
            boolean whatsapp,
            String birthday,
            List<String> mail,
            AddressView address
    ) {

        static Sensitives of(Member member) {
            return new Sensitives(
                    member.fullUsername(),
                    member.commonName(),
                    member.mobile(),
                    member.whatsapp(),
                    member.birthday(),
                    member.mail(),
                    member.address().map(AddressView::of).orElse(null));
        }
    }

    public record AddressView(
            String street,
            String houseNumber,
            String postalCode,
            String city,
            String state,
            String countryCode
    ) {

        static AddressView of(Address address) {
            return new AddressView(address.street(), address.houseNumber(), address.postalCode(),
                    address.city(), address.state(), address.countryCode());
        }
    }
}
