package com.keg.roster.member;

/**
 * Postal address of a member. Only built when the directory entry carries every field.
 */
public record Address(
        String street,
        String houseNumber,
        String postalCode,
        String city,
        String state,
        String countryCode
) {
}
