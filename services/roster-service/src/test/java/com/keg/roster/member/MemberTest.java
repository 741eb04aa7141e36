package com.keg.roster.member;

import static com.keg.roster.member.TestMembers.member;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Member")
class MemberTest {

    @Test
    @DisplayName("orders by joining year, then last name, then first name")
    void ordersByJoiningThenName() {
        Member zed = member("zed", "Zed", "Berger", 2010);
        Member bob = member("bob", "Bob", "Abel", 2005);
        Member ann = member("ann", "Ann", "Abel", 2005);

        List<Member> members = new ArrayList<>(List.of(zed, bob, ann));
        Collections.sort(members);

        assertThat(members).extracting(Member::firstName).containsExactly("Ann", "Bob", "Zed");
    }

    @Test
    @DisplayName("compares photos by content")
    void comparesPhotosByContent() {
        Member one = TestMembers.karli();
        Member two = TestMembers.karli();

        assertThat(one).isEqualTo(two).hasSameHashCodeAs(two);
        assertThat(one.photo()).isNotSameAs(two.photo());
    }

    @Test
    @DisplayName("members with equal order but different data are not equal")
    void orderIsCoarserThanEquality() {
        Member one = member("ann", "Ann", "Abel", 2005);
        Member two = one.withTitles(List.of("Kapellmeister"));

        assertThat(one.compareTo(two)).isZero();
        assertThat(one).isNotEqualTo(two);
    }

    @Test
    @DisplayName("photo bytes cannot be modified from outside")
    void photoIsCopied() {
        byte[] photo = {1, 2, 3};
        Member member = new Member("ann", TestMembers.dn("ann"), "Ann", "Abel", null, null, null, null, 2005,
                false, false, false, false, 'f', null, photo, null);

        photo[0] = 9;
        member.photo()[1] = 9;

        assertThat(member.photo()).containsExactly(1, 2, 3);
        assertThat(member.address()).isEmpty();
        assertThat(member.titles()).isEmpty();
    }

    @Test
    @DisplayName("matches DN, username and mail ignoring case")
    void matchesKeys() {
        Member karli = TestMembers.karli();

        assertThat(karli.matches("UID=KARLI,OU=MITGLIEDER,DC=MVL,DC=AT")).isTrue();
        assertThat(karli.matches("Karli")).isTrue();
        assertThat(karli.matches("KARLI@mvl.at")).isTrue();
        assertThat(karli.matches("anna")).isFalse();
        assertThat(karli.matches(null)).isFalse();
    }

    @Test
    @DisplayName("toString omits photo bytes")
    void toStringOmitsPhoto() {
        assertThat(TestMembers.karli().toString()).contains("photo=3 bytes").doesNotContain("[B@");
    }
}
