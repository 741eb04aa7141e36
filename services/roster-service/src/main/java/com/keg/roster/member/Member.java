package com.keg.roster.member;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A member of the association as read from the directory.
 * <p>
 * {@code fullUsername} is the fully-qualified directory name. It is the identity key used as
 * token subject and matched against group member lists.
 * <p>
 * Equality covers every field, the photo by content. The natural order (joining year, then
 * last name, then first name) is coarser than equality.
 *
 * @param gender single character code, {@code 'u'} when the directory has none
 * @param photo  JPEG bytes, empty when the directory has none
 */
public record Member(
        String username,
        String fullUsername,
        String firstName,
        String lastName,
        String commonName,
        List<String> titles,
        List<String> mobile,
        List<String> mail,
        int joining,
        boolean listed,
        boolean official,
        boolean active,
        boolean whatsapp,
        char gender,
        String birthday,
        byte[] photo,
        Optional<Address> address
) implements Comparable<Member> {

    public static final char UNKNOWN_GENDER = 'u';

    private static final Comparator<Member> ORDER = Comparator
            .comparingInt(Member::joining)
            .thenComparing(Member::lastName)
            .thenComparing(Member::firstName);

    public Member {
        Objects.requireNonNull(fullUsername, "fullUsername must not be null");
        titles = titles == null ? List.of() : List.copyOf(titles);
        mobile = mobile == null ? List.of() : List.copyOf(mobile);
        mail = mail == null ? List.of() : List.copyOf(mail);
        photo = photo == null ? new byte[0] : photo.clone();
        address = address == null ? Optional.empty() : address;
    }

    @Override
    public byte[] photo() {
        return photo.clone();
    }

    public boolean hasPhoto() {
        return photo.length > 0;
    }

    /** Returns a copy with the titles replaced. */
    public Member withTitles(List<String> sortedTitles) {
        return new Member(username, fullUsername, firstName, lastName, commonName, sortedTitles, mobile,
                mail, joining, listed, official, active, whatsapp, gender, birthday, photo, address);
    }

    /**
     * True iff {@code key} equals the DN, the username or one of the mail addresses, ignoring case.
     */
    public boolean matches(String key) {
        if (key == null) {
            return false;
        }
        return fullUsername.equalsIgnoreCase(key)
                || key.equalsIgnoreCase(username)
                || mail.stream().anyMatch(key::equalsIgnoreCase);
    }

    @Override
    public int compareTo(Member other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Member)) {
            return false;
        }
        Member other = (Member) o;
        return joining == other.joining
                && listed == other.listed
                && official == other.official
                && active == other.active
                && whatsapp == other.whatsapp
                && gender == other.gender
                && Objects.equals(username, other.username)
                && fullUsername.equals(other.fullUsername)
                && Objects.equals(firstName, other.firstName)
                && Objects.equals(lastName, other.lastName)
                && Objects.equals(commonName, other.commonName)
                && titles.equals(other.titles)
                && mobile.equals(other.mobile)
                && mail.equals(other.mail)
                && Objects.equals(birthday, other.birthday)
                && Arrays.equals(photo, other.photo)
                && address.equals(other.address);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(username, fullUsername, firstName, lastName, commonName, titles, mobile,
                mail, joining, listed, official, active, whatsapp, gender, birthday, address);
        return 31 * result + Arrays.hashCode(photo);
    }

    @Override
    public String toString() {
        return "Member[username=" + username + ", fullUsername=" + fullUsername
                + ", name=" + firstName + " " + lastName + ", joining=" + joining
                + ", photo=" + photo.length + " bytes]";
    }
}
