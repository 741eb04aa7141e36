package com.keg.security;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BasicCredentials")
class BasicCredentialsTest {

    private static String basic(String pair) {
        return "Basic " + Base64.getEncoder().encodeToString(pair.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("splits username and password at the first colon")
    void splitsAtFirstColon() {
        assertThat(BasicCredentials.parse(basic("karli:se:cr:et")))
                .contains(new BasicCredentials("karli", "se:cr:et"));
    }

    @Test
    @DisplayName("keeps an empty password empty")
    void emptyPassword() {
        assertThat(BasicCredentials.parse(basic("karli:")))
                .contains(new BasicCredentials("karli", ""));
    }

    @Test
    @DisplayName("decodes UTF-8")
    void utf8() {
        assertThat(BasicCredentials.parse(basic("jörg:grüß")))
                .contains(new BasicCredentials("jörg", "grüß"));
    }

    @Test
    @DisplayName("ignores a missing or non-Basic header")
    void notBasic() {
        assertThat(BasicCredentials.parse(null)).isEmpty();
        assertThat(BasicCredentials.parse("Bearer abc")).isEmpty();
    }

    @Test
    @DisplayName("rejects invalid Base64 and payloads without colon")
    void malformed() {
        assertThatThrownBy(() -> BasicCredentials.parse("Basic %%%"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BasicCredentials.parse(basic("karli")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("never prints the password")
    void toStringHidesPassword() {
        assertThat(new BasicCredentials("karli", "secret").toString()).doesNotContain("secret");
    }
}
