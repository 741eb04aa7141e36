package com.keg.directory;

import java.time.Duration;
import java.util.Set;

/**
 * Connection settings of the directory server.
 *
 * @param serverUrl        {@code ldap://host:port} for plaintext or {@code ldaps://host:port} for TLS
 * @param bindDn           service account DN used for synchronization searches, null or blank for anonymous
 * @param password         service account password, null means empty
 * @param connectTimeout   TCP connect timeout
 * @param readTimeout      timeout for a single response
 * @param binaryAttributes attributes to be returned as raw bytes (e.g. photos)
 */
public record DirectorySettings(
        String serverUrl,
        String bindDn,
        String password,
        Duration connectTimeout,
        Duration readTimeout,
        Set<String> binaryAttributes
) {

    public DirectorySettings {
        if (serverUrl == null || serverUrl.isBlank()) {
            throw new IllegalArgumentException("serverUrl must not be null or blank");
        }
        if (bindDn != null && bindDn.isBlank()) {
            bindDn = null;
        }
        if (connectTimeout == null) {
            connectTimeout = Duration.ofSeconds(5);
        }
        if (readTimeout == null) {
            readTimeout = Duration.ofSeconds(10);
        }
        binaryAttributes = binaryAttributes == null ? Set.of() : Set.copyOf(binaryAttributes);
    }

    /**
     * Returns the service bind password, treating an absent one as empty.
     */
    public String passwordOrEmpty() {
        return password == null ? "" : password;
    }

    @Override
    public String toString() {
        return "DirectorySettings[serverUrl=" + serverUrl + ", bindDn=" + bindDn
                + ", connectTimeout=" + connectTimeout + ", readTimeout=" + readTimeout + "]";
    }
}
