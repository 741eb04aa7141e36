package com.keg.roster.api;

import java.time.Instant;

/**
 * Body of a successful login or renewal. The tokens themselves travel in headers.
 *
 * @param renewalExpiresAt null for a renewal response, which issues no new renewal token
 */
public record SessionView(String username, Instant accessExpiresAt, Instant renewalExpiresAt) {
}
