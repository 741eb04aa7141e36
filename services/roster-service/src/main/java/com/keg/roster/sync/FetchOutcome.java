package com.keg.roster.sync;

import com.keg.roster.member.DirectorySnapshot;

/**
 * Result of fetching all five categories: either every fetch succeeded and the snapshot is
 * complete, or one failed and there is nothing to apply.
 *
 * @param snapshot the fetched data, null on failure
 * @param category the category whose fetch failed, null on success
 * @param cause    the failure, null on success
 */
public record FetchOutcome(DirectorySnapshot snapshot, String category, Exception cause) {

    public static FetchOutcome ok(DirectorySnapshot snapshot) {
        return new FetchOutcome(snapshot, null, null);
    }

    public static FetchOutcome fail(String category, Exception cause) {
        return new FetchOutcome(null, category, cause);
    }

    public boolean successful() {
        return snapshot != null;
    }
}
