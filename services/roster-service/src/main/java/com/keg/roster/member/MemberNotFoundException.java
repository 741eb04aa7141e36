package com.keg.roster.member;

/**
 * No cached member matches the requested key.
 */
public class MemberNotFoundException extends RuntimeException {

    public MemberNotFoundException(String key) {
        super("No member with such username: " + key);
    }
}
