package com.keg.roster.auth;

import com.keg.roster.member.Member;
import com.keg.security.IssuedToken;

/**
 * The result of a login: one access and one renewal token for the same member.
 */
public record TokenPair(Member member, IssuedToken access, IssuedToken renewal) {
}
