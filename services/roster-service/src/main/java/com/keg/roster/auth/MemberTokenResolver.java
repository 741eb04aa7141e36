package com.keg.roster.auth;

import com.keg.roster.member.Member;
import com.keg.roster.member.MemberCache;
import com.keg.security.Claims;
import com.keg.security.TokenException;
import com.keg.security.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns decoded claims into a live member.
 * <p>
 * The tier is checked first, then the subject is looked up in the cache. A member removed from
 * the directory disappears from the cache with the next synchronization, which invalidates all
 * of their tokens.
 */
public class MemberTokenResolver {

    private static final Logger log = LoggerFactory.getLogger(MemberTokenResolver.class);

    private final MemberCache cache;

    public MemberTokenResolver(MemberCache cache) {
        this.cache = cache;
    }

    /**
     * @param expected the tier the calling context accepts
     * @throws TokenException on a tier mismatch or an unknown subject
     */
    public Member resolve(Claims claims, TokenType expected) throws TokenException {
        try {
            claims.requireType(expected);
        } catch (TokenException e) {
            log.info("Tried to use a {} token as {} token", claims.type(), expected);
            throw e;
        }
        log.debug("Token issued by {} for {}, looking up the member", claims.issuer(), claims.subject());
        return cache.find(claims.subject())
                .orElseThrow(() -> new TokenException(TokenException.Reason.UNKNOWN_SUBJECT,
                        "No member for subject " + claims.subject()));
    }
}
