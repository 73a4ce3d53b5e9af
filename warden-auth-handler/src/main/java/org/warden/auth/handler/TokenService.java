// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.


package org.warden.auth.handler;

import org.warden.auth.Audience;
import org.warden.auth.Token;
import org.warden.auth.WardenConfig;
import org.warden.auth.WardenException;
import org.warden.auth.spi.TokenSigner;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Issues, verifies and authorizes tokens.
 *
 * <p>The {@link TokenSigner} only checks signatures. Time checks happen here, against the
 * injected {@link Clock}, and always after the signature was accepted:
 * <ol>
 *   <li>bad signature or malformed token - INVALID_TOKEN</li>
 *   <li>{@code now >= exp} - EXPIRED_TOKEN</li>
 *   <li>{@code now < nbf} - INVALID_TOKEN</li>
 * </ol>
 */
public class TokenService {

    private static final Logger LOG = LogManager.getLogger(TokenService.class);

    private final TokenSigner signer;
    private final Clock clock;
    private final String issuer;
    private final Audience audience;
    private final Duration ttl;

    /**
     * @param signer signing capability
     * @param clock time source for {@code iat} and the expiration check
     * @param issuer default issuer
     * @param audience default audience
     * @param ttl default time to live, null for tokens that never expire
     */
    public TokenService(TokenSigner signer, Clock clock, String issuer, Audience audience, Duration ttl) {
        this.signer = Objects.requireNonNull(signer, "signer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.issuer = Objects.requireNonNull(issuer, "issuer");
        this.audience = audience != null ? audience : Audience.none();
        if (ttl != null && !isValidTtl(ttl)) {
            throw new IllegalArgumentException("ttl must be positive and at most "
                    + WardenConfig.MAX_TOKEN_TTL_SECONDS + "s, got: " + ttl);
        }
        this.ttl = ttl;
    }

    public static TokenService fromConfig(TokenSigner signer, Clock clock, WardenConfig config) {
        return new TokenService(signer, clock,
                config.getString(WardenConfig.TOKEN_ISSUER, WardenConfig.DEFAULT_TOKEN_ISSUER),
                Audience.of(config.getList(WardenConfig.TOKEN_AUDIENCE)),
                Duration.ofSeconds(config.getLong(WardenConfig.TOKEN_TTL_SECONDS,
                        WardenConfig.DEFAULT_TOKEN_TTL_SECONDS)));
    }

    /**
     * Issues a token for {@code subject} with the default issuer, audience and ttl.
     */
    public IssuedToken issue(UUID subject) throws WardenException {
        return issue(subject, issuer, audience, ttl, null);
    }

    /**
     * Issues and signs a token. {@code iat} is the current time; {@code exp} is {@code iat + ttl}
     * when a ttl is given, otherwise the token has no expiration.
     *
     * @param subject principal id
     * @param issuer issuer claim
     * @param audience audience claim, null for none
     * @param ttl time to live, may be null
     * @param claims custom claims, may be null
     * @return the token and its signed form
     * @throws WardenException CONVERSION if a custom claim shadows a registered claim or the ttl
     *         is out of range
     */
    public IssuedToken issue(UUID subject, String issuer, Audience audience, Duration ttl,
            Map<String, ?> claims) throws WardenException {
        if (ttl != null && !isValidTtl(ttl)) {
            throw WardenException.conversion("ttl", "ttl must be positive and at most "
                    + WardenConfig.MAX_TOKEN_TTL_SECONDS + "s");
        }
        Instant now = clock.instant();
        Token.Builder builder = Token.builder()
                .issuer(issuer)
                .subject(subject)
                .audience(audience)
                .issuedAt(now)
                .claims(claims);
        if (ttl != null) {
            builder.expiration(now.plus(ttl));
        }
        Token token = builder.build();
        String encoded = signer.sign(token);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Issued token {} for {} expiring at {}", token.getId(), subject,
                    token.getExpiration().orElse(null));
        }
        return new IssuedToken(token, encoded);
    }

    /**
     * Checks the signature only. Expired tokens are returned as is.
     *
     * @throws WardenException INVALID_TOKEN
     */
    public Token verify(String encoded) throws WardenException {
        return signer.verify(encoded);
    }

    /**
     * Verifies the signature, then the time window, and returns the subject.
     *
     * @param encoded signed token
     * @return principal id
     * @throws WardenException INVALID_TOKEN or EXPIRED_TOKEN
     */
    public UUID authorize(String encoded) throws WardenException {
        Token token = signer.verify(encoded);
        Instant now = clock.instant();
        if (token.isExpired(now)) {
            LOG.debug("Rejected expired token {} of {}", token.getId(), token.getSubject());
            throw WardenException.expiredToken();
        }
        if (token.getNotBefore().isPresent() && now.isBefore(token.getNotBefore().get())) {
            throw WardenException.invalidToken("token not yet valid", null);
        }
        return token.getSubject();
    }

    private static boolean isValidTtl(Duration ttl) {
        return !ttl.isNegative() && !ttl.isZero()
                && ttl.compareTo(Duration.ofSeconds(WardenConfig.MAX_TOKEN_TTL_SECONDS)) <= 0;
    }

    public Clock getClock() {
        return clock;
    }

    public String getIssuer() {
        return issuer;
    }

    public Audience getAudience() {
        return audience;
    }

    public Duration getTtl() {
        return ttl;
    }
}
