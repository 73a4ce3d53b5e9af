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


package org.warden.auth.plugin.jwt;

import org.warden.auth.Audience;
import org.warden.auth.Token;
import org.warden.auth.WardenException;
import org.warden.auth.spi.TokenSigner;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.PrematureJwtException;
import io.jsonwebtoken.io.SerializationException;
import io.jsonwebtoken.security.SignatureException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.security.PublicKey;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import javax.crypto.SecretKey;

/**
 * {@link TokenSigner} producing compact JWS strings.
 *
 * <p>Claim mapping: {@code jti, iss, sub, aud, exp, nbf, iat} carry the token's fixed fields;
 * custom claims are flattened into the same payload. The audience is decoded by size: one
 * recipient gives {@link Audience.Kind#ONE}, more give {@link Audience.Kind#MANY}.
 *
 * <p>Verification checks the signature only. Expired or not-yet-valid tokens with a good
 * signature decode normally; the token service applies the time checks.
 */
public class JwtTokenSigner implements TokenSigner {

    private static final Logger LOG = LogManager.getLogger(JwtTokenSigner.class);

    private final SigningKeys keys;
    private final JwtParser parser;

    public JwtTokenSigner(SigningKeys keys) {
        this.keys = Objects.requireNonNull(keys, "keys are required");
        if (keys.getVerificationKey() instanceof SecretKey) {
            this.parser = Jwts.parser().verifyWith((SecretKey) keys.getVerificationKey()).build();
        } else {
            this.parser = Jwts.parser().verifyWith((PublicKey) keys.getVerificationKey()).build();
        }
    }

    @Override
    public String algorithm() {
        return keys.getAlgorithm().name();
    }

    @Override
    public String sign(Token token) throws WardenException {
        Objects.requireNonNull(token, "token is required");
        Token.checkCustomClaims(token.getClaims());
        try {
            JwtBuilder builder = Jwts.builder()
                    .id(token.getId())
                    .issuer(token.getIssuer())
                    .subject(token.getSubject().toString())
                    .issuedAt(Date.from(token.getIssuedAt()));
            Audience audience = token.getAudience();
            if (!audience.isEmpty()) {
                builder.audience().add(audience.getValues()).and();
            }
            token.getExpiration().ifPresent(exp -> builder.expiration(Date.from(exp)));
            token.getNotBefore().ifPresent(nbf -> builder.notBefore(Date.from(nbf)));
            for (Map.Entry<String, Object> claim : token.getClaims().entrySet()) {
                builder.claim(claim.getKey(), claim.getValue());
            }
            return builder.signWith(keys.getSigningKey()).compact();
        } catch (SerializationException e) {
            throw WardenException.conversion("claims", "custom claims cannot be serialized");
        } catch (JwtException e) {
            throw WardenException.internal("token signing failed", e);
        } catch (RuntimeException e) {
            // e.g. a timestamp outside the range of java.util.Date
            throw WardenException.internal("token signing failed", e);
        }
    }

    @Override
    public Token verify(String encoded) throws WardenException {
        if (encoded == null || encoded.trim().isEmpty()) {
            throw WardenException.invalidToken("token is empty", null);
        }
        Claims claims;
        try {
            claims = parser.parseSignedClaims(encoded.trim()).getPayload();
        } catch (ExpiredJwtException e) {
            // the signature was checked before the expiration
            claims = e.getClaims();
        } catch (PrematureJwtException e) {
            claims = e.getClaims();
        } catch (SignatureException e) {
            LOG.debug("Invalid JWT signature: {}", e.getMessage());
            throw WardenException.invalidToken("invalid signature", e);
        } catch (MalformedJwtException e) {
            LOG.debug("Malformed JWT: {}", e.getMessage());
            throw WardenException.invalidToken("malformed token", e);
        } catch (JwtException | IllegalArgumentException e) {
            LOG.debug("Rejected JWT: {}", e.getMessage());
            throw WardenException.invalidToken("token rejected", e);
        }
        return toToken(claims);
    }

    private static Token toToken(Claims claims) throws WardenException {
        UUID subject;
        try {
            subject = UUID.fromString(required(claims.getSubject(), Token.SUBJECT));
        } catch (IllegalArgumentException e) {
            throw WardenException.invalidToken("subject is not a principal id", e);
        }
        Token.Builder builder = Token.builder()
                .id(required(claims.getId(), Token.ID))
                .issuer(required(claims.getIssuer(), Token.ISSUER))
                .subject(subject)
                .issuedAt(toInstant(required(claims.getIssuedAt(), Token.ISSUED_AT)))
                .expiration(toInstant(claims.getExpiration()))
                .notBefore(toInstant(claims.getNotBefore()));
        Collection<String> audience = claims.getAudience();
        builder.audience(Audience.of(audience != null ? new ArrayList<>(audience) : null));
        for (Map.Entry<String, Object> claim : claims.entrySet()) {
            if (!Token.REGISTERED_CLAIMS.contains(claim.getKey())) {
                builder.claim(claim.getKey(), claim.getValue());
            }
        }
        return builder.build();
    }

    private static <T> T required(T value, String claim) throws WardenException {
        if (value == null) {
            throw WardenException.invalidToken("missing claim " + claim, null);
        }
        return value;
    }

    private static Instant toInstant(Date date) {
        return date != null ? date.toInstant() : null;
    }

    @Override
    public String toString() {
        return "JwtTokenSigner{" + keys.getAlgorithm() + "}";
    }
}
