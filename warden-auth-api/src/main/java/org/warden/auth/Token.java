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


package org.warden.auth;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * A time-bounded assertion of a principal's identity.
 *
 * <p>Tokens are never stored. They are signed into a string by a signing capability and
 * rebuilt from that string on verification. Timestamps have second precision, matching the
 * numeric-date claims they are encoded as.
 */
public final class Token {

    public static final String ID = "jti";
    public static final String ISSUER = "iss";
    public static final String SUBJECT = "sub";
    public static final String AUDIENCE = "aud";
    public static final String EXPIRATION = "exp";
    public static final String NOT_BEFORE = "nbf";
    public static final String ISSUED_AT = "iat";

    /** Claim names with a fixed meaning; custom claims may not reuse them. */
    public static final Set<String> REGISTERED_CLAIMS = Collections.unmodifiableSet(new HashSet<>(
            Arrays.asList(ID, ISSUER, SUBJECT, AUDIENCE, EXPIRATION, NOT_BEFORE, ISSUED_AT)));

    private final String id;
    private final String issuer;
    private final UUID subject;
    private final Audience audience;
    private final Instant expiration;
    private final Instant notBefore;
    private final Instant issuedAt;
    private final Map<String, Object> claims;

    private Token(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.issuer = Objects.requireNonNull(builder.issuer, "issuer is required");
        this.subject = Objects.requireNonNull(builder.subject, "subject is required");
        this.audience = builder.audience != null ? builder.audience : Audience.none();
        this.expiration = truncate(builder.expiration);
        this.notBefore = truncate(builder.notBefore);
        this.issuedAt = truncate(Objects.requireNonNull(builder.issuedAt, "issuedAt is required"));
        this.claims = Collections.unmodifiableMap(new LinkedHashMap<>(builder.claims));
    }

    private static Instant truncate(Instant instant) {
        return instant != null ? instant.truncatedTo(ChronoUnit.SECONDS) : null;
    }

    /**
     * Rejects custom claims that would shadow a registered claim.
     *
     * @param claims custom claims
     * @throws WardenException CONVERSION naming the shadowed claim
     */
    public static void checkCustomClaims(Map<String, ?> claims) throws WardenException {
        for (String name : claims.keySet()) {
            if (REGISTERED_CLAIMS.contains(name)) {
                throw WardenException.conversion(name, "custom claim shadows a registered claim");
            }
        }
    }

    public String getId() {
        return id;
    }

    public String getIssuer() {
        return issuer;
    }

    public UUID getSubject() {
        return subject;
    }

    public Audience getAudience() {
        return audience;
    }

    public Optional<Instant> getExpiration() {
        return Optional.ofNullable(expiration);
    }

    public Optional<Instant> getNotBefore() {
        return Optional.ofNullable(notBefore);
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    public Map<String, Object> getClaims() {
        return claims;
    }

    /**
     * Whether the token is past its expiration at {@code now}. A token without expiration
     * never expires.
     *
     * @param now current time
     * @return true if {@code now} is at or after the expiration
     */
    public boolean isExpired(Instant now) {
        return expiration != null && !now.isBefore(expiration);
    }

    /**
     * Whether the token may be used at {@code now}: not expired and not before its
     * not-before time.
     *
     * @param now current time
     * @return true if usable
     */
    public boolean isActive(Instant now) {
        return !isExpired(now) && (notBefore == null || !now.isBefore(notBefore));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Token that = (Token) o;
        return id.equals(that.id)
                && issuer.equals(that.issuer)
                && subject.equals(that.subject)
                && audience.equals(that.audience)
                && Objects.equals(expiration, that.expiration)
                && Objects.equals(notBefore, that.notBefore)
                && issuedAt.equals(that.issuedAt)
                && claims.equals(that.claims);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, subject, issuedAt);
    }

    @Override
    public String toString() {
        return "Token{"
                + "id='" + id + '\''
                + ", issuer='" + issuer + '\''
                + ", subject=" + subject
                + ", audience=" + audience
                + (expiration != null ? ", expiration=" + expiration : "")
                + (notBefore != null ? ", notBefore=" + notBefore : "")
                + ", issuedAt=" + issuedAt
                + ", claims=" + claims.keySet()
                + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link Token}. A random id is assigned when none is set.
     */
    public static final class Builder {
        private String id;
        private String issuer;
        private UUID subject;
        private Audience audience;
        private Instant expiration;
        private Instant notBefore;
        private Instant issuedAt;
        private Map<String, Object> claims = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder issuer(String issuer) {
            this.issuer = issuer;
            return this;
        }

        public Builder subject(UUID subject) {
            this.subject = subject;
            return this;
        }

        public Builder audience(Audience audience) {
            this.audience = audience;
            return this;
        }

        public Builder expiration(Instant expiration) {
            this.expiration = expiration;
            return this;
        }

        public Builder notBefore(Instant notBefore) {
            this.notBefore = notBefore;
            return this;
        }

        public Builder issuedAt(Instant issuedAt) {
            this.issuedAt = issuedAt;
            return this;
        }

        public Builder claims(Map<String, ?> claims) {
            this.claims = claims != null ? new LinkedHashMap<>(claims) : new LinkedHashMap<>();
            return this;
        }

        public Builder claim(String name, Object value) {
            this.claims.put(name, value);
            return this;
        }

        public Token build() {
            return new Token(this);
        }
    }
}
