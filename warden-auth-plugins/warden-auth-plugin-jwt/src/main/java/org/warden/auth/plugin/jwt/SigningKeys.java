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

import org.warden.auth.WardenConfig;
import org.warden.auth.WardenException;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;

import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;
import javax.crypto.SecretKey;

/**
 * Key set used to sign and verify tokens. Immutable once built.
 *
 * <ul>
 *   <li>{@link Algorithm#ES256} - ECDSA P-256 key pair; the private key signs, the public key verifies</li>
 *   <li>{@link Algorithm#HS256} - one 256-bit HMAC secret for both</li>
 * </ul>
 */
public final class SigningKeys {

    /**
     * Supported signing algorithms.
     */
    public enum Algorithm {
        ES256,
        HS256;

        /**
         * Parses a configured algorithm name case-insensitively.
         *
         * @param name algorithm name
         * @return algorithm
         * @throws WardenException CONVERSION on field {@code token.algorithm}
         */
        public static Algorithm parse(String name) throws WardenException {
            try {
                return valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw WardenException.conversion(WardenConfig.TOKEN_ALGORITHM,
                        "unknown signing algorithm '" + name + "', supported: ES256, HS256");
            }
        }
    }

    private final Algorithm algorithm;
    private final Key signingKey;
    private final Key verificationKey;

    private SigningKeys(Algorithm algorithm, Key signingKey, Key verificationKey) {
        this.algorithm = algorithm;
        this.signingKey = signingKey;
        this.verificationKey = verificationKey;
    }

    /**
     * Generates fresh key material.
     *
     * @param algorithm target algorithm
     * @return new key set
     */
    public static SigningKeys generate(Algorithm algorithm) {
        switch (algorithm) {
            case HS256:
                SecretKey secret = Jwts.SIG.HS256.key().build();
                return new SigningKeys(algorithm, secret, secret);
            case ES256:
                KeyPair pair = Jwts.SIG.ES256.keyPair().build();
                return new SigningKeys(algorithm, pair.getPrivate(), pair.getPublic());
            default:
                throw new IllegalArgumentException("Unknown algorithm: " + algorithm);
        }
    }

    public static SigningKeys hmac(byte[] secret) {
        SecretKey key = Keys.hmacShaKeyFor(secret);
        return new SigningKeys(Algorithm.HS256, key, key);
    }

    public static SigningKeys ecdsa(PrivateKey privateKey, PublicKey publicKey) {
        return new SigningKeys(Algorithm.ES256,
                Objects.requireNonNull(privateKey, "privateKey is required"),
                Objects.requireNonNull(publicKey, "publicKey is required"));
    }

    /**
     * Rebuilds keys from their persisted form.
     *
     * @param document persisted key document
     * @return key set
     * @throws WardenException INTERNAL if the document is incomplete or the keys do not decode
     */
    static SigningKeys fromDocument(SigningKeyDocument document) throws WardenException {
        Algorithm algorithm;
        try {
            algorithm = Algorithm.parse(Objects.requireNonNull(document.getAlgorithm(), "algorithm"));
        } catch (WardenException | NullPointerException e) {
            throw WardenException.internal("key file has no valid algorithm", e);
        }
        Base64.Decoder decoder = Base64.getDecoder();
        try {
            switch (algorithm) {
                case HS256:
                    return hmac(decoder.decode(required(document.getSecret(), "secret")));
                case ES256:
                    KeyFactory factory = KeyFactory.getInstance("EC");
                    PublicKey publicKey = factory.generatePublic(
                            new X509EncodedKeySpec(decoder.decode(required(document.getPublicKey(), "publicKey"))));
                    PrivateKey privateKey = factory.generatePrivate(
                            new PKCS8EncodedKeySpec(decoder.decode(required(document.getPrivateKey(), "privateKey"))));
                    return ecdsa(privateKey, publicKey);
                default:
                    throw WardenException.internal("unsupported algorithm " + algorithm, null);
            }
        } catch (GeneralSecurityException | RuntimeException e) {
            throw WardenException.internal("key file holds unreadable " + algorithm + " key material", e);
        }
    }

    SigningKeyDocument toDocument() {
        Base64.Encoder encoder = Base64.getEncoder();
        if (algorithm == Algorithm.HS256) {
            return new SigningKeyDocument(algorithm.name(), encoder.encodeToString(signingKey.getEncoded()),
                    null, null);
        }
        return new SigningKeyDocument(algorithm.name(), null,
                encoder.encodeToString(verificationKey.getEncoded()),
                encoder.encodeToString(signingKey.getEncoded()));
    }

    private static String required(String value, String field) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("missing " + field);
        }
        return value;
    }

    public Algorithm getAlgorithm() {
        return algorithm;
    }

    public Key getSigningKey() {
        return signingKey;
    }

    public Key getVerificationKey() {
        return verificationKey;
    }

    @Override
    public String toString() {
        return "SigningKeys{" + algorithm + "}";
    }
}
