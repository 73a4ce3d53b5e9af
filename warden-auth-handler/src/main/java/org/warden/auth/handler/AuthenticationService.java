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

import org.warden.auth.AuthenticatedPrincipal;
import org.warden.auth.AuthenticationResult;
import org.warden.auth.User;
import org.warden.auth.UserPatch;
import org.warden.auth.WardenException;
import org.warden.auth.spi.UserStore;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Authentication orchestrator: registration, password login and token authorization.
 *
 * <p>Login flow:
 * <ol>
 *   <li>Reject login strings locked by {@link LoginAttemptTracker}</li>
 *   <li>Look the principal up by email, phone or username</li>
 *   <li>Reject principals locked under any of their logins</li>
 *   <li>Verify the password against the stored hash</li>
 *   <li>Upgrade the stored hash if the hasher settings changed</li>
 *   <li>Issue a token</li>
 * </ol>
 *
 * <p>An unknown login and a wrong password both come back as a FAILURE result. Their codes
 * (NOT_FOUND and UNAUTHORIZED) differ for logging, while
 * {@link AuthenticationResult#getPublicMessage()} reads the same for both.
 */
public class AuthenticationService {

    private static final Logger LOG = LogManager.getLogger(AuthenticationService.class);

    private final UserStore users;
    private final CredentialService credentials;
    private final TokenService tokens;
    private final LoginAttemptTracker attempts;

    public AuthenticationService(UserStore users, CredentialService credentials, TokenService tokens,
            LoginAttemptTracker attempts) {
        this.users = Objects.requireNonNull(users, "users");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.attempts = Objects.requireNonNull(attempts, "attempts");
    }

    /**
     * Registers a principal and signs a token for it. If the store rejects the user the hash is
     * dropped and no token is issued.
     *
     * @param user new principal carrying a plaintext password
     * @return the stored user, without password, and its token
     * @throws WardenException CONVERSION if the password breaks the policy, CONFLICT if the id,
     *         email, phone or username is taken, INTERNAL on hashing or signing failures
     */
    public AuthenticatedPrincipal register(User user) throws WardenException {
        Objects.requireNonNull(user, "user");
        String hash = credentials.hashNew(user.getPassword().orElse(null));
        UUID id = users.create(user.withPassword(hash));
        IssuedToken issued = tokens.issue(id);
        LOG.info("Registered principal {} ({})", id, user.getUsername());
        return new AuthenticatedPrincipal(user, issued.getToken(), issued.getEncoded());
    }

    /**
     * Authenticates with a login (email, phone or username) and a plaintext password.
     *
     * @param login lookup key
     * @param password plaintext password
     * @return SUCCESS with principal and token, or FAILURE with the reason
     */
    public AuthenticationResult authenticate(String login, String password) {
        if (attempts.isLocked(login)) {
            attempts.recordFailure(login);
            return locked(login);
        }
        try {
            Optional<User> found = users.findByLogin(login);
            if (!found.isPresent()) {
                attempts.recordFailure(login);
                LOG.info("Failed login '{}': unknown principal", login);
                return AuthenticationResult.failure(WardenException.notFound(UserStore.TABLE_NAME));
            }
            User user = found.get();
            if (attempts.isLocked(user.getId())) {
                attempts.recordFailure(user.getId());
                return locked(login);
            }
            Optional<String> storedHash = user.getPassword();
            if (!storedHash.isPresent() || !credentials.verify(password, storedHash.get())) {
                attempts.recordFailure(user.getId());
                LOG.info("Failed login '{}': password mismatch for {}", login, user.getId());
                return AuthenticationResult.failure(WardenException.unauthorized("password mismatch"));
            }
            attempts.reset(user.getId());
            attempts.reset(login);
            rehashIfNeeded(user, password, storedHash.get());
            IssuedToken issued = tokens.issue(user.getId());
            LOG.debug("Authenticated {} via '{}'", user.getId(), login);
            return AuthenticationResult.success(
                    new AuthenticatedPrincipal(user, issued.getToken(), issued.getEncoded()));
        } catch (WardenException e) {
            LOG.warn("Login '{}' failed unexpectedly: {}", login, e.getMessage(), e);
            return AuthenticationResult.failure(e);
        }
    }

    private static AuthenticationResult locked(String login) {
        LOG.info("Rejected login '{}': temporarily locked", login);
        return AuthenticationResult.failure(WardenException.unauthorized(
                "account temporarily locked due to too many failed login attempts"));
    }

    /**
     * Returns the principal id of a valid, unexpired token.
     *
     * @throws WardenException INVALID_TOKEN or EXPIRED_TOKEN
     */
    public UUID authorize(String token) throws WardenException {
        return tokens.authorize(token);
    }

    private void rehashIfNeeded(User user, String password, String storedHash) {
        if (!credentials.needsRehash(storedHash)) {
            return;
        }
        try {
            String upgraded = credentials.hash(password);
            users.patch(user.getId(), UserPatch.builder().password(upgraded).build());
            LOG.info("Rehashed password of {} with {}", user.getId(), credentials.getHasher().algorithm());
        } catch (WardenException e) {
            // the login itself succeeded; the next one retries
            LOG.warn("Failed to rehash password of {}: {}", user.getId(), e.getMessage(), e);
        }
    }

    public TokenService getTokenService() {
        return tokens;
    }

    public CredentialService getCredentialService() {
        return credentials;
    }

    public LoginAttemptTracker getAttemptTracker() {
        return attempts;
    }
}
