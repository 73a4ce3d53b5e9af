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

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a login attempt.
 *
 * <p>Authentication can result in one of two states:
 * <ul>
 *   <li>{@link Status#SUCCESS} - the principal and its freshly issued token are available</li>
 *   <li>{@link Status#FAILURE} - the exception explains why</li>
 * </ul>
 *
 * <p>{@link Status} drives control flow. Expected failures (unknown login, wrong password,
 * locked account) are returned as {@link #failure(WardenException)}; the reason keeps its
 * {@link ErrorCode} for logging, while {@link #getPublicMessage()} is the same for all of them
 * so that callers cannot tell an unknown account from a wrong password.
 */
public final class AuthenticationResult {

    /**
     * Authentication result status.
     */
    public enum Status {
        /**
         * Authentication successful.
         * The principal is available via {@link AuthenticationResult#getPrincipal()}.
         */
        SUCCESS,

        /**
         * Authentication failed.
         * The exception is available via {@link AuthenticationResult#getException()}.
         */
        FAILURE
    }

    static final String FAILURE_MESSAGE = "invalid credentials";

    private final Status status;
    private final AuthenticatedPrincipal principal;
    private final WardenException exception;

    private AuthenticationResult(Status status, AuthenticatedPrincipal principal, WardenException exception) {
        this.status = Objects.requireNonNull(status, "status is required");
        this.principal = principal;
        this.exception = exception;
    }

    /**
     * Creates a successful authentication result.
     *
     * @param principal the authenticated principal with its token
     * @return success result
     * @throws NullPointerException if principal is null
     */
    public static AuthenticationResult success(AuthenticatedPrincipal principal) {
        Objects.requireNonNull(principal, "principal is required for success");
        return new AuthenticationResult(Status.SUCCESS, principal, null);
    }

    /**
     * Creates a failure result.
     *
     * @param exception the exception describing the failure
     * @return failure result
     * @throws NullPointerException if exception is null
     */
    public static AuthenticationResult failure(WardenException exception) {
        Objects.requireNonNull(exception, "exception is required for failure");
        return new AuthenticationResult(Status.FAILURE, null, exception);
    }

    public Status getStatus() {
        return status;
    }

    /**
     * Returns the authenticated principal if successful.
     *
     * @return the principal, or null if not successful
     */
    public AuthenticatedPrincipal getPrincipal() {
        return principal;
    }

    public Optional<AuthenticatedPrincipal> principal() {
        return Optional.ofNullable(principal);
    }

    /**
     * Returns the failure reason. Its code distinguishes NOT_FOUND from UNAUTHORIZED for
     * internal logging; do not show it to the caller.
     *
     * @return the exception, or null if not FAILURE
     */
    public WardenException getException() {
        return exception;
    }

    public Optional<WardenException> exception() {
        return Optional.ofNullable(exception);
    }

    /**
     * Returns the caller-facing failure message. Unexpected failures (status 500 or above) read
     * {@code internal server error}; every expected failure reads {@code invalid credentials}.
     *
     * @return public message, or empty for success
     */
    public Optional<String> getPublicMessage() {
        if (exception == null) {
            return Optional.empty();
        }
        return Optional.of(exception.getStatus() >= 500 ? exception.getPublicMessage() : FAILURE_MESSAGE);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isFailure() {
        return status == Status.FAILURE;
    }

    @Override
    public String toString() {
        switch (status) {
            case SUCCESS:
                return "AuthenticationResult{SUCCESS, principal=" + principal.getUser().getId() + "}";
            case FAILURE:
                return "AuthenticationResult{FAILURE, code=" + exception.getCode()
                        + ", error=" + exception.getMessage() + "}";
            default:
                return "AuthenticationResult{" + status + "}";
        }
    }
}
