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
 * The single failure type raised by Warden stores, capabilities and services.
 *
 * <p>Library and adapter failures (lock interruption, jjwt, BCrypt, I/O) are translated into a
 * {@code WardenException} at the module that talks to the library, so callers only ever see
 * an {@link ErrorCode}.
 *
 * <p>Use the static factories:
 * <pre>{@code
 * throw WardenException.notFound("member");
 * throw WardenException.conversion("owner", "expected a boolean");
 * throw WardenException.internal("hashing failed", cause);
 * }</pre>
 */
public class WardenException extends Exception {

    private static final long serialVersionUID = 1L;

    private static final String INTERNAL_MESSAGE = "internal server error";

    private final ErrorCode code;
    private final String item;
    private final String field;
    private final int status;

    public WardenException(ErrorCode code, String message) {
        this(code, message, null, null, code.getStatus(), null);
    }

    public WardenException(ErrorCode code, String message, Throwable cause) {
        this(code, message, null, null, code.getStatus(), cause);
    }

    private WardenException(ErrorCode code, String message, String item, String field, int status,
                            Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.item = item;
        this.field = field;
        this.status = status;
    }

    public static WardenException notFound(String item) {
        return new WardenException(ErrorCode.NOT_FOUND, item + " not found", item, null,
                ErrorCode.NOT_FOUND.getStatus(), null);
    }

    public static WardenException conflict(String item) {
        return new WardenException(ErrorCode.CONFLICT, item + " already exists", item, null,
                ErrorCode.CONFLICT.getStatus(), null);
    }

    public static WardenException unauthorized(String message) {
        return new WardenException(ErrorCode.UNAUTHORIZED, message);
    }

    public static WardenException invalidToken(String message, Throwable cause) {
        return new WardenException(ErrorCode.INVALID_TOKEN, message, cause);
    }

    public static WardenException expiredToken() {
        return new WardenException(ErrorCode.EXPIRED_TOKEN, "expired token");
    }

    /**
     * Creates a conversion error for a caller-supplied value.
     *
     * @param field offending field name, may be null
     * @param message description of what was expected, may be null
     * @return conversion error with status 400
     */
    public static WardenException conversion(String field, String message) {
        return conversion(field, message, ErrorCode.CONVERSION.getStatus());
    }

    /**
     * Creates a conversion error with an explicit status classification. A status of 500 or
     * above marks a conversion of data the system itself produced.
     *
     * @param field offending field name, may be null
     * @param message description of what was expected, may be null
     * @param status caller-facing status classification
     * @return conversion error
     */
    public static WardenException conversion(String field, String message, int status) {
        String text = message != null ? message : "invalid data format";
        if (field != null) {
            text = text + " for field `" + field + "`";
        }
        return new WardenException(ErrorCode.CONVERSION, text, null, field, status, null);
    }

    public static WardenException lockPoisoned(String item, Throwable cause) {
        return new WardenException(ErrorCode.LOCK_POISONED, "lock poisoned on " + item, item, null,
                ErrorCode.LOCK_POISONED.getStatus(), cause);
    }

    public static WardenException inconsistentData(String item, String message) {
        return new WardenException(ErrorCode.INCONSISTENT_DATA, "data inconsistency in " + item + ": " + message,
                item, null, ErrorCode.INCONSISTENT_DATA.getStatus(), null);
    }

    public static WardenException unsupported(String message) {
        return new WardenException(ErrorCode.UNSUPPORTED_OPERATION, message);
    }

    public static WardenException internal(String message, Throwable cause) {
        return new WardenException(ErrorCode.INTERNAL, message, cause);
    }

    public ErrorCode getCode() {
        return code;
    }

    /**
     * Returns the table or item name the failure refers to (NOT_FOUND, CONFLICT, LOCK_POISONED).
     *
     * @return optional item name
     */
    public Optional<String> getItem() {
        return Optional.ofNullable(item);
    }

    /**
     * Returns the offending field of a CONVERSION failure.
     *
     * @return optional field name
     */
    public Optional<String> getField() {
        return Optional.ofNullable(field);
    }

    public int getStatus() {
        return status;
    }

    public boolean isExpected() {
        return code.isExpected() && status < 500;
    }

    /**
     * Returns the message that may be shown to an external caller. Internal details never leak:
     * anything classified 500 or above reads {@code internal server error}.
     *
     * @return caller-facing message
     */
    public String getPublicMessage() {
        if (status >= 500) {
            return INTERNAL_MESSAGE;
        }
        switch (code) {
            case UNAUTHORIZED:
                return "invalid credentials";
            case INVALID_TOKEN:
                return "invalid token";
            case EXPIRED_TOKEN:
                return "expired token";
            case UNSUPPORTED_OPERATION:
                return "unsupported operation";
            default:
                return getMessage();
        }
    }

    @Override
    public String toString() {
        return getClass().getName() + "[" + code + "]: " + getMessage();
    }
}
