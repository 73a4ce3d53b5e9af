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

import java.util.Locale;
import java.util.Objects;

/**
 * An email contact with its verification flag.
 */
public final class EmailAddress {

    private final String value;
    private final boolean verified;

    private EmailAddress(String value, boolean verified) {
        this.value = value;
        this.verified = verified;
    }

    /**
     * Validates and wraps an unverified address. An address is accepted when it contains both
     * {@code @} and {@code .}.
     *
     * @param value address text
     * @return unverified email address
     * @throws WardenException CONVERSION on field {@code email}
     */
    public static EmailAddress parse(String value) throws WardenException {
        return parse(value, false);
    }

    public static EmailAddress parse(String value, boolean verified) throws WardenException {
        if (value == null) {
            throw WardenException.conversion("email", "email is required");
        }
        String trimmed = value.trim();
        if (trimmed.indexOf('@') < 0 || trimmed.indexOf('.') < 0) {
            throw WardenException.conversion("email", "invalid email address");
        }
        return new EmailAddress(trimmed, verified);
    }

    public String getValue() {
        return value;
    }

    /**
     * Lookup form of the address, used as the unique index key.
     *
     * @return lower-cased address
     */
    public String normalized() {
        return value.toLowerCase(Locale.ROOT);
    }

    public boolean isVerified() {
        return verified;
    }

    public EmailAddress withVerified(boolean verified) {
        return new EmailAddress(value, verified);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        EmailAddress that = (EmailAddress) o;
        return verified == that.verified && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, verified);
    }

    @Override
    public String toString() {
        return value + (verified ? " (verified)" : "");
    }
}
