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

import org.warden.auth.WardenConfig;
import org.warden.auth.WardenException;

/**
 * Complexity rules applied to every new password before it is hashed.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li><b>password.min_length</b> - Minimum password length, default: 8</li>
 *   <li><b>password.require_uppercase</b> - Require uppercase letters, default: false</li>
 *   <li><b>password.require_lowercase</b> - Require lowercase letters, default: false</li>
 *   <li><b>password.require_digit</b> - Require digits, default: false</li>
 *   <li><b>password.require_special</b> - Require special characters, default: false</li>
 * </ul>
 */
public final class PasswordPolicy {

    public static final int DEFAULT_MIN_LENGTH = 8;

    private static final String FIELD = "password";

    private final int minLength;
    private final boolean requireUppercase;
    private final boolean requireLowercase;
    private final boolean requireDigit;
    private final boolean requireSpecial;

    public PasswordPolicy(int minLength, boolean requireUppercase, boolean requireLowercase,
            boolean requireDigit, boolean requireSpecial) {
        if (minLength <= 0) {
            throw new IllegalArgumentException("minLength must be positive, got: " + minLength);
        }
        this.minLength = minLength;
        this.requireUppercase = requireUppercase;
        this.requireLowercase = requireLowercase;
        this.requireDigit = requireDigit;
        this.requireSpecial = requireSpecial;
    }

    public static PasswordPolicy fromConfig(WardenConfig config) {
        return new PasswordPolicy(
                config.getInt(WardenConfig.PASSWORD_MIN_LENGTH, DEFAULT_MIN_LENGTH),
                config.getBoolean(WardenConfig.PASSWORD_REQUIRE_UPPERCASE, false),
                config.getBoolean(WardenConfig.PASSWORD_REQUIRE_LOWERCASE, false),
                config.getBoolean(WardenConfig.PASSWORD_REQUIRE_DIGIT, false),
                config.getBoolean(WardenConfig.PASSWORD_REQUIRE_SPECIAL, false));
    }

    /**
     * Checks a candidate password. The message never echoes the password.
     *
     * @param password candidate plaintext
     * @throws WardenException CONVERSION on field {@code password} naming the first broken rule
     */
    public void check(String password) throws WardenException {
        if (password == null || password.isEmpty()) {
            throw WardenException.conversion(FIELD, "password is required");
        }
        if (password.length() < minLength) {
            throw WardenException.conversion(FIELD, "password must be at least " + minLength + " characters");
        }
        boolean upper = false;
        boolean lower = false;
        boolean digit = false;
        boolean special = false;
        for (int i = 0; i < password.length(); i++) {
            char c = password.charAt(i);
            if (Character.isUpperCase(c)) {
                upper = true;
            } else if (Character.isLowerCase(c)) {
                lower = true;
            } else if (Character.isDigit(c)) {
                digit = true;
            } else if (!Character.isWhitespace(c)) {
                special = true;
            }
        }
        if (requireUppercase && !upper) {
            throw WardenException.conversion(FIELD, "password must contain an uppercase letter");
        }
        if (requireLowercase && !lower) {
            throw WardenException.conversion(FIELD, "password must contain a lowercase letter");
        }
        if (requireDigit && !digit) {
            throw WardenException.conversion(FIELD, "password must contain a digit");
        }
        if (requireSpecial && !special) {
            throw WardenException.conversion(FIELD, "password must contain a special character");
        }
    }

    public int getMinLength() {
        return minLength;
    }

    @Override
    public String toString() {
        return "PasswordPolicy{minLength=" + minLength
                + ", upper=" + requireUppercase
                + ", lower=" + requireLowercase
                + ", digit=" + requireDigit
                + ", special=" + requireSpecial + "}";
    }
}
