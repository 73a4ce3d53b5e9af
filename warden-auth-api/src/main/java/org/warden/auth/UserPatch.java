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

import java.util.Map;
import java.util.Optional;

/**
 * Typed partial update of a {@link User}. Absent fields are left untouched.
 *
 * <p>Setting a new email or phone resets its verified flag unless the matching
 * {@code emailVerified} / {@code phoneVerified} field is also set.
 */
public final class UserPatch {

    public static final String USERNAME = "username";
    public static final String EMAIL = "email";
    public static final String PHONE = "phone";
    public static final String PASSWORD = "password";
    public static final String EMAIL_VERIFIED = "email_verified";
    public static final String PHONE_VERIFIED = "phone_verified";

    private final String username;
    private final EmailAddress email;
    private final Phone phone;
    private final String password;
    private final Boolean emailVerified;
    private final Boolean phoneVerified;

    private UserPatch(Builder builder) {
        this.username = builder.username;
        this.email = builder.email;
        this.phone = builder.phone;
        this.password = builder.password;
        this.emailVerified = builder.emailVerified;
        this.phoneVerified = builder.phoneVerified;
    }

    /**
     * Converts an untyped field map. Unknown fields and values of the wrong type are rejected.
     *
     * @param fields field name to value
     * @return typed patch
     * @throws WardenException CONVERSION naming the offending field
     */
    public static UserPatch fromMap(Map<String, ?> fields) throws WardenException {
        Builder builder = builder();
        for (Map.Entry<String, ?> entry : fields.entrySet()) {
            String field = entry.getKey();
            Object value = entry.getValue();
            switch (field) {
                case USERNAME:
                    String name = PatchValues.asString(field, value);
                    if (name.trim().isEmpty()) {
                        throw WardenException.conversion(field, "username must not be blank");
                    }
                    builder.username(name);
                    break;
                case EMAIL:
                    builder.email(EmailAddress.parse(PatchValues.asString(field, value)));
                    break;
                case PHONE:
                    builder.phone(Phone.parse(PatchValues.asString(field, value)));
                    break;
                case PASSWORD:
                    builder.password(PatchValues.asString(field, value));
                    break;
                case EMAIL_VERIFIED:
                    builder.emailVerified(PatchValues.asBoolean(field, value));
                    break;
                case PHONE_VERIFIED:
                    builder.phoneVerified(PatchValues.asBoolean(field, value));
                    break;
                default:
                    throw WardenException.conversion(field, "unknown field");
            }
        }
        return builder.build();
    }

    /**
     * Applies the present fields to {@code user}.
     *
     * @param user current record
     * @return patched copy
     * @throws WardenException CONVERSION when a verified flag targets a contact the user lacks
     */
    public User applyTo(User user) throws WardenException {
        Contact contact = user.getContact();
        if (email != null) {
            contact = contact.withEmail(email);
        }
        if (phone != null) {
            contact = contact.withPhone(phone);
        }
        if (emailVerified != null) {
            EmailAddress current = contact.getEmail().orElseThrow(
                    () -> WardenException.conversion(EMAIL_VERIFIED, "user has no email"));
            contact = contact.withEmail(current.withVerified(emailVerified));
        }
        if (phoneVerified != null) {
            Phone current = contact.getPhone().orElseThrow(
                    () -> WardenException.conversion(PHONE_VERIFIED, "user has no phone"));
            contact = contact.withPhone(current.withVerified(phoneVerified));
        }
        User.Builder builder = user.toBuilder().contact(contact);
        if (username != null) {
            builder.username(username);
        }
        if (password != null) {
            builder.password(password);
        }
        return builder.build();
    }

    public Optional<String> getUsername() {
        return Optional.ofNullable(username);
    }

    public Optional<EmailAddress> getEmail() {
        return Optional.ofNullable(email);
    }

    public Optional<Phone> getPhone() {
        return Optional.ofNullable(phone);
    }

    public Optional<String> getPassword() {
        return Optional.ofNullable(password);
    }

    public Optional<Boolean> getEmailVerified() {
        return Optional.ofNullable(emailVerified);
    }

    public Optional<Boolean> getPhoneVerified() {
        return Optional.ofNullable(phoneVerified);
    }

    public boolean isEmpty() {
        return username == null && email == null && phone == null && password == null
                && emailVerified == null && phoneVerified == null;
    }

    @Override
    public String toString() {
        return "UserPatch{"
                + (username != null ? "username='" + username + "' " : "")
                + (email != null ? "email=" + email + " " : "")
                + (phone != null ? "phone=" + phone + " " : "")
                + (password != null ? "password=[PROTECTED] " : "")
                + (emailVerified != null ? "emailVerified=" + emailVerified + " " : "")
                + (phoneVerified != null ? "phoneVerified=" + phoneVerified : "")
                + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link UserPatch}.
     */
    public static final class Builder {
        private String username;
        private EmailAddress email;
        private Phone phone;
        private String password;
        private Boolean emailVerified;
        private Boolean phoneVerified;

        private Builder() {
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder email(EmailAddress email) {
            this.email = email;
            return this;
        }

        public Builder phone(Phone phone) {
            this.phone = phone;
            return this;
        }

        /**
         * Sets a replacement password hash.
         *
         * @param password already hashed password
         * @return this builder
         */
        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder emailVerified(Boolean emailVerified) {
            this.emailVerified = emailVerified;
            return this;
        }

        public Builder phoneVerified(Boolean phoneVerified) {
            this.phoneVerified = phoneVerified;
            return this;
        }

        public UserPatch build() {
            return new UserPatch(this);
        }
    }
}
