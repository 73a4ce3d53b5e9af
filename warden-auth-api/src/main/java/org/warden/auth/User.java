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
import java.util.UUID;

/**
 * An authenticable identity.
 *
 * <p>The password field holds a hash (never plaintext once persisted) and is cleared with
 * {@link #withoutPassword()} before a user is handed back to callers.
 *
 * <pre>{@code
 * User user = User.builder()
 *     .username("alice")
 *     .contact(Contact.email(EmailAddress.parse("alice@example.com")))
 *     .password("secret123")
 *     .build();
 * }</pre>
 */
public final class User {

    private final UUID id;
    private final String username;
    private final Contact contact;
    private final String password;

    private User(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID();
        this.username = Objects.requireNonNull(builder.username, "username is required");
        this.contact = Objects.requireNonNull(builder.contact, "contact is required");
        this.password = builder.password;
        if (username.trim().isEmpty()) {
            throw new IllegalArgumentException("username must not be blank");
        }
    }

    public UUID getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public Contact getContact() {
        return contact;
    }

    public Optional<String> getPassword() {
        return Optional.ofNullable(password);
    }

    /**
     * Returns a copy with the password field cleared.
     *
     * @return user without credential
     */
    public User withoutPassword() {
        if (password == null) {
            return this;
        }
        return toBuilder().password(null).build();
    }

    public User withPassword(String password) {
        return toBuilder().password(password).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        User that = (User) o;
        return id.equals(that.id)
                && username.equals(that.username)
                && contact.equals(that.contact)
                && Objects.equals(password, that.password);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, username, contact);
    }

    @Override
    public String toString() {
        return "User{"
                + "id=" + id
                + ", username='" + username + '\''
                + ", contact=" + contact
                + ", password=" + (password != null ? "[PROTECTED]" : "none")
                + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .username(username)
                .contact(contact)
                .password(password);
    }

    /**
     * Builder for {@link User}. A random id is assigned when none is set.
     */
    public static final class Builder {
        private UUID id;
        private String username;
        private Contact contact;
        private String password;

        private Builder() {
        }

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder contact(Contact contact) {
            this.contact = contact;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public User build() {
            return new User(this);
        }
    }
}
