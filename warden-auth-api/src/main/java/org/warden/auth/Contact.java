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
 * Phone and/or email of a {@link User}. At least one of the two is present.
 */
public final class Contact {

    private final EmailAddress email;
    private final Phone phone;

    private Contact(EmailAddress email, Phone phone) {
        if (email == null && phone == null) {
            throw new IllegalArgumentException("contact requires an email or a phone");
        }
        this.email = email;
        this.phone = phone;
    }

    public static Contact of(EmailAddress email, Phone phone) {
        return new Contact(email, phone);
    }

    public static Contact email(EmailAddress email) {
        return new Contact(Objects.requireNonNull(email, "email is required"), null);
    }

    public static Contact phone(Phone phone) {
        return new Contact(null, Objects.requireNonNull(phone, "phone is required"));
    }

    public Optional<EmailAddress> getEmail() {
        return Optional.ofNullable(email);
    }

    public Optional<Phone> getPhone() {
        return Optional.ofNullable(phone);
    }

    public Contact withEmail(EmailAddress email) {
        return new Contact(email, phone);
    }

    public Contact withPhone(Phone phone) {
        return new Contact(email, phone);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Contact that = (Contact) o;
        return Objects.equals(email, that.email) && Objects.equals(phone, that.phone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(email, phone);
    }

    @Override
    public String toString() {
        return "Contact{"
                + (email != null ? "email=" + email : "")
                + (email != null && phone != null ? ", " : "")
                + (phone != null ? "phone=" + phone : "")
                + '}';
    }
}
