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

/**
 * A phone contact with its verification flag.
 */
public final class Phone {

    private final String value;
    private final boolean verified;

    private Phone(String value, boolean verified) {
        this.value = value;
        this.verified = verified;
    }

    public static Phone parse(String value) throws WardenException {
        return parse(value, false);
    }

    /**
     * Wraps a phone number. Only blankness is checked.
     *
     * @param value phone number text
     * @param verified whether ownership of the number was confirmed
     * @return phone contact
     * @throws WardenException CONVERSION on field {@code phone} when blank
     */
    public static Phone parse(String value, boolean verified) throws WardenException {
        if (value == null || value.trim().isEmpty()) {
            throw WardenException.conversion("phone", "phone is required");
        }
        return new Phone(value.trim(), verified);
    }

    public String getValue() {
        return value;
    }

    public boolean isVerified() {
        return verified;
    }

    public Phone withVerified(boolean verified) {
        return new Phone(value, verified);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Phone that = (Phone) o;
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
