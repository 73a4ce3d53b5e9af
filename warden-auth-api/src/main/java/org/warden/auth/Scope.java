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

import com.google.common.base.Splitter;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * A resource-owner / resource-name / permission triple.
 *
 * <p>Canonical string form is {@code <owner-id>:<name>:<permission>}, e.g.
 * {@code 7f0c...:invoices:read}. {@link #parse(String)} accepts exactly that shape.
 */
public final class Scope {

    private static final Splitter FIELD_SPLITTER = Splitter.on(':');

    private final UUID ownerId;
    private final String name;
    private final Permission permission;

    public Scope(UUID ownerId, String name, Permission permission) {
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId is required");
        this.name = Objects.requireNonNull(name, "name is required");
        this.permission = Objects.requireNonNull(permission, "permission is required");
        if (name.isEmpty() || name.indexOf(':') >= 0) {
            throw new IllegalArgumentException("scope name must be non-empty and contain no ':'");
        }
    }

    /**
     * Parses the canonical string form.
     *
     * @param value scope text
     * @return parsed scope
     * @throws WardenException CONVERSION when the field count is not three, or the id or
     *         permission does not parse
     */
    public static Scope parse(String value) throws WardenException {
        if (value == null) {
            throw WardenException.conversion("scope", "scope is required");
        }
        List<String> parts = FIELD_SPLITTER.splitToList(value);
        if (parts.size() != 3) {
            throw WardenException.conversion("scope",
                    "expected 3 ':'-separated fields but got " + parts.size());
        }
        UUID ownerId;
        try {
            ownerId = UUID.fromString(parts.get(0));
        } catch (IllegalArgumentException e) {
            throw WardenException.conversion("id", "invalid owner id '" + parts.get(0) + "'");
        }
        // UUID.fromString also accepts short groups such as 1-1-1-1-1
        if (!ownerId.toString().equals(parts.get(0).toLowerCase(Locale.ROOT))) {
            throw WardenException.conversion("id", "owner id '" + parts.get(0) + "' is not in canonical form");
        }
        String name = parts.get(1);
        if (name.isEmpty()) {
            throw WardenException.conversion("name", "resource name is required");
        }
        return new Scope(ownerId, name, Permission.parse(parts.get(2)));
    }

    public UUID getOwnerId() {
        return ownerId;
    }

    public String getName() {
        return name;
    }

    public Permission getPermission() {
        return permission;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Scope that = (Scope) o;
        return ownerId.equals(that.ownerId)
                && name.equals(that.name)
                && permission == that.permission;
    }

    @Override
    public int hashCode() {
        return Objects.hash(ownerId, name, permission);
    }

    @Override
    public String toString() {
        return ownerId + ":" + name + ":" + permission;
    }
}
