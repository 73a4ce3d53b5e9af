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

/**
 * Permission part of a {@link Scope}. Rendered lower case, parsed case-insensitively.
 */
public enum Permission {
    READ,
    WRITE,
    DELETE,
    ADMIN;

    /**
     * Parses a permission name.
     *
     * @param value permission text such as {@code read} or {@code WRITE}
     * @return matching permission
     * @throws WardenException CONVERSION on field {@code permission} if the name is unknown
     */
    public static Permission parse(String value) throws WardenException {
        if (value == null || value.trim().isEmpty()) {
            throw WardenException.conversion("permission", "permission is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw WardenException.conversion("permission", "unknown permission '" + value + "'");
        }
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
