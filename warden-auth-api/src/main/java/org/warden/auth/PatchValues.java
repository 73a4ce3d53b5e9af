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

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Conversions shared by the patch descriptors' {@code fromMap} factories.
 */
final class PatchValues {

    private PatchValues() {
    }

    static String asString(String field, Object value) throws WardenException {
        if (value instanceof String) {
            return (String) value;
        }
        throw WardenException.conversion(field, "expected a string but got " + describe(value));
    }

    static boolean asBoolean(String field, Object value) throws WardenException {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if ("true".equalsIgnoreCase(text)) {
                return true;
            }
            if ("false".equalsIgnoreCase(text)) {
                return false;
            }
        }
        throw WardenException.conversion(field, "expected a boolean but got " + describe(value));
    }

    static Set<UUID> asUuidSet(String field, Object value) throws WardenException {
        if (!(value instanceof Collection)) {
            throw WardenException.conversion(field, "expected a list of ids but got " + describe(value));
        }
        Set<UUID> ids = new LinkedHashSet<>();
        for (Object element : (Collection<?>) value) {
            if (element instanceof UUID) {
                ids.add((UUID) element);
            } else if (element instanceof String) {
                try {
                    ids.add(UUID.fromString((String) element));
                } catch (IllegalArgumentException e) {
                    throw WardenException.conversion(field, "invalid id '" + element + "'");
                }
            } else {
                throw WardenException.conversion(field, "expected an id but got " + describe(element));
            }
        }
        return ids;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
