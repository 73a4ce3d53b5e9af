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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Token audience: none, a single recipient or several.
 */
public final class Audience {

    /**
     * Shape of the audience claim.
     */
    public enum Kind {
        NONE,
        ONE,
        MANY
    }

    private static final Audience NONE = new Audience(Kind.NONE, Collections.emptyList());

    private final Kind kind;
    private final List<String> values;

    private Audience(Kind kind, List<String> values) {
        this.kind = kind;
        this.values = values;
    }

    public static Audience none() {
        return NONE;
    }

    public static Audience one(String value) {
        Objects.requireNonNull(value, "audience value is required");
        return new Audience(Kind.ONE, Collections.singletonList(value));
    }

    /**
     * Builds an audience from a collection: empty gives {@link Kind#NONE}, a single element
     * {@link Kind#ONE}, more {@link Kind#MANY}.
     *
     * @param values recipients
     * @return audience
     */
    public static Audience of(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return NONE;
        }
        if (values.size() == 1) {
            return one(values.iterator().next());
        }
        List<String> copy = new ArrayList<>(values.size());
        for (String value : values) {
            copy.add(Objects.requireNonNull(value, "audience value is required"));
        }
        return new Audience(Kind.MANY, Collections.unmodifiableList(copy));
    }

    public Kind getKind() {
        return kind;
    }

    public List<String> getValues() {
        return values;
    }

    public boolean isEmpty() {
        return kind == Kind.NONE;
    }

    public boolean contains(String value) {
        return values.contains(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Audience that = (Audience) o;
        return kind == that.kind && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, values);
    }

    @Override
    public String toString() {
        switch (kind) {
            case NONE:
                return "Audience{NONE}";
            case ONE:
                return "Audience{" + values.get(0) + "}";
            default:
                return "Audience{" + values + "}";
        }
    }
}
