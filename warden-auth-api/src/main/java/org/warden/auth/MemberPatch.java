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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Typed partial update of a {@link Member}: any subset of {@code title}, {@code owner} and
 * {@code roles}. The key of a membership cannot be patched.
 *
 * <pre>{@code
 * MemberPatch patch = MemberPatch.builder().title("Lead").build();
 * MemberPatch fromRequest = MemberPatch.fromMap(Map.of("owner", "true"));
 * }</pre>
 */
public final class MemberPatch {

    public static final String TITLE = "title";
    public static final String OWNER = "owner";
    public static final String ROLES = "roles";

    private final String title;
    private final Boolean owner;
    private final Set<UUID> roles;

    private MemberPatch(Builder builder) {
        this.title = builder.title;
        this.owner = builder.owner;
        this.roles = builder.roles != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(builder.roles))
                : null;
    }

    /**
     * Converts an untyped field map.
     *
     * <ul>
     *   <li>{@code title} - string</li>
     *   <li>{@code owner} - boolean, or the strings {@code "true"} / {@code "false"}</li>
     *   <li>{@code roles} - collection of {@link UUID}s or UUID strings</li>
     * </ul>
     *
     * @param fields field name to value
     * @return typed patch
     * @throws WardenException CONVERSION naming the field for unknown fields or mistyped values
     */
    public static MemberPatch fromMap(Map<String, ?> fields) throws WardenException {
        Builder builder = builder();
        for (Map.Entry<String, ?> entry : fields.entrySet()) {
            String field = entry.getKey();
            switch (field) {
                case TITLE:
                    builder.title(PatchValues.asString(field, entry.getValue()));
                    break;
                case OWNER:
                    builder.owner(PatchValues.asBoolean(field, entry.getValue()));
                    break;
                case ROLES:
                    builder.roles(PatchValues.asUuidSet(field, entry.getValue()));
                    break;
                default:
                    throw WardenException.conversion(field, "unknown field");
            }
        }
        return builder.build();
    }

    public Member applyTo(Member member) {
        Member.Builder builder = member.toBuilder();
        if (title != null) {
            builder.title(title);
        }
        if (owner != null) {
            builder.owner(owner);
        }
        if (roles != null) {
            builder.roles(roles);
        }
        return builder.build();
    }

    public Optional<String> getTitle() {
        return Optional.ofNullable(title);
    }

    public Optional<Boolean> getOwner() {
        return Optional.ofNullable(owner);
    }

    public Optional<Set<UUID>> getRoles() {
        return Optional.ofNullable(roles);
    }

    public boolean isEmpty() {
        return title == null && owner == null && roles == null;
    }

    @Override
    public String toString() {
        return "MemberPatch{"
                + (title != null ? "title='" + title + "' " : "")
                + (owner != null ? "owner=" + owner + " " : "")
                + (roles != null ? "roles=" + roles : "")
                + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link MemberPatch}.
     */
    public static final class Builder {
        private String title;
        private Boolean owner;
        private Set<UUID> roles;

        private Builder() {
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder owner(Boolean owner) {
            this.owner = owner;
            return this;
        }

        public Builder roles(Collection<UUID> roles) {
            this.roles = roles != null ? new LinkedHashSet<>(roles) : null;
            return this;
        }

        public MemberPatch build() {
            return new MemberPatch(this);
        }
    }
}
