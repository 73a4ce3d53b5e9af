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
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Association between a tenant and a principal, carrying a display title, an owner flag and
 * the role ids granted inside the tenant.
 *
 * <p>Role ids keep insertion order.
 */
public final class Member {

    private final MemberKey key;
    private final String title;
    private final boolean owner;
    private final Set<UUID> roles;

    private Member(Builder builder) {
        if (builder.tenantId == null || builder.principalId == null) {
            throw new NullPointerException("tenantId and principalId are required");
        }
        this.key = new MemberKey(builder.tenantId, builder.principalId);
        this.title = builder.title != null ? builder.title : "";
        this.owner = builder.owner;
        this.roles = Collections.unmodifiableSet(new LinkedHashSet<>(builder.roles));
    }

    public MemberKey getKey() {
        return key;
    }

    public UUID getTenantId() {
        return key.getTenantId();
    }

    public UUID getPrincipalId() {
        return key.getPrincipalId();
    }

    public String getTitle() {
        return title;
    }

    public boolean isOwner() {
        return owner;
    }

    public Set<UUID> getRoles() {
        return roles;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Member that = (Member) o;
        return owner == that.owner
                && key.equals(that.key)
                && title.equals(that.title)
                && roles.equals(that.roles);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, title, owner, roles);
    }

    @Override
    public String toString() {
        return "Member{"
                + "key=" + key
                + ", title='" + title + '\''
                + ", owner=" + owner
                + ", roles=" + roles
                + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder initialized with the values of this membership.
     *
     * @return builder with copied values
     */
    public Builder toBuilder() {
        return new Builder()
                .key(key)
                .title(title)
                .owner(owner)
                .roles(roles);
    }

    /**
     * Builder for {@link Member}.
     */
    public static final class Builder {
        private UUID tenantId;
        private UUID principalId;
        private String title;
        private boolean owner;
        private Set<UUID> roles = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder tenantId(UUID tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder principalId(UUID principalId) {
            this.principalId = principalId;
            return this;
        }

        public Builder key(MemberKey key) {
            this.tenantId = key.getTenantId();
            this.principalId = key.getPrincipalId();
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder owner(boolean owner) {
            this.owner = owner;
            return this;
        }

        public Builder roles(Collection<UUID> roles) {
            this.roles = roles != null ? new LinkedHashSet<>(roles) : new LinkedHashSet<>();
            return this;
        }

        public Builder addRole(UUID role) {
            this.roles.add(Objects.requireNonNull(role, "role"));
            return this;
        }

        /**
         * Builds the membership.
         *
         * @return the built membership
         * @throws NullPointerException if the tenant or principal id is missing
         */
        public Member build() {
            return new Member(this);
        }
    }
}
