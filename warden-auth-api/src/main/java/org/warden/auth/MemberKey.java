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
import java.util.UUID;

/**
 * Composite primary key of a {@link Member}: (tenant id, principal id).
 */
public final class MemberKey {

    private final UUID tenantId;
    private final UUID principalId;

    public MemberKey(UUID tenantId, UUID principalId) {
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId is required");
        this.principalId = Objects.requireNonNull(principalId, "principalId is required");
    }

    public static MemberKey of(UUID tenantId, UUID principalId) {
        return new MemberKey(tenantId, principalId);
    }

    public UUID getTenantId() {
        return tenantId;
    }

    public UUID getPrincipalId() {
        return principalId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        MemberKey that = (MemberKey) o;
        return tenantId.equals(that.tenantId) && principalId.equals(that.principalId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tenantId, principalId);
    }

    @Override
    public String toString() {
        return "(" + tenantId + ", " + principalId + ")";
    }
}
