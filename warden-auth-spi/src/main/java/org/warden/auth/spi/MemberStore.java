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


package org.warden.auth.spi;

import org.warden.auth.Member;
import org.warden.auth.MemberKey;
import org.warden.auth.MemberPatch;
import org.warden.auth.WardenException;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Storage of memberships keyed by (tenant id, principal id), with two secondary indexes:
 * tenant to principal ids and principal to tenant ids.
 *
 * <p>For every stored membership (t, p), {@code principalsOf(t)} contains p and
 * {@code tenantsOf(p)} contains t, each at most once; no index entry exists without a
 * membership behind it.
 */
public interface MemberStore extends Table<MemberKey, Member, MemberPatch> {

    String TABLE_NAME = "member";

    /**
     * Replaces the membership stored under {@code key}. When {@code member} carries a different
     * key the membership is moved.
     *
     * @param key key of the membership to replace
     * @param member replacement
     * @return key the membership is now stored under
     * @throws WardenException NOT_FOUND if {@code key} is absent, CONFLICT if a move targets a
     *         key held by another membership
     */
    MemberKey update(MemberKey key, Member member) throws WardenException;

    List<Member> findByTenant(UUID tenantId) throws WardenException;

    List<Member> findByPrincipal(UUID principalId) throws WardenException;

    /**
     * Principal ids of a tenant, in the order they joined.
     *
     * @param tenantId tenant id
     * @return principal ids, empty if the tenant has no members
     * @throws WardenException LOCK_POISONED on concurrency-control failure
     */
    List<UUID> principalsOf(UUID tenantId) throws WardenException;

    List<UUID> tenantsOf(UUID principalId) throws WardenException;

    /**
     * Field deletion is not defined for memberships.
     *
     * @param key membership key
     * @param fields names of the fields to delete
     * @throws WardenException always UNSUPPORTED_OPERATION
     */
    void deleteFields(MemberKey key, Collection<String> fields) throws WardenException;

    /**
     * Verifies that both secondary indexes agree with the primary table.
     *
     * @throws WardenException INCONSISTENT_DATA describing the first disagreement found
     */
    void checkConsistency() throws WardenException;
}
