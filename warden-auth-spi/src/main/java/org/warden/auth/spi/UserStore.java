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

import org.warden.auth.User;
import org.warden.auth.UserPatch;
import org.warden.auth.WardenException;

import java.util.Optional;
import java.util.UUID;

/**
 * Storage of principals. Email, phone and username are unique across the table.
 */
public interface UserStore extends Table<UUID, User, UserPatch> {

    String TABLE_NAME = "user";

    /**
     * Looks a user up by a login identifier: email, phone or username. Email and username
     * match case-insensitively.
     *
     * @param login login identifier
     * @return matching user with its stored password hash, or empty
     * @throws WardenException LOCK_POISONED on concurrency-control failure
     */
    Optional<User> findByLogin(String login) throws WardenException;
}
