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


package org.warden.auth.store.memory;

import org.warden.auth.WardenException;
import org.warden.auth.spi.Database;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Process-scoped in-memory database. Construct one at startup and pass it to the components
 * that need storage; {@link #close()} drops all data.
 */
public class MemoryDatabase implements Database {

    private static final Logger LOG = LogManager.getLogger(MemoryDatabase.class);

    private final MemoryUserStore users = new MemoryUserStore();
    private final MemoryMemberStore members = new MemoryMemberStore();

    @Override
    public MemoryUserStore users() {
        return users;
    }

    @Override
    public MemoryMemberStore members() {
        return members;
    }

    @Override
    public void close() {
        clear(users);
        clear(members);
        LOG.info("Closed in-memory database");
    }

    private static void clear(MemoryTable<?, ?, ?> table) {
        try {
            table.clear();
        } catch (WardenException e) {
            LOG.warn("Could not clear table {} on close", table.name(), e);
        }
    }
}
