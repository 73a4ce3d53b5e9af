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

import org.warden.auth.EmailAddress;
import org.warden.auth.Phone;
import org.warden.auth.User;
import org.warden.auth.UserPatch;
import org.warden.auth.WardenException;
import org.warden.auth.spi.UserStore;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory {@link UserStore} with unique email, phone and username indexes.
 */
public class MemoryUserStore extends MemoryTable<UUID, User, UserPatch> implements UserStore {

    // guarded by the table lock
    private final Map<String, UUID> byEmail = new HashMap<>();
    private final Map<String, UUID> byPhone = new HashMap<>();
    private final Map<String, UUID> byUsername = new HashMap<>();

    public MemoryUserStore() {
        super(TABLE_NAME);
    }

    @Override
    public Optional<User> findByLogin(String login) throws WardenException {
        if (login == null || login.trim().isEmpty()) {
            return Optional.empty();
        }
        String trimmed = login.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        return inReadLock(() -> {
            UUID id = byEmail.get(lower);
            if (id == null) {
                id = byPhone.get(trimmed);
            }
            if (id == null) {
                id = byUsername.get(lower);
            }
            return id == null ? Optional.<User>empty() : Optional.ofNullable(rowOrNull(id));
        });
    }

    @Override
    protected UUID keyOf(User item) {
        return item.getId();
    }

    @Override
    protected User applyPatch(User current, UserPatch patch) throws WardenException {
        return patch.applyTo(current);
    }

    /**
     * Email, phone and username share one login namespace: a value taken in any index by
     * another user is a conflict, otherwise {@link #findByLogin} could not reach both users.
     */
    @Override
    protected void checkUnique(User item, User replaced) throws WardenException {
        UUID id = item.getId();
        Optional<String> email = item.getContact().getEmail().map(EmailAddress::normalized);
        if (email.isPresent() && isLoginTakenByOther(email.get(), id)) {
            throw WardenException.conflict("email");
        }
        Optional<String> phone = item.getContact().getPhone().map(Phone::getValue);
        if (phone.isPresent() && isLoginTakenByOther(phone.get(), id)) {
            throw WardenException.conflict("phone");
        }
        if (isLoginTakenByOther(item.getUsername().trim(), id)) {
            throw WardenException.conflict("username");
        }
    }

    @Override
    protected void indexAdd(User item) {
        item.getContact().getEmail().ifPresent(email -> byEmail.put(email.normalized(), item.getId()));
        item.getContact().getPhone().ifPresent(phone -> byPhone.put(phone.getValue(), item.getId()));
        byUsername.put(usernameKey(item), item.getId());
    }

    @Override
    protected void indexRemove(User item) {
        item.getContact().getEmail().ifPresent(email -> byEmail.remove(email.normalized(), item.getId()));
        item.getContact().getPhone().ifPresent(phone -> byPhone.remove(phone.getValue(), item.getId()));
        byUsername.remove(usernameKey(item), item.getId());
    }

    @Override
    protected void indexClear() {
        byEmail.clear();
        byPhone.clear();
        byUsername.clear();
    }

    private boolean isLoginTakenByOther(String login, UUID id) {
        String lower = login.toLowerCase(Locale.ROOT);
        return isTakenByOther(byEmail, lower, id)
                || isTakenByOther(byPhone, login, id)
                || isTakenByOther(byUsername, lower, id);
    }

    private static boolean isTakenByOther(Map<String, UUID> index, String value, UUID id) {
        UUID owner = index.get(value);
        return owner != null && !owner.equals(id);
    }

    private static String usernameKey(User user) {
        return user.getUsername().trim().toLowerCase(Locale.ROOT);
    }
}
