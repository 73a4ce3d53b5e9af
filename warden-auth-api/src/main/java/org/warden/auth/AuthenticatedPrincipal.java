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

/**
 * A principal together with the token issued for it. The user never carries a password.
 */
public final class AuthenticatedPrincipal {

    private final User user;
    private final Token token;
    private final String encodedToken;

    public AuthenticatedPrincipal(User user, Token token, String encodedToken) {
        this.user = Objects.requireNonNull(user, "user is required").withoutPassword();
        this.token = Objects.requireNonNull(token, "token is required");
        this.encodedToken = Objects.requireNonNull(encodedToken, "encodedToken is required");
    }

    public User getUser() {
        return user;
    }

    public Token getToken() {
        return token;
    }

    /**
     * Returns the signed token string to hand to the client.
     *
     * @return compact signed token
     */
    public String getEncodedToken() {
        return encodedToken;
    }

    @Override
    public String toString() {
        return "AuthenticatedPrincipal{user=" + user.getId() + ", token=" + token.getId() + "}";
    }
}
