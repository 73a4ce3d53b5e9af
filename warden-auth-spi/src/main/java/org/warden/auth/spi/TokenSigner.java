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

import org.warden.auth.Token;
import org.warden.auth.WardenException;

/**
 * Token signing capability.
 *
 * <p>Verification only checks integrity and decodes the claims. Time-window checks
 * (expiration, not-before) are the caller's job, so an expired but correctly signed token
 * verifies.
 */
public interface TokenSigner extends AutoCloseable {

    String algorithm();

    /**
     * Serializes and signs a token.
     *
     * @param token token to sign
     * @return compact signed string
     * @throws WardenException CONVERSION if a custom claim cannot be encoded, INTERNAL on
     *         signing failure
     */
    String sign(Token token) throws WardenException;

    /**
     * Verifies the signature of a token string and decodes it.
     *
     * @param encoded compact signed string
     * @return decoded token
     * @throws WardenException INVALID_TOKEN on a bad signature or malformed input
     */
    Token verify(String encoded) throws WardenException;

    @Override
    default void close() {
    }
}
