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

/**
 * Kinds of failure shared by every Warden module.
 *
 * <p>Each kind carries a caller-facing status classification (HTTP-like) and whether it is an
 * expected, reportable outcome or an unexpected internal failure:
 * <ul>
 *   <li>Expected - NOT_FOUND, CONFLICT, UNAUTHORIZED, INVALID_TOKEN, EXPIRED_TOKEN, CONVERSION,
 *       UNSUPPORTED_OPERATION</li>
 *   <li>Unexpected - LOCK_POISONED, INCONSISTENT_DATA, INTERNAL. Log with full context and show the
 *       caller a generic failure.</li>
 * </ul>
 */
public enum ErrorCode {

    /** Record absent. */
    NOT_FOUND(404, true),

    /** Uniqueness violation on create. */
    CONFLICT(409, true),

    /** Credential mismatch. */
    UNAUTHORIZED(401, true),

    /** Token signature or format is not valid. */
    INVALID_TOKEN(401, true),

    /** Token is correctly signed but past its expiration. */
    EXPIRED_TOKEN(401, true),

    /** Malformed field value during patch or parse. */
    CONVERSION(400, true),

    /** Operation not defined for the entity. */
    UNSUPPORTED_OPERATION(405, true),

    /** Concurrency-control failure inside a store. */
    LOCK_POISONED(500, false),

    /** Derived structures disagree with the primary data. */
    INCONSISTENT_DATA(500, false),

    /** Unexpected lower-layer failure (hashing library, I/O, ...). */
    INTERNAL(500, false);

    private final int status;
    private final boolean expected;

    ErrorCode(int status, boolean expected) {
        this.status = status;
        this.expected = expected;
    }

    /**
     * Returns the default caller-facing status classification.
     *
     * @return HTTP-like status code
     */
    public int getStatus() {
        return status;
    }

    /**
     * Whether this kind is a normal, reportable outcome.
     *
     * @return true for expected outcomes, false for internal failures
     */
    public boolean isExpected() {
        return expected;
    }
}
