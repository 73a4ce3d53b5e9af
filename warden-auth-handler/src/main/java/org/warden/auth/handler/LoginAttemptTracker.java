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


package org.warden.auth.handler;

import org.warden.auth.WardenConfig;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Brute-force protection. A key is locked once {@code maxAttempts} failures fall within
 * {@code lockout} of the first one, and unlocks when that window has passed.
 *
 * <p>Failures are counted per principal once the login resolves to one, so the email, phone and
 * username of an account share a single budget. Logins that match nobody are counted by the
 * normalised login string.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li><b>brute_force.max_attempts</b> - Max failed attempts before lockout, default: 5</li>
 *   <li><b>brute_force.lockout_duration_seconds</b> - Lockout duration, default: 300 (5 min)</li>
 * </ul>
 */
public class LoginAttemptTracker {

    private static final Logger LOG = LogManager.getLogger(LoginAttemptTracker.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final int DEFAULT_LOCKOUT_DURATION = 300; // 5 minutes

    private final Map<String, FailureWindow> byLogin = new ConcurrentHashMap<>();
    private final Map<UUID, FailureWindow> byPrincipal = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int maxAttempts;
    private final Duration lockout;

    public LoginAttemptTracker(Clock clock, int maxAttempts, Duration lockout) {
        this.clock = Objects.requireNonNull(clock, "clock");
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive, got: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.lockout = Objects.requireNonNull(lockout, "lockout");
    }

    public static LoginAttemptTracker fromConfig(Clock clock, WardenConfig config) {
        return new LoginAttemptTracker(clock,
                config.getInt(WardenConfig.MAX_ATTEMPTS, DEFAULT_MAX_ATTEMPTS),
                Duration.ofSeconds(config.getInt(WardenConfig.LOCKOUT_DURATION, DEFAULT_LOCKOUT_DURATION)));
    }

    public boolean isLocked(String login) {
        return isLocked(byLogin, normalize(login));
    }

    public boolean isLocked(UUID principalId) {
        return isLocked(byPrincipal, principalId);
    }

    public void recordFailure(String login) {
        recordFailure(byLogin, normalize(login), login);
    }

    public void recordFailure(UUID principalId) {
        recordFailure(byPrincipal, principalId, principalId);
    }

    public void reset(String login) {
        byLogin.remove(normalize(login));
    }

    public void reset(UUID principalId) {
        byPrincipal.remove(principalId);
    }

    public int getFailureCount(String login) {
        return count(byLogin.get(normalize(login)));
    }

    public int getFailureCount(UUID principalId) {
        return count(byPrincipal.get(principalId));
    }

    public void clear() {
        byLogin.clear();
        byPrincipal.clear();
    }

    private <K> boolean isLocked(Map<K, FailureWindow> failures, K key) {
        FailureWindow window = failures.get(key);
        if (window == null) {
            return false;
        }
        if (window.attempts < maxAttempts) {
            return false;
        }
        if (!window.hasElapsed(clock.instant(), lockout)) {
            return true;
        }
        // Lockout expired, reset
        failures.remove(key, window);
        return false;
    }

    private <K> void recordFailure(Map<K, FailureWindow> failures, K key, Object display) {
        Instant now = clock.instant();
        FailureWindow updated = failures.compute(key, (k, window) -> {
            if (window == null || window.hasElapsed(now, lockout)) {
                return new FailureWindow(now);
            }
            window.attempts++;
            return window;
        });
        if (updated.attempts == maxAttempts) {
            LOG.warn("'{}' locked for {}s after {} failed attempts", display, lockout.getSeconds(), maxAttempts);
        }
    }

    private static int count(FailureWindow window) {
        return window == null ? 0 : window.attempts;
    }

    private static String normalize(String login) {
        return login == null ? "" : login.trim().toLowerCase(Locale.ROOT);
    }

    private static class FailureWindow {
        final Instant firstFailure;
        volatile int attempts = 1;

        FailureWindow(Instant firstFailure) {
            this.firstFailure = firstFailure;
        }

        boolean hasElapsed(Instant now, Duration lockout) {
            return !now.isBefore(firstFailure.plus(lockout));
        }
    }
}
