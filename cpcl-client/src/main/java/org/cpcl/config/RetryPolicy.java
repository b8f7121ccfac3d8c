/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.cpcl.config;

import org.cpcl.exception.CpclInvalidArgumentException;

import java.time.Duration;

/**
 * Retry policy for RPC calls.
 *
 * <p>A policy bounds the number of attempts made for one call and the pause taken after
 * each failed attempt. The pause after attempt {@code n} (starting at 1) is
 * {@code initialDelay * multiplier^n}, capped at {@code maxDelay}. No pause follows the
 * final attempt.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;

    private RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, double multiplier) {
        if (maxAttempts < 1) {
            throw new CpclInvalidArgumentException("Max attempts must be at least 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
    }

    /**
     * Creates a retry policy with exponential backoff using default parameters.
     *
     * <p>Default configuration:
     * <ul>
     *   <li>Max attempts: 5</li>
     *   <li>Initial delay: 100ms</li>
     *   <li>Max delay: 5s</li>
     *   <li>Multiplier: 2.0</li>
     * </ul>
     *
     * @return a RetryPolicy with exponential backoff configuration
     */
    public static RetryPolicy exponentialBackoff() {
        return new RetryPolicy(5, Duration.ofMillis(100), Duration.ofSeconds(5), 2.0);
    }

    /**
     * Creates a retry policy with exponential backoff and custom parameters.
     *
     * @param maxAttempts  the maximum number of attempts per call
     * @param initialDelay the base delay the backoff is computed from
     * @param maxDelay     the maximum delay between attempts
     * @param multiplier   the multiplier for exponential backoff
     * @return a RetryPolicy with custom exponential backoff configuration
     */
    public static RetryPolicy exponentialBackoff(
            int maxAttempts, Duration initialDelay, Duration maxDelay, double multiplier) {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, multiplier);
    }

    /**
     * Creates a retry policy with fixed delay between attempts.
     *
     * @param maxAttempts the maximum number of attempts per call
     * @param delay       the fixed delay between attempts
     * @return a RetryPolicy with fixed delay configuration
     */
    public static RetryPolicy fixedDelay(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, delay, delay, 1.0);
    }

    /**
     * Creates a policy that makes a single attempt.
     *
     * @return a RetryPolicy that does not retry
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0);
    }

    /**
     * Returns a copy of this policy with a different attempt budget.
     *
     * @param maxAttempts the maximum number of attempts per call
     * @return a new RetryPolicy
     */
    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, multiplier);
    }

    /**
     * Computes the pause taken after a failed attempt.
     *
     * @param attempt the 1-based number of the attempt that failed
     * @return the delay before the next attempt
     */
    public Duration delayAfter(int attempt) {
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt);
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.round(millis));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getMultiplier() {
        return multiplier;
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts + ", initialDelay=" + initialDelay + ", maxDelay="
                + maxDelay + ", multiplier=" + multiplier + '}';
    }
}
