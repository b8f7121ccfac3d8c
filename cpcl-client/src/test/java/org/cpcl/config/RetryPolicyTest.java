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
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void shouldDoubleDelayUpToMaximum() {
        // given
        RetryPolicy policy = RetryPolicy.exponentialBackoff(10, Duration.ofMillis(100), Duration.ofSeconds(1), 2.0);

        // when & then
        assertThat(policy.delayAfter(1)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.delayAfter(2)).isEqualTo(Duration.ofMillis(400));
        assertThat(policy.delayAfter(3)).isEqualTo(Duration.ofMillis(800));
        assertThat(policy.delayAfter(4)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delayAfter(9)).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void shouldUseDefaults() {
        // when
        RetryPolicy policy = RetryPolicy.exponentialBackoff();

        // then
        assertThat(policy.getMaxAttempts()).isEqualTo(5);
        assertThat(policy.getInitialDelay()).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.getMaxDelay()).isEqualTo(Duration.ofSeconds(5));
        assertThat(policy.getMultiplier()).isEqualTo(2.0);
    }

    @Test
    void shouldKeepFixedDelayConstant() {
        // given
        RetryPolicy policy = RetryPolicy.fixedDelay(3, Duration.ofMillis(50));

        // when & then
        assertThat(policy.delayAfter(1)).isEqualTo(Duration.ofMillis(50));
        assertThat(policy.delayAfter(2)).isEqualTo(Duration.ofMillis(50));
    }

    @Test
    void shouldMakeSingleAttemptWithoutRetry() {
        assertThat(RetryPolicy.noRetry().getMaxAttempts()).isEqualTo(1);
    }

    @Test
    void shouldReplaceAttemptBudgetOnly() {
        // when
        RetryPolicy policy = RetryPolicy.exponentialBackoff().withMaxAttempts(2);

        // then
        assertThat(policy.getMaxAttempts()).isEqualTo(2);
        assertThat(policy.getInitialDelay()).isEqualTo(Duration.ofMillis(100));
    }

    @Test
    void shouldRejectZeroAttempts() {
        assertThatThrownBy(() -> RetryPolicy.fixedDelay(0, Duration.ZERO))
                .isInstanceOf(CpclInvalidArgumentException.class)
                .hasMessage("Max attempts must be at least 1, got 0");
    }
}
