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

package org.cpcl.connection;

import org.cpcl.exception.CpclInvalidArgumentException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyspaceContextTest {

    @Test
    void shouldHidePasswordFromToString() {
        // when
        KeyspaceContext context = new KeyspaceContext("Shop", "shop", "secret");

        // then
        assertThat(context.hasCredentials()).isTrue();
        assertThat(context.toString()).contains("Shop").doesNotContain("secret");
    }

    @Test
    void shouldTreatMissingUsernameAsNoCredentials() {
        assertThat(KeyspaceContext.of("Shop").hasCredentials()).isFalse();
        assertThat(new KeyspaceContext("Shop", "", "secret").hasCredentials()).isFalse();
    }

    @Test
    void shouldRejectBlankKeyspace() {
        assertThatThrownBy(() -> KeyspaceContext.of(" "))
                .isInstanceOf(CpclInvalidArgumentException.class)
                .hasMessage("Keyspace cannot be null or empty");
    }
}
