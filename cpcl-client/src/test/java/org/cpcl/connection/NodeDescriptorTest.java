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

class NodeDescriptorTest {

    @Test
    void shouldDefaultToFramedLocalhost() {
        // when
        NodeDescriptor node = NodeDescriptor.localhost();

        // then
        assertThat(node.host()).isEqualTo("127.0.0.1");
        assertThat(node.port()).isEqualTo(9160);
        assertThat(node.useFramedTransport()).isTrue();
        assertThat(node.sendTimeout()).isEmpty();
        assertThat(node.receiveTimeout()).isEmpty();
        assertThat(node).hasToString("127.0.0.1:9160");
    }

    @Test
    void shouldExposeTimeouts() {
        // when
        NodeDescriptor node = new NodeDescriptor("db1", 9161, false, 250, 5000);

        // then
        assertThat(node.sendTimeout()).contains(250);
        assertThat(node.receiveTimeout()).contains(5000);
    }

    @Test
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> NodeDescriptor.of(" ", 9160)).isInstanceOf(CpclInvalidArgumentException.class);
        assertThatThrownBy(() -> NodeDescriptor.of("db1", 0)).isInstanceOf(CpclInvalidArgumentException.class);
        assertThatThrownBy(() -> NodeDescriptor.of("db1", 70000)).isInstanceOf(CpclInvalidArgumentException.class);
        assertThatThrownBy(() -> new NodeDescriptor("db1", 9160, true, -1, null))
                .isInstanceOf(CpclInvalidArgumentException.class);
    }
}
