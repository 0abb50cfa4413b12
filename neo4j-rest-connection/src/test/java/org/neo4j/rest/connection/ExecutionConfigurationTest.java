/*
 * Copyright (c) "Neo4j"
 * Neo4j Sweden AB [https://neo4j.com]
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.neo4j.rest.connection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class ExecutionConfigurationTest {

    @Test
    void shouldEnableJsonStreamingByDefault() {
        var configuration = ExecutionConfiguration.defaultConfig();

        assertTrue(configuration.jsonStreaming());
        assertNull(configuration.connectTimeout());
        assertNull(configuration.requestTimeout());
    }

    @Test
    void shouldFormatUserAgent() {
        var userAgent = ExecutionConfiguration.defaultConfig().userAgent();

        assertTrue(
                userAgent.matches("Neo4jRestConnection/\\d+\\.\\d+\\.\\d+\\.\\d+"),
                "User agent should be in format Neo4jRestConnection/1.2.3.4 but was " + userAgent);
    }

    @Test
    void shouldBuildConfiguration() {
        var configuration = ExecutionConfiguration.builder()
                .withJsonStreaming(false)
                .withUserAgent("agent/1.0.0.0")
                .withConnectTimeout(Duration.ofSeconds(5))
                .withRequestTimeout(Duration.ofSeconds(30))
                .build();

        assertFalse(configuration.jsonStreaming());
        assertEquals("agent/1.0.0.0", configuration.userAgent());
        assertEquals(Duration.ofSeconds(5), configuration.connectTimeout());
        assertEquals(Duration.ofSeconds(30), configuration.requestTimeout());
    }

    @Test
    void shouldCopyIntoBuilder() {
        var configuration = ExecutionConfiguration.builder()
                .withJsonStreaming(false)
                .build()
                .toBuilder()
                .withUserAgent("agent/2.0.0.0")
                .build();

        assertFalse(configuration.jsonStreaming());
        assertEquals("agent/2.0.0.0", configuration.userAgent());
    }

    @Test
    void shouldRejectNonPositiveTimeouts() {
        var builder = ExecutionConfiguration.builder().withConnectTimeout(Duration.ZERO);

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void shouldRejectNullUserAgent() {
        var builder = ExecutionConfiguration.builder().withUserAgent(null);

        assertThrows(NullPointerException.class, builder::build);
    }
}
