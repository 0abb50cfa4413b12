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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class CypherCapabilitiesTest {

    @ParameterizedTest
    @MethodSource("shouldResolveCapabilitiesArgs")
    void shouldResolveCapabilities(String version, CypherCapabilities expected) {
        assertEquals(expected, CypherCapabilities.forVersion(ServerVersion.parse(version)));
    }

    static Stream<Arguments> shouldResolveCapabilitiesArgs() {
        return Stream.of(
                Arguments.of("", CypherCapabilities.CYPHER_19),
                Arguments.of("1.5.M02", CypherCapabilities.CYPHER_19),
                Arguments.of("1.9.9.9", CypherCapabilities.CYPHER_19),
                Arguments.of("2.0.0", CypherCapabilities.CYPHER_20),
                Arguments.of("2.0.0-RC1", CypherCapabilities.CYPHER_20),
                Arguments.of("2.1.8", CypherCapabilities.CYPHER_20),
                Arguments.of("2.2.0", CypherCapabilities.CYPHER_22),
                Arguments.of("2.2.0-M03", CypherCapabilities.CYPHER_22),
                Arguments.of("3.5.1", CypherCapabilities.CYPHER_22),
                Arguments.of("5.26.0", CypherCapabilities.CYPHER_22));
    }

    @Test
    void shouldExposeLegacyFeatures() {
        var capabilities = CypherCapabilities.CYPHER_19;

        assertTrue(capabilities.supportsPropertySuffixesForControllingNullComparisons());
        assertFalse(capabilities.supportsCollectAs());
        assertFalse(capabilities.supportsNullComparisonsWithIsOperator());
        assertFalse(capabilities.supportsPlanner());
    }

    @Test
    void shouldOnlySupportPlannerFrom22() {
        assertFalse(CypherCapabilities.CYPHER_20.supportsPlanner());
        assertTrue(CypherCapabilities.CYPHER_22.supportsPlanner());
        assertTrue(CypherCapabilities.CYPHER_22.supportsCollectAs());
        assertTrue(CypherCapabilities.CYPHER_22.supportsNullComparisonsWithIsOperator());
    }
}
