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

import java.util.Objects;

/**
 * Defines the Cypher dialect features available on a server.
 * <p>
 * Exactly one value is active per connection. It is resolved from the {@link ServerVersion} during connect and does
 * not change until the client reconnects.
 *
 * @since 1.0.0
 */
public enum CypherCapabilities {
    /**
     * The legacy dialect of servers older than 2.0.
     */
    CYPHER_19(false, true, false, false),
    /**
     * The dialect introduced with the 2.0 line.
     */
    CYPHER_20(true, false, true, false),
    /**
     * The dialect of 2.2 and later servers.
     */
    CYPHER_22(true, false, true, true);

    private static final ServerVersion CYPHER_20_MIN_VERSION = ServerVersion.of(2, 0);
    private static final ServerVersion CYPHER_22_MIN_VERSION = ServerVersion.of(2, 2);

    private final boolean supportsCollectAs;
    private final boolean supportsPropertySuffixesForControllingNullComparisons;
    private final boolean supportsNullComparisonsWithIsOperator;
    private final boolean supportsPlanner;

    CypherCapabilities(
            boolean supportsCollectAs,
            boolean supportsPropertySuffixesForControllingNullComparisons,
            boolean supportsNullComparisonsWithIsOperator,
            boolean supportsPlanner) {
        this.supportsCollectAs = supportsCollectAs;
        this.supportsPropertySuffixesForControllingNullComparisons =
                supportsPropertySuffixesForControllingNullComparisons;
        this.supportsNullComparisonsWithIsOperator = supportsNullComparisonsWithIsOperator;
        this.supportsPlanner = supportsPlanner;
    }

    /**
     * Resolves the capabilities of a server version.
     *
     * @param version the server version
     * @return {@link #CYPHER_19} below 2.0, {@link #CYPHER_20} from 2.0 up to 2.2 and {@link #CYPHER_22} from 2.2
     */
    public static CypherCapabilities forVersion(ServerVersion version) {
        Objects.requireNonNull(version);
        if (version.isAtLeast(CYPHER_22_MIN_VERSION)) {
            return CYPHER_22;
        } else if (version.isAtLeast(CYPHER_20_MIN_VERSION)) {
            return CYPHER_20;
        }
        return CYPHER_19;
    }

    /**
     * Indicates if {@code collect(...) AS ...} aggregation aliases are supported.
     * @return {@code true} if supported
     */
    public boolean supportsCollectAs() {
        return supportsCollectAs;
    }

    /**
     * Indicates if the {@code ?} and {@code !} property suffixes control null comparisons.
     * @return {@code true} if supported
     */
    public boolean supportsPropertySuffixesForControllingNullComparisons() {
        return supportsPropertySuffixesForControllingNullComparisons;
    }

    /**
     * Indicates if {@code IS NULL} and {@code IS NOT NULL} comparisons are supported.
     * @return {@code true} if supported
     */
    public boolean supportsNullComparisonsWithIsOperator() {
        return supportsNullComparisonsWithIsOperator;
    }

    /**
     * Indicates if the query planner may be selected per query.
     * @return {@code true} if supported
     */
    public boolean supportsPlanner() {
        return supportsPlanner;
    }
}
