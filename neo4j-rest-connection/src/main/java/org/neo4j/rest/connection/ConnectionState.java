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
import java.util.Optional;

/**
 * The outcome of a successful connect.
 * <p>
 * A new instance is published as a whole at the end of each successful connect and is never modified afterwards.
 *
 * @param rootDescriptor the root endpoint response
 * @param serverVersion the parsed server version
 * @param cypherCapabilities the capabilities resolved from the server version
 * @param rootNodeReference the reference node or {@code null}
 * @since 1.0.0
 */
public record ConnectionState(
        RootDescriptor rootDescriptor,
        ServerVersion serverVersion,
        CypherCapabilities cypherCapabilities,
        NodeReference rootNodeReference) {
    public ConnectionState {
        Objects.requireNonNull(rootDescriptor);
        Objects.requireNonNull(serverVersion);
        Objects.requireNonNull(cypherCapabilities);
    }

    /**
     * Derives the state from a root descriptor.
     *
     * @param rootDescriptor the root endpoint response
     * @return the state
     */
    public static ConnectionState of(RootDescriptor rootDescriptor) {
        var serverVersion = rootDescriptor.version();
        return new ConnectionState(
                rootDescriptor,
                serverVersion,
                CypherCapabilities.forVersion(serverVersion),
                rootDescriptor.referenceNode().map(NodeReference::fromUri).orElse(null));
    }

    public Optional<NodeReference> rootNode() {
        return Optional.ofNullable(rootNodeReference);
    }
}
