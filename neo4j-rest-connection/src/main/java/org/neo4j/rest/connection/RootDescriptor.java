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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The parsed response of the server's root endpoint.
 * <p>
 * Endpoint values are opaque URIs, either relative to the client's root URI or absolute. Any endpoint the server does
 * not advertise is {@code null}.
 *
 * @param node the node creation endpoint
 * @param nodeIndex the node index endpoint
 * @param relationshipIndex the relationship index endpoint
 * @param batch the batch endpoint
 * @param extensionsInfo the extensions info endpoint
 * @param cypher the Cypher endpoint
 * @param transaction the transactional Cypher endpoint
 * @param referenceNodeUri the reference node URI or {@code null}
 * @param neo4jVersion the raw server version string or {@code null}
 * @param extensions the extension endpoints by plugin name and operation name
 * @since 1.0.0
 */
public record RootDescriptor(
        String node,
        String nodeIndex,
        String relationshipIndex,
        String batch,
        String extensionsInfo,
        String cypher,
        String transaction,
        String referenceNodeUri,
        String neo4jVersion,
        Map<String, Map<String, String>> extensions) {

    public RootDescriptor {
        if (extensions == null) {
            extensions = Collections.emptyMap();
        } else {
            var copy = new LinkedHashMap<String, Map<String, String>>();
            extensions.forEach((plugin, operations) -> copy.put(
                    plugin,
                    operations != null
                            ? Collections.unmodifiableMap(new LinkedHashMap<>(operations))
                            : Collections.emptyMap()));
            extensions = Collections.unmodifiableMap(copy);
        }
    }

    /**
     * Returns the reference node URI.
     * @return the reference node URI or an empty {@link Optional} when the server has no reference node
     */
    public Optional<String> referenceNode() {
        return Optional.ofNullable(referenceNodeUri);
    }

    /**
     * Parses {@link #neo4jVersion()}.
     * @return the server version, {@link ServerVersion#ZERO} if it is absent or cannot be parsed
     */
    public ServerVersion version() {
        return ServerVersion.parse(neo4jVersion);
    }

    /**
     * Looks up an extension endpoint.
     * @param plugin the plugin name, for instance {@code GremlinPlugin}
     * @param operation the operation name, for instance {@code execute_script}
     * @return the endpoint or an empty {@link Optional}
     */
    public Optional<String> extension(String plugin, String operation) {
        var operations = extensions.get(plugin);
        return operations != null ? Optional.ofNullable(operations.get(operation)) : Optional.empty();
    }
}
