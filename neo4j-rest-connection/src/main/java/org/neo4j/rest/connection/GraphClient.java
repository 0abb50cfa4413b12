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

import java.net.URI;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import org.neo4j.rest.connection.exception.GraphClientNotConnectedException;

/**
 * A client of the Neo4j REST API.
 * <p>
 * A client must be connected before use. Connecting reads the server's root endpoint, parses the server version and
 * resolves the {@link CypherCapabilities} the rest of the client works with. Every connect attempt notifies the
 * registered {@link OperationCompletedListener} instances exactly once, whether it succeeds or fails.
 * <p>
 * Connect must not be invoked concurrently on the same instance. Once connected, the state accessors are safe to use
 * from any thread.
 *
 * @since 1.0.0
 */
public interface GraphClient {
    /**
     * Returns the root URI exactly as configured, including any user info.
     *
     * @return the root URI
     */
    URI rootUri();

    /**
     * Returns the configuration applied to outbound requests.
     *
     * @return the configuration
     */
    ExecutionConfiguration executionConfiguration();

    /**
     * Connects to the server, blocking until the outcome is known.
     * <p>
     * Calling this method on a connected client runs the negotiation again. A failed attempt keeps the previous
     * {@link ConnectionState}.
     *
     * @throws org.neo4j.rest.connection.exception.UnexpectedHttpStatusException if the server responds with a
     * non-success status
     * @throws org.neo4j.rest.connection.exception.GraphServiceUnavailableException if the request cannot be sent, the
     * cause is the transport's {@link java.io.IOException}
     * @throws org.neo4j.rest.connection.exception.ResponseDecodingException if the response cannot be decoded
     */
    void connect();

    /**
     * Connects to the server.
     *
     * @return the connect {@link CompletionStage}, completed exceptionally with the same exceptions {@link #connect()}
     * throws
     */
    CompletionStage<Void> connectAsync();

    /**
     * Indicates if a connect attempt has succeeded.
     *
     * @return {@code true} if connected
     */
    boolean isConnected();

    /**
     * Returns the state of the last successful connect.
     *
     * @return the state or an empty {@link Optional} if the client has never connected
     */
    Optional<ConnectionState> connectionState();

    /**
     * Returns the root endpoint response.
     *
     * @return the root descriptor
     * @throws GraphClientNotConnectedException if the client is not connected
     */
    default RootDescriptor rootDescriptor() {
        return requireConnectionState().rootDescriptor();
    }

    /**
     * Returns the server version.
     *
     * @return the server version
     * @throws GraphClientNotConnectedException if the client is not connected
     */
    default ServerVersion serverVersion() {
        return requireConnectionState().serverVersion();
    }

    /**
     * Returns the Cypher capabilities of the server.
     *
     * @return the capabilities
     * @throws GraphClientNotConnectedException if the client is not connected
     */
    default CypherCapabilities cypherCapabilities() {
        return requireConnectionState().cypherCapabilities();
    }

    /**
     * Returns the reference node of the server.
     *
     * @return the reference node or an empty {@link Optional} if the server does not have one
     * @throws GraphClientNotConnectedException if the client is not connected
     */
    default Optional<NodeReference> rootNode() {
        return requireConnectionState().rootNode();
    }

    /**
     * Registers a listener.
     *
     * @param listener the listener
     */
    void addOperationCompletedListener(OperationCompletedListener listener);

    /**
     * Removes a previously registered listener.
     *
     * @param listener the listener
     */
    void removeOperationCompletedListener(OperationCompletedListener listener);

    private ConnectionState requireConnectionState() {
        return connectionState().orElseThrow(GraphClientNotConnectedException::new);
    }
}
