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
import java.util.Comparator;
import java.util.Objects;
import java.util.ServiceLoader;
import org.neo4j.rest.connection.exception.GraphClientException;

/**
 * Creates {@link GraphClient} instances using the {@link GraphClientFactory} implementations available to the
 * {@link ServiceLoader}.
 *
 * @since 1.0.0
 */
public final class GraphClients {
    /**
     * Creates a client with the default configuration and credentials taken from the URI user info, if any.
     *
     * @param rootUri the root URI, for instance {@code http://localhost:7474/db/data}
     * @return the client, not yet connected
     */
    public static GraphClient create(URI rootUri) {
        return create(rootUri, null, ExecutionConfiguration.defaultConfig(), LoggingProvider.system());
    }

    /**
     * Creates a client with the default configuration.
     *
     * @param rootUri the root URI
     * @param credentials the credentials or {@code null}
     * @return the client, not yet connected
     */
    public static GraphClient create(URI rootUri, Credentials credentials) {
        return create(rootUri, credentials, ExecutionConfiguration.defaultConfig(), LoggingProvider.system());
    }

    /**
     * Creates a client.
     *
     * @param rootUri the root URI
     * @param credentials the credentials or {@code null}
     * @param configuration the configuration
     * @param loggingProvider the logging provider
     * @return the client, not yet connected
     * @throws GraphClientException if no factory supports the URI scheme
     */
    public static GraphClient create(
            URI rootUri,
            Credentials credentials,
            ExecutionConfiguration configuration,
            LoggingProvider loggingProvider) {
        Objects.requireNonNull(rootUri);
        var scheme = rootUri.getScheme();
        var factory = ServiceLoader.load(GraphClientFactory.class).stream()
                .map(ServiceLoader.Provider::get)
                .filter(candidate -> scheme != null && candidate.supports(scheme))
                .min(Comparator.comparingInt(GraphClientFactory::getOrder))
                .orElseThrow(() -> new GraphClientException(
                        "No %s found for URI scheme %s".formatted(GraphClientFactory.class.getSimpleName(), scheme)));
        return factory.create(
                rootUri, credentials, Objects.requireNonNull(configuration), Objects.requireNonNull(loggingProvider));
    }

    private GraphClients() {}
}
