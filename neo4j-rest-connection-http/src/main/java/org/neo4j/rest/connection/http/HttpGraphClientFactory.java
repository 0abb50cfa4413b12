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
package org.neo4j.rest.connection.http;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.Objects;
import java.util.Set;
import org.neo4j.rest.connection.Credentials;
import org.neo4j.rest.connection.ExecutionConfiguration;
import org.neo4j.rest.connection.GraphClient;
import org.neo4j.rest.connection.GraphClientFactory;
import org.neo4j.rest.connection.LoggingProvider;
import org.neo4j.rest.connection.exception.GraphClientException;
import org.neo4j.rest.connection.http.impl.HttpGraphClient;

/**
 * A factory that creates {@link GraphClient} instances talking to the Neo4j REST API over HTTP.
 * @since 1.0.0
 */
public final class HttpGraphClientFactory implements GraphClientFactory {
    private static final Set<String> SUPPORTED_SCHEMES = Set.of("http", "https");

    /**
     * Creates a new instance of this factory.
     * <p>
     * It is used by {@link java.util.ServiceLoader}.
     */
    public HttpGraphClientFactory() {}

    @Override
    public boolean supports(String scheme) {
        return scheme != null && SUPPORTED_SCHEMES.contains(scheme);
    }

    @Override
    public GraphClient create(
            URI rootUri,
            Credentials credentials,
            ExecutionConfiguration configuration,
            LoggingProvider loggingProvider) {
        Objects.requireNonNull(rootUri);
        if (!supports(rootUri.getScheme())) {
            throw new GraphClientException("Unsupported URI scheme: " + rootUri.getScheme());
        }
        var builder = HttpClient.newBuilder();
        if (configuration.connectTimeout() != null) {
            builder.connectTimeout(configuration.connectTimeout());
        }
        return new HttpGraphClient(
                builder.build(), rootUri, credentials, configuration, Clock.systemUTC(), loggingProvider);
    }
}
