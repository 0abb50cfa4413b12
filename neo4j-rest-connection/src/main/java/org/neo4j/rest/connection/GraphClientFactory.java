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

/**
 * A factory for creating instances of {@link GraphClient}.
 * <p>
 * It should be discovered using the {@link java.util.ServiceLoader}.
 * @since 1.0.0
 */
public interface GraphClientFactory {
    /**
     * Indicates if {@link GraphClient} instances created by this factory support the given {@link URI} scheme.
     * @param scheme the {@link URI} scheme
     * @return {@code true} if support is available, {@code false} if not
     */
    boolean supports(String scheme);

    /**
     * Creates a new {@link GraphClient} instance.
     * @param rootUri the root URI of the server's REST API, it may embed credentials in its user info
     * @param credentials the credentials or {@code null} to use the ones embedded in the root URI, if any
     * @param configuration the configuration
     * @param loggingProvider the {@link LoggingProvider} that should be used for logging
     * @return the new {@link GraphClient} instance
     */
    GraphClient create(
            URI rootUri, Credentials credentials, ExecutionConfiguration configuration, LoggingProvider loggingProvider);

    /**
     * Returns the order of this factory.
     * <p>
     * This may be used for sorting factories that support the same scheme in order to select the one with highest
     * precedence.
     * <p>
     * The higher the value is, the lower the precedence is. For example, the {@link Integer#MIN_VALUE} has highest
     * precedence.
     * <p>
     * The default is {@link Integer#MAX_VALUE}.
     * @return the order
     */
    default int getOrder() {
        return Integer.MAX_VALUE;
    }
}
