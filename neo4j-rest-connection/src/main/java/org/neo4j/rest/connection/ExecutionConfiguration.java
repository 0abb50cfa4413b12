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

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration applied to every request a {@link GraphClient} sends.
 *
 * @param jsonStreaming whether the {@code X-Stream: true} header is sent
 * @param userAgent the {@code User-Agent} header value
 * @param connectTimeout the transport connect timeout or {@code null} for none
 * @param requestTimeout the request timeout or {@code null} for none
 * @since 1.0.0
 */
public record ExecutionConfiguration(
        boolean jsonStreaming, String userAgent, Duration connectTimeout, Duration requestTimeout) {
    static final ExecutionConfiguration DEFAULT =
            new ExecutionConfiguration(true, ClientInfoUtil.userAgent(), null, null);

    public ExecutionConfiguration {
        Objects.requireNonNull(userAgent);
        requirePositive(connectTimeout, "connectTimeout");
        requirePositive(requestTimeout, "requestTimeout");
    }

    /**
     * Returns the default configuration: JSON streaming enabled, the default user agent and no timeouts.
     * @return the default configuration
     */
    public static ExecutionConfiguration defaultConfig() {
        return DEFAULT;
    }

    /**
     * Returns a new {@link Builder} initialised with the default values.
     * @return a new builder
     */
    public static Builder builder() {
        return new ExecutionConfigurationBuilderImpl(DEFAULT);
    }

    /**
     * Returns a new {@link Builder} initialised with the values of this configuration.
     * @return a new builder
     */
    public Builder toBuilder() {
        return new ExecutionConfigurationBuilderImpl(this);
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration != null && (duration.isNegative() || duration.isZero())) {
            throw new IllegalArgumentException("%s must be positive, got %s".formatted(name, duration));
        }
    }

    /**
     * A builder for creating {@link ExecutionConfiguration}.
     * @since 1.0.0
     */
    public interface Builder {
        /**
         * Enables or disables JSON streaming.
         * <p>
         * The default is {@code true}.
         * @param jsonStreaming {@code true} to request streamed responses
         * @return this builder
         */
        Builder withJsonStreaming(boolean jsonStreaming);

        /**
         * Sets the {@code User-Agent} header value.
         * <p>
         * The default is {@code Neo4jRestConnection/<major>.<minor>.<build>.<revision>}.
         * @param userAgent the user agent
         * @return this builder
         */
        Builder withUserAgent(String userAgent);

        /**
         * Sets the transport connect timeout.
         * <p>
         * The default is {@code null}, leaving it to the transport.
         * @param connectTimeout the timeout or {@code null}
         * @return this builder
         */
        Builder withConnectTimeout(Duration connectTimeout);

        /**
         * Sets the request timeout.
         * <p>
         * The default is {@code null}, leaving it to the transport.
         * @param requestTimeout the timeout or {@code null}
         * @return this builder
         */
        Builder withRequestTimeout(Duration requestTimeout);

        /**
         * Builds a new {@link ExecutionConfiguration}.
         * @return the new configuration
         */
        ExecutionConfiguration build();
    }
}
