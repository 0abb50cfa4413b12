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

class ExecutionConfigurationBuilderImpl implements ExecutionConfiguration.Builder {
    private boolean jsonStreaming;
    private String userAgent;
    private Duration connectTimeout;
    private Duration requestTimeout;

    ExecutionConfigurationBuilderImpl(ExecutionConfiguration configuration) {
        this.jsonStreaming = configuration.jsonStreaming();
        this.userAgent = configuration.userAgent();
        this.connectTimeout = configuration.connectTimeout();
        this.requestTimeout = configuration.requestTimeout();
    }

    @Override
    public ExecutionConfiguration.Builder withJsonStreaming(boolean jsonStreaming) {
        this.jsonStreaming = jsonStreaming;
        return this;
    }

    @Override
    public ExecutionConfiguration.Builder withUserAgent(String userAgent) {
        this.userAgent = userAgent;
        return this;
    }

    @Override
    public ExecutionConfiguration.Builder withConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        return this;
    }

    @Override
    public ExecutionConfiguration.Builder withRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        return this;
    }

    @Override
    public ExecutionConfiguration build() {
        return new ExecutionConfiguration(jsonStreaming, userAgent, connectTimeout, requestTimeout);
    }
}
