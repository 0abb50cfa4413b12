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

/**
 * A provider of {@link System.Logger} instances.
 *
 * @since 1.0.0
 */
public interface LoggingProvider {
    /**
     * Returns a logger for the given class.
     *
     * @param cls the class
     * @return the logger
     */
    System.Logger getLog(Class<?> cls);

    /**
     * Returns a logger for the given name.
     *
     * @param name the logger name
     * @return the logger
     */
    System.Logger getLog(String name);

    /**
     * Returns a provider that delegates to {@link System#getLogger(String)}.
     *
     * @return the provider
     */
    static LoggingProvider system() {
        return SystemLoggingProvider.INSTANCE;
    }
}
