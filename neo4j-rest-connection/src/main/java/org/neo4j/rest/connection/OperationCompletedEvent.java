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
 * Describes a completed client operation.
 *
 * @param operation the operation name, for instance {@code Connect}
 * @param timeTaken the time the operation took
 * @param exception the exception the operation failed with or {@code null} if it succeeded, the same instance the
 * caller receives, so a transport {@link java.io.IOException} arrives as the cause of a
 * {@link org.neo4j.rest.connection.exception.GraphServiceUnavailableException}
 * @since 1.0.0
 */
public record OperationCompletedEvent(String operation, Duration timeTaken, Throwable exception) {
    public OperationCompletedEvent {
        Objects.requireNonNull(operation);
        Objects.requireNonNull(timeTaken);
    }

    /**
     * Indicates if the operation failed.
     * @return {@code true} if there is an exception
     */
    public boolean hasException() {
        return exception != null;
    }
}
