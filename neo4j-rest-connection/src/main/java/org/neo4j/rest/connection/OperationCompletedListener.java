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
 * A listener notified once for every completed {@link GraphClient} operation, successful or not.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface OperationCompletedListener {
    /**
     * Invoked after the outcome of an operation is known and before it is reported to the caller.
     * <p>
     * Exceptions thrown by this method are logged and otherwise ignored.
     *
     * @param event the event
     */
    void onOperationCompleted(OperationCompletedEvent event);
}
