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
package org.neo4j.rest.connection.exception;

import java.io.Serial;

/**
 * Indicates that a request could not be sent to the server or its response could not be received.
 *
 * @since 1.0.0
 */
public class GraphServiceUnavailableException extends GraphClientException {
    @Serial
    private static final long serialVersionUID = 8127034409384765233L;

    public GraphServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
