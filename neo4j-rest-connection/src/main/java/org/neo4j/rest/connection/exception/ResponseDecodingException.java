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
 * Indicates a response body that does not have the expected shape.
 *
 * @since 1.0.0
 */
public class ResponseDecodingException extends GraphClientException {
    @Serial
    private static final long serialVersionUID = -5219466302975311468L;

    public ResponseDecodingException(String message) {
        super(message);
    }

    public ResponseDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
