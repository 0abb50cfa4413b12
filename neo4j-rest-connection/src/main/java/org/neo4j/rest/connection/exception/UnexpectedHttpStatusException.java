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
 * Indicates that the server responded with a status outside the success range.
 *
 * @since 1.0.0
 */
public class UnexpectedHttpStatusException extends GraphClientException {
    @Serial
    private static final long serialVersionUID = 4623016841339907154L;

    private final int statusCode;
    private final String reasonPhrase;

    public UnexpectedHttpStatusException(int statusCode, String reasonPhrase) {
        super("Received an unexpected HTTP status when executing the request.\r\n\r\nThe response status was: %d %s"
                .formatted(statusCode, reasonPhrase));
        this.statusCode = statusCode;
        this.reasonPhrase = reasonPhrase;
    }

    /**
     * Returns the received status code.
     * @return the status code
     */
    public int statusCode() {
        return statusCode;
    }

    /**
     * Returns the reason phrase of the received status, for instance {@code InternalServerError}.
     * @return the reason phrase
     */
    public String reasonPhrase() {
        return reasonPhrase;
    }
}
