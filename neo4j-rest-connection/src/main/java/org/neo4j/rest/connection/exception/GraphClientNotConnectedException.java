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
 * Indicates an attempt to read connection dependent state before a successful connect.
 *
 * @since 1.0.0
 */
public class GraphClientNotConnectedException extends IllegalStateException {
    @Serial
    private static final long serialVersionUID = 1942851147286402960L;

    public GraphClientNotConnectedException() {
        super("The graph client is not connected to the server. Call the Connect method first.");
    }
}
