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
import java.util.Objects;
import org.neo4j.rest.connection.exception.ResponseDecodingException;

/**
 * A handle to a node known by its id.
 *
 * @param id the node id
 * @param uri the node URI
 * @since 1.0.0
 */
public record NodeReference(long id, String uri) {
    public NodeReference {
        Objects.requireNonNull(uri);
    }

    /**
     * Creates a reference from a node URI such as {@code http://localhost:7474/db/data/node/123}.
     *
     * @param uri the node URI
     * @return the reference
     * @throws ResponseDecodingException if the last path segment is not a node id
     */
    public static NodeReference fromUri(String uri) {
        Objects.requireNonNull(uri);
        String path;
        try {
            path = URI.create(uri).getPath();
        } catch (IllegalArgumentException e) {
            throw new ResponseDecodingException("Invalid node URI %s".formatted(uri), e);
        }
        if (path == null) {
            throw new ResponseDecodingException("Invalid node URI %s".formatted(uri));
        }
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        var segment = path.substring(path.lastIndexOf('/') + 1);
        try {
            return new NodeReference(Long.parseLong(segment), uri);
        } catch (NumberFormatException e) {
            throw new ResponseDecodingException("Cannot read node id from %s".formatted(uri), e);
        }
    }
}
