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
package org.neo4j.rest.connection.http.impl;

import static org.neo4j.rest.connection.http.impl.Fieldnames.BATCH;
import static org.neo4j.rest.connection.http.impl.Fieldnames.CYPHER;
import static org.neo4j.rest.connection.http.impl.Fieldnames.EXTENSIONS;
import static org.neo4j.rest.connection.http.impl.Fieldnames.EXTENSIONS_INFO;
import static org.neo4j.rest.connection.http.impl.Fieldnames.NEO4J_VERSION;
import static org.neo4j.rest.connection.http.impl.Fieldnames.NODE;
import static org.neo4j.rest.connection.http.impl.Fieldnames.NODE_INDEX;
import static org.neo4j.rest.connection.http.impl.Fieldnames.REFERENCE_NODE;
import static org.neo4j.rest.connection.http.impl.Fieldnames.RELATIONSHIP_INDEX;
import static org.neo4j.rest.connection.http.impl.Fieldnames.TRANSACTION;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.neo4j.rest.connection.RootDescriptor;
import org.neo4j.rest.connection.exception.ResponseDecodingException;

final class RootDescriptorDecoder {
    private final HttpContext httpContext;

    RootDescriptorDecoder(HttpContext httpContext) {
        this.httpContext = Objects.requireNonNull(httpContext);
    }

    RootDescriptor decode(String body) {
        if (body == null || body.isBlank()) {
            throw new ResponseDecodingException("Received an empty root endpoint response");
        }
        Map<String, Object> root;
        try {
            root = httpContext.json().mapFrom(body);
        } catch (IOException e) {
            throw new ResponseDecodingException("Cannot parse %s to RootDescriptor".formatted(body), e);
        }
        if (root == null) {
            throw new ResponseDecodingException("Cannot parse %s to RootDescriptor".formatted(body));
        }
        return new RootDescriptor(
                endpoint(root, NODE),
                endpoint(root, NODE_INDEX),
                endpoint(root, RELATIONSHIP_INDEX),
                endpoint(root, BATCH),
                endpoint(root, EXTENSIONS_INFO),
                endpoint(root, CYPHER),
                endpoint(root, TRANSACTION),
                string(root, REFERENCE_NODE),
                string(root, NEO4J_VERSION),
                extensions(root));
    }

    private String endpoint(Map<String, Object> root, String key) {
        var value = string(root, key);
        return value != null ? httpContext.relativize(value) : null;
    }

    private static String string(Map<String, Object> map, String key) {
        var value = map.get(key);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw new ResponseDecodingException("Expected %s to be a string but was %s".formatted(key, value));
    }

    private Map<String, Map<String, String>> extensions(Map<String, Object> root) {
        var value = root.get(EXTENSIONS);
        if (value == null) {
            return Collections.emptyMap();
        }
        if (!(value instanceof Map<?, ?> plugins)) {
            throw new ResponseDecodingException("Expected %s to be an object but was %s".formatted(EXTENSIONS, value));
        }
        var extensions = new LinkedHashMap<String, Map<String, String>>();
        for (var plugin : plugins.entrySet()) {
            if (!(plugin.getValue() instanceof Map<?, ?> operations)) {
                throw new ResponseDecodingException(
                        "Expected extension %s to be an object but was %s".formatted(plugin.getKey(), plugin.getValue()));
            }
            var endpoints = new LinkedHashMap<String, String>();
            for (var operation : operations.entrySet()) {
                if (!(operation.getValue() instanceof String uri)) {
                    throw new ResponseDecodingException("Expected extension operation %s.%s to be a string but was %s"
                            .formatted(plugin.getKey(), operation.getKey(), operation.getValue()));
                }
                endpoints.put(String.valueOf(operation.getKey()), uri);
            }
            extensions.put(String.valueOf(plugin.getKey()), endpoints);
        }
        return extensions;
    }
}
