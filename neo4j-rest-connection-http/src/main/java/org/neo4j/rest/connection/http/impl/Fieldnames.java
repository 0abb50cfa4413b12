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

public final class Fieldnames {

    public static final String NODE = "node";
    public static final String NODE_INDEX = "node_index";
    public static final String RELATIONSHIP_INDEX = "relationship_index";
    public static final String BATCH = "batch";
    public static final String EXTENSIONS_INFO = "extensions_info";
    public static final String CYPHER = "cypher";
    public static final String TRANSACTION = "transaction";
    public static final String REFERENCE_NODE = "reference_node";
    public static final String NEO4J_VERSION = "neo4j_version";
    public static final String EXTENSIONS = "extensions";

    public static final String STREAM_HEADER = "X-Stream";

    private Fieldnames() {}
}
