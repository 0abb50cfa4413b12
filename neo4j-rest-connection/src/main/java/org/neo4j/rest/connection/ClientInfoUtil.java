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

final class ClientInfoUtil {
    static final String PRODUCT_NAME = "Neo4jRestConnection";

    static String userAgent() {
        return "%s/%s".formatted(PRODUCT_NAME, ServerVersion.parse(clientVersion()));
    }

    /**
     * Extracts the client version from the jar MANIFEST.MF file.
     */
    static String clientVersion() {
        var pkg = GraphClient.class.getPackage();
        if (pkg != null && pkg.getImplementationVersion() != null) {
            return pkg.getImplementationVersion();
        }
        // not running from a jar, only happens during development
        return "dev";
    }

    private ClientInfoUtil() {}
}
