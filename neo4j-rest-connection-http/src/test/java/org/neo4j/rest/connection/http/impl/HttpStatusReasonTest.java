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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class HttpStatusReasonTest {

    @ParameterizedTest
    @CsvSource({
        "200, OK",
        "400, BadRequest",
        "401, Unauthorized",
        "404, NotFound",
        "500, InternalServerError",
        "503, ServiceUnavailable",
        "299, 299"
    })
    void shouldMapReasonPhrase(int statusCode, String expected) {
        assertEquals(expected, HttpStatusReason.reasonPhrase(statusCode));
    }

    @Test
    void shouldOnlyTreat2xxAsSuccess() {
        assertTrue(HttpStatusReason.isSuccess(200));
        assertTrue(HttpStatusReason.isSuccess(299));
        assertFalse(HttpStatusReason.isSuccess(199));
        assertFalse(HttpStatusReason.isSuccess(300));
        assertFalse(HttpStatusReason.isSuccess(500));
    }
}
