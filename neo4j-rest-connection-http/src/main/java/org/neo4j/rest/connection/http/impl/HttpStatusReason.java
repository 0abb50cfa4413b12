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

import java.util.Map;

/**
 * Reason phrases for HTTP status codes, written as single PascalCase words ({@code InternalServerError}).
 * <p>
 * The transport does not expose the reason phrase the server sent, HTTP/2 responses do not even carry one.
 */
final class HttpStatusReason {
    private static final Map<Integer, String> REASON_PHRASES = Map.ofEntries(
            Map.entry(100, "Continue"),
            Map.entry(101, "SwitchingProtocols"),
            Map.entry(102, "Processing"),
            Map.entry(103, "EarlyHints"),
            Map.entry(200, "OK"),
            Map.entry(201, "Created"),
            Map.entry(202, "Accepted"),
            Map.entry(203, "NonAuthoritativeInformation"),
            Map.entry(204, "NoContent"),
            Map.entry(205, "ResetContent"),
            Map.entry(206, "PartialContent"),
            Map.entry(207, "MultiStatus"),
            Map.entry(208, "AlreadyReported"),
            Map.entry(226, "IMUsed"),
            Map.entry(300, "MultipleChoices"),
            Map.entry(301, "MovedPermanently"),
            Map.entry(302, "Found"),
            Map.entry(303, "SeeOther"),
            Map.entry(304, "NotModified"),
            Map.entry(305, "UseProxy"),
            Map.entry(306, "Unused"),
            Map.entry(307, "TemporaryRedirect"),
            Map.entry(308, "PermanentRedirect"),
            Map.entry(400, "BadRequest"),
            Map.entry(401, "Unauthorized"),
            Map.entry(402, "PaymentRequired"),
            Map.entry(403, "Forbidden"),
            Map.entry(404, "NotFound"),
            Map.entry(405, "MethodNotAllowed"),
            Map.entry(406, "NotAcceptable"),
            Map.entry(407, "ProxyAuthenticationRequired"),
            Map.entry(408, "RequestTimeout"),
            Map.entry(409, "Conflict"),
            Map.entry(410, "Gone"),
            Map.entry(411, "LengthRequired"),
            Map.entry(412, "PreconditionFailed"),
            Map.entry(413, "RequestEntityTooLarge"),
            Map.entry(414, "RequestUriTooLong"),
            Map.entry(415, "UnsupportedMediaType"),
            Map.entry(416, "RequestedRangeNotSatisfiable"),
            Map.entry(417, "ExpectationFailed"),
            Map.entry(421, "MisdirectedRequest"),
            Map.entry(422, "UnprocessableEntity"),
            Map.entry(423, "Locked"),
            Map.entry(424, "FailedDependency"),
            Map.entry(426, "UpgradeRequired"),
            Map.entry(428, "PreconditionRequired"),
            Map.entry(429, "TooManyRequests"),
            Map.entry(431, "RequestHeaderFieldsTooLarge"),
            Map.entry(451, "UnavailableForLegalReasons"),
            Map.entry(500, "InternalServerError"),
            Map.entry(501, "NotImplemented"),
            Map.entry(502, "BadGateway"),
            Map.entry(503, "ServiceUnavailable"),
            Map.entry(504, "GatewayTimeout"),
            Map.entry(505, "HttpVersionNotSupported"),
            Map.entry(506, "VariantAlsoNegotiates"),
            Map.entry(507, "InsufficientStorage"),
            Map.entry(508, "LoopDetected"),
            Map.entry(510, "NotExtended"),
            Map.entry(511, "NetworkAuthenticationRequired"));

    /**
     * Returns the reason phrase of a status code, or the code itself when it is not a registered status.
     */
    static String reasonPhrase(int statusCode) {
        return REASON_PHRASES.getOrDefault(statusCode, String.valueOf(statusCode));
    }

    static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    private HttpStatusReason() {}
}
