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

import com.fasterxml.jackson.jr.ob.JSON;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Objects;
import org.neo4j.rest.connection.Credentials;
import org.neo4j.rest.connection.ExecutionConfiguration;
import org.neo4j.rest.connection.exception.GraphClientException;

/**
 * Everything needed to build requests against one server.
 *
 * @param httpClient the transport
 * @param baseUri the root URI without user info
 * @param json the JSON codec
 * @param authHeader the {@code Authorization} header value or {@code null}
 * @param configuration the configuration applied to every request
 */
public record HttpContext(
        HttpClient httpClient, URI baseUri, JSON json, String authHeader, ExecutionConfiguration configuration) {

    public HttpContext {
        Objects.requireNonNull(httpClient);
        Objects.requireNonNull(json);
        Objects.requireNonNull(configuration);
        baseUri = withoutUserInfoAndFragment(baseUri);
    }

    // works on the raw components so that encoded characters in the path survive
    private static URI withoutUserInfoAndFragment(URI uri) {
        var authority = uri.getRawAuthority();
        if (authority != null) {
            authority = authority.substring(authority.lastIndexOf('@') + 1);
        }
        var builder = new StringBuilder();
        if (uri.getScheme() != null) {
            builder.append(uri.getScheme()).append(':');
        }
        if (authority != null) {
            builder.append("//").append(authority);
        }
        if (uri.getRawPath() != null) {
            builder.append(uri.getRawPath());
        }
        if (uri.getRawQuery() != null) {
            builder.append('?').append(uri.getRawQuery());
        }
        try {
            return new URI(builder.toString());
        } catch (URISyntaxException e) {
            throw new GraphClientException("Invalid URI", e);
        }
    }

    /**
     * Creates a context for the given root URI.
     * <p>
     * Explicit credentials take precedence over credentials embedded in the user info of the root URI.
     */
    public static HttpContext of(
            HttpClient httpClient,
            URI rootUri,
            JSON json,
            Credentials credentials,
            ExecutionConfiguration configuration) {
        var effectiveCredentials = credentials != null
                ? credentials
                : Credentials.fromUserInfo(rootUri).orElse(null);
        var authHeader = effectiveCredentials != null ? basicAuthHeader(effectiveCredentials) : null;
        return new HttpContext(httpClient, rootUri, json, authHeader, configuration);
    }

    static String basicAuthHeader(Credentials credentials) {
        return "Basic "
                + Base64.getEncoder()
                        .encodeToString("%s:%s"
                                .formatted(credentials.username(), credentials.password())
                                .getBytes(StandardCharsets.UTF_8));
    }

    public String[] headers() {
        var headers = new ArrayList<String>();
        headers.add("Accept");
        headers.add("application/json");
        headers.add("User-Agent");
        headers.add(configuration.userAgent());
        if (authHeader != null) {
            headers.add("Authorization");
            headers.add(authHeader);
        }
        if (configuration.jsonStreaming()) {
            headers.add(Fieldnames.STREAM_HEADER);
            headers.add("true");
        }
        return headers.toArray(String[]::new);
    }

    HttpRequest newRootRequest() {
        var builder = HttpRequest.newBuilder(baseUri).headers(headers()).GET();
        if (configuration.requestTimeout() != null) {
            builder.timeout(configuration.requestTimeout());
        }
        return builder.build();
    }

    /**
     * Makes an absolute endpoint URI relative to {@link #baseUri()} when it points below it.
     */
    String relativize(String endpoint) {
        var base = baseUri.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        if (!base.isEmpty() && endpoint.startsWith(base)) {
            var remainder = endpoint.substring(base.length());
            if (remainder.isEmpty() || remainder.startsWith("/")) {
                return remainder;
            }
        }
        return endpoint;
    }
}
