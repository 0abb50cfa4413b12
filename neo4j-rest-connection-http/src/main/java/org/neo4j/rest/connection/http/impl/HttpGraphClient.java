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

import static org.neo4j.rest.connection.http.impl.FutureUtil.completionExceptionCause;
import static org.neo4j.rest.connection.http.impl.HttpUtil.mapToString;

import com.fasterxml.jackson.jr.ob.JSON;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import org.neo4j.rest.connection.ConnectionState;
import org.neo4j.rest.connection.Credentials;
import org.neo4j.rest.connection.ExecutionConfiguration;
import org.neo4j.rest.connection.GraphClient;
import org.neo4j.rest.connection.LoggingProvider;
import org.neo4j.rest.connection.OperationCompletedEvent;
import org.neo4j.rest.connection.OperationCompletedListener;
import org.neo4j.rest.connection.exception.GraphClientException;
import org.neo4j.rest.connection.exception.GraphServiceUnavailableException;
import org.neo4j.rest.connection.exception.UnexpectedHttpStatusException;

public final class HttpGraphClient implements GraphClient {
    static final String CONNECT_OPERATION = "Connect";

    private final System.Logger log;
    private final URI rootUri;
    private final ExecutionConfiguration configuration;
    private final HttpContext httpContext;
    private final RootDescriptorDecoder rootDescriptorDecoder;
    private final Clock clock;
    private final List<OperationCompletedListener> listeners = new CopyOnWriteArrayList<>();

    // written once per successful connect
    private volatile ConnectionState connectionState;

    public HttpGraphClient(
            HttpClient httpClient,
            URI rootUri,
            Credentials credentials,
            ExecutionConfiguration configuration,
            Clock clock,
            LoggingProvider logging) {
        this.log = logging.getLog(getClass());
        this.rootUri = Objects.requireNonNull(rootUri);
        this.configuration = Objects.requireNonNull(configuration);
        this.clock = Objects.requireNonNull(clock);
        this.httpContext = HttpContext.of(httpClient, rootUri, JSON.std, credentials, configuration);
        this.rootDescriptorDecoder = new RootDescriptorDecoder(httpContext);
    }

    @Override
    public URI rootUri() {
        return rootUri;
    }

    @Override
    public ExecutionConfiguration executionConfiguration() {
        return configuration;
    }

    @Override
    public void connect() {
        try {
            connectAsync().toCompletableFuture().join();
        } catch (CompletionException e) {
            var cause = completionExceptionCause(e);
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            } else if (cause instanceof Error error) {
                throw error;
            }
            throw new GraphClientException("Failed to connect to %s".formatted(httpContext.baseUri()), cause);
        }
    }

    @Override
    public CompletionStage<Void> connectAsync() {
        var startMillis = clock.millis();
        CompletionStage<ConnectionState> negotiation;
        try {
            var request = httpContext.newRootRequest();
            if (log.isLoggable(System.Logger.Level.DEBUG)) {
                log.log(System.Logger.Level.DEBUG, "Sending request %s".formatted(mapToString(request)));
            }
            negotiation = httpContext
                    .httpClient()
                    .sendAsync(request, HttpResponse.BodyHandlers.ofString())
                    .thenApply(this::negotiate);
        } catch (Throwable throwable) {
            negotiation = CompletableFuture.failedStage(throwable);
        }
        return negotiation.handle((state, throwable) -> {
            var timeTaken = Duration.ofMillis(clock.millis() - startMillis);
            if (throwable != null) {
                var error = mapConnectError(completionExceptionCause(throwable));
                log.log(
                        System.Logger.Level.DEBUG,
                        "Failed to connect to %s: %s".formatted(httpContext.baseUri(), error.getMessage()));
                fireOperationCompleted(new OperationCompletedEvent(CONNECT_OPERATION, timeTaken, error));
                throw new CompletionException(error);
            }
            connectionState = state;
            log.log(
                    System.Logger.Level.DEBUG,
                    "Connected to %s, server version %s, capabilities %s"
                            .formatted(httpContext.baseUri(), state.serverVersion(), state.cypherCapabilities()));
            fireOperationCompleted(new OperationCompletedEvent(CONNECT_OPERATION, timeTaken, null));
            return null;
        });
    }

    private ConnectionState negotiate(HttpResponse<String> response) {
        if (log.isLoggable(System.Logger.Level.DEBUG)) {
            log.log(System.Logger.Level.DEBUG, "Received response %s".formatted(mapToString(response)));
        }
        var statusCode = response.statusCode();
        if (!HttpStatusReason.isSuccess(statusCode)) {
            throw new UnexpectedHttpStatusException(statusCode, HttpStatusReason.reasonPhrase(statusCode));
        }
        var rootDescriptor = rootDescriptorDecoder.decode(response.body());
        return ConnectionState.of(rootDescriptor);
    }

    private Throwable mapConnectError(Throwable throwable) {
        if (throwable instanceof IOException) {
            return new GraphServiceUnavailableException(
                    "An error occurred while sending request to %s".formatted(httpContext.baseUri()), throwable);
        }
        return throwable;
    }

    private void fireOperationCompleted(OperationCompletedEvent event) {
        for (var listener : listeners) {
            try {
                listener.onOperationCompleted(event);
            } catch (RuntimeException e) {
                log.log(System.Logger.Level.WARNING, "Operation completed listener failed", e);
            }
        }
    }

    @Override
    public boolean isConnected() {
        return connectionState != null;
    }

    @Override
    public Optional<ConnectionState> connectionState() {
        return Optional.ofNullable(connectionState);
    }

    @Override
    public void addOperationCompletedListener(OperationCompletedListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    @Override
    public void removeOperationCompletedListener(OperationCompletedListener listener) {
        listeners.remove(listener);
    }
}
