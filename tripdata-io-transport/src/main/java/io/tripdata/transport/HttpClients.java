package io.tripdata.transport;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;

import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;

/// Builds the OkHttp clients shared by probing, discovery and transfer.
public final class HttpClients {

    /// Connect timeout of [#create()]
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    /// Read and write timeout of [#create()]
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);

    private HttpClients() {
    }

    /// @return a client with the default timeouts
    public static OkHttpClient create() {
        return create(DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT);
    }

    /// Creates a client tuned for many concurrent requests against few hosts.
    ///
    /// Redirects are followed, HTTP/2 is preferred, and the dispatcher limits are raised so that
    /// parallel fragment tasks and ranged chunks are not serialized per host.
    ///
    /// @param connectTimeout connect timeout
    /// @param readTimeout read and write timeout
    /// @return a new client
    public static OkHttpClient create(Duration connectTimeout, Duration readTimeout) {
        Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequests(128);
        dispatcher.setMaxRequestsPerHost(32);

        return new OkHttpClient.Builder()
            .dispatcher(dispatcher)
            .connectionPool(new ConnectionPool(32, 5, TimeUnit.MINUTES))
            .connectTimeout(connectTimeout)
            .readTimeout(readTimeout)
            .writeTimeout(readTimeout)
            .protocols(Arrays.asList(Protocol.HTTP_2, Protocol.HTTP_1_1))
            .followRedirects(true)
            .followSslRedirects(true)
            .retryOnConnectionFailure(true)
            .build();
    }

    /// Release the dispatcher threads and pooled connections of a client.
    ///
    /// @param client the client to shut down
    public static void shutdown(OkHttpClient client) {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}
