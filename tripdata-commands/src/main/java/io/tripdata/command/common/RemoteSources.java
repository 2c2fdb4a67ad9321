package io.tripdata.command.common;

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

import io.tripdata.api.Backend;
import io.tripdata.api.DatasetDiscovery;
import io.tripdata.api.RemoteFileSource;
import io.tripdata.api.SelectionCriteria;
import io.tripdata.api.SourceDescriptor;
import io.tripdata.s3.S3FileSource;
import io.tripdata.s3.S3Settings;
import io.tripdata.sync.DatasetLocations;
import io.tripdata.sync.discovery.ObjectStoreDatasetDiscovery;
import io.tripdata.sync.discovery.WebDatasetDiscovery;
import io.tripdata.transport.HttpClients;
import io.tripdata.transport.HttpFileSource;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.Map;

/// The backends of one command invocation.
///
/// The HTTP backend is always available; the object store client is only created when the
/// object store is the selected source.
public final class RemoteSources implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(RemoteSources.class);

    private final OkHttpClient client;
    private final HttpFileSource http;
    private final S3FileSource s3;

    private RemoteSources(OkHttpClient client, S3FileSource s3) {
        this.client = client;
        this.http = new HttpFileSource(client);
        this.s3 = s3;
    }

    /// @param source the selected source backend
    /// @param settings object store settings, used only for the object store
    /// @return the opened backends
    public static RemoteSources open(Backend source, S3Settings settings) {
        S3FileSource s3 = null;
        if (source == Backend.OBJECT_STORE) {
            logger.debug("Opening object store client with {}", settings);
            s3 = new S3FileSource(settings);
        }
        return new RemoteSources(HttpClients.create(), s3);
    }

    /// @return web access only
    public static RemoteSources web() {
        return new RemoteSources(HttpClients.create(), null);
    }

    /// @return every open backend by kind
    public Map<Backend, RemoteFileSource> byBackend() {
        Map<Backend, RemoteFileSource> sources = new EnumMap<>(Backend.class);
        sources.put(Backend.WEB, http);
        if (s3 != null) {
            sources.put(Backend.OBJECT_STORE, s3);
        }
        return sources;
    }

    /// @param source the selected source backend
    /// @param locations where the dataset is published
    /// @return the matching discovery strategy
    public DatasetDiscovery discovery(Backend source, DatasetLocations locations) {
        if (source == Backend.OBJECT_STORE) {
            if (s3 == null) {
                throw new IllegalStateException("Object store backend was not opened");
            }
            return new ObjectStoreDatasetDiscovery(s3);
        }
        return new WebDatasetDiscovery(client, locations);
    }

    /// @param source the selected source backend
    /// @param locations where the dataset is published
    /// @param templating criteria used to template web candidates, or null to take every link
    /// @return where discovery should look
    public static SourceDescriptor descriptor(Backend source, DatasetLocations locations,
                                              SelectionCriteria templating) {
        return source == Backend.OBJECT_STORE
            ? SourceDescriptor.objectStore(locations.s3Prefix())
            : SourceDescriptor.web(locations.webPageUrl(), templating);
    }

    @Override
    public void close() {
        if (s3 != null) {
            s3.close();
        }
        http.close();
        HttpClients.shutdown(client);
    }
}
