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

import io.tripdata.api.RemoteFileInfo;
import io.tripdata.api.RemoteFileNotFoundException;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/// Determines size, type, modification time and checksum hints of a URL without reading it.
///
/// Servers disagree about HEAD: some reject it, some omit the length, some report the length of
/// a compressed body. The prober therefore makes at most two attempts. A HEAD request comes
/// first; only when it fails or yields no usable size is a GET issued. Both send
/// `Accept-Encoding: identity` and follow redirects. A failed GET is terminal and surfaces as
/// [RemoteFileNotFoundException]. There are no other retries.
///
/// Every response is closed before returning. The GET body is never read, so probing a large
/// file costs only the response headers.
///
/// Instances are thread safe.
public class RemoteInfoProber {
    private static final Logger classLogger = LogManager.getLogger(RemoteInfoProber.class);

    private final OkHttpClient client;
    private final Logger logger;

    /// @param client the HTTP client; redirects must be enabled
    public RemoteInfoProber(OkHttpClient client) {
        this(client, classLogger);
    }

    /// @param client the HTTP client; redirects must be enabled
    /// @param logger where attempt failures are logged
    public RemoteInfoProber(OkHttpClient client, Logger logger) {
        this.client = client;
        this.logger = logger;
    }

    /// Probe a URL.
    ///
    /// @param url an absolute HTTP(S) URL
    /// @return the metadata; the size is absent when neither attempt yielded a trustworthy one
    /// @throws RemoteFileNotFoundException when the GET attempt fails
    public RemoteFileInfo probe(String url) throws RemoteFileNotFoundException {
        ProbeAttempt head = attempt(url, ProbePolicy.HEAD);
        if (head.hasSize()) {
            return head.info();
        }
        if (!head.succeeded()) {
            logger.debug("HEAD probe of {} failed, trying GET: {}", url, head.error().getMessage());
        } else {
            logger.debug("HEAD probe of {} gave no usable size, trying GET", url);
        }

        ProbeAttempt get = attempt(url, ProbePolicy.GET);
        if (!get.succeeded()) {
            throw new RemoteFileNotFoundException(url, get.error());
        }
        return head.succeeded() ? merge(head.info(), get.info()) : get.info();
    }

    /// Make a single probe request.
    ///
    /// @param url the URL
    /// @param policy HEAD or GET
    /// @return the attempt; never throws for network or status failures
    public ProbeAttempt attempt(String url, ProbePolicy policy) {
        HttpUrl httpUrl = HttpUrl.parse(url);
        if (httpUrl == null) {
            return ProbeAttempt.failed(policy, new IOException("Not an HTTP(S) URL: " + url));
        }
        Request request = new Request.Builder()
            .url(httpUrl)
            .header("Accept-Encoding", "identity")
            .method(policy.method(), null)
            .build();

        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                return ProbeAttempt.failed(policy,
                    new IOException(policy.method() + " " + url + " returned status " + response.code()));
            }
            RemoteFileInfo info = HttpMetadataHeaders.toInfo(url, response);
            logger.trace("{} {} -> {}", policy.method(), url, info);
            return ProbeAttempt.succeeded(policy, info);
        } catch (IOException e) {
            return ProbeAttempt.failed(policy, e);
        }
    }

    // Fields of the later response win where present.
    private static RemoteFileInfo merge(RemoteFileInfo first, RemoteFileInfo second) {
        RemoteFileInfo.Builder builder = first.toBuilder();
        second.getSize().ifPresent(builder::size);
        second.getMimeType().ifPresent(builder::mimeType);
        second.getModifiedAt().ifPresent(builder::modifiedAt);
        second.getResolvedUrl().ifPresent(builder::resolvedUrl);
        second.getChecksums().forEach(builder::checksum);
        builder.supportsRanges(first.supportsRanges() || second.supportsRanges());
        return builder.build();
    }
}
