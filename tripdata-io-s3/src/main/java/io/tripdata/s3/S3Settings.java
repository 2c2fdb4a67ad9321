package io.tripdata.s3;

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

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/// Connection settings for the object-store backend.
///
/// Credentials are optional: without them the client signs nothing, which is enough for public
/// buckets.
///
/// @param accessKeyId access key id, or null
/// @param secretAccessKey secret key, or null
/// @param region signing region
/// @param scheme `https` or `http`
/// @param requestTimeout timeout of a single request
/// @param connectTimeout TCP connect timeout
/// @param endpointOverride custom endpoint for S3 compatible stores, or null
public record S3Settings(
    String accessKeyId,
    String secretAccessKey,
    String region,
    String scheme,
    Duration requestTimeout,
    Duration connectTimeout,
    String endpointOverride
) {
    /// Default signing region
    public static final String DEFAULT_REGION = "us-east-1";
    /// Default scheme
    public static final String DEFAULT_SCHEME = "https";
    /// Default request timeout
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(6);
    /// Default connect timeout
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(3);

    /// Validating constructor; blank strings count as absent.
    public S3Settings {
        accessKeyId = blankToNull(accessKeyId);
        secretAccessKey = blankToNull(secretAccessKey);
        region = Optional.ofNullable(blankToNull(region)).orElse(DEFAULT_REGION);
        scheme = Optional.ofNullable(blankToNull(scheme)).orElse(DEFAULT_SCHEME);
        if (!scheme.equals("https") && !scheme.equals("http")) {
            throw new IllegalArgumentException("scheme must be http or https, got " + scheme);
        }
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (requestTimeout.isNegative() || requestTimeout.isZero()
            || connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("timeouts must be positive");
        }
        endpointOverride = blankToNull(endpointOverride);
    }

    /// @return anonymous access to `us-east-1` over https with the default timeouts
    public static S3Settings defaults() {
        return new S3Settings(null, null, DEFAULT_REGION, DEFAULT_SCHEME,
            DEFAULT_REQUEST_TIMEOUT, DEFAULT_CONNECT_TIMEOUT, null);
    }

    /// @param accessKeyId access key id, may be null
    /// @param secretAccessKey secret key, may be null
    /// @param region region, may be null for the default
    /// @param endpointOverride endpoint, may be null
    /// @return settings with the default scheme and timeouts
    public static S3Settings of(String accessKeyId, String secretAccessKey, String region, String endpointOverride) {
        return new S3Settings(accessKeyId, secretAccessKey, region, DEFAULT_SCHEME,
            DEFAULT_REQUEST_TIMEOUT, DEFAULT_CONNECT_TIMEOUT, endpointOverride);
    }

    /// @return true when both key parts are present
    public boolean hasCredentials() {
        return accessKeyId != null && secretAccessKey != null;
    }

    @Override
    public String toString() {
        return "S3Settings{region=" + region
            + ", scheme=" + scheme
            + ", credentials=" + (hasCredentials() ? "static" : "anonymous")
            + ", requestTimeout=" + requestTimeout
            + ", connectTimeout=" + connectTimeout
            + ", endpointOverride=" + endpointOverride + "}";
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
