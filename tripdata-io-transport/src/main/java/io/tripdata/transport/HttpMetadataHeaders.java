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
import okhttp3.Headers;
import okhttp3.Response;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.List;
import java.util.Optional;

/// Reads file metadata from HTTP response headers.
public final class HttpMetadataHeaders {

    /// Checksum hint headers copied verbatim into [RemoteFileInfo#getChecksums()]
    public static final List<String> CHECKSUM_HEADERS =
        List.of(RemoteFileInfo.ETAG, RemoteFileInfo.CONTENT_MD5, RemoteFileInfo.DIGEST);

    private HttpMetadataHeaders() {
    }

    /// Infer the uncompressed size of a resource.
    ///
    /// Content-Length is trusted only when no content coding was applied (no Content-Encoding,
    /// or `identity`, or empty). A length that describes an encoded body is dropped rather than
    /// misreported. When there is no Content-Length at all, the total of a
    /// `Content-Range: bytes a-b/TOTAL` header is used.
    ///
    /// @param headers response headers
    /// @return the size, or empty when unknown
    public static Optional<Long> inferSize(Headers headers) {
        String contentLength = headers.get("Content-Length");
        if (contentLength != null) {
            String encoding = headers.get("Content-Encoding");
            if (encoding == null || encoding.isBlank() || "identity".equalsIgnoreCase(encoding.trim())) {
                return parseLong(contentLength);
            }
            return Optional.empty();
        }
        String contentRange = headers.get("Content-Range");
        if (contentRange != null) {
            return parseRangeTotal(contentRange);
        }
        return Optional.empty();
    }

    /// @param contentRange a Content-Range value such as `bytes 0-99/500`
    /// @return the total length, empty when absent (`*`) or malformed
    public static Optional<Long> parseRangeTotal(String contentRange) {
        int slash = contentRange.lastIndexOf('/');
        if (slash < 0) {
            return Optional.empty();
        }
        return parseLong(contentRange.substring(slash + 1));
    }

    /// @param headers response headers
    /// @return Content-Type without parameters
    public static Optional<String> mimeType(Headers headers) {
        String contentType = headers.get("Content-Type");
        if (contentType == null) {
            return Optional.empty();
        }
        int semicolon = contentType.indexOf(';');
        String type = (semicolon >= 0 ? contentType.substring(0, semicolon) : contentType).trim();
        return type.isEmpty() ? Optional.empty() : Optional.of(type);
    }

    /// Last-Modified, read as an HTTP date first and then as an RFC 2822 date, which may omit
    /// the weekday or the seconds and may carry a numeric offset.
    ///
    /// @param headers response headers
    /// @return Last-Modified as an instant, empty when absent or unparseable
    public static Optional<Instant> lastModified(Headers headers) {
        Date date = headers.getDate("Last-Modified");
        if (date != null) {
            return Optional.of(date.toInstant());
        }
        String value = headers.get("Last-Modified");
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(ZonedDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /// @param headers response headers
    /// @return true if `Accept-Ranges: bytes` is present
    public static boolean acceptsRanges(Headers headers) {
        return "bytes".equalsIgnoreCase(headers.get("Accept-Ranges"));
    }

    /// Build the metadata of a completed response.
    ///
    /// @param name the URL that was probed
    /// @param response the response, any redirects already followed
    /// @return the metadata
    public static RemoteFileInfo toInfo(String name, Response response) {
        Headers headers = response.headers();
        RemoteFileInfo.Builder builder = RemoteFileInfo.builder(name)
            .size(inferSize(headers).orElse(null))
            .mimeType(mimeType(headers).orElse(null))
            .modifiedAt(lastModified(headers).orElse(null))
            .resolvedUrl(response.request().url().toString())
            .supportsRanges(acceptsRanges(headers));
        for (String field : CHECKSUM_HEADERS) {
            builder.checksum(field, headers.get(field));
        }
        return builder.build();
    }

    private static Optional<Long> parseLong(String value) {
        try {
            long parsed = Long.parseLong(value.trim());
            return parsed < 0 ? Optional.empty() : Optional.of(parsed);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
