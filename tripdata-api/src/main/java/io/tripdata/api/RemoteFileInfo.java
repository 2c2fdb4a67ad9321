package io.tripdata.api;

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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// What is known about a remote file without downloading it.
///
/// Every attribute except the name is optional. An absent size means the server gave no
/// reliable length; callers must treat it as unknown and never as zero.
public final class RemoteFileInfo {

    /// Header name used for entity tags in [#checksums()]
    public static final String ETAG = "ETag";
    /// Header name used for MD5 digests in [#checksums()]
    public static final String CONTENT_MD5 = "Content-MD5";
    /// Header name used for RFC 3230 digests in [#checksums()]
    public static final String DIGEST = "Digest";

    private final String name;
    private final Long size;
    private final String mimeType;
    private final Instant modifiedAt;
    private final Map<String, String> checksums;
    private final String resolvedUrl;
    private final boolean supportsRanges;

    private RemoteFileInfo(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name");
        this.size = builder.size;
        this.mimeType = builder.mimeType;
        this.modifiedAt = builder.modifiedAt;
        this.checksums = Collections.unmodifiableMap(new LinkedHashMap<>(builder.checksums));
        this.resolvedUrl = builder.resolvedUrl;
        this.supportsRanges = builder.supportsRanges;
    }

    /// @param name the path or URL that was asked about
    /// @return a new builder
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /// @return a builder pre-populated with this instance's values
    public Builder toBuilder() {
        Builder builder = new Builder(name);
        builder.size = size;
        builder.mimeType = mimeType;
        builder.modifiedAt = modifiedAt;
        builder.checksums.putAll(checksums);
        builder.resolvedUrl = resolvedUrl;
        builder.supportsRanges = supportsRanges;
        return builder;
    }

    /// @return the path or URL that was asked about
    public String getName() {
        return name;
    }

    /// @return the size in bytes, when the server reported an uncompressed length
    public Optional<Long> getSize() {
        return Optional.ofNullable(size);
    }

    /// @return the content type without parameters
    public Optional<String> getMimeType() {
        return Optional.ofNullable(mimeType);
    }

    /// @return the last modification time
    public Optional<Instant> getModifiedAt() {
        return Optional.ofNullable(modifiedAt);
    }

    /// Opaque checksum hints keyed by header name ([#ETAG], [#CONTENT_MD5], [#DIGEST]).
    /// They are copied, never computed or verified.
    /// @return an unmodifiable map, possibly empty
    public Map<String, String> getChecksums() {
        return checksums;
    }

    /// @return the final URL after redirects, for web files
    public Optional<String> getResolvedUrl() {
        return Optional.ofNullable(resolvedUrl);
    }

    /// @return true if the source advertised byte range support
    public boolean supportsRanges() {
        return supportsRanges;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RemoteFileInfo)) {
            return false;
        }
        RemoteFileInfo that = (RemoteFileInfo) o;
        return supportsRanges == that.supportsRanges
            && name.equals(that.name)
            && Objects.equals(size, that.size)
            && Objects.equals(mimeType, that.mimeType)
            && Objects.equals(modifiedAt, that.modifiedAt)
            && checksums.equals(that.checksums)
            && Objects.equals(resolvedUrl, that.resolvedUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, size, mimeType, modifiedAt, checksums, resolvedUrl, supportsRanges);
    }

    @Override
    public String toString() {
        return "RemoteFileInfo{name=" + name
            + ", size=" + size
            + ", mimeType=" + mimeType
            + ", modifiedAt=" + modifiedAt
            + ", checksums=" + checksums
            + ", resolvedUrl=" + resolvedUrl
            + ", supportsRanges=" + supportsRanges + "}";
    }

    /// Mutable builder for [RemoteFileInfo].
    public static final class Builder {
        private final String name;
        private Long size;
        private String mimeType;
        private Instant modifiedAt;
        private final Map<String, String> checksums = new LinkedHashMap<>();
        private String resolvedUrl;
        private boolean supportsRanges;

        private Builder(String name) {
            this.name = name;
        }

        /// @param size size in bytes, or null when unknown
        /// @return this builder
        public Builder size(Long size) {
            if (size != null && size < 0) {
                throw new IllegalArgumentException("size must not be negative: " + size);
            }
            this.size = size;
            return this;
        }

        /// @param mimeType content type without parameters, or null
        /// @return this builder
        public Builder mimeType(String mimeType) {
            this.mimeType = mimeType;
            return this;
        }

        /// @param modifiedAt modification time, or null
        /// @return this builder
        public Builder modifiedAt(Instant modifiedAt) {
            this.modifiedAt = modifiedAt;
            return this;
        }

        /// @param field checksum header name
        /// @param value opaque value; ignored when null or empty
        /// @return this builder
        public Builder checksum(String field, String value) {
            if (value != null && !value.isEmpty()) {
                checksums.put(field, value);
            }
            return this;
        }

        /// @param resolvedUrl final URL after redirects, or null
        /// @return this builder
        public Builder resolvedUrl(String resolvedUrl) {
            this.resolvedUrl = resolvedUrl;
            return this;
        }

        /// @param supportsRanges whether byte ranges are accepted
        /// @return this builder
        public Builder supportsRanges(boolean supportsRanges) {
            this.supportsRanges = supportsRanges;
            return this;
        }

        /// @return the immutable info
        public RemoteFileInfo build() {
            return new RemoteFileInfo(this);
        }
    }
}
