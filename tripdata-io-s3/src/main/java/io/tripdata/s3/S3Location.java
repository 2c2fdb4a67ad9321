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

/// A bucket and a key or key prefix.
///
/// @param bucket the bucket name
/// @param key the key or prefix, possibly empty
public record S3Location(String bucket, String key) {

    /// Validating constructor.
    public S3Location {
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("bucket must not be empty");
        }
        key = key == null ? "" : key;
    }

    /// Parse `s3://bucket/key` or `bucket/key`.
    ///
    /// @param location the location
    /// @return the parsed location
    public static S3Location parse(String location) {
        if (location == null) {
            throw new IllegalArgumentException("location must not be null");
        }
        String path = location.startsWith("s3://") ? location.substring("s3://".length()) : location;
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        int slash = path.indexOf('/');
        if (slash < 0) {
            return new S3Location(path, "");
        }
        return new S3Location(path.substring(0, slash), path.substring(slash + 1));
    }

    /// @return `bucket/key`, the form used as a fragment path
    public String path() {
        return key.isEmpty() ? bucket : bucket + "/" + key;
    }

    /// @return `s3://bucket/key`
    public String uri() {
        return "s3://" + path();
    }
}
