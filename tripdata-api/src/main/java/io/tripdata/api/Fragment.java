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

import java.util.Objects;
import java.util.Optional;

/// A remote file handle produced by discovery.
///
/// The identity (record type, year, month) is decoded lazily from the file name; a name that
/// does not follow the grammar only fails when [#identity()] is asked for, so one bad entry in a
/// listing cannot fail the listing itself. Object-store listings already carry size and
/// modification time, which are kept as [#listedInfo()] so no extra request is needed.
public final class Fragment {

    private final String path;
    private final Backend backend;
    private final RemoteFileInfo listedInfo;

    private Fragment(String path, Backend backend, RemoteFileInfo listedInfo) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("fragment path must not be empty");
        }
        this.path = path;
        this.backend = Objects.requireNonNull(backend, "backend");
        this.listedInfo = listedInfo;
    }

    /// @param url an absolute HTTP(S) URL
    /// @return a web fragment whose metadata is resolved by probing
    public static Fragment web(String url) {
        return new Fragment(url, Backend.WEB, null);
    }

    /// @param path `bucket/key` of the object
    /// @param listedInfo metadata returned by the listing call, may be null
    /// @return an object-store fragment
    public static Fragment objectStore(String path, RemoteFileInfo listedInfo) {
        return new Fragment(path, Backend.OBJECT_STORE, listedInfo);
    }

    /// @return the backend-relative identifier: a URL for web, `bucket/key` for object stores
    public String path() {
        return path;
    }

    /// @return where the fragment lives
    public Backend backend() {
        return backend;
    }

    /// @return the last segment of [#path()]
    public String fileName() {
        return TripFileName.baseName(path);
    }

    /// @return the decoded identity
    /// @throws FragmentParseException if the file name does not follow the trip grammar
    public TripFileName identity() {
        return TripFileName.parse(fileName());
    }

    /// @return metadata supplied by the listing, if any
    public Optional<RemoteFileInfo> listedInfo() {
        return Optional.ofNullable(listedInfo);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Fragment)) {
            return false;
        }
        Fragment that = (Fragment) o;
        return path.equals(that.path) && backend == that.backend;
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, backend);
    }

    @Override
    public String toString() {
        return backend.shortName() + ":" + path;
    }
}
