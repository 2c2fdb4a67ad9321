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

import java.io.IOException;
import java.nio.file.Path;

/// Access to the files of one backend.
///
/// Implementations are shared by all sync tasks of a run and must be thread safe.
public interface RemoteFileSource extends AutoCloseable {

    /// @return the backend this source serves
    Backend backend();

    /// Resolve metadata for a fragment without reading its payload.
    ///
    /// @param fragment the fragment
    /// @return what the backend knows about it
    /// @throws RemoteFileNotFoundException if the file cannot be resolved
    /// @throws IOException on other I/O failures
    RemoteFileInfo info(Fragment fragment) throws IOException;

    /// Copy a fragment to a local file in chunks.
    ///
    /// The destination is replaced atomically: on failure no partial file is left under the
    /// destination name.
    ///
    /// @param fragment the fragment to copy
    /// @param info metadata previously returned by [#info(Fragment)]
    /// @param destination the local file to write
    /// @param options chunk size and thread count
    /// @return bytes written
    /// @throws TransferException if the copy fails
    long copyTo(Fragment fragment, RemoteFileInfo info, Path destination, TransferOptions options)
        throws TransferException;

    /// Read a byte range of a fragment.
    ///
    /// @param fragment the fragment
    /// @param offset first byte
    /// @param length number of bytes; fewer are returned only at end of file
    /// @return the bytes read
    /// @throws IOException if the range cannot be read
    byte[] readRange(Fragment fragment, long offset, int length) throws IOException;

    @Override
    default void close() throws IOException {
    }
}
