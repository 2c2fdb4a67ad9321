package io.tripdata.sync.metadata;

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

import io.tripdata.api.Fragment;
import io.tripdata.api.RemoteFileSource;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.SeekableInputStream;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;

/// Parquet [InputFile] over ranged reads of a remote fragment.
///
/// The stream keeps one window of bytes. A read outside the window fetches a new one; windows
/// near the end of the file are aligned to the end, so the footer length and the footer itself
/// usually arrive with one request.
public class RemoteInputFile implements InputFile {

    /// Default window size.
    public static final int DEFAULT_WINDOW = 64 * 1024;

    private final RemoteFileSource source;
    private final Fragment fragment;
    private final long length;
    private final int window;

    /// @param source backend serving the fragment
    /// @param fragment the file
    /// @param length its size in bytes
    public RemoteInputFile(RemoteFileSource source, Fragment fragment, long length) {
        this(source, fragment, length, DEFAULT_WINDOW);
    }

    /// @param source backend serving the fragment
    /// @param fragment the file
    /// @param length its size in bytes
    /// @param window bytes fetched per request
    public RemoteInputFile(RemoteFileSource source, Fragment fragment, long length, int window) {
        if (length < 0) {
            throw new IllegalArgumentException("negative length " + length);
        }
        if (window <= 0) {
            throw new IllegalArgumentException("window must be positive, got " + window);
        }
        this.source = source;
        this.fragment = fragment;
        this.length = length;
        this.window = window;
    }

    @Override
    public long getLength() {
        return length;
    }

    @Override
    public SeekableInputStream newStream() {
        return new RangeSeekableInputStream();
    }

    @Override
    public String toString() {
        return fragment.path();
    }

    private final class RangeSeekableInputStream extends SeekableInputStream {
        private long position;
        private long bufferStart;
        private byte[] buffer = new byte[0];

        @Override
        public long getPos() {
            return position;
        }

        @Override
        public void seek(long newPos) throws IOException {
            if (newPos < 0 || newPos > length) {
                throw new EOFException("Seek to " + newPos + " outside 0.." + length + " of " + fragment.path());
            }
            position = newPos;
        }

        @Override
        public int read() throws IOException {
            if (position >= length) {
                return -1;
            }
            fill();
            return buffer[(int) (position++ - bufferStart)] & 0xFF;
        }

        @Override
        public int read(byte[] bytes, int off, int len) throws IOException {
            if (len == 0) {
                return 0;
            }
            if (position >= length) {
                return -1;
            }
            fill();
            int available = (int) (bufferStart + buffer.length - position);
            int count = Math.min(len, available);
            System.arraycopy(buffer, (int) (position - bufferStart), bytes, off, count);
            position += count;
            return count;
        }

        @Override
        public void readFully(byte[] bytes) throws IOException {
            readFully(bytes, 0, bytes.length);
        }

        @Override
        public void readFully(byte[] bytes, int start, int len) throws IOException {
            int done = 0;
            while (done < len) {
                int count = read(bytes, start + done, len - done);
                if (count < 0) {
                    throw new EOFException("Reached end of " + fragment.path() + " with "
                        + (len - done) + " bytes left to read");
                }
                done += count;
            }
        }

        @Override
        public int read(ByteBuffer buf) throws IOException {
            int len = buf.remaining();
            if (len == 0) {
                return 0;
            }
            byte[] bytes = new byte[len];
            int count = read(bytes, 0, len);
            if (count > 0) {
                buf.put(bytes, 0, count);
            }
            return count;
        }

        @Override
        public void readFully(ByteBuffer buf) throws IOException {
            byte[] bytes = new byte[buf.remaining()];
            readFully(bytes);
            buf.put(bytes);
        }

        private void fill() throws IOException {
            if (position >= bufferStart && position < bufferStart + buffer.length) {
                return;
            }
            long start = Math.max(0, Math.min(position, length - window));
            int count = (int) Math.min(window, length - start);
            byte[] fetched = source.readRange(fragment, start, count);
            if (start + fetched.length <= position) {
                throw new EOFException("Short read of " + fragment.path() + " at offset " + start
                    + ": " + fetched.length + " bytes");
            }
            bufferStart = start;
            buffer = fetched;
        }
    }
}
