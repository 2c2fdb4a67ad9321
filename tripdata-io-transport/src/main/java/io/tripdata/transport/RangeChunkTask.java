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

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Path;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/// Downloads one byte range of a file and writes it at the same offset of the target file.
///
/// Failures are not retried: the shared failure flag is raised so sibling chunks stop early,
/// and the cause is rethrown as a [CompletionException].
public class RangeChunkTask implements Runnable {
    private static final int BUFFER_SIZE = 16384;

    private final OkHttpClient client;
    private final String url;
    private final Path targetFile;
    private final long startByte;
    private final long endByte;
    private final AtomicLong totalBytes;
    private final AtomicBoolean failed;

    /// @param client the http client
    /// @param url the url to read
    /// @param targetFile the pre-sized file to write into
    /// @param startByte first byte, inclusive
    /// @param endByte last byte, inclusive
    /// @param totalBytes counter of bytes written by all chunks
    /// @param failed flag shared by all chunks of one transfer
    public RangeChunkTask(OkHttpClient client, String url, Path targetFile, long startByte, long endByte,
                          AtomicLong totalBytes, AtomicBoolean failed) {
        this.client = client;
        this.url = url;
        this.targetFile = targetFile;
        this.startByte = startByte;
        this.endByte = endByte;
        this.totalBytes = totalBytes;
        this.failed = failed;
    }

    @Override
    public void run() {
        if (failed.get()) {
            return;
        }
        String rangeHeader = "bytes=" + startByte + "-" + endByte;
        Request request = new Request.Builder()
            .url(url)
            .header("Range", rangeHeader)
            .header("Accept-Encoding", "identity")
            .build();

        try (Response response = client.newCall(request).execute()) {
            if (response.code() != 206) {
                throw new IOException("Unexpected HTTP status " + response.code() + " for range " + rangeHeader);
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("No response body for range " + rangeHeader);
            }
            long written;
            try (RandomAccessFile raf = new RandomAccessFile(targetFile.toFile(), "rw")) {
                written = writeChunk(raf, body);
            }
            long expected = endByte - startByte + 1;
            if (written != expected) {
                throw new IOException("Range " + rangeHeader + " returned " + written + " bytes, expected " + expected);
            }
            totalBytes.addAndGet(written);
        } catch (IOException e) {
            failed.set(true);
            throw new CompletionException(e);
        }
    }

    private long writeChunk(RandomAccessFile raf, ResponseBody body) throws IOException {
        raf.seek(startByte);
        byte[] buffer = new byte[BUFFER_SIZE];
        long written = 0;
        try (BufferedSource source = body.source()) {
            int read;
            while ((read = source.read(buffer)) != -1) {
                raf.write(buffer, 0, read);
                written += read;
            }
        }
        return written;
    }
}
