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

import io.tripdata.api.Backend;
import io.tripdata.api.Fragment;
import io.tripdata.api.PartFiles;
import io.tripdata.api.RemoteFileInfo;
import io.tripdata.api.RemoteFileSource;
import io.tripdata.api.TransferException;
import io.tripdata.api.TransferOptions;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/// Web backend: files addressed by HTTP(S) URL.
///
/// Metadata comes from [RemoteInfoProber]. Copies run as parallel ranged requests when the
/// size is known, the server accepts byte ranges and more than one transfer thread is allowed;
/// otherwise the body is streamed in chunks of the configured size. Either way the data goes
/// through a [PartFiles] part file.
public class HttpFileSource implements RemoteFileSource {
    private static final Logger logger = LogManager.getLogger(HttpFileSource.class);

    private final OkHttpClient client;
    private final RemoteInfoProber prober;
    private final boolean ownsClient;

    /// Creates a source with its own client, released on [#close()].
    public HttpFileSource() {
        this(HttpClients.create(), true);
    }

    /// @param client a shared client; not shut down by [#close()]
    public HttpFileSource(OkHttpClient client) {
        this(client, false);
    }

    private HttpFileSource(OkHttpClient client, boolean ownsClient) {
        this.client = client;
        this.prober = new RemoteInfoProber(client);
        this.ownsClient = ownsClient;
    }

    @Override
    public Backend backend() {
        return Backend.WEB;
    }

    @Override
    public RemoteFileInfo info(Fragment fragment) throws IOException {
        return prober.probe(fragment.path());
    }

    @Override
    public long copyTo(Fragment fragment, RemoteFileInfo info, Path destination, TransferOptions options)
        throws TransferException {
        String url = info.getResolvedUrl().orElse(fragment.path());
        Path part = PartFiles.partFile(destination);
        try {
            PartFiles.createParents(destination);
            Optional<Long> size = info.getSize();
            long bytes;
            if (size.isPresent() && info.supportsRanges() && options.multiThreaded()
                && size.get() > options.chunkSize()) {
                bytes = copyRanged(url, part, size.get(), options);
            } else {
                bytes = copyStream(url, part, options);
            }
            if (size.isPresent() && bytes != size.get()) {
                throw new IOException("Expected " + size.get() + " bytes but received " + bytes);
            }
            PartFiles.moveIntoPlace(part, destination);
            return bytes;
        } catch (IOException | RuntimeException e) {
            PartFiles.deletePartial(part);
            throw new TransferException(url, destination, e);
        }
    }

    @Override
    public byte[] readRange(Fragment fragment, long offset, int length) throws IOException {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative: " + offset);
        }
        if (length <= 0) {
            return new byte[0];
        }
        String rangeHeader = "bytes=" + offset + "-" + (offset + length - 1);
        Request request = new Request.Builder()
            .url(fragment.path())
            .header("Range", rangeHeader)
            .header("Accept-Encoding", "identity")
            .build();

        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (response.code() == 416) {
                throw new IOException("Requested range not satisfiable for " + fragment.path() + ": " + rangeHeader);
            }
            if (!response.isSuccessful() || body == null) {
                throw new IOException("Range request " + rangeHeader + " for " + fragment.path()
                    + " failed with status " + response.code());
            }
            BufferedSource source = body.source();
            if (response.code() == 200) {
                // range ignored, full body returned
                source.skip(offset);
            }
            byte[] data = new byte[length];
            int filled = 0;
            while (filled < length) {
                int read = source.read(data, filled, length - filled);
                if (read == -1) {
                    break;
                }
                filled += read;
            }
            if (filled < length) {
                byte[] shorter = new byte[filled];
                System.arraycopy(data, 0, shorter, 0, filled);
                return shorter;
            }
            return data;
        }
    }

    private long copyStream(String url, Path part, TransferOptions options) throws IOException {
        Request request = new Request.Builder()
            .url(url)
            .header("Accept-Encoding", "identity")
            .build();
        logger.debug("Streaming {} in {} byte chunks", url, options.chunkSize());
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("GET " + url + " failed with status " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("No response body for " + url);
            }
            long total = 0;
            byte[] buffer = new byte[options.chunkSize()];
            try (InputStream in = body.byteStream(); OutputStream out = Files.newOutputStream(part)) {
                int read;
                while ((read = in.read(buffer)) != -1) {
                    out.write(buffer, 0, read);
                    total += read;
                }
            }
            return total;
        }
    }

    private long copyRanged(String url, Path part, long size, TransferOptions options) throws IOException {
        logger.debug("Fetching {} as {} byte ranges on {} threads", url, options.chunkSize(), options.threads());
        try (RandomAccessFile raf = new RandomAccessFile(part.toFile(), "rw")) {
            raf.setLength(size);
        }
        AtomicLong totalBytes = new AtomicLong();
        AtomicBoolean failed = new AtomicBoolean(false);
        ExecutorService executor = Executors.newFixedThreadPool(options.threads());
        try {
            List<CompletableFuture<Void>> chunks = new ArrayList<>();
            for (long start = 0; start < size; start += options.chunkSize()) {
                long end = Math.min(start + options.chunkSize(), size) - 1;
                RangeChunkTask task = new RangeChunkTask(client, url, part, start, end, totalBytes, failed);
                chunks.add(CompletableFuture.runAsync(task, executor));
            }
            CompletableFuture.allOf(chunks.toArray(new CompletableFuture[0])).join();
            return totalBytes.get();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                ? e.getCause().getCause() : e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("Ranged transfer of " + url + " failed", cause == null ? e : cause);
        } finally {
            executor.shutdownNow();
        }
    }

    @Override
    public void close() {
        if (ownsClient) {
            HttpClients.shutdown(client);
        }
    }
}
