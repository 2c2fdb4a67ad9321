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

import com.amazonaws.AmazonServiceException;
import com.amazonaws.SdkClientException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.GetObjectRequest;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.S3Object;
import com.amazonaws.services.s3.model.S3ObjectSummary;
import com.amazonaws.services.s3.transfer.Download;
import com.amazonaws.services.s3.transfer.TransferManager;
import com.amazonaws.services.s3.transfer.TransferManagerBuilder;
import io.tripdata.api.Backend;
import io.tripdata.api.Fragment;
import io.tripdata.api.PartFiles;
import io.tripdata.api.RemoteFileInfo;
import io.tripdata.api.RemoteFileNotFoundException;
import io.tripdata.api.RemoteFileSource;
import io.tripdata.api.TransferException;
import io.tripdata.api.TransferOptions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;

/// Object-store backend over Amazon S3 or a compatible store.
///
/// Fragment paths are `bucket/key`. Listings are recursive, so objects below hive-style
/// partition directories (`year=2023/month=01/...`) come back as ordinary leaf files, and each
/// fragment carries the size, modification time and ETag from the listing. Copies use the SDK's
/// [TransferManager] when more than one thread is allowed, and a chunked stream otherwise.
public class S3FileSource implements RemoteFileSource {
    private static final Logger logger = LogManager.getLogger(S3FileSource.class);

    private final AmazonS3 s3;
    private final boolean ownsClient;

    /// @param settings settings for a client owned by this source
    public S3FileSource(S3Settings settings) {
        this(S3ClientFactory.create(settings), true);
    }

    /// @param s3 a shared client; not shut down by [#close()]
    public S3FileSource(AmazonS3 s3) {
        this(s3, false);
    }

    private S3FileSource(AmazonS3 s3, boolean ownsClient) {
        this.s3 = s3;
        this.ownsClient = ownsClient;
    }

    @Override
    public Backend backend() {
        return Backend.OBJECT_STORE;
    }

    /// List every object below a prefix.
    ///
    /// @param prefix where to list
    /// @return one fragment per object; directory markers are skipped
    /// @throws IOException if a listing page cannot be fetched
    public List<Fragment> list(S3Location prefix) throws IOException {
        ListObjectsV2Request request = new ListObjectsV2Request()
            .withBucketName(prefix.bucket())
            .withPrefix(prefix.key());
        List<Fragment> fragments = new ArrayList<>();
        try {
            ListObjectsV2Result result;
            do {
                result = s3.listObjectsV2(request);
                for (S3ObjectSummary summary : result.getObjectSummaries()) {
                    if (summary.getKey().endsWith("/")) {
                        continue;
                    }
                    String path = summary.getBucketName() == null
                        ? prefix.bucket() + "/" + summary.getKey()
                        : summary.getBucketName() + "/" + summary.getKey();
                    fragments.add(Fragment.objectStore(path, toInfo(path, summary)));
                }
                request.setContinuationToken(result.getNextContinuationToken());
            } while (result.isTruncated());
        } catch (SdkClientException e) {
            throw new IOException("Listing " + prefix.uri() + " failed: " + e.getMessage(), e);
        }
        logger.debug("Listed {} objects under {}", fragments.size(), prefix.uri());
        return fragments;
    }

    @Override
    public RemoteFileInfo info(Fragment fragment) throws IOException {
        Optional<RemoteFileInfo> listed = fragment.listedInfo();
        if (listed.isPresent()) {
            return listed.get();
        }
        S3Location location = S3Location.parse(fragment.path());
        try {
            ObjectMetadata metadata = s3.getObjectMetadata(location.bucket(), location.key());
            return toInfo(fragment.path(), metadata);
        } catch (AmazonServiceException e) {
            if (e.getStatusCode() == 404) {
                throw new RemoteFileNotFoundException(location.uri(), e);
            }
            throw new IOException("Metadata request for " + location.uri() + " failed: " + e.getMessage(), e);
        } catch (SdkClientException e) {
            throw new IOException("Metadata request for " + location.uri() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public long copyTo(Fragment fragment, RemoteFileInfo info, Path destination, TransferOptions options)
        throws TransferException {
        S3Location location = S3Location.parse(fragment.path());
        Path part = PartFiles.partFile(destination);
        try {
            PartFiles.createParents(destination);
            long bytes = options.multiThreaded()
                ? copyWithTransferManager(location, part, options)
                : copyStream(location, part, options);
            Optional<Long> size = info.getSize();
            if (size.isPresent() && bytes != size.get()) {
                throw new IOException("Expected " + size.get() + " bytes but received " + bytes);
            }
            PartFiles.moveIntoPlace(part, destination);
            return bytes;
        } catch (IOException | RuntimeException e) {
            PartFiles.deletePartial(part);
            throw new TransferException(location.uri(), destination, e);
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
        S3Location location = S3Location.parse(fragment.path());
        GetObjectRequest request = new GetObjectRequest(location.bucket(), location.key())
            .withRange(offset, offset + length - 1);
        try (S3Object object = s3.getObject(request); InputStream in = object.getObjectContent()) {
            return in.readNBytes(length);
        } catch (SdkClientException e) {
            throw new IOException("Range read of " + location.uri() + " failed: " + e.getMessage(), e);
        }
    }

    private long copyStream(S3Location location, Path part, TransferOptions options) throws IOException {
        logger.debug("Streaming {} in {} byte chunks", location.uri(), options.chunkSize());
        long total = 0;
        byte[] buffer = new byte[options.chunkSize()];
        try (S3Object object = s3.getObject(new GetObjectRequest(location.bucket(), location.key()));
             InputStream in = object.getObjectContent();
             OutputStream out = Files.newOutputStream(part)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                out.write(buffer, 0, read);
                total += read;
            }
        }
        return total;
    }

    private long copyWithTransferManager(S3Location location, Path part, TransferOptions options) throws IOException {
        logger.debug("Downloading {} with {} transfer threads", location.uri(), options.threads());
        TransferManager transferManager = TransferManagerBuilder.standard()
            .withS3Client(s3)
            .withExecutorFactory(() -> Executors.newFixedThreadPool(options.threads()))
            .build();
        try {
            Download download = transferManager.download(
                new GetObjectRequest(location.bucket(), location.key()), part.toFile());
            download.waitForCompletion();
            return Files.size(part);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while downloading " + location.uri(), e);
        } finally {
            transferManager.shutdownNow(false);
        }
    }

    private static RemoteFileInfo toInfo(String path, S3ObjectSummary summary) {
        return RemoteFileInfo.builder(path)
            .size(summary.getSize())
            .modifiedAt(summary.getLastModified() == null ? null : summary.getLastModified().toInstant())
            .checksum(RemoteFileInfo.ETAG, summary.getETag())
            .resolvedUrl(S3Location.parse(path).uri())
            .supportsRanges(true)
            .build();
    }

    private static RemoteFileInfo toInfo(String path, ObjectMetadata metadata) {
        String contentType = metadata.getContentType();
        if (contentType != null && contentType.indexOf(';') >= 0) {
            contentType = contentType.substring(0, contentType.indexOf(';')).trim();
        }
        return RemoteFileInfo.builder(path)
            .size(metadata.getContentLength())
            .mimeType(contentType)
            .modifiedAt(metadata.getLastModified() == null ? null : metadata.getLastModified().toInstant())
            .checksum(RemoteFileInfo.ETAG, metadata.getETag())
            .checksum(RemoteFileInfo.CONTENT_MD5, metadata.getContentMD5())
            .resolvedUrl(S3Location.parse(path).uri())
            .supportsRanges(true)
            .build();
    }

    @Override
    public void close() {
        if (ownsClient) {
            s3.shutdown();
        }
    }
}
