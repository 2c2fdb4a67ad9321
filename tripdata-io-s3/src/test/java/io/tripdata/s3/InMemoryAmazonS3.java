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

import com.amazonaws.SdkClientException;
import com.amazonaws.services.s3.AbstractAmazonS3;
import com.amazonaws.services.s3.model.AmazonS3Exception;
import com.amazonaws.services.s3.model.GetObjectRequest;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.S3Object;
import com.amazonaws.services.s3.model.S3ObjectSummary;

import java.io.ByteArrayInputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;

/// An S3 client over an in-memory bucket map, for tests.
///
/// Supports paginated V2 listings, object metadata, whole and ranged gets. Keys can be marked as
/// failing, and listing can be made to fail, to exercise error paths.
public class InMemoryAmazonS3 extends AbstractAmazonS3 {

    private final Map<String, ConcurrentSkipListMap<String, StoredObject>> buckets = new ConcurrentHashMap<>();
    private final Set<String> failingKeys = ConcurrentHashMap.newKeySet();
    private final AtomicInteger getCount = new AtomicInteger();
    private volatile boolean listingFails;
    private volatile int pageSize = 1000;

    private record StoredObject(byte[] data, Instant modified) {
    }

    public InMemoryAmazonS3 put(String bucket, String key, byte[] data, Instant modified) {
        buckets.computeIfAbsent(bucket, b -> new ConcurrentSkipListMap<>()).put(key, new StoredObject(data, modified));
        return this;
    }

    public InMemoryAmazonS3 failKey(String key) {
        failingKeys.add(key);
        return this;
    }

    public InMemoryAmazonS3 failListing(boolean fails) {
        this.listingFails = fails;
        return this;
    }

    public InMemoryAmazonS3 pageSize(int pageSize) {
        this.pageSize = pageSize;
        return this;
    }

    public int getObjectCount() {
        return getCount.get();
    }

    @Override
    public ListObjectsV2Result listObjectsV2(ListObjectsV2Request request) {
        if (listingFails) {
            throw new SdkClientException("Unable to execute HTTP request: connection refused");
        }
        ConcurrentSkipListMap<String, StoredObject> bucket = bucket(request.getBucketName());
        String prefix = request.getPrefix() == null ? "" : request.getPrefix();
        List<String> keys = new ArrayList<>();
        for (String key : bucket.keySet()) {
            if (key.startsWith(prefix)) {
                keys.add(key);
            }
        }
        int start = request.getContinuationToken() == null ? 0 : Integer.parseInt(request.getContinuationToken());
        int end = Math.min(keys.size(), start + pageSize);

        ListObjectsV2Result result = new ListObjectsV2Result();
        result.setBucketName(request.getBucketName());
        result.setPrefix(prefix);
        for (String key : keys.subList(start, end)) {
            StoredObject object = bucket.get(key);
            S3ObjectSummary summary = new S3ObjectSummary();
            summary.setBucketName(request.getBucketName());
            summary.setKey(key);
            summary.setSize(object.data().length);
            summary.setLastModified(Date.from(object.modified()));
            summary.setETag("etag-" + key.hashCode());
            result.getObjectSummaries().add(summary);
        }
        result.setKeyCount(end - start);
        result.setTruncated(end < keys.size());
        if (end < keys.size()) {
            result.setNextContinuationToken(Integer.toString(end));
        }
        return result;
    }

    @Override
    public ObjectMetadata getObjectMetadata(String bucketName, String key) {
        StoredObject object = find(bucketName, key);
        ObjectMetadata metadata = new ObjectMetadata();
        metadata.setContentLength(object.data().length);
        metadata.setLastModified(Date.from(object.modified()));
        metadata.setContentType("application/octet-stream");
        metadata.setHeader("ETag", "etag-" + key.hashCode());
        return metadata;
    }

    @Override
    public S3Object getObject(GetObjectRequest request) {
        getCount.incrementAndGet();
        StoredObject stored = find(request.getBucketName(), request.getKey());
        if (failingKeys.contains(request.getKey())) {
            throw new SdkClientException("Connection reset while reading " + request.getKey());
        }
        byte[] data = stored.data();
        long[] range = request.getRange();
        if (range != null) {
            int from = (int) Math.min(range[0], data.length);
            int to = (int) Math.min(range[1] + 1, data.length);
            byte[] slice = new byte[to - from];
            System.arraycopy(data, from, slice, 0, slice.length);
            data = slice;
        }
        S3Object object = new S3Object();
        object.setBucketName(request.getBucketName());
        object.setKey(request.getKey());
        ObjectMetadata metadata = new ObjectMetadata();
        metadata.setContentLength(data.length);
        metadata.setLastModified(Date.from(stored.modified()));
        object.setObjectMetadata(metadata);
        object.setObjectContent(new ByteArrayInputStream(data));
        return object;
    }

    @Override
    public void shutdown() {
    }

    private ConcurrentSkipListMap<String, StoredObject> bucket(String name) {
        ConcurrentSkipListMap<String, StoredObject> bucket = buckets.get(name);
        if (bucket == null) {
            AmazonS3Exception e = new AmazonS3Exception("The specified bucket does not exist");
            e.setStatusCode(404);
            e.setErrorCode("NoSuchBucket");
            throw e;
        }
        return bucket;
    }

    private StoredObject find(String bucketName, String key) {
        StoredObject object = bucket(bucketName).get(key);
        if (object == null) {
            AmazonS3Exception e = new AmazonS3Exception("Not Found");
            e.setStatusCode(404);
            e.setErrorCode("NoSuchKey");
            throw e;
        }
        return object;
    }
}
