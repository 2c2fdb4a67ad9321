package io.tripdata.sync.discovery;

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
import io.tripdata.api.DatasetDiscovery;
import io.tripdata.api.DiscoveryException;
import io.tripdata.api.Fragment;
import io.tripdata.api.SourceDescriptor;
import io.tripdata.s3.S3FileSource;
import io.tripdata.s3.S3Location;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.List;

/// Lists every object under a bucket prefix.
///
/// Each fragment carries the size and modification time from the listing, so the sync stage
/// needs no further metadata request for it.
public class ObjectStoreDatasetDiscovery implements DatasetDiscovery {
    private static final Logger logger = LogManager.getLogger(ObjectStoreDatasetDiscovery.class);

    private final S3FileSource source;

    /// @param source the object store to list
    public ObjectStoreDatasetDiscovery(S3FileSource source) {
        this.source = source;
    }

    @Override
    public List<Fragment> discover(SourceDescriptor descriptor) throws DiscoveryException {
        if (descriptor.backend() != Backend.OBJECT_STORE) {
            throw new IllegalArgumentException("Not an object store source: " + descriptor);
        }
        S3Location prefix;
        try {
            prefix = S3Location.parse(descriptor.location());
        } catch (IllegalArgumentException e) {
            throw new DiscoveryException(descriptor.location(), "Invalid object store location", e);
        }
        try {
            List<Fragment> fragments = source.list(prefix);
            logger.debug("Listed {} objects under {}", fragments.size(), prefix.uri());
            return fragments;
        } catch (IOException e) {
            throw new DiscoveryException(descriptor.location(), "Listing failed", e);
        }
    }
}
