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

import com.amazonaws.ClientConfiguration;
import com.amazonaws.Protocol;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.AnonymousAWSCredentials;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.client.builder.AwsClientBuilder.EndpointConfiguration;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Builds S3 clients from [S3Settings].
public final class S3ClientFactory {
    private static final Logger logger = LogManager.getLogger(S3ClientFactory.class);

    private S3ClientFactory() {
    }

    /// @param settings connection settings
    /// @return a new client
    public static AmazonS3 create(S3Settings settings) {
        ClientConfiguration clientConfig = new ClientConfiguration()
            .withProtocol("http".equals(settings.scheme()) ? Protocol.HTTP : Protocol.HTTPS)
            .withRequestTimeout((int) settings.requestTimeout().toMillis())
            .withConnectionTimeout((int) settings.connectTimeout().toMillis());

        AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard()
            .withClientConfiguration(clientConfig);

        if (settings.hasCredentials()) {
            builder.withCredentials(new AWSStaticCredentialsProvider(
                new BasicAWSCredentials(settings.accessKeyId(), settings.secretAccessKey())));
        } else {
            builder.withCredentials(new AWSStaticCredentialsProvider(new AnonymousAWSCredentials()));
        }

        if (settings.endpointOverride() != null) {
            builder.withEndpointConfiguration(new EndpointConfiguration(settings.endpointOverride(), settings.region()));
            // S3 compatible stores such as MinIO need path-style addressing
            builder.withPathStyleAccessEnabled(true);
        } else {
            builder.withRegion(settings.region());
        }
        logger.debug("Creating S3 client with {}", settings);
        return builder.build();
    }
}
