package io.tripdata.command.common;

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

import io.tripdata.s3.S3Settings;
import picocli.CommandLine;

/**
 * Object store connection options, defaulting to the standard AWS environment variables.
 * Without credentials the bucket is read anonymously.
 */
public class S3Options {

    @CommandLine.Option(
        names = {"--aws-access-key-id"},
        description = "Access key id (default: $AWS_ACCESS_KEY_ID)",
        defaultValue = "${env:AWS_ACCESS_KEY_ID}"
    )
    private String accessKeyId;

    @CommandLine.Option(
        names = {"--aws-secret-access-key"},
        description = "Secret access key (default: $AWS_SECRET_ACCESS_KEY)",
        defaultValue = "${env:AWS_SECRET_ACCESS_KEY}"
    )
    private String secretAccessKey;

    @CommandLine.Option(
        names = {"--aws-region"},
        description = "Region (default: $AWS_REGION or us-east-1)",
        defaultValue = "${env:AWS_REGION:-us-east-1}"
    )
    private String region;

    @CommandLine.Option(
        names = {"--s3-endpoint"},
        description = "Endpoint override for S3 compatible stores (default: $AWS_ENDPOINT_OVERRIDE)",
        defaultValue = "${env:AWS_ENDPOINT_OVERRIDE}"
    )
    private String endpointOverride;

    /**
     * @return client settings from the options
     */
    public S3Settings settings() {
        return S3Settings.of(accessKeyId, secretAccessKey, region, endpointOverride);
    }
}
