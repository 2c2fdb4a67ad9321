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

import io.tripdata.sync.DatasetLocations;
import picocli.CommandLine;

/**
 * Where the dataset is published. The defaults point at the public NYC TLC locations.
 */
public class DatasetLocationOptions {

    private static final DatasetLocations NYC_TLC = DatasetLocations.nycTlc();

    @CommandLine.Option(
        names = {"--s3-prefix"},
        description = "Bucket and prefix listed for the s3 source (default: ${DEFAULT-VALUE})",
        defaultValue = "nyc-tlc/trip data/"
    )
    private String s3Prefix = NYC_TLC.s3Prefix();

    @CommandLine.Option(
        names = {"--web-page"},
        description = "Page linking the trip files for the web source (default: ${DEFAULT-VALUE})",
        defaultValue = "https://www.nyc.gov/site/tlc/about/tlc-trip-record-data.page"
    )
    private String webPageUrl = NYC_TLC.webPageUrl();

    @CommandLine.Option(
        names = {"--cloudfront-base"},
        description = "Base URL of the published trip files (default: ${DEFAULT-VALUE})",
        defaultValue = "https://d37ci6vzurychx.cloudfront.net/trip-data"
    )
    private String cloudFrontBaseUrl = NYC_TLC.cloudFrontBaseUrl();

    /**
     * @return the configured locations
     */
    public DatasetLocations locations() {
        return new DatasetLocations(s3Prefix, NYC_TLC.s3BaseUrl(), cloudFrontBaseUrl, webPageUrl,
            NYC_TLC.linkSelector(), NYC_TLC.zoneLookupUrl(), NYC_TLC.zonesUrl());
    }
}
