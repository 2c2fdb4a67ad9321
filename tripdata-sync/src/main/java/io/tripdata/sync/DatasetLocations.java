package io.tripdata.sync;

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

import java.util.Objects;

/// Where the trip dataset and its companion files are published.
///
/// @param s3Prefix `bucket/prefix/` listed for object-store discovery
/// @param s3BaseUrl `s3://` base used when reporting object-store URLs of a file
/// @param cloudFrontBaseUrl HTTPS base of the published files
/// @param webPageUrl page linking to every published file
/// @param linkSelector CSS selector of the file links on that page
/// @param zoneLookupUrl taxi zone lookup table
/// @param zonesUrl taxi zone shapes archive
public record DatasetLocations(
    String s3Prefix,
    String s3BaseUrl,
    String cloudFrontBaseUrl,
    String webPageUrl,
    String linkSelector,
    String zoneLookupUrl,
    String zonesUrl
) {
    /// Validating constructor; trailing slashes are removed from the base URLs.
    public DatasetLocations {
        Objects.requireNonNull(s3Prefix, "s3Prefix");
        s3BaseUrl = stripTrailingSlash(Objects.requireNonNull(s3BaseUrl, "s3BaseUrl"));
        cloudFrontBaseUrl = stripTrailingSlash(Objects.requireNonNull(cloudFrontBaseUrl, "cloudFrontBaseUrl"));
        Objects.requireNonNull(webPageUrl, "webPageUrl");
        Objects.requireNonNull(linkSelector, "linkSelector");
        Objects.requireNonNull(zoneLookupUrl, "zoneLookupUrl");
        Objects.requireNonNull(zonesUrl, "zonesUrl");
    }

    /// @return the public NYC TLC locations
    public static DatasetLocations nycTlc() {
        return new DatasetLocations(
            "nyc-tlc/trip data/",
            "s3://nyc-tlc/trip data",
            "https://d37ci6vzurychx.cloudfront.net/trip-data",
            "https://www.nyc.gov/site/tlc/about/tlc-trip-record-data.page",
            "a[href*='trip-data']",
            "https://d37ci6vzurychx.cloudfront.net/misc/taxi_zone_lookup.csv",
            "https://d37ci6vzurychx.cloudfront.net/misc/taxi_zones.zip");
    }

    /// @param fileName a trip file name
    /// @return its object-store URL
    public String s3Url(String fileName) {
        return s3BaseUrl + "/" + fileName;
    }

    /// @param fileName a trip file name
    /// @return its CloudFront URL
    public String cloudFrontUrl(String fileName) {
        return cloudFrontBaseUrl + "/" + fileName;
    }

    /// @param cloudFrontBaseUrl another CloudFront base
    /// @return a copy using it
    public DatasetLocations withCloudFrontBaseUrl(String cloudFrontBaseUrl) {
        return new DatasetLocations(s3Prefix, s3BaseUrl, cloudFrontBaseUrl, webPageUrl, linkSelector,
            zoneLookupUrl, zonesUrl);
    }

    /// @param webPageUrl another listing page
    /// @return a copy using it
    public DatasetLocations withWebPageUrl(String webPageUrl) {
        return new DatasetLocations(s3Prefix, s3BaseUrl, cloudFrontBaseUrl, webPageUrl, linkSelector,
            zoneLookupUrl, zonesUrl);
    }

    /// @param zoneLookupUrl lookup table URL
    /// @param zonesUrl shapes archive URL
    /// @return a copy using them
    public DatasetLocations withZoneUrls(String zoneLookupUrl, String zonesUrl) {
        return new DatasetLocations(s3Prefix, s3BaseUrl, cloudFrontBaseUrl, webPageUrl, linkSelector,
            zoneLookupUrl, zonesUrl);
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
