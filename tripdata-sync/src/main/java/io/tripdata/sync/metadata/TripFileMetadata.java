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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/// One row of a trip metadata table.
///
/// @param fileName trip file name
/// @param s3Url object-store URL of the file
/// @param cloudFrontUrl HTTPS URL of the file
/// @param recordType record type token
/// @param year data year
/// @param month data month
/// @param modificationTime ISO-8601 modification instant, or null when the server gave none
/// @param numRows total rows
/// @param numColumns leaf column count
/// @param columnNames comma-joined column names
/// @param sizeBytes size in bytes
/// @param sizeMbs size in MiB
/// @param sizeGbs size in GiB
/// @param metadataSource backend the metadata was read from
@JsonPropertyOrder({
    "file_name", "file_s3_url", "file_cloudfront_url", "file_record_type", "file_year", "file_month",
    "file_modification_time", "file_num_rows", "file_num_columns", "file_column_names",
    "file_size_bytes", "file_size_mbs", "file_size_gbs", "file_metadata_source"
})
public record TripFileMetadata(
    @JsonProperty("file_name") String fileName,
    @JsonProperty("file_s3_url") String s3Url,
    @JsonProperty("file_cloudfront_url") String cloudFrontUrl,
    @JsonProperty("file_record_type") String recordType,
    @JsonProperty("file_year") int year,
    @JsonProperty("file_month") int month,
    @JsonProperty("file_modification_time") String modificationTime,
    @JsonProperty("file_num_rows") long numRows,
    @JsonProperty("file_num_columns") int numColumns,
    @JsonProperty("file_column_names") String columnNames,
    @JsonProperty("file_size_bytes") long sizeBytes,
    @JsonProperty("file_size_mbs") double sizeMbs,
    @JsonProperty("file_size_gbs") double sizeGbs,
    @JsonProperty("file_metadata_source") String metadataSource
) {
    static final double MIB = 1024d * 1024d;
    static final double GIB = MIB * 1024d;
}
