package io.tripdata.api;

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

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// The identity encoded in a trip file name: `{type}_tripdata_{year}-{month}.{ext}`.
///
/// @param recordType the leading token, never empty
/// @param year the four digit year
/// @param month the month, 1 through 12
/// @param extension everything after the first dot following the month, e.g. `parquet`
public record TripFileName(String recordType, int year, int month, String extension) {

    private static final Pattern TRIP_FILE_NAME =
        Pattern.compile("^([^_.\\-/]+)_tripdata_(\\d{4})-(\\d{1,2})\\.([^/]+)$");

    /// Validating constructor.
    public TripFileName {
        if (recordType == null || recordType.isEmpty()) {
            throw new IllegalArgumentException("record type must not be empty");
        }
        if (year < 1000 || year > 9999) {
            throw new IllegalArgumentException("year must have four digits, got " + year);
        }
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month must be within 1..12, got " + month);
        }
    }

    /// Parse the base name of a path or URL.
    ///
    /// @param pathOrName a bare file name, an object key or a URL
    /// @return the decoded identity
    /// @throws FragmentParseException if the base name does not follow the grammar
    public static TripFileName parse(String pathOrName) {
        String fileName = baseName(pathOrName);
        Matcher matcher = TRIP_FILE_NAME.matcher(fileName);
        if (!matcher.matches()) {
            throw new FragmentParseException(fileName,
                "expected {type}_tripdata_{year}-{month}.{ext}");
        }
        int year = Integer.parseInt(matcher.group(2));
        if (year < 1000) {
            throw new FragmentParseException(fileName, "year " + matcher.group(2) + " has a leading zero");
        }
        int month = Integer.parseInt(matcher.group(3));
        if (month < 1 || month > 12) {
            throw new FragmentParseException(fileName, "month " + month + " is outside 1..12");
        }
        return new TripFileName(matcher.group(1), year, month, matcher.group(4));
    }

    /// Render the canonical name, with a zero padded month.
    /// @param type the record type
    /// @param year the year
    /// @param month the month
    /// @param extension the extension without the dot
    /// @return e.g. `yellow_tripdata_2023-01.parquet`
    public static String format(RecordType type, int year, int month, String extension) {
        return String.format("%s_tripdata_%d-%02d.%s", type.token(), year, month, extension);
    }

    /// The last path segment of a slash separated path or URL, query and fragment removed.
    /// @param pathOrUrl the path
    /// @return the base name, possibly empty
    public static String baseName(String pathOrUrl) {
        if (pathOrUrl == null) {
            return "";
        }
        String path = pathOrUrl;
        int cut = path.indexOf('?');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        cut = path.indexOf('#');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    /// @return the known record family, if the token is one
    public Optional<RecordType> knownRecordType() {
        return RecordType.fromToken(recordType);
    }
}
