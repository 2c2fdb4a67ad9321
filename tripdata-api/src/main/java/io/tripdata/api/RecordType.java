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

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/// Trip record families published by the dataset. The token is the leading part of every
/// file name, e.g. `yellow` in `yellow_tripdata_2023-01.parquet`.
public enum RecordType {
    /// For-hire vehicle trips
    FHV("fhv"),
    /// High volume for-hire vehicle trips
    FHVHV("fhvhv"),
    /// Green taxi trips
    GREEN("green"),
    /// Yellow taxi trips
    YELLOW("yellow");

    private final String token;

    RecordType(String token) {
        this.token = token;
    }

    /// @return the lower case file name token
    public String token() {
        return token;
    }

    /// Look up a record type by its file name token.
    /// @param token the token, case-insensitive
    /// @return the record type, or empty if the token names no known family
    public static Optional<RecordType> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String wanted = token.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(t -> t.token.equals(wanted)).findFirst();
    }

    @Override
    public String toString() {
        return token;
    }
}
