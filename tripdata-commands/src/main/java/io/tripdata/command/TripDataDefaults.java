package io.tripdata.command;

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
import io.tripdata.api.RecordType;

import java.nio.file.Path;
import java.time.LocalDate;

/// Defaults and valid ranges shared by the commands.
public final class TripDataDefaults {

    /// First year with published trip records
    public static final int FIRST_YEAR = 2009;
    /// Months are numbered 1..12
    public static final int FIRST_MONTH = 1;
    /// Last month of a year
    public static final int LAST_MONTH = 12;

    /// Default source of trip files
    public static final Backend DEFAULT_SOURCE = Backend.OBJECT_STORE;
    /// Default record type
    public static final RecordType DEFAULT_RECORD_TYPE = RecordType.YELLOW;

    /// Local base directory
    public static final Path LOCAL_BASE = Path.of("./data");
    /// Trip files, relative to the base
    public static final String TRIPS_DATA_DIR = "trips-data";
    /// Metadata tables, relative to the base
    public static final String TRIPS_METADATA_DIR = "trips-metadata";
    /// Zone files, relative to the base
    public static final String ZONES_DATA_DIR = "zones-data";

    /// Web sources are read one file at a time for metadata
    public static final int WEB_METADATA_WORKERS = 1;

    private TripDataDefaults() {
    }

    /// @return the current year, the last valid `--year`
    public static int currentYear() {
        return LocalDate.now().getYear();
    }

    /// @return one worker per available processor
    public static int defaultWorkers() {
        return Runtime.getRuntime().availableProcessors();
    }
}
