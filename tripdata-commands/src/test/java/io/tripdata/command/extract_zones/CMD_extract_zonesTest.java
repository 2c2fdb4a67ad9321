package io.tripdata.command.extract_zones;

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

import io.tripdata.command.CMD_tripdata;
import io.tripdata.jetty.testserver.JettyFileServerFixture;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CMD_extract_zones")
class CMD_extract_zonesTest {

    @TempDir
    static Path served;

    @TempDir
    Path data;

    private static JettyFileServerFixture server;

    @BeforeAll
    static void startServer() throws IOException {
        Path misc = Files.createDirectories(served.resolve("misc"));
        Files.writeString(misc.resolve("taxi_zone_lookup.csv"), "LocationID,Borough\n1,EWR\n");
        Files.write(misc.resolve("taxi_zones.zip"), new byte[]{'P', 'K', 5, 6});
        server = new JettyFileServerFixture(served);
        server.start();
    }

    @AfterAll
    static void stopServer() {
        server.close();
    }

    @Test
    @DisplayName("downloads both zone files into the zones directory")
    void shouldDownloadZones() throws IOException {
        int exitCode = CMD_tripdata.commandLine().execute("extract-zones",
            "--zone-lookup-url", server.url("misc/taxi_zone_lookup.csv"),
            "--zones-url", server.url("misc/taxi_zones.zip"),
            "-d", data.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(data.resolve("zones-data").resolve("taxi_zone_lookup.csv")))
            .isEqualTo("LocationID,Borough\n1,EWR\n");
        assertThat(data.resolve("zones-data").resolve("taxi_zones.zip")).hasSize(4);
    }

    @Test
    @DisplayName("exits with 1 when a zone file is missing")
    void shouldFailForMissingZoneFile() {
        int exitCode = CMD_tripdata.commandLine().execute("extract-zones",
            "--zone-lookup-url", server.url("misc/taxi_zone_lookup.csv"),
            "--zones-url", server.url("misc/missing.zip"),
            "-d", data.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(data.resolve("zones-data").resolve("taxi_zone_lookup.csv")).exists();
    }
}
