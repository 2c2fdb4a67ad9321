package io.tripdata.command.extract_metadata;

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

import io.tripdata.jetty.testserver.JettyFileServerFixture;
import io.tripdata.sync.metadata.TripParquetFixtures;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CMD_extract_metadata")
class CMD_extract_metadataTest {

    @TempDir
    static Path served;

    @TempDir
    Path data;

    private static JettyFileServerFixture server;

    @BeforeAll
    static void startServer() throws IOException {
        Path scratch = Files.createDirectories(served.resolve("scratch"));
        Path tripData = Files.createDirectories(served.resolve("trip-data"));
        Files.write(tripData.resolve("green_tripdata_2022-01.parquet"), TripParquetFixtures.tripFile(scratch, 10));
        Files.write(tripData.resolve("green_tripdata_2022-02.parquet"), TripParquetFixtures.tripFile(scratch, 20));
        Files.write(tripData.resolve("yellow_tripdata_2022-01.parquet"), TripParquetFixtures.tripFile(scratch, 5));
        Files.writeString(served.resolve("index.html"), "<html><body>"
            + "<a href=\"trip-data/green_tripdata_2022-01.parquet\">Jan</a>"
            + "<a href=\"trip-data/green_tripdata_2022-02.parquet\">Feb</a>"
            + "<a href=\"trip-data/yellow_tripdata_2022-01.parquet\">Yellow Jan</a>"
            + "</body></html>");
        server = new JettyFileServerFixture(served);
        server.start();
    }

    @AfterAll
    static void stopServer() {
        server.close();
    }

    @Test
    @DisplayName("writes one row per selected web file")
    void shouldWriteMetadataTable() throws IOException {
        CMD_extract_metadata command = new CMD_extract_metadata();
        command.clock = Clock.fixed(Instant.parse("2024-06-01T10:00:00Z"), ZoneOffset.UTC);

        int exitCode = new CommandLine(command).execute("-s", "web", "-t", "green", "-y", "2022",
            "--web-page", server.url("index.html"), "-d", data.toString());

        assertThat(exitCode).isZero();
        Path table = data.resolve("trips-metadata").resolve("2024-06-01_web_green_tripmetadata_2022.csv");
        List<String> lines = Files.readAllLines(table);
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).startsWith("file_name,file_s3_url,");
        assertThat(lines.get(1)).startsWith("green_tripdata_2022-01.parquet,").contains(",10,4,");
        assertThat(lines.get(2)).startsWith("green_tripdata_2022-02.parquet,").contains(",20,4,");
    }

    @Test
    @DisplayName("restricts the table to the given months")
    void shouldRestrictMonths() throws IOException {
        CMD_extract_metadata command = new CMD_extract_metadata();
        command.clock = Clock.fixed(Instant.parse("2024-06-01T10:00:00Z"), ZoneOffset.UTC);

        int exitCode = new CommandLine(command).execute("-s", "web", "-t", "green", "-y", "2022", "-m", "2",
            "--web-page", server.url("index.html"), "-d", data.toString());

        assertThat(exitCode).isZero();
        List<String> lines = Files.readAllLines(
            data.resolve("trips-metadata").resolve("2024-06-01_web_green_tripmetadata_2022.csv"));
        assertThat(lines).hasSize(2);
        assertThat(lines.get(1)).startsWith("green_tripdata_2022-02.parquet,");
    }
}
