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

import io.tripdata.api.Backend;
import io.tripdata.api.Fragment;
import io.tripdata.api.RemoteFileNotFoundException;
import io.tripdata.jetty.testserver.JettyFileServerFixture;
import io.tripdata.s3.InMemoryAmazonS3;
import io.tripdata.sync.InMemoryFileSource;
import io.tripdata.s3.S3FileSource;
import io.tripdata.sync.DatasetLocations;
import io.tripdata.transport.HttpClients;
import io.tripdata.transport.HttpFileSource;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TripMetadataHarvester")
class TripMetadataHarvesterTest {

    private static final Instant MODIFIED = Instant.parse("2023-03-20T08:30:00Z");
    private static final String JAN = "yellow_tripdata_2023-01.parquet";
    private static final String FEB = "yellow_tripdata_2023-02.parquet";

    @TempDir
    static Path root;

    private static byte[] january;
    private static byte[] february;
    private static JettyFileServerFixture server;
    private static OkHttpClient client;

    @BeforeAll
    static void setUp() throws IOException {
        Path scratch = Files.createDirectories(root.resolve("scratch"));
        january = TripParquetFixtures.tripFile(scratch, 30);
        february = TripParquetFixtures.tripFile(scratch, 12);
        Path served = Files.createDirectories(root.resolve("served"));
        Files.write(served.resolve(JAN), january);
        Files.write(served.resolve(FEB), february);
        Files.writeString(served.resolve("yellow_tripdata_2023-03.parquet"), "not parquet");
        server = new JettyFileServerFixture(served);
        server.start();
        client = HttpClients.create();
    }

    @AfterAll
    static void tearDown() {
        HttpClients.shutdown(client);
        server.close();
    }

    @Test
    @DisplayName("builds one row per object-store file from listing and footer")
    void harvestsObjectStore() throws IOException {
        InMemoryAmazonS3 s3 = new InMemoryAmazonS3()
            .put("nyc-tlc", "trip data/" + JAN, january, MODIFIED)
            .put("nyc-tlc", "trip data/" + FEB, february, MODIFIED);
        S3FileSource source = new S3FileSource(s3);
        List<Fragment> fragments = source.list(io.tripdata.s3.S3Location.parse("nyc-tlc/trip data/"));
        TripMetadataHarvester harvester = new TripMetadataHarvester(
            Map.of(Backend.OBJECT_STORE, source), DatasetLocations.nycTlc(), 2);

        HarvestResult result = harvester.harvest(fragments);

        assertThat(result.hasFailures()).isFalse();
        assertThat(result.rows()).hasSize(2);
        TripFileMetadata row = result.rows().get(0);
        assertThat(row.fileName()).isEqualTo(JAN);
        assertThat(row.s3Url()).isEqualTo("s3://nyc-tlc/trip data/" + JAN);
        assertThat(row.cloudFrontUrl()).isEqualTo("https://d37ci6vzurychx.cloudfront.net/trip-data/" + JAN);
        assertThat(row.recordType()).isEqualTo("yellow");
        assertThat(row.year()).isEqualTo(2023);
        assertThat(row.month()).isEqualTo(1);
        assertThat(row.modificationTime()).isEqualTo("2023-03-20T08:30:00Z");
        assertThat(row.numRows()).isEqualTo(30);
        assertThat(row.numColumns()).isEqualTo(4);
        assertThat(row.columnNames()).isEqualTo("VendorID,tpep_pickup_datetime,trip_distance,store_and_fwd_flag");
        assertThat(row.sizeBytes()).isEqualTo(january.length);
        assertThat(row.sizeMbs()).isCloseTo(january.length / 1048576d, within(1e-12));
        assertThat(row.metadataSource()).isEqualTo("s3");
        assertThat(result.rows().get(1).numRows()).isEqualTo(12);
    }

    @Test
    @DisplayName("reads web files with ranged requests and isolates failures")
    void harvestsWebWithFailures() {
        HttpFileSource source = new HttpFileSource(client);
        TripMetadataHarvester harvester = new TripMetadataHarvester(
            Map.of(Backend.WEB, source), DatasetLocations.nycTlc(), 1);
        Fragment jan = Fragment.web(server.url(JAN));
        Fragment notParquet = Fragment.web(server.url("yellow_tripdata_2023-03.parquet"));
        Fragment missing = Fragment.web(server.url("yellow_tripdata_2023-04.parquet"));

        HarvestResult result = harvester.harvest(List.of(jan, notParquet, missing));

        assertThat(result.rows()).singleElement().satisfies(row -> {
            assertThat(row.fileName()).isEqualTo(JAN);
            assertThat(row.numRows()).isEqualTo(30);
            assertThat(row.metadataSource()).isEqualTo("web");
        });
        assertThat(result.failures()).extracting(HarvestResult.Failure::fragment).containsExactly(notParquet, missing);
        assertThat(result.failures().get(1).error()).isInstanceOf(RemoteFileNotFoundException.class);
        assertThat(server.getRequests()).anyMatch(r -> r.header("Range") != null);
    }

    @Test
    @DisplayName("records a reader linkage error as a failure of that file only")
    void isolatesLinkageErrors() {
        InMemoryFileSource healthy = new InMemoryFileSource().put(JAN, january, MODIFIED);
        InMemoryFileSource broken = new InMemoryFileSource() {
            @Override
            public byte[] readRange(Fragment fragment, long offset, int length) {
                throw new NoClassDefFoundError("org/apache/hadoop/mapreduce/lib/input/FileInputFormat");
            }
        }.put(FEB, february, MODIFIED);
        Fragment jan = InMemoryFileSource.fragment(JAN);
        Fragment feb = InMemoryFileSource.fragment(FEB);

        HarvestResult fromHealthy = new TripMetadataHarvester(
            Map.of(Backend.WEB, healthy), DatasetLocations.nycTlc(), 1).harvest(List.of(jan));
        HarvestResult fromBroken = new TripMetadataHarvester(
            Map.of(Backend.WEB, broken), DatasetLocations.nycTlc(), 2).harvest(List.of(feb));

        assertThat(fromHealthy.rows()).singleElement().satisfies(row -> assertThat(row.numRows()).isEqualTo(30));
        assertThat(fromBroken.rows()).isEmpty();
        assertThat(fromBroken.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.fragment()).isEqualTo(feb);
            assertThat(failure.error()).isInstanceOf(IOException.class)
                .hasCauseInstanceOf(NoClassDefFoundError.class);
        });
    }

    @Test
    @DisplayName("rejects a non-positive worker count")
    void rejectsWorkers() {
        assertThatIllegalArgumentException()
            .isThrownBy(() -> new TripMetadataHarvester(Map.of(), DatasetLocations.nycTlc(), 0));
    }
}
