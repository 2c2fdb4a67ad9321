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

import io.tripdata.api.Backend;
import io.tripdata.api.Fragment;
import io.tripdata.api.PartFiles;
import io.tripdata.api.RemoteFileNotFoundException;
import io.tripdata.api.SyncOutcome;
import io.tripdata.api.SyncReport;
import io.tripdata.api.SyncStatus;
import io.tripdata.api.TransferException;
import io.tripdata.api.TransferOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SyncOrchestrator")
class SyncOrchestratorTest {

    private static final String JAN = "yellow_tripdata_2023-01.parquet";
    private static final String FEB = "yellow_tripdata_2023-02.parquet";
    private static final String MAR = "yellow_tripdata_2023-03.parquet";
    private static final Instant PUBLISHED = Instant.parse("2023-03-01T12:00:00Z");

    @TempDir
    Path local;

    private InMemoryFileSource source;
    private SyncOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        source = new InMemoryFileSource()
            .put(JAN, bytes("january"), PUBLISHED)
            .put(FEB, bytes("february"), PUBLISHED);
        orchestrator = new SyncOrchestrator(Map.of(Backend.WEB, source),
            SyncSettings.builder().localRoot(local).workers(4).transferOptions(new TransferOptions(16, 1)).build());
    }

    @Test
    @DisplayName("downloads missing files into the local root")
    void downloadsMissing() throws IOException {
        SyncReport report = orchestrator.sync(List.of(InMemoryFileSource.fragment(JAN),
            InMemoryFileSource.fragment(FEB)));

        assertThat(report.count(SyncStatus.DOWNLOADED)).isEqualTo(2);
        assertThat(report.hasFailures()).isFalse();
        assertThat(Files.readString(local.resolve(JAN))).isEqualTo("january");
        assertThat(Files.readString(local.resolve(FEB))).isEqualTo("february");
        assertThat(report.outcomes()).extracting(SyncOutcome::bytes).containsExactlyInAnyOrder(7L, 8L);
    }

    @Test
    @DisplayName("a second run with unchanged remotes transfers nothing")
    void secondRunSkips() {
        List<Fragment> fragments = List.of(InMemoryFileSource.fragment(JAN), InMemoryFileSource.fragment(FEB));
        orchestrator.sync(fragments);
        source.copied().clear();

        SyncReport second = orchestrator.sync(fragments);

        assertThat(second.count(SyncStatus.SKIPPED)).isEqualTo(2);
        assertThat(source.copied()).isEmpty();
    }

    @Test
    @DisplayName("replaces a local copy older than the remote")
    void updatesStaleCopy() throws IOException {
        Path existing = local.resolve(JAN);
        Files.writeString(existing, "stale");
        Files.setLastModifiedTime(existing, FileTime.from(PUBLISHED.minusSeconds(3600)));

        SyncOutcome outcome = orchestrator.syncOne(InMemoryFileSource.fragment(JAN));

        assertThat(outcome.status()).isEqualTo(SyncStatus.UPDATED);
        assertThat(Files.readString(existing)).isEqualTo("january");
    }

    @Test
    @DisplayName("keeps a local copy as new as the remote")
    void keepsFreshCopy() throws IOException {
        Path existing = local.resolve(JAN);
        Files.writeString(existing, "local");
        Files.setLastModifiedTime(existing, FileTime.from(PUBLISHED));

        SyncOutcome outcome = orchestrator.syncOne(InMemoryFileSource.fragment(JAN));

        assertThat(outcome.status()).isEqualTo(SyncStatus.SKIPPED);
        assertThat(Files.readString(existing)).isEqualTo("local");
        assertThat(source.copied()).isEmpty();
    }

    @Test
    @DisplayName("keeps an existing copy when the remote has no modification time")
    void keepsCopyWithoutRemoteTime() throws IOException {
        source.put(MAR, bytes("march"), null);
        Path existing = local.resolve(MAR);
        Files.writeString(existing, "local");
        Files.setLastModifiedTime(existing, FileTime.from(Instant.EPOCH));

        SyncOutcome outcome = orchestrator.syncOne(InMemoryFileSource.fragment(MAR));

        assertThat(outcome.status()).isEqualTo(SyncStatus.SKIPPED);
        assertThat(Files.readString(existing)).isEqualTo("local");
    }

    @Test
    @DisplayName("a missing remote file fails only its own fragment")
    void missingRemoteIsIsolated() {
        SyncReport report = orchestrator.sync(List.of(InMemoryFileSource.fragment(JAN),
            InMemoryFileSource.fragment(MAR), InMemoryFileSource.fragment(FEB)));

        assertThat(report.count(SyncStatus.DOWNLOADED)).isEqualTo(2);
        assertThat(report.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.fragment().fileName()).isEqualTo(MAR);
            assertThat(failure.error()).isInstanceOf(RemoteFileNotFoundException.class);
        });
        assertThat(local.resolve(MAR)).doesNotExist();
    }

    @Test
    @DisplayName("a failed transfer leaves neither the file nor its part file")
    void failedTransferCleansUp() {
        source.failCopy(FEB);

        SyncOutcome outcome = orchestrator.syncOne(InMemoryFileSource.fragment(FEB));

        assertThat(outcome.status()).isEqualTo(SyncStatus.FAILED);
        assertThat(outcome.error()).isInstanceOf(TransferException.class);
        assertThat(local.resolve(FEB)).doesNotExist();
        assertThat(PartFiles.partFile(local.resolve(FEB))).doesNotExist();
    }

    @Test
    @DisplayName("fragments that share a file name are not written twice")
    void duplicateDestinationsFail() {
        Fragment first = InMemoryFileSource.fragment(JAN);
        Fragment second = Fragment.web("https://mirror.example/other/" + JAN);

        SyncReport report = orchestrator.sync(List.of(first, second));

        assertThat(report.count(SyncStatus.DOWNLOADED)).isEqualTo(1);
        assertThat(report.failures()).singleElement()
            .satisfies(f -> assertThat(f.fragment()).isEqualTo(second));
        assertThat(source.copied()).containsExactly(JAN);
    }

    @Test
    @DisplayName("a fragment from an unconfigured backend fails")
    void unconfiguredBackendFails() {
        SyncOutcome outcome = orchestrator.syncOne(Fragment.objectStore("nyc-tlc/trip data/" + JAN, null));

        assertThat(outcome.status()).isEqualTo(SyncStatus.FAILED);
        assertThat(outcome.error()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("an empty fragment list gives an empty report")
    void emptyInput() {
        assertThat(orchestrator.sync(List.of()).outcomes()).isEmpty();
    }

    @Test
    @DisplayName("rejects invalid settings")
    void rejectsInvalidSettings() {
        assertThatIllegalArgumentException().isThrownBy(() -> SyncSettings.builder().workers(1).build());
        assertThatIllegalArgumentException()
            .isThrownBy(() -> SyncSettings.builder().localRoot(local).workers(0).build());
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
