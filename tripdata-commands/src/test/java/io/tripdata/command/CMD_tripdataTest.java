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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CMD_tripdata")
class CMD_tripdataTest {

    @TempDir
    Path data;

    @Test
    @DisplayName("lists the extract subcommands in its usage")
    void shouldListSubcommands() {
        String usage = CMD_tripdata.commandLine().getUsageMessage();

        assertThat(usage).contains("extract-trips", "extract-metadata", "extract-zones");
    }

    @Test
    @DisplayName("exits with a usage error for an out of range year")
    void shouldRejectYear() {
        StringWriter err = new StringWriter();
        CommandLine commandLine = CMD_tripdata.commandLine().setErr(new PrintWriter(err));

        int exitCode = commandLine.execute("extract-trips", "-y", "2001", "-d", data.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("2001");
        assertThat(data).isEmptyDirectory();
    }

    @Test
    @DisplayName("exits with a usage error for conflicting verbosity flags")
    void shouldRejectVerboseAndQuiet() {
        CommandLine commandLine = CMD_tripdata.commandLine().setErr(new PrintWriter(new StringWriter()));

        int exitCode = commandLine.execute("extract-zones", "-v", "-q", "-d", data.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(data).isEmptyDirectory();
    }

    @Test
    @DisplayName("exits with a usage error for an unknown subcommand")
    void shouldRejectUnknownSubcommand() {
        CommandLine commandLine = CMD_tripdata.commandLine().setErr(new PrintWriter(new StringWriter()));

        assertThat(commandLine.execute("extract-everything")).isEqualTo(2);
    }
}
