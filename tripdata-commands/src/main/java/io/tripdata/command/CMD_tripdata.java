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

import io.tripdata.command.extract_metadata.CMD_extract_metadata;
import io.tripdata.command.extract_trips.CMD_extract_trips;
import io.tripdata.command.extract_zones.CMD_extract_zones;
import io.tripdata.command.logging.TripDataLoggingConfigurationFactory;
import org.apache.logging.log4j.core.config.ConfigurationFactory;
import picocli.CommandLine;

/// Tools for mirroring the NYC TLC trip record dataset
///
/// This is the top level command which serves as the entry point for all sub-commands
@CommandLine.Command(name = "tripdata",
    mixinStandardHelpOptions = true,
    versionProvider = CMD_tripdata.VersionProvider.class,
    description = "Mirror NYC TLC trip record files, their metadata and the taxi zone files",
    subcommands = {
        CommandLine.HelpCommand.class, CMD_extract_trips.class, CMD_extract_metadata.class,
        CMD_extract_zones.class
    })
public class CMD_tripdata {

    /// run a tripdata command
    /// @param args
    ///     command line args
    public static void main(String[] args) {
        System.setProperty("slf4j.internal.verbosity", "ERROR");
        System.setProperty(
            ConfigurationFactory.CONFIGURATION_FACTORY_PROPERTY,
            TripDataLoggingConfigurationFactory.class.getCanonicalName()
        );
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /// @return the configured command line, without executing it
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_tripdata())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }

    /// Reports the implementation version of the packaged jar
    static final class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = CMD_tripdata.class.getPackage().getImplementationVersion();
            return new String[]{"tripdata " + (version == null ? "development build" : version)};
        }
    }
}
