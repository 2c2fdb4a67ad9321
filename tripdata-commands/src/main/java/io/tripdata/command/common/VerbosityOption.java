package io.tripdata.command.common;

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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/**
 * Shared verbosity control options.
 * Provides {@code -v/--verbose} and {@code -q/--quiet}, applied to the {@code io.tripdata} loggers.
 */
public class VerbosityOption {

    static final String LOGGER_NAME = "io.tripdata";

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Log debug details"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Log only warnings and errors"
    )
    private boolean quiet = false;

    /**
     * @return true if verbose is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * @return true if quiet is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * @return the level selected by the flags, or null to keep the configured one
     */
    public Level level() {
        if (verbose) {
            return Level.DEBUG;
        }
        if (quiet) {
            return Level.WARN;
        }
        return null;
    }

    /**
     * Validates the flags and applies the selected level.
     *
     * @param commandLine the command being run, for usage errors
     * @throws CommandLine.ParameterException if both flags are given
     */
    public void apply(CommandLine commandLine) {
        if (verbose && quiet) {
            throw new CommandLine.ParameterException(commandLine,
                "Cannot specify both --verbose and --quiet options");
        }
        Level level = level();
        if (level != null) {
            Configurator.setLevel(LOGGER_NAME, level);
        }
    }
}
