package io.tripdata.command.logging;

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
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.ConsoleAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.ConfigurationFactory;
import org.apache.logging.log4j.core.config.ConfigurationSource;
import org.apache.logging.log4j.core.config.Order;
import org.apache.logging.log4j.core.config.builder.api.AppenderComponentBuilder;
import org.apache.logging.log4j.core.config.builder.api.ConfigurationBuilder;
import org.apache.logging.log4j.core.config.builder.impl.BuiltConfiguration;
import org.apache.logging.log4j.core.config.plugins.Plugin;

import java.net.URI;

/// Console logging for the command line tools.
///
/// Installed by the main class through [ConfigurationFactory#CONFIGURATION_FACTORY_PROPERTY].
@Plugin(name = "TripDataLoggingConfigurationFactory", category = ConfigurationFactory.CATEGORY)
@Order(50)
public class TripDataLoggingConfigurationFactory extends ConfigurationFactory {

    /// Layout of every console line
    public static final String PATTERN = "%d - %p - %m%n";

    static Configuration createConfiguration(String name, ConfigurationBuilder<BuiltConfiguration> builder) {
        builder.setConfigurationName(name);
        builder.setStatusLevel(Level.ERROR);
        AppenderComponentBuilder console = builder.newAppender("Console", "CONSOLE")
            .addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
        console.add(builder.newLayout("PatternLayout").addAttribute("pattern", PATTERN));
        builder.add(console);
        builder.add(builder.newLogger("io.tripdata", Level.INFO)
            .add(builder.newAppenderRef("Console"))
            .addAttribute("additivity", false));
        builder.add(builder.newLogger("org.apache.hadoop", Level.ERROR));
        builder.add(builder.newLogger("org.apache.parquet", Level.WARN));
        builder.add(builder.newLogger("com.amazonaws", Level.WARN));
        builder.add(builder.newRootLogger(Level.WARN).add(builder.newAppenderRef("Console")));
        return builder.build();
    }

    @Override
    public Configuration getConfiguration(LoggerContext loggerContext, ConfigurationSource source) {
        return getConfiguration(loggerContext, source.toString(), null);
    }

    @Override
    public Configuration getConfiguration(LoggerContext loggerContext, String name, URI configLocation) {
        ConfigurationBuilder<BuiltConfiguration> builder = newConfigurationBuilder();
        return createConfiguration(name, builder);
    }

    @Override
    protected String[] getSupportedTypes() {
        return new String[]{"*"};
    }
}
