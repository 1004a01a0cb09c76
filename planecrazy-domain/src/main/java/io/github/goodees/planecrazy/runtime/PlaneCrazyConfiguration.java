package io.github.goodees.planecrazy.runtime;

/*-
 * #%L
 * planecrazy
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Settings of the PlaneCrazy runtime. {@link #load()} reads defaults, then {@code planecrazy.properties} from the
 * classpath, then {@code planecrazy.*} system properties, later sources overriding earlier ones.
 */
public class PlaneCrazyConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(PlaneCrazyConfiguration.class);

    public static final String RESOURCE = "planecrazy.properties";
    public static final String PREFIX = "planecrazy.";

    public static final String EVENT_DIRECTORY = "planecrazy.events.directory";
    public static final String STRICT_READS = "planecrazy.events.strict";
    public static final String COMMAND_THREADS = "planecrazy.commands.threads";
    public static final String COMMAND_TIMEOUT_MS = "planecrazy.commands.timeoutMs";
    public static final String COMMAND_RETRIES = "planecrazy.commands.retries";
    public static final String COMMAND_RETRY_DELAY_MS = "planecrazy.commands.retryDelayMs";

    private final Path eventDirectory;
    private final boolean strictReads;
    private final int commandThreads;
    private final long commandTimeoutMs;
    private final int commandRetries;
    private final long commandRetryDelayMs;

    private PlaneCrazyConfiguration(Builder builder) {
        this.eventDirectory = builder.eventDirectory;
        this.strictReads = builder.strictReads;
        this.commandThreads = builder.commandThreads;
        this.commandTimeoutMs = builder.commandTimeoutMs;
        this.commandRetries = builder.commandRetries;
        this.commandRetryDelayMs = builder.commandRetryDelayMs;
    }

    public static PlaneCrazyConfiguration load() {
        Properties properties = new Properties();
        try (InputStream in = PlaneCrazyConfiguration.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
                logger.info("Loaded configuration from classpath resource {}", RESOURCE);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + RESOURCE, e);
        }
        System.getProperties().stringPropertyNames().stream()
                .filter(name -> name.startsWith(PREFIX))
                .forEach(name -> properties.setProperty(name, System.getProperty(name)));
        return fromProperties(properties);
    }

    /**
     * Configuration from given properties, defaults for missing keys.
     * @param properties the properties
     * @return configuration
     * @throws IllegalArgumentException when a value cannot be parsed
     */
    public static PlaneCrazyConfiguration fromProperties(Properties properties) {
        Builder builder = builder();
        String directory = properties.getProperty(EVENT_DIRECTORY);
        if (directory != null) {
            builder.eventDirectory(Paths.get(directory.trim()));
        }
        String strict = properties.getProperty(STRICT_READS);
        if (strict != null) {
            builder.strictReads(Boolean.parseBoolean(strict.trim()));
        }
        builder.commandThreads(intValue(properties, COMMAND_THREADS, builder.commandThreads));
        builder.commandTimeoutMs(longValue(properties, COMMAND_TIMEOUT_MS, builder.commandTimeoutMs));
        builder.commandRetries(intValue(properties, COMMAND_RETRIES, builder.commandRetries));
        builder.commandRetryDelayMs(longValue(properties, COMMAND_RETRY_DELAY_MS, builder.commandRetryDelayMs));
        return builder.build();
    }

    private static int intValue(Properties properties, String key, int defaultValue) {
        return (int) longValue(properties, key, defaultValue);
    }

    private static long longValue(Properties properties, String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not a number: " + value, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Path getEventDirectory() {
        return eventDirectory;
    }

    /**
     * @return whether reading a corrupt record fails instead of skipping it
     */
    public boolean isStrictReads() {
        return strictReads;
    }

    public int getCommandThreads() {
        return commandThreads;
    }

    public long getCommandTimeoutMs() {
        return commandTimeoutMs;
    }

    /**
     * @return number of retries of a command whose events could not be stored
     */
    public int getCommandRetries() {
        return commandRetries;
    }

    public long getCommandRetryDelayMs() {
        return commandRetryDelayMs;
    }

    @Override
    public String toString() {
        return "PlaneCrazyConfiguration{eventDirectory=" + eventDirectory + ", strictReads=" + strictReads
                + ", commandThreads=" + commandThreads + ", commandTimeoutMs=" + commandTimeoutMs
                + ", commandRetries=" + commandRetries + ", commandRetryDelayMs=" + commandRetryDelayMs + "}";
    }

    public static class Builder {
        private Path eventDirectory = Paths.get("data", "events");
        private boolean strictReads = false;
        private int commandThreads = 4;
        private long commandTimeoutMs = 30_000;
        private int commandRetries = 3;
        private long commandRetryDelayMs = 100;

        public Builder eventDirectory(Path eventDirectory) {
            this.eventDirectory = eventDirectory;
            return this;
        }

        public Builder strictReads(boolean strictReads) {
            this.strictReads = strictReads;
            return this;
        }

        public Builder commandThreads(int commandThreads) {
            this.commandThreads = commandThreads;
            return this;
        }

        public Builder commandTimeoutMs(long commandTimeoutMs) {
            this.commandTimeoutMs = commandTimeoutMs;
            return this;
        }

        public Builder commandRetries(int commandRetries) {
            this.commandRetries = commandRetries;
            return this;
        }

        public Builder commandRetryDelayMs(long commandRetryDelayMs) {
            this.commandRetryDelayMs = commandRetryDelayMs;
            return this;
        }

        public PlaneCrazyConfiguration build() {
            if (eventDirectory == null) {
                throw new IllegalArgumentException("Event directory must be specified");
            }
            if (commandThreads < 1) {
                throw new IllegalArgumentException("At least one command thread is required");
            }
            if (commandTimeoutMs <= 0) {
                throw new IllegalArgumentException("Command timeout must be positive");
            }
            if (commandRetries < 0 || commandRetryDelayMs < 0) {
                throw new IllegalArgumentException("Retries and retry delay cannot be negative");
            }
            return new PlaneCrazyConfiguration(this);
        }
    }
}
