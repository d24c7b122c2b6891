package io.github.goodees.ledger.core.config;

/*-
 * #%L
 * ledger-core
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

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Mutable implementation of {@link EventSourcingConfig}, that can also be read from properties.
 *
 * <p>Recognized properties:</p>
 * <ul>
 *     <li>{@code ledger.unknownEventPolicy}: {@code ignore} or {@code reject}</li>
 *     <li>{@code ledger.clock}: {@code system} or {@code fixed:<ISO-8601 instant>}</li>
 * </ul>
 */
public class DefaultEventSourcingConfig implements EventSourcingConfig {
    public static final String UNKNOWN_EVENT_POLICY = "ledger.unknownEventPolicy";
    public static final String CLOCK = "ledger.clock";

    private static final String FIXED_CLOCK_PREFIX = "fixed:";

    private Clock clock = Clock.systemUTC();
    private UnknownEventPolicy unknownEventPolicy = UnknownEventPolicy.IGNORE;

    public static DefaultEventSourcingConfig fromProperties(Properties properties) {
        DefaultEventSourcingConfig config = new DefaultEventSourcingConfig();
        String policy = properties.getProperty(UNKNOWN_EVENT_POLICY);
        if (policy != null) {
            try {
                config.setUnknownEventPolicy(UnknownEventPolicy.valueOf(policy.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid value of " + UNKNOWN_EVENT_POLICY + ": " + policy, e);
            }
        }
        String clock = properties.getProperty(CLOCK);
        if (clock != null) {
            config.setClock(parseClock(clock.trim()));
        }
        return config;
    }

    /**
     * Read configuration from a properties resource on the classpath.
     * @param resource name of the resource, e. g. {@code ledger.properties}
     * @return configuration, defaults when resource does not exist
     * @throws IOException when resource exists, but cannot be read
     */
    public static DefaultEventSourcingConfig fromClasspath(String resource) throws IOException {
        Properties properties = new Properties();
        try (InputStream in = DefaultEventSourcingConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null) {
                properties.load(in);
            }
        }
        return fromProperties(properties);
    }

    private static Clock parseClock(String value) {
        if ("system".equalsIgnoreCase(value)) {
            return Clock.systemUTC();
        }
        if (value.startsWith(FIXED_CLOCK_PREFIX)) {
            try {
                return Clock.fixed(Instant.parse(value.substring(FIXED_CLOCK_PREFIX.length())), ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid value of " + CLOCK + ": " + value, e);
            }
        }
        throw new IllegalArgumentException("Invalid value of " + CLOCK + ": " + value);
    }

    @Override
    public Clock getClock() {
        return clock;
    }

    public void setClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public UnknownEventPolicy getUnknownEventPolicy() {
        return unknownEventPolicy;
    }

    public void setUnknownEventPolicy(UnknownEventPolicy unknownEventPolicy) {
        this.unknownEventPolicy = Objects.requireNonNull(unknownEventPolicy);
    }

    @Override
    public String toString() {
        return "DefaultEventSourcingConfig{" + "clock=" + clock + ", unknownEventPolicy=" + unknownEventPolicy + '}';
    }
}
