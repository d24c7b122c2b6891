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

import java.time.Clock;

/**
 * Configuration shared by entities, repositories and projections.
 */
public interface EventSourcingConfig {

    /**
     * Sensible defaults: system UTC clock, unknown events are {@linkplain UnknownEventPolicy#IGNORE ignored}.
     */
    EventSourcingConfig DEFAULT_CONFIG = new DefaultEventSourcingConfig();

    /**
     * Clock used to timestamp newly emitted events.
     * @return the clock
     */
    Clock getClock();

    /**
     * Treatment of event kinds an entity or projection does not know about.
     * @return the policy
     */
    UnknownEventPolicy getUnknownEventPolicy();
}
