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

import io.github.goodees.ledger.core.Event;
import io.github.goodees.ledger.core.UnsupportedEventException;
import org.slf4j.Logger;

/**
 * Decides what happens when an entity replays, or a projection folds, an event kind it does not recognize.
 */
public enum UnknownEventPolicy {
    /**
     * Skip the event with a warning. The event still advances entity's version.
     */
    IGNORE {
        @Override
        public void handle(Event event, String consumer, Logger logger) {
            logger.warn("{} ignores unknown event {} of stream {} at version {}", consumer, event.getType(),
                event.entityId(), event.entityStateVersion());
        }
    },
    /**
     * Fail with {@link UnsupportedEventException}.
     */
    REJECT {
        @Override
        public void handle(Event event, String consumer, Logger logger) {
            throw new UnsupportedEventException(event, consumer);
        }
    };

    public abstract void handle(Event event, String consumer, Logger logger);
}
