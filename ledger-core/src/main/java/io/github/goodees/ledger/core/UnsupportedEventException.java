package io.github.goodees.ledger.core;

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

import io.github.goodees.ledger.core.config.UnknownEventPolicy;

/**
 * Thrown when an event of unknown kind is met while {@link UnknownEventPolicy#REJECT} is in effect.
 */
public class UnsupportedEventException extends IllegalStateException {
    private final transient Event event;

    public UnsupportedEventException(Event event, String consumer) {
        super("Unsupported event type " + event.getType() + " for " + consumer + " in stream " + event.entityId()
                + " at version " + event.entityStateVersion());
        this.event = event;
    }

    public Event getEvent() {
        return event;
    }
}
