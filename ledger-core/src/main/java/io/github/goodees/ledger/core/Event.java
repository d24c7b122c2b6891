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

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable fact about business domain relevant fact that became true.
 *
 * <p>Every Event sourced entity class defines its own set of events. Once an event is appended to an
 * {@link io.github.goodees.ledger.core.store.EventStore} it is never changed or removed.</p>
 *
 * <p>The methods provided in this interface define metadata that is common to all events, regardless of their payload.
 * Payload is defined by the concrete event types.</p>
 *
 * Support for events based on <a href="http://immutables.github.io">Immutables</a> is in package
 * {@link io.github.goodees.ledger.core.immutables}.
 */
public interface Event {
    /**
     * The type of event. For every entity class this must uniquely identify the event to be created.
     * @return textual description of the type of event, uses class name by default, stripped from suffix Event
     */
    default String getType() {
        return EventType.defaultTypeName(getClass());
    }

    /**
     * Globally unique identity of this event, assigned when the event is created.
     * @return the event id
     */
    UUID eventId();

    /**
     * The id of the entity this event relates to, which is also the id of the stream the event is stored in.
     * @return the entity id
     * @see EventSourcedEntity#getIdentity()
     */
    String entityId();

    /**
     * The time when an event occurred.
     * @return the instant of event creation
     */
    Instant getTimestamp();

    /**
     * The version of the entity expected after this event is applied.
     * This allows for performing optimistic locking on an entity.
     * @return the version on an entity
     * @see EventSourcedEntity#nextEventVersion()
     */
    long entityStateVersion();

}
