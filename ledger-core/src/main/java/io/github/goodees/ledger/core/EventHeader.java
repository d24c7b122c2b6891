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
import java.util.Objects;
import java.util.UUID;

/**
 * Metadata of the next event an entity is about to emit. Event builders copy it via their {@code from(Event)} method,
 * so that concrete events only need to supply their payload.
 */
public final class EventHeader implements Event {
    private final UUID eventId;
    private final String entityId;
    private final Instant timestamp;
    private final long entityStateVersion;

    /**
     * Header for the next event of the entity. The version is one past entity's current version and the timestamp
     * comes from entity's configured clock.
     * @param entity the entity emitting the event
     */
    public EventHeader(EventSourcedEntity entity) {
        this(UUID.randomUUID(), entity.getIdentity(), entity.now(), entity.nextEventVersion());
    }

    public EventHeader(String entityId, long entityStateVersion, Instant timestamp) {
        this(UUID.randomUUID(), entityId, timestamp, entityStateVersion);
    }

    public EventHeader(UUID eventId, String entityId, Instant timestamp, long entityStateVersion) {
        this.eventId = Objects.requireNonNull(eventId);
        this.entityId = Objects.requireNonNull(entityId);
        this.timestamp = Objects.requireNonNull(timestamp);
        this.entityStateVersion = entityStateVersion;
    }

    @Override
    public UUID eventId() {
        return eventId;
    }

    @Override
    public String entityId() {
        return entityId;
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public long entityStateVersion() {
        return entityStateVersion;
    }

    @Override
    public String toString() {
        return "EventHeader{" + "eventId=" + eventId + ", entityId=" + entityId + ", timestamp=" + timestamp
                + ", entityStateVersion=" + entityStateVersion + '}';
    }
}
