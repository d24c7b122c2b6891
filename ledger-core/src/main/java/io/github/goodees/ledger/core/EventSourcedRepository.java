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

import io.github.goodees.ledger.core.store.ConcurrencyConflictException;
import io.github.goodees.ledger.core.store.EventStore;
import io.github.goodees.ledger.core.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

import static java.util.stream.Collectors.toList;

/**
 * Loads entities by replaying their streams and saves their uncommitted events.
 *
 * <h2>Load</h2>
 * {@link #load(String)} reads the stream of the entity, {@linkplain #instantiate(String) instantiates} an empty
 * entity and replays the stream into it. Every call produces new, independent instance. Variants
 * {@link #loadAsOf(String, long)} and {@link #loadAsOf(String, Instant)} replay only a prefix of the stream and return
 * the entity as it was at that point of its history.
 *
 * <h2>Save</h2>
 * {@link #save(EventSourcedEntity)} appends uncommitted events, expecting the stream to still be at the version the
 * entity had before these events. When another writer was faster, {@link ConcurrencyConflictException} is propagated
 * and the caller needs to load the entity again and retry the command.
 *
 * @param <E> the type of entity this repository handles
 */
public abstract class EventSourcedRepository<E extends EventSourcedEntity> {

    protected final Logger logger = LoggerFactory.getLogger(getClass());
    private final EventStore eventStore;

    protected EventSourcedRepository(EventStore eventStore) {
        this.eventStore = Objects.requireNonNull(eventStore, "Event store cannot be null");
    }

    /**
     * Create a new instance for given id, that has no state yet. Repository will replay the history afterwards.
     * @param entityId the identity of the entity
     * @return freshly instantiated entity object
     */
    protected abstract E instantiate(String entityId);

    protected final EventStore getEventStore() {
        return eventStore;
    }

    /**
     * Load current state of an entity.
     * @param entityId the identity of the entity
     * @return the entity, or empty if no event was ever stored for it
     */
    public Optional<E> load(String entityId) {
        return reconstruct(entityId, eventStore.readStream(entityId));
    }

    /**
     * Load the entity as it was right after given version.
     * @param entityId the identity of the entity
     * @param version last version to replay
     * @return the entity at given version, or empty if there is no event up to that version
     */
    public Optional<E> loadAsOf(String entityId, long version) {
        return reconstruct(entityId, historyUntil(entityId, e -> e.entityStateVersion() <= version));
    }

    /**
     * Load the entity as it was at given instant.
     * @param entityId the identity of the entity
     * @param instant point in time, events that occurred at this instant are included
     * @return the entity at given time, or empty if no event occurred until then
     */
    public Optional<E> loadAsOf(String entityId, Instant instant) {
        return reconstruct(entityId, historyUntil(entityId, e -> !e.getTimestamp().isAfter(instant)));
    }

    private List<Event> historyUntil(String entityId, Predicate<Event> included) {
        // stream is ordered by version, stop at first event that is past the boundary
        List<Event> history = new ArrayList<>();
        for (Event event : eventStore.readStream(entityId)) {
            if (!included.test(event)) {
                break;
            }
            history.add(event);
        }
        return history;
    }

    private Optional<E> reconstruct(String entityId, List<Event> history) {
        if (history.isEmpty()) {
            return Optional.empty();
        }
        E entity = instantiate(entityId);
        entity.replay(history);
        logger.debug("Loaded {} from {} events, version {}", entityId, history.size(), entity.getStateVersion());
        return Optional.of(entity);
    }

    /**
     * Append uncommitted events of the entity to its stream. Does nothing if there are none. On success the
     * entity has no more uncommitted events, on failure the store and the entity stay unchanged.
     * @param entity entity to save
     * @throws ConcurrencyConflictException when the stream changed since the entity was loaded
     * @throws EventStoreException when the events violate the contract of the store
     */
    public void save(E entity) throws EventStoreException {
        List<Event> pending = entity.getUncommittedEvents();
        if (pending.isEmpty()) {
            return;
        }
        long expectedVersion = entity.getStateVersion() - pending.size();
        eventStore.append(entity.getIdentity(), new ArrayList<>(pending), expectedVersion);
        logger.debug("Saved {} events of {}, version {}", pending.size(), entity.getIdentity(),
            entity.getStateVersion());
        entity.markCommitted();
    }

    /**
     * Compare the version of an entity with the stored stream.
     * @param entity entity instance
     * @return true if no newer events are stored for the entity
     */
    public boolean isCurrent(E entity) {
        return eventStore.currentVersion(entity.getIdentity()) <= entity.getStateVersion();
    }

    /**
     * Apply events stored after the version of given instance to it.
     * @param entity entity without uncommitted events
     * @return the same instance, now at the current version of its stream
     * @throws IllegalStateException if the entity has uncommitted events
     */
    public E catchUp(E entity) {
        if (!entity.getUncommittedEvents().isEmpty()) {
            throw new IllegalStateException("Entity " + entity.getIdentity() + " has "
                    + entity.getUncommittedEvents().size() + " uncommitted events and cannot catch up");
        }
        List<Event> newer = eventStore.readStream(entity.getIdentity(), entity.getStateVersion());
        if (!newer.isEmpty()) {
            entity.replay(newer);
            logger.debug("Entity {} caught up with {} events: {}", entity.getIdentity(), newer.size(),
                newer.stream().map(Event::getType).collect(toList()));
        }
        return entity;
    }

}
