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

import io.github.goodees.ledger.core.config.EventSourcingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class of an entity whose state is derived purely from its events.
 *
 * <h2>Lifecycle</h2>
 * An entity either starts fresh, when a subclass constructor validates its input and {@linkplain #emit(Event) emits}
 * the first event, or it is reconstructed by {@linkplain #replay(Iterable) replaying} its history. Replay does not
 * validate anything, the log is trusted.
 *
 * <h2>State changes</h2>
 * Commands of subclasses validate business rules and then call {@link #emit(Event)}. Emitted events pass through
 * {@link #updateState(Event)}, the same method that handles replayed events, which makes replayed state identical to
 * the state produced by live execution. Emitted events are kept as {@linkplain #getUncommittedEvents() uncommitted}
 * until an {@link EventSourcedRepository} appends them to the store.
 *
 * <p>An instance is not thread safe. Each load from repository produces an independent instance.</p>
 */
public abstract class EventSourcedEntity {
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final String identity;
    private final EventSourcingConfig config;
    private long stateVersion;
    private final List<Event> uncommittedEvents = new ArrayList<>();
    private final List<Event> readOnlyUncommittedView = Collections.unmodifiableList(uncommittedEvents);

    /**
     * Constructor for subclasses.
     * @param identity the identity of the entity
     * @param config configuration with the clock and the unknown event policy
     */
    protected EventSourcedEntity(String identity, EventSourcingConfig config) {
        this.identity = Objects.requireNonNull(identity, "Entity identity cannot be null");
        this.config = Objects.requireNonNull(config, "Configuration cannot be null");
    }

    /**
     * Return entity's identity.
     * @return entity's identity
     */
    public final String getIdentity() {
        return identity;
    }

    /**
     * Version of an entity. Each entity has monotonic growing version number that corresponds to number of events
     * applied to it. It equals the version of the last applied event, 0 for an entity with no events.
     * @return current entity version
     */
    public final long getStateVersion() {
        return stateVersion;
    }

    /**
     * Events emitted since the entity was created, loaded or last saved.
     * @return read only view of pending events, in order of emission
     */
    public final List<Event> getUncommittedEvents() {
        return readOnlyUncommittedView;
    }

    /**
     * Called by the repository after uncommitted events were appended to the store.
     */
    final void markCommitted() {
        uncommittedEvents.clear();
    }

    /**
     * Offer next version for an event.
     * @return the version next produced event should have
     */
    protected final long nextEventVersion() {
        return stateVersion + 1;
    }

    /**
     * Current time according to configured clock.
     * @return timestamp for a new event
     */
    protected final Instant now() {
        return config.getClock().instant();
    }

    protected final EventSourcingConfig getConfig() {
        return config;
    }

    /**
     * Apply a new event and record it as uncommitted. Commands call this method after all their validations passed.
     * @param event the event produced by a command
     * @throws IllegalArgumentException if the event does not belong to this entity or does not follow its version
     */
    protected final void emit(Event event) {
        if (!identity.equals(event.entityId())) {
            throw new IllegalArgumentException("Entity " + identity + " cannot emit event of entity "
                    + event.entityId());
        }
        if (event.entityStateVersion() != nextEventVersion()) {
            throw new IllegalArgumentException("Entity " + identity + " at version " + stateVersion
                    + " cannot emit event with version " + event.entityStateVersion());
        }
        applyEvent(event);
        uncommittedEvents.add(event);
    }

    /**
     * Rebuild the state from past events. Events are applied in order given, without any validation.
     * @param history events of this entity, ordered by version
     */
    protected final void replay(Iterable<? extends Event> history) {
        int count = 0;
        for (Event event : history) {
            applyEvent(event);
            count++;
        }
        logger.debug("Entity {} replayed {} events, now at version {}", identity, count, stateVersion);
    }

    private void applyEvent(Event event) {
        updateState(event);
        stateVersion = event.entityStateVersion();
    }

    /**
     * Update the state as result of application of an event. This method must be very robust - it may not throw
     * an exception or break state invariants under any input. Failing to do so will make the entity irrecoverable.
     * Event kinds the entity does not know should be passed to {@link #unknownEvent(Event)}.
     *
     * @param event event to apply
     */
    protected abstract void updateState(Event event);

    /**
     * Handle an event kind this entity does not recognize according to configured
     * {@link io.github.goodees.ledger.core.config.UnknownEventPolicy}.
     * @param event the unrecognized event
     */
    protected void unknownEvent(Event event) {
        config.getUnknownEventPolicy().handle(event, getClass().getSimpleName() + " " + identity, logger);
    }

}
