package io.github.goodees.ledger.core.projection;

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
import io.github.goodees.ledger.core.config.EventSourcingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Read model folded from events, keyed by entity id. A projection is disposable: {@link #rebuild(Iterable)} discards
 * all views and folds the given events again. It is never a source of truth for business decisions or concurrency
 * checks.
 *
 * <p>Subclasses implement {@link #project(Event)} and use {@link #put(String, Object)} and
 * {@link #update(String, UnaryOperator)} to maintain the views.</p>
 *
 * @param <V> type of view
 */
public abstract class Projection<V> {
    protected final Logger logger = LoggerFactory.getLogger(getClass());
    private final EventSourcingConfig config;
    private final Map<String, V> views = new LinkedHashMap<>();

    protected Projection(EventSourcingConfig config) {
        this.config = Objects.requireNonNull(config, "Configuration cannot be null");
    }

    /**
     * Discard current views and fold events in the order given.
     * @param events globally ordered events, e. g. {@link io.github.goodees.ledger.core.store.EventStore#readAll()}
     */
    public synchronized void rebuild(Iterable<? extends Event> events) {
        views.clear();
        int count = 0;
        for (Event event : events) {
            project(event);
            count++;
        }
        logger.debug("Rebuilt {} views from {} events", views.size(), count);
    }

    /**
     * Fold single event into the views.
     * @param event the event
     */
    protected abstract void project(Event event);

    public synchronized Optional<V> get(String entityId) {
        return Optional.ofNullable(views.get(entityId));
    }

    /**
     * All views, in order their entities first appeared in the events.
     * @return copy of all views
     */
    public synchronized Collection<V> getAll() {
        return Collections.unmodifiableList(new ArrayList<>(views.values()));
    }

    public synchronized int size() {
        return views.size();
    }

    protected final void put(String entityId, V view) {
        views.put(entityId, view);
    }

    /**
     * Replace a view with updated one. Events for entities without a view are skipped, as their creation event is
     * not part of folded events.
     * @param entityId the entity
     * @param updater function producing the new view
     */
    protected final void update(String entityId, UnaryOperator<V> updater) {
        V current = views.get(entityId);
        if (current == null) {
            logger.debug("No view for {}, skipping event", entityId);
            return;
        }
        views.put(entityId, updater.apply(current));
    }

    protected void unknownEvent(Event event) {
        config.getUnknownEventPolicy().handle(event, getClass().getSimpleName(), logger);
    }
}
