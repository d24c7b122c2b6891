package io.github.goodees.ledger.core.store.inmemory;

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
import io.github.goodees.ledger.core.store.EventStore;
import io.github.goodees.ledger.core.store.EventStoreException;
import io.github.goodees.ledger.core.store.StoredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static java.util.stream.Collectors.toList;

/**
 * Event store keeping all streams in memory. Appends are serialized by a write lock spanning the version check and
 * the append, reads share a read lock and copy what they return.
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final Map<String, List<StoredEvent>> streams = new LinkedHashMap<>();
    private final List<StoredEvent> log = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void append(String streamId, List<? extends Event> events, long expectedVersion)
            throws EventStoreException {
        Objects.requireNonNull(streamId, "Stream id cannot be null");
        Objects.requireNonNull(events, "Events cannot be null");
        if (expectedVersion < 0) {
            throw new IllegalArgumentException("Expected version cannot be negative: " + expectedVersion);
        }
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            long actualVersion = lastVersionOf(streamId);
            if (actualVersion != expectedVersion) {
                logger.debug("Rejecting {} events for stream {}, expected version {}, actual {}", events.size(),
                    streamId, expectedVersion, actualVersion);
                throw EventStoreException.concurrencyConflict(streamId, expectedVersion, actualVersion);
            }
            verifySequence(streamId, events, expectedVersion);
            if (events.isEmpty()) {
                return;
            }
            List<StoredEvent> stream = streams.computeIfAbsent(streamId, (i) -> new ArrayList<>());
            for (Event event : events) {
                StoredEvent stored = new StoredEvent(log.size() + 1, event);
                stream.add(stored);
                log.add(stored);
                logger.debug("Stored {} v{} for stream {} at position {}", event.getType(),
                    event.entityStateVersion(), streamId, stored.getPosition());
            }
        } finally {
            writeLock.unlock();
        }
    }

    private static void verifySequence(String streamId, List<? extends Event> events, long expectedVersion)
            throws EventStoreException {
        long version = expectedVersion;
        for (Event event : events) {
            if (!streamId.equals(event.entityId())) {
                throw EventStoreException.foreignStream(streamId, event);
            }
            if (event.entityStateVersion() != version + 1) {
                throw EventStoreException.nonMonotonic(streamId, version + 1, event);
            }
            version++;
        }
    }

    // call only while holding a lock
    private long lastVersionOf(String streamId) {
        List<StoredEvent> stream = streams.get(streamId);
        return stream == null || stream.isEmpty() ? 0 : stream.get(stream.size() - 1).getEvent().entityStateVersion();
    }

    @Override
    public List<Event> readStream(String streamId) {
        return readStream(streamId, 0);
    }

    @Override
    public List<Event> readStream(String streamId, long afterVersion) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            List<StoredEvent> stream = streams.getOrDefault(streamId, Collections.emptyList());
            return stream.stream()
                    .map(StoredEvent::getEvent)
                    .filter(e -> e.entityStateVersion() > afterVersion)
                    .collect(toList());
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public List<Event> readAll() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return log.stream().map(StoredEvent::getEvent).collect(toList());
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public List<StoredEvent> readAllAfter(long position) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            // positions start at 1 and have no gaps, so position n is at index n-1
            int from = (int) Math.min(Math.max(position, 0), log.size());
            return new ArrayList<>(log.subList(from, log.size()));
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public long currentVersion(String streamId) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return lastVersionOf(streamId);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public long totalEventCount() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return log.size();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public Set<String> streamIds() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return Collections.unmodifiableSet(new LinkedHashSet<>(streams.keySet()));
        } finally {
            readLock.unlock();
        }
    }
}
