package io.github.goodees.ledger.core.store;

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

import java.util.List;
import java.util.Set;

/**
 * Append-only storage of event streams. Every entity has its own stream, keyed by entity id. Versions of events in a
 * stream form contiguous sequence starting at 1.
 *
 * <p>Implementations must make the version check and the append of {@link #append(String, List, long)} a single
 * atomic step, and reads must never observe partially appended batch.</p>
 */
public interface EventStore {

    /**
     * Append events to a stream, if the stream is at expected version. Either all events are appended, or none.
     * @param streamId the stream (entity id)
     * @param events events to append, in order. First one must have version {@code expectedVersion + 1} and each
     *               following one version one higher than its predecessor
     * @param expectedVersion version the stream is expected to be at, 0 for a stream that does not exist yet
     * @throws ConcurrencyConflictException when the stream is not at expected version
     * @throws EventStoreException with {@link EventStoreException.Fault#PROGRAMMATIC_ERROR} when events do not follow
     *         expected version or belong to another stream
     */
    void append(String streamId, List<? extends Event> events, long expectedVersion) throws EventStoreException;

    /**
     * Read entire stream.
     * @param streamId the stream (entity id)
     * @return events ordered by version, empty list when the stream does not exist
     */
    List<Event> readStream(String streamId);

    /**
     * Read events of a stream that happened after specified version.
     * @param streamId the stream (entity id)
     * @param afterVersion events that happened after this version. 0 returns entire history
     * @return events ordered by version
     */
    List<Event> readStream(String streamId, long afterVersion);

    /**
     * Consistent snapshot of all streams, in global order of appends.
     * @return all events in the store
     */
    List<Event> readAll();

    /**
     * Events appended after specified global position.
     * @param position position of last known event, 0 for all events
     * @return stored events with their positions, in order of appends
     */
    List<StoredEvent> readAllAfter(long position);

    /**
     * Current version of a stream.
     * @param streamId the stream (entity id)
     * @return version of last event of the stream, 0 if the stream does not exist
     */
    long currentVersion(String streamId);

    /**
     * Number of events in the store. As positions start at 1 and have no gaps, this is also the position of the
     * last appended event, to be passed to {@link #readAllAfter(long)} later.
     * @return count of all events, 0 for an empty store
     */
    long totalEventCount();

    Set<String> streamIds();
}
