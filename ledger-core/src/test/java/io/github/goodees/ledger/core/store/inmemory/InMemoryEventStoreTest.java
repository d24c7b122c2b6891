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
import io.github.goodees.ledger.core.TestEvent;
import io.github.goodees.ledger.core.store.ConcurrencyConflictException;
import io.github.goodees.ledger.core.store.EventStoreException;
import io.github.goodees.ledger.core.store.StoredEvent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ErrorCollector;
import org.junit.rules.TestName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.stream.Collectors.toList;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class InMemoryEventStoreTest {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventStoreTest.class);

    @Rule
    public TestName testName = new TestName();
    @Rule
    public ErrorCollector collector = new ErrorCollector();

    private InMemoryEventStore eventStore;

    @Before
    public void setUp() {
        eventStore = new InMemoryEventStore();
    }

    private String name() {
        return testName.getMethodName();
    }

    private static List<Long> versions(List<Event> events) {
        return events.stream().map(Event::entityStateVersion).collect(toList());
    }

    @Test
    public void events_for_new_stream_are_appended() throws EventStoreException {
        eventStore.append(name(), Arrays.asList(new TestEvent(name(), 1, 100), new TestEvent(name(), 2, 200)), 0);
        assertEquals(2, eventStore.currentVersion(name()));
        assertThat(versions(eventStore.readStream(name())), contains(1L, 2L));
    }

    @Test
    public void events_for_existing_stream_are_appended() throws EventStoreException {
        eventStore.append(name(), Arrays.asList(new TestEvent(name(), 1, 100), new TestEvent(name(), 2, 200)), 0);
        eventStore.append(name(), Arrays.asList(new TestEvent(name(), 3, 100), new TestEvent(name(), 4, 200)), 2);
        assertThat(versions(eventStore.readStream(name())), contains(1L, 2L, 3L, 4L));
        assertEquals(4, eventStore.totalEventCount());
    }

    @Test
    public void missing_stream_reads_empty() {
        assertThat(eventStore.readStream(name()), empty());
        assertEquals(0, eventStore.currentVersion(name()));
    }

    @Test
    public void stream_can_be_read_after_version() throws EventStoreException {
        eventStore.append(name(), Arrays.asList(new TestEvent(name(), 1, 1), new TestEvent(name(), 2, 2),
            new TestEvent(name(), 3, 3)), 0);
        assertThat(versions(eventStore.readStream(name(), 1)), contains(2L, 3L));
        assertThat(eventStore.readStream(name(), 3), empty());
    }

    @Test
    public void wrong_expected_version_fails_and_appends_nothing() throws EventStoreException {
        eventStore.append(name(), Collections.singletonList(new TestEvent(name(), 1, 100)), 0);
        try {
            eventStore.append(name(), Collections.singletonList(new TestEvent(name(), 1, 200)), 0);
            fail("should have failed");
        } catch (ConcurrencyConflictException e) {
            assertEquals(EventStoreException.Fault.OPTIMISTIC_LOCK, e.getFault());
            assertEquals(name(), e.getStreamId());
            assertEquals(0, e.getExpectedVersion());
            assertEquals(1, e.getActualVersion());
        }
        assertEquals(1, eventStore.readStream(name()).size());
    }

    @Test
    public void expected_version_ahead_of_stream_fails() {
        try {
            eventStore.append(name(), Collections.singletonList(new TestEvent(name(), 6, 100)), 5);
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.OPTIMISTIC_LOCK, e.getFault());
            assertThat(eventStore.readStream(name()), empty());
        }
    }

    @Test
    public void skipping_versions_fails() {
        try {
            eventStore.append(name(), Arrays.asList(new TestEvent(name(), 1, 100), new TestEvent(name(), 3, 200)),
                0);
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
            assertThat(eventStore.readStream(name()), empty());
        }
    }

    @Test
    public void duplicate_versions_fail() {
        try {
            eventStore.append(name(), Arrays.asList(new TestEvent(name(), 1, 100), new TestEvent(name(), 1, 200)),
                0);
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
            assertEquals(0, eventStore.totalEventCount());
        }
    }

    @Test
    public void mixing_streams_fails() {
        try {
            eventStore.append(name(), Arrays.asList(new TestEvent(name(), 1, 100), new TestEvent(name() + "!", 2,
                200)), 0);
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
            assertThat(eventStore.streamIds(), empty());
        }
    }

    @Test
    public void read_all_follows_order_of_appends() throws EventStoreException {
        TestEvent a1 = new TestEvent("a", 1, 1);
        TestEvent b1 = new TestEvent("b", 1, 1);
        TestEvent a2 = new TestEvent("a", 2, 1);
        TestEvent b2 = new TestEvent("b", 2, 1);
        eventStore.append("a", Collections.singletonList(a1), 0);
        eventStore.append("b", Collections.singletonList(b1), 0);
        eventStore.append("a", Collections.singletonList(a2), 1);
        eventStore.append("b", Collections.singletonList(b2), 1);
        assertThat(eventStore.readAll(), contains(a1, b1, a2, b2));
        assertThat(eventStore.streamIds(), contains("a", "b"));
    }

    @Test
    public void read_all_after_position_returns_newer_events() throws EventStoreException {
        eventStore.append("a", Arrays.asList(new TestEvent("a", 1, 1), new TestEvent("a", 2, 1)), 0);
        long position = eventStore.totalEventCount();
        TestEvent b1 = new TestEvent("b", 1, 1);
        eventStore.append("b", Collections.singletonList(b1), 0);

        List<StoredEvent> newer = eventStore.readAllAfter(position);
        assertEquals(1, newer.size());
        assertEquals(3, newer.get(0).getPosition());
        assertEquals(b1, newer.get(0).getEvent());
        assertThat(eventStore.readAllAfter(eventStore.totalEventCount()), empty());
        assertEquals(3, eventStore.readAllAfter(0).size());
    }

    @Test
    public void returned_lists_are_snapshots() throws EventStoreException {
        eventStore.append(name(), Collections.singletonList(new TestEvent(name(), 1, 1)), 0);
        List<Event> stream = eventStore.readStream(name());
        List<Event> all = eventStore.readAll();
        eventStore.append(name(), Collections.singletonList(new TestEvent(name(), 2, 1)), 1);
        assertEquals(1, stream.size());
        assertEquals(1, all.size());
    }

    @Test(timeout = 5000)
    public void concurrent_appends_with_same_expected_version_admit_exactly_one() throws Exception {
        eventStore.append(name(), Collections.singletonList(new TestEvent(name(), 1, 0)), 0);
        int writers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                int payload = i;
                futures.add(executor.submit(() -> {
                    try {
                        start.await();
                        eventStore.append(name(), Collections.singletonList(new TestEvent(name(), 2, payload)), 1);
                        successes.incrementAndGet();
                    } catch (ConcurrencyConflictException e) {
                        logger.info("Writer {} lost: {}", payload, e.getMessage());
                        conflicts.incrementAndGet();
                    } catch (Exception e) {
                        collector.addError(e);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdown();
            executor.awaitTermination(1, TimeUnit.SECONDS);
        }
        assertEquals(1, successes.get());
        assertEquals(writers - 1, conflicts.get());
        assertThat(versions(eventStore.readStream(name())), contains(1L, 2L));
    }

    @Test(timeout = 10000)
    public void concurrent_writers_with_retries_keep_streams_contiguous() throws Exception {
        int writers = 4;
        int eventsPerWriter = 50;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                String stream = "stream-" + (i % 2);
                futures.add(executor.submit(() -> {
                    start.await();
                    int appended = 0;
                    while (appended < eventsPerWriter) {
                        long version = eventStore.currentVersion(stream);
                        try {
                            eventStore.append(stream, Collections.singletonList(new TestEvent(stream, version + 1, 1)),
                                version);
                            appended++;
                        } catch (ConcurrencyConflictException e) {
                            // reload and retry
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdown();
            executor.awaitTermination(1, TimeUnit.SECONDS);
        }
        assertEquals(writers * eventsPerWriter, eventStore.totalEventCount());
        assertThat(eventStore.streamIds(), containsInAnyOrder("stream-0", "stream-1"));
        for (String stream : eventStore.streamIds()) {
            List<Long> versions = versions(eventStore.readStream(stream));
            for (int i = 0; i < versions.size(); i++) {
                assertEquals(i + 1, versions.get(i).longValue());
            }
        }
        List<StoredEvent> all = eventStore.readAllAfter(0);
        for (int i = 0; i < all.size(); i++) {
            assertEquals(i + 1, all.get(i).getPosition());
        }
        assertEquals(all.size(), eventStore.readAll().size());
    }
}
