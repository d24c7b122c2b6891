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

import java.util.Objects;

/**
 * An event together with its global position in the store. Positions are assigned at append time, are unique and have
 * no gaps.
 */
public final class StoredEvent {
    private final long position;
    private final Event event;

    public StoredEvent(long position, Event event) {
        this.position = position;
        this.event = Objects.requireNonNull(event);
    }

    public long getPosition() {
        return position;
    }

    public Event getEvent() {
        return event;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;

        StoredEvent that = (StoredEvent) o;
        return position == that.position && event.equals(that.event);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(position) + event.hashCode();
    }

    @Override
    public String toString() {
        return "StoredEvent{" + "position=" + position + ", event=" + event + '}';
    }
}
