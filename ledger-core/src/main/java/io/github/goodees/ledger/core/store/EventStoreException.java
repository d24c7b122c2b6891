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

/**
 * Failure to append events. The store is unchanged for the stream when this exception is thrown.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        /**
         * The stream is not at expected version. The caller should reload the entity and retry the command.
         */
        OPTIMISTIC_LOCK,
        /**
         * Appended events violate the contract of the store. Signals a bug, retrying will not help.
         */
        PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public static ConcurrencyConflictException concurrencyConflict(String streamId, long expectedVersion,
            long actualVersion) {
        return new ConcurrencyConflictException(streamId, expectedVersion, actualVersion);
    }

    public static EventStoreException foreignStream(String expected, Event violating) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Event for stream " + violating.entityId()
                + " cannot be appended to stream " + expected, null);
    }

    public static EventStoreException nonMonotonic(String streamId, long expectedVersion, Event violating) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Event for stream " + streamId
                + " does not follow sequence. Expected: " + expectedVersion + " actual: "
                + violating.entityStateVersion(), null);
    }
}
