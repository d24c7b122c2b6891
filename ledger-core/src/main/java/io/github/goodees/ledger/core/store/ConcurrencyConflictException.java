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

/**
 * Optimistic lock failure. Another writer appended to the stream since the entity was loaded.
 */
public class ConcurrencyConflictException extends EventStoreException {
    private final String streamId;
    private final long expectedVersion;
    private final long actualVersion;

    ConcurrencyConflictException(String streamId, long expectedVersion, long actualVersion) {
        super(Fault.OPTIMISTIC_LOCK, "Concurrency conflict on stream " + streamId + ": expected version "
                + expectedVersion + ", but current version is " + actualVersion, null);
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getStreamId() {
        return streamId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
