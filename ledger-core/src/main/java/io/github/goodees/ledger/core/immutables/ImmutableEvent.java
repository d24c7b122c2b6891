package io.github.goodees.ledger.core.immutables;

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

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.databind.annotation.JsonTypeIdResolver;
import io.github.goodees.ledger.core.Event;
import io.github.goodees.ledger.core.EventHeader;
import io.github.goodees.ledger.core.EventSourcedEntity;
import io.github.goodees.ledger.core.EventType;
import java.util.function.Function;

/**
 * Base for events generated by <a href="http://immutables.github.io">Immutables</a>. Concrete events declare a
 * nested {@code Builder} extending the generated one, and obtain it via {@link #builderForEntity(EventSourcedEntity, Function)}
 * so that metadata is filled in from the emitting entity:
 *
 * <pre>
 * &#64;Value.Immutable
 * public interface MoneyDepositedEvent extends AccountEvent {
 *     BigDecimal getAmount();
 *
 *     static Builder builder(EventSourcedEntity source) {
 *         return builderForEntity(source, (h) -&gt; new Builder().from(h));
 *     }
 *
 *     class Builder extends ImmutableMoneyDepositedEvent.Builder {
 *     }
 * }
 * </pre>
 *
 * <p>JSON type names are resolved by {@link ImmutableEventTypeResolver}.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.CUSTOM, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonTypeIdResolver(ImmutableEventTypeResolver.class)
// allow for future changes in an event
@JsonIgnoreProperties(ignoreUnknown = true)
// Put key values at the front
@JsonPropertyOrder({ "eventId", "entityId", "entityStateVersion", "timestamp" })
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public interface ImmutableEvent extends Event {

    @Override
    @JsonIgnore
    // type property is written by resolver, and is requires default naming scheme
    default String getType() {
        return EventType.fromClassStripping(getClass(), "Immutable", "Event");
    }

    static <T> T builderForEntity(EventSourcedEntity entity, Function<Event, T> buildFromEvent) {
        return buildFromEvent.apply(new EventHeader(entity));
    }

}
