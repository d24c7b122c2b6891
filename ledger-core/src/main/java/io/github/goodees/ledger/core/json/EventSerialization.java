package io.github.goodees.ledger.core.json;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.goodees.ledger.core.immutables.ImmutableEvent;

import java.util.List;
import java.util.Objects;

/**
 * JSON form of {@link ImmutableEvent}s, e. g. for exporting audit trail of a stream. Every event carries its type name
 * in property {@code type}, which is mapped back to event class within the package of the base type passed for
 * reading.
 *
 * @param <E> base type of events, all event classes need to reside in its package
 */
public class EventSerialization<E extends ImmutableEvent> {
    private final ObjectMapper mapper;
    private final Class<E> baseType;
    private final JavaType historyType;

    public EventSerialization(Class<E> baseType) {
        this(createMapper(), baseType);
    }

    public EventSerialization(ObjectMapper mapper, Class<E> baseType) {
        this.mapper = Objects.requireNonNull(mapper);
        this.baseType = Objects.requireNonNull(baseType);
        this.historyType = mapper.getTypeFactory().constructCollectionType(List.class, baseType);
    }

    /**
     * Mapper with Java 8 and Java time support, writing dates as ISO-8601 strings.
     * @return new mapper
     */
    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModules(new Jdk8Module(), new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    public String toJson(E event) {
        try {
            return mapper.writerFor(baseType).writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Cannot serialize event " + event, e);
        }
    }

    public E fromJson(String json) {
        try {
            return mapper.readValue(json, baseType);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Cannot deserialize " + baseType.getSimpleName() + ": "
                    + e.getOriginalMessage(), e);
        }
    }

    /**
     * Serialize sequence of events as JSON array.
     * @param history events, e. g. a stream read from the store
     * @return JSON array
     */
    public String historyToJson(List<? extends E> history) {
        try {
            return mapper.writerFor(historyType).writeValueAsString(history);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Cannot serialize history of " + history.size() + " events", e);
        }
    }

    public List<E> historyFromJson(String json) {
        try {
            return mapper.readValue(json, historyType);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Cannot deserialize history of " + baseType.getSimpleName()
                    + ": " + e.getOriginalMessage(), e);
        }
    }
}
