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

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.DatabindContext;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.jsontype.impl.TypeIdResolverBase;
import com.fasterxml.jackson.databind.type.TypeFactory;
import io.github.goodees.ledger.core.Event;
import java.io.IOException;

/**
 * Automatic JSON event type names and their instantiation for ImmutableEvent descendants.
 * 
 * The convention is consistent with implementation of ImmutableEvent.getType and is following:
 * 
 * <ul>
 * <li>All events are defined in same package as parent class</li>
 * <li>All events have suffix Event</li>
 * </ul>
 * 
 * @see ImmutableEvent#getType()
 */
public class ImmutableEventTypeResolver extends TypeIdResolverBase {
    private final static String PREFIX = "Immutable";
    private final static String SUFFIX = "Event";

    private JavaType baseType;
    private String basePackage;

    @Override
    public void init(JavaType bt) {
        this.baseType = bt;
        String className = bt.getRawClass().getName();
        this.basePackage = className.substring(0, className.lastIndexOf("."));
    }

    @Override
    public JavaType typeFromId(DatabindContext context, String id) throws IOException {
        JavaType type = resolve(id, context.getTypeFactory());
        if (type == null) {
            throw ((DeserializationContext) context).invalidTypeIdException(baseType, id, "no event class " + className(id));
        }
        return type;
    }

    /**
     * Find event class for type name.
     * @param id type name, e. g. MoneyDeposited
     * @param typeFactory jackson type factory
     * @return the type, or null if no such event class exists in package of base type
     */
    JavaType resolve(String id, TypeFactory typeFactory) {
        try {
            Class<?> eventClass = typeFactory.findClass(className(id));
            if (!baseType.getRawClass().isAssignableFrom(eventClass)) {
                return null;
            }
            return typeFactory.constructType(eventClass);
        } catch (ClassNotFoundException ex) {
            return null;
        }
    }

    @Override
    public String idFromValue(Object value) {
        if (value instanceof ImmutableEvent) {
            return ((Event) value).getType();
        } else {
            throw new IllegalArgumentException(
                "This type resolver is only for non-null descendants of ImmutableEvent, was given " + value);
        }
    }

    @Override
    public String idFromValueAndType(Object value, Class<?> suggestedType) {
        if (value instanceof ImmutableEvent && ImmutableEvent.class.isAssignableFrom(suggestedType)) {
            return ((Event) value).getType();
        } else {
            throw new IllegalArgumentException(
                "This type resolver is only for non-null descendants of ImmutableEvent, was given "
                        + (suggestedType == null ? null : suggestedType.getName()) + " " + value);
        }
    }

    @Override
    public String getDescForKnownTypeIds() {
        return "event types in package " + basePackage;
    }

    @Override
    public JsonTypeInfo.Id getMechanism() {
        return JsonTypeInfo.Id.CUSTOM;
    }

    private String className(String id) {
        return basePackage + "." + PREFIX + id + SUFFIX;
    }

}
