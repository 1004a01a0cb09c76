package io.github.goodees.planecrazy.core.store;

/*-
 * #%L
 * planecrazy
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

import io.github.goodees.planecrazy.core.Event;
import io.github.goodees.planecrazy.core.EventType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps type discriminators to event classes. Stores only ever decode types registered here, so adding an event type
 * is a matter of registering its class.
 */
public class EventTypeRegistry {
    private final Map<String, Class<? extends Event>> types;

    private EventTypeRegistry(Builder builder) {
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(builder.types));
    }

    public Class<? extends Event> classFor(String type) {
        Class<? extends Event> eventClass = types.get(type);
        if (eventClass == null) {
            throw new IllegalArgumentException("Unknown event type: " + type);
        }
        return eventClass;
    }

    public boolean isRegistered(String type) {
        return types.containsKey(type);
    }

    /**
     * Whether the event is an instance of the class registered under its type.
     * @param event the event
     * @return true if store may persist it
     */
    public boolean supports(Event event) {
        Class<? extends Event> eventClass = types.get(event.getType());
        return eventClass != null && eventClass.isInstance(event);
    }

    public Set<String> getTypes() {
        return types.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Class<? extends Event>> types = new LinkedHashMap<>();

        /**
         * Register event class under {@linkplain EventType#defaultTypeName(Class) default name}.
         * @param eventClass the event class, usually the abstract value type
         * @return this builder
         */
        public Builder register(Class<? extends Event> eventClass) {
            return register(EventType.defaultTypeName(eventClass), eventClass);
        }

        public Builder register(String type, Class<? extends Event> eventClass) {
            Objects.requireNonNull(type, "Type must be specified");
            Objects.requireNonNull(eventClass, "Event class must be specified");
            Class<? extends Event> previous = types.putIfAbsent(type, eventClass);
            if (previous != null && previous != eventClass) {
                throw new IllegalArgumentException("Type " + type + " is already registered for " + previous.getName());
            }
            return this;
        }

        @SafeVarargs
        public final Builder registerAll(Class<? extends Event>... eventClasses) {
            for (Class<? extends Event> eventClass : eventClasses) {
                register(eventClass);
            }
            return this;
        }

        public EventTypeRegistry build() {
            return new EventTypeRegistry(this);
        }
    }
}
