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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.goodees.planecrazy.core.Event;

import java.io.IOException;

/**
 * JSON serialization of events with Jackson. The discriminator is resolved through an {@link EventTypeRegistry},
 * payload carries only the event's own properties.
 */
public class JacksonEventSerialization implements Serialization<Event> {
    public static final int CURRENT_PAYLOAD_VERSION = 1;
    static final String ID = "id";
    static final String OCCURRED_AT = "occurredAt";

    private final ObjectMapper mapper;
    private final EventTypeRegistry registry;

    public JacksonEventSerialization(EventTypeRegistry registry) {
        this(registry, createMapper());
    }

    public JacksonEventSerialization(EventTypeRegistry registry, ObjectMapper mapper) {
        this.registry = registry;
        this.mapper = mapper;
    }

    /**
     * Mapper supporting Optional and java.time values, writing instants as ISO-8601 text.
     * @return new mapper instance
     */
    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModules(new Jdk8Module(), new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Override
    public int payloadVersion(Event object) {
        return CURRENT_PAYLOAD_VERSION;
    }

    @Override
    public String serialize(Event object) {
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize event " + object.getId(), e);
        }
    }

    @Override
    public Event deserialize(int payloadVersion, String payload, String type) {
        if (payloadVersion != CURRENT_PAYLOAD_VERSION) {
            throw new IllegalArgumentException("Unsupported payload version " + payloadVersion + " of type " + type);
        }
        Class<? extends Event> eventClass = registry.classFor(type);
        try {
            JsonNode tree = mapper.readTree(payload);
            requireProperty(tree, ID, type);
            requireProperty(tree, OCCURRED_AT, type);
            return mapper.treeToValue(tree, eventClass);
        } catch (IOException e) {
            throw new IllegalArgumentException("Payload is not a valid " + type + " event: " + e.getMessage(), e);
        }
    }

    // identity and time must come from the record, never from builder defaults
    private static void requireProperty(JsonNode tree, String property, String type) {
        JsonNode value = tree == null ? null : tree.get(property);
        if (value == null || !value.isTextual() || value.asText().trim().isEmpty()) {
            throw new IllegalArgumentException("Payload of " + type + " event lacks " + property);
        }
    }

    @Override
    public Event toSerializable(Object o) {
        if (o instanceof Event && registry.supports((Event) o)) {
            return (Event) o;
        }
        return null;
    }

    public EventTypeRegistry getRegistry() {
        return registry;
    }
}
