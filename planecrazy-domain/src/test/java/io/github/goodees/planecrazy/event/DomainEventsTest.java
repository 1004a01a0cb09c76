package io.github.goodees.planecrazy.event;

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
import io.github.goodees.planecrazy.core.store.EventTypeRegistry;
import io.github.goodees.planecrazy.core.store.JacksonEventSerialization;
import org.junit.Test;

import java.time.Instant;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class DomainEventsTest {
    private final JacksonEventSerialization serialization = DomainEvents.serialization();

    @Test
    public void all_event_types_are_registered() {
        EventTypeRegistry registry = DomainEvents.registry();
        assertEquals(13, registry.getTypes().size());
        assertThat(registry.getTypes(), hasItems("CommentAdded", "AircraftFavourited", "TypeUnfavourited",
                "AircraftLastSeen"));
        assertEquals(AirportFavouritedEvent.class, registry.classFor("AirportFavourited"));
    }

    @Test
    public void type_is_simple_name_without_suffix() {
        assertEquals("CommentDeleted", CommentDeletedEvent.builder().commentId("c").entityType("Aircraft")
                .entityId("A").build().getType());
    }

    @Test
    public void event_survives_persisted_form() {
        AirportFavouritedEvent event = AirportFavouritedEvent.builder()
                .icaoCode("LKPR")
                .name("Prague")
                .latitude(50.1)
                .occurredAt(Instant.parse("2024-06-01T12:00:00.123456Z"))
                .build();

        String payload = serialization.serialize(event);
        Event read = serialization.deserialize(serialization.payloadVersion(event), payload, event.getType());

        assertEquals(event, read);
        assertThat(payload, containsString("\"occurredAt\":\"2024-06-01T12:00:00.123456Z\""));
        assertThat(payload, not(containsString("longitude")));
        assertThat(payload, not(containsString("\"type\"")));
    }

    @Test
    public void unknown_properties_are_ignored() {
        Event read = serialization.deserialize(1,
                "{\"id\":\"e1\",\"occurredAt\":\"2024-06-01T12:00:00Z\",\"icao24\":\"ABCDEF\",\"future\":true}",
                "AircraftUnfavourited");
        assertEquals("e1", read.getId());
        assertTrue(read instanceof AircraftUnfavouritedEvent);
    }

    @Test(expected = IllegalArgumentException.class)
    public void payload_without_occurrence_time_is_rejected() {
        serialization.deserialize(1, "{\"id\":\"e1\",\"icao24\":\"ABCDEF\"}", "AircraftUnfavourited");
    }

    @Test
    public void subject_names_the_entity() {
        assertEquals(EntityKey.of("Airport", "LKPR"),
                AirportFavouritedEvent.builder().icaoCode("LKPR").build().subject());
        assertEquals(EntityKey.of("Aircraft", "ABCDEF"),
                AircraftLastSeenEvent.builder().icao24("ABCDEF").build().subject());
        assertEquals("Type_A320", EntityKey.of(EntityKind.TYPE, "A320").asAggregateId());
    }
}
