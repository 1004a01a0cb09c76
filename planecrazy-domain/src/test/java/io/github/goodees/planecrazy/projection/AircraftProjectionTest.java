package io.github.goodees.planecrazy.projection;

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

import io.github.goodees.planecrazy.core.store.EventStoreException;
import io.github.goodees.planecrazy.core.store.inmemory.InMemoryEventStore;
import io.github.goodees.planecrazy.event.AircraftFirstSeenEvent;
import io.github.goodees.planecrazy.event.AircraftIdentityUpdatedEvent;
import io.github.goodees.planecrazy.event.AircraftLastSeenEvent;
import io.github.goodees.planecrazy.event.AircraftPositionUpdatedEvent;
import org.junit.Test;

import java.time.Instant;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class AircraftProjectionTest {
    private final InMemoryEventStore store = new InMemoryEventStore();
    private final AircraftProjection projection = new AircraftProjection(store);
    private final Instant start = Instant.parse("2024-06-01T12:00:00Z");

    @Test
    public void tracking_events_build_aircraft_state() throws EventStoreException {
        store.persist(
                AircraftFirstSeenEvent.builder().icao24("4CA7B5").occurredAt(start)
                        .initialLatitude(53.42).initialLongitude(-6.27).build(),
                AircraftPositionUpdatedEvent.builder().icao24("4CA7B5").occurredAt(start.plusSeconds(5))
                        .latitude(53.5).longitude(-6.2).altitude(3000.0).velocity(150.0).onGround(false).build(),
                AircraftIdentityUpdatedEvent.builder().icao24("4CA7B5").occurredAt(start.plusSeconds(6))
                        .registration("EI-DWA").callsign("RYR12").build(),
                AircraftIdentityUpdatedEvent.builder().icao24("4CA7B5").occurredAt(start.plusSeconds(7))
                        .registration(" ").squawk("7000").build(),
                AircraftLastSeenEvent.builder().icao24("4CA7B5").occurredAt(start.plusSeconds(8))
                        .lastAltitude(3100.0).build());
        projection.rebuild();

        AircraftView view = projection.getAircraft("4CA7B5").get();
        assertEquals(start, view.getFirstSeen());
        assertEquals(start.plusSeconds(8), view.getLastSeen());
        assertEquals(start.plusSeconds(7), view.getLastUpdated());
        assertEquals(53.5, view.getLatitude().get(), 1e-9);
        assertEquals(3100.0, view.getAltitude().get(), 1e-9);
        assertEquals("EI-DWA", view.getRegistration().get());
        assertEquals("7000", view.getSquawk().get());
        assertEquals(3, view.getTotalUpdates());
        assertEquals(1, projection.count());
    }

    @Test
    public void update_delivered_after_rebuild_is_counted_once() throws EventStoreException {
        AircraftPositionUpdatedEvent update = AircraftPositionUpdatedEvent.builder().icao24("ABCDEF")
                .occurredAt(start).latitude(1.0).longitude(2.0).build();
        store.persist(update);
        projection.rebuild();

        assertFalse(projection.applyEvent(update));
        assertEquals(1, projection.getAircraft("ABCDEF").get().getTotalUpdates());
    }

    @Test
    public void position_update_of_unknown_aircraft_creates_it() {
        projection.applyEvent(AircraftPositionUpdatedEvent.builder().icao24("ABCDEF").occurredAt(start)
                .latitude(1.0).longitude(2.0).onGround(true).build());

        AircraftView view = projection.getAircraft("ABCDEF").get();
        assertTrue(view.isOnGround());
        assertEquals(start, view.getFirstSeen());
        assertEquals(1, view.getTotalUpdates());
    }

    @Test
    public void seen_since_filters_by_last_seen() {
        projection.applyEvent(AircraftFirstSeenEvent.builder().icao24("AAAAAA").occurredAt(start).build());
        projection.applyEvent(AircraftFirstSeenEvent.builder().icao24("BBBBBB").occurredAt(start.plusSeconds(60))
                .build());

        assertEquals(1, projection.getAircraftSeenSince(start.plusSeconds(60)).size());
        assertEquals(2, projection.getAircraftSeenSince(start).size());
        assertFalse(projection.getAircraft("CCCCCC").isPresent());
    }

    @Test
    public void rebuild_twice_gives_same_state() throws EventStoreException {
        store.persist(AircraftFirstSeenEvent.builder().icao24("AAAAAA").occurredAt(start).build(),
                AircraftPositionUpdatedEvent.builder().icao24("AAAAAA").occurredAt(start.plusSeconds(1))
                        .latitude(1.0).longitude(1.0).onGround(false).build());
        projection.rebuild();
        AircraftView first = projection.getAircraft("AAAAAA").get();
        projection.rebuild();
        assertEquals(first, projection.getAircraft("AAAAAA").get());
    }
}
