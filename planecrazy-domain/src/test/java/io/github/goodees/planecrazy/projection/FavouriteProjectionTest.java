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
import io.github.goodees.planecrazy.event.AircraftFavouritedEvent;
import io.github.goodees.planecrazy.event.AircraftUnfavouritedEvent;
import io.github.goodees.planecrazy.event.AirportFavouritedEvent;
import io.github.goodees.planecrazy.event.TypeFavouritedEvent;
import io.github.goodees.planecrazy.event.TypeUnfavouritedEvent;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class FavouriteProjectionTest {
    private final InMemoryEventStore store = new InMemoryEventStore();
    private final FavouriteProjection projection = new FavouriteProjection(store);

    @Before
    public void setUp() throws EventStoreException {
        store.persist(
                AircraftFavouritedEvent.builder().icao24("ABCDEF").typeCode("B738").build(),
                AircraftFavouritedEvent.builder().icao24("123456").build(),
                AircraftUnfavouritedEvent.builder().icao24("123456").build(),
                TypeFavouritedEvent.builder().typeCode("A320").build(),
                TypeUnfavouritedEvent.builder().typeCode("A320").build(),
                AirportFavouritedEvent.builder().icaoCode("KJFK").name("John F. Kennedy").build());
        projection.rebuild();
    }

    @Test
    public void only_current_favourites_remain() {
        assertEquals(2, projection.getAll().size());
        assertTrue(projection.isFavourited("Aircraft", "ABCDEF"));
        assertFalse(projection.isFavourited("Aircraft", "123456"));
        assertFalse(projection.isFavourited("Type", "A320"));
        assertTrue(projection.isFavourited("Airport", "KJFK"));
    }

    @Test
    public void entity_type_is_matched_ignoring_case() {
        List<FavouriteView> aircraft = projection.getByType("AIRCRAFT");
        assertEquals(1, aircraft.size());
        assertEquals("B738", aircraft.get(0).getTypeCode().get());
        assertTrue(projection.isFavourited("airport", "KJFK"));
    }

    @Test
    public void rebuild_twice_gives_same_favourites() throws EventStoreException {
        List<FavouriteView> before = projection.getAll();
        projection.rebuild();
        assertEquals(before, projection.getAll());
    }

    @Test
    public void favourite_time_is_time_of_event() {
        FavouriteView airport = projection.getFavouriteAirports().get(0);
        assertEquals("John F. Kennedy", airport.getName().get());
        assertTrue(projection.getFavouriteTypes().isEmpty());
        assertEquals(1, projection.getFavouriteAircraft().size());
        assertFalse(airport.getFavouritedAt().isAfter(java.time.Instant.now()));
    }
}
