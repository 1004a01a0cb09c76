package io.github.goodees.planecrazy.aggregate;

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

import io.github.goodees.planecrazy.core.aggregate.InvalidStateException;
import io.github.goodees.planecrazy.event.AircraftFavouritedEvent;
import io.github.goodees.planecrazy.event.AircraftUnfavouritedEvent;
import io.github.goodees.planecrazy.event.AirportFavouritedEvent;
import io.github.goodees.planecrazy.event.EntityKey;
import io.github.goodees.planecrazy.event.EntityKind;
import io.github.goodees.planecrazy.event.TypeFavouritedEvent;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class FavouriteAggregateTest {
    private final EntityKey aircraft = EntityKey.of(EntityKind.AIRCRAFT, "ABCDEF");

    @Test
    public void favourite_state_follows_last_event() {
        FavouriteAggregate aggregate = new FavouriteAggregate(aircraft);
        aggregate.loadFromHistory(Arrays.asList(
                AircraftFavouritedEvent.builder().icao24("ABCDEF").build(),
                AircraftUnfavouritedEvent.builder().icao24("ABCDEF").build(),
                AircraftFavouritedEvent.builder().icao24("ABCDEF").build()));

        assertTrue(aggregate.isFavourited());
        assertEquals("Aircraft_ABCDEF", aggregate.getId());
    }

    @Test(expected = InvalidStateException.class)
    public void favourite_twice_is_rejected() {
        FavouriteAggregate aggregate = new FavouriteAggregate(aircraft);
        aggregate.loadFromHistory(Arrays.asList(AircraftFavouritedEvent.builder().icao24("ABCDEF").build()));
        aggregate.favouriteAircraft(null, null);
    }

    @Test
    public void airport_favourite_carries_optional_position() {
        FavouriteAggregate aggregate = new FavouriteAggregate(EntityKey.of(EntityKind.AIRPORT, "LKPR"));
        aggregate.favouriteAirport("Prague", null, 14.26);

        AirportFavouritedEvent event = (AirportFavouritedEvent) aggregate.getUncommittedEvents().get(0);
        assertFalse(event.getLatitude().isPresent());
        assertEquals(14.26, event.getLongitude().get(), 1e-9);
        assertTrue(aggregate.isFavourited());
    }

    @Test(expected = IllegalArgumentException.class)
    public void command_must_match_kind_of_entity() {
        new FavouriteAggregate(aircraft).favouriteType("Boeing 737");
    }

    @Test
    public void stream_selects_events_of_one_entity() {
        assertTrue(FavouriteAggregate.streamOf(EntityKey.of("Type", "A320"))
                .test(TypeFavouritedEvent.builder().typeCode("A320").build()));
        assertFalse(FavouriteAggregate.streamOf(EntityKey.of("Aircraft", "A320"))
                .test(TypeFavouritedEvent.builder().typeCode("A320").build()));
    }
}
