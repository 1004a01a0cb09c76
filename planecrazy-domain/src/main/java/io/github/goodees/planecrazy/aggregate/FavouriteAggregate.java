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

import io.github.goodees.planecrazy.core.aggregate.AggregateRoot;
import io.github.goodees.planecrazy.event.AircraftFavouritedEvent;
import io.github.goodees.planecrazy.event.AircraftUnfavouritedEvent;
import io.github.goodees.planecrazy.event.AirportFavouritedEvent;
import io.github.goodees.planecrazy.event.AirportUnfavouritedEvent;
import io.github.goodees.planecrazy.event.EntityKey;
import io.github.goodees.planecrazy.event.EntityKind;
import io.github.goodees.planecrazy.event.FavouriteEvent;
import io.github.goodees.planecrazy.event.TypeFavouritedEvent;
import io.github.goodees.planecrazy.event.TypeUnfavouritedEvent;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Whether a single entity is a favourite. Favouriting is only allowed when it is not, and unfavouriting only when it
 * is.
 */
public class FavouriteAggregate extends AggregateRoot<FavouriteEvent> {
    private final EntityKey target;
    private boolean favourited;

    public FavouriteAggregate(EntityKey target) {
        super(target.asAggregateId());
        this.target = target;
    }

    /**
     * Selection of the favourite events of single entity.
     * @param target the entity
     * @return predicate matching its substream
     */
    public static Predicate<FavouriteEvent> streamOf(EntityKey target) {
        return e -> target.equals(e.subject());
    }

    public void favouriteAircraft(String registration, String typeCode) {
        requireKind(EntityKind.AIRCRAFT);
        requireNotFavourited();
        raise(AircraftFavouritedEvent.builder()
                .icao24(target.getId())
                .registration(registration)
                .typeCode(typeCode)
                .build());
    }

    public void unfavouriteAircraft() {
        requireKind(EntityKind.AIRCRAFT);
        requireFavourited();
        raise(AircraftUnfavouritedEvent.builder().icao24(target.getId()).build());
    }

    public void favouriteType(String typeName) {
        requireKind(EntityKind.TYPE);
        requireNotFavourited();
        raise(TypeFavouritedEvent.builder()
                .typeCode(target.getId())
                .typeName(typeName)
                .build());
    }

    public void unfavouriteType() {
        requireKind(EntityKind.TYPE);
        requireFavourited();
        raise(TypeUnfavouritedEvent.builder().typeCode(target.getId()).build());
    }

    public void favouriteAirport(String name, Double latitude, Double longitude) {
        requireKind(EntityKind.AIRPORT);
        requireNotFavourited();
        raise(AirportFavouritedEvent.builder()
                .icaoCode(target.getId())
                .name(name)
                .latitude(Optional.ofNullable(latitude))
                .longitude(Optional.ofNullable(longitude))
                .build());
    }

    public void unfavouriteAirport() {
        requireKind(EntityKind.AIRPORT);
        requireFavourited();
        raise(AirportUnfavouritedEvent.builder().icaoCode(target.getId()).build());
    }

    private void requireKind(EntityKind kind) {
        if (!kind.getName().equals(target.getType())) {
            throw new IllegalArgumentException("Favourite of " + target.getType() + " cannot be changed as "
                    + kind.getName());
        }
    }

    private void requireNotFavourited() {
        if (favourited) {
            throw invalidState(target.getType() + " " + target.getId() + " is already favourited.");
        }
    }

    private void requireFavourited() {
        if (!favourited) {
            throw invalidState(target.getType() + " " + target.getId() + " is not favourited.");
        }
    }

    @Override
    protected void updateState(FavouriteEvent event) {
        if (target.equals(event.subject())) {
            favourited = event.favourited();
        }
    }

    public EntityKey getTarget() {
        return target;
    }

    public boolean isFavourited() {
        return favourited;
    }
}
