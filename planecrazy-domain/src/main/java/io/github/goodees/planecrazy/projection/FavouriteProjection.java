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

import io.github.goodees.planecrazy.core.Event;
import io.github.goodees.planecrazy.core.matching.TypeSwitch;
import io.github.goodees.planecrazy.core.projection.AbstractProjection;
import io.github.goodees.planecrazy.core.store.EventLog;
import io.github.goodees.planecrazy.event.AircraftFavouritedEvent;
import io.github.goodees.planecrazy.event.AirportFavouritedEvent;
import io.github.goodees.planecrazy.event.EntityKey;
import io.github.goodees.planecrazy.event.EntityKind;
import io.github.goodees.planecrazy.event.FavouriteEvent;
import io.github.goodees.planecrazy.event.TypeFavouritedEvent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.stream.Collectors.toList;

/**
 * Current favourites. Entity type arguments of the queries are matched case-insensitively.
 */
public class FavouriteProjection extends AbstractProjection {
    public static final String NAME = "Favourites";

    private final Map<EntityKey, FavouriteView> favourites = new LinkedHashMap<>();

    private final TypeSwitch fold = TypeSwitch.builder()
            .on(AircraftFavouritedEvent.class, e -> put(new FavouriteView.Builder()
                    .entityType(EntityKind.AIRCRAFT.getName())
                    .entityId(e.getIcao24())
                    .favouritedAt(e.getOccurredAt())
                    .registration(e.getRegistration())
                    .typeCode(e.getTypeCode())
                    .build()))
            .on(TypeFavouritedEvent.class, e -> put(new FavouriteView.Builder()
                    .entityType(EntityKind.TYPE.getName())
                    .entityId(e.getTypeCode())
                    .favouritedAt(e.getOccurredAt())
                    .typeCode(e.getTypeCode())
                    .typeName(e.getTypeName())
                    .build()))
            .on(AirportFavouritedEvent.class, e -> put(new FavouriteView.Builder()
                    .entityType(EntityKind.AIRPORT.getName())
                    .entityId(e.getIcaoCode())
                    .favouritedAt(e.getOccurredAt())
                    .name(e.getName())
                    .latitude(e.getLatitude())
                    .longitude(e.getLongitude())
                    .build()))
            .on(FavouriteEvent.class, e -> !e.favourited(), e -> favourites.remove(e.subject()))
            .build();

    public FavouriteProjection(EventLog log) {
        super(NAME, log);
    }

    private void put(FavouriteView view) {
        favourites.put(EntityKey.of(view.getEntityType(), view.getEntityId()), view);
    }

    @Override
    protected boolean handle(Event event) {
        return fold.executeMatching(event);
    }

    @Override
    protected void clear() {
        favourites.clear();
    }

    @Override
    protected void clearEntity(String entityType, String entityId) {
        favourites.remove(EntityKey.of(canonical(entityType), entityId));
    }

    @Override
    protected boolean concerns(Event event, String entityType, String entityId) {
        return event instanceof FavouriteEvent && ((FavouriteEvent) event).subject().is(canonical(entityType), entityId);
    }

    public List<FavouriteView> getAll() {
        return query(() -> new ArrayList<>(favourites.values()));
    }

    public List<FavouriteView> getByType(String entityType) {
        String type = canonical(entityType);
        return query(() -> favourites.values().stream()
                .filter(f -> f.getEntityType().equals(type))
                .collect(toList()));
    }

    public boolean isFavourited(String entityType, String entityId) {
        return getFavourite(entityType, entityId).isPresent();
    }

    public Optional<FavouriteView> getFavourite(String entityType, String entityId) {
        EntityKey key = EntityKey.of(canonical(entityType), entityId);
        return query(() -> Optional.ofNullable(favourites.get(key)));
    }

    public List<FavouriteView> getFavouriteAircraft() {
        return getByType(EntityKind.AIRCRAFT.getName());
    }

    public List<FavouriteView> getFavouriteTypes() {
        return getByType(EntityKind.TYPE.getName());
    }

    public List<FavouriteView> getFavouriteAirports() {
        return getByType(EntityKind.AIRPORT.getName());
    }

    private static String canonical(String entityType) {
        return EntityKind.fromName(entityType).map(EntityKind::getName).orElse(entityType);
    }
}
