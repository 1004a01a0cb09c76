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
import io.github.goodees.planecrazy.event.AircraftFirstSeenEvent;
import io.github.goodees.planecrazy.event.AircraftIdentityUpdatedEvent;
import io.github.goodees.planecrazy.event.AircraftLastSeenEvent;
import io.github.goodees.planecrazy.event.AircraftPositionUpdatedEvent;
import io.github.goodees.planecrazy.event.EntityKind;
import io.github.goodees.planecrazy.event.TrackingEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.stream.Collectors.toList;

/**
 * Last known state of every aircraft that was ever tracked.
 */
public class AircraftProjection extends AbstractProjection {
    public static final String NAME = "Aircraft";

    private final Map<String, AircraftView> aircraft = new LinkedHashMap<>();

    private final TypeSwitch fold = TypeSwitch.builder()
            .on(AircraftFirstSeenEvent.class, this::firstSeen)
            .on(AircraftPositionUpdatedEvent.class, this::positionUpdated)
            .on(AircraftIdentityUpdatedEvent.class, this::identityUpdated)
            .on(AircraftLastSeenEvent.class, this::lastSeen)
            .build();

    public AircraftProjection(EventLog log) {
        super(NAME, log);
    }

    @Override
    protected boolean handle(Event event) {
        return fold.executeMatching(event);
    }

    private void firstSeen(AircraftFirstSeenEvent event) {
        AircraftView.Builder builder = builderOf(event);
        builder.latitude(event.getInitialLatitude()).longitude(event.getInitialLongitude());
        aircraft.put(event.getIcao24(), builder.build());
    }

    private void positionUpdated(AircraftPositionUpdatedEvent event) {
        AircraftView.Builder builder = builderOf(event);
        AircraftView current = builder.build();
        builder.latitude(event.getLatitude())
                .longitude(event.getLongitude())
                .altitude(event.getAltitude())
                .velocity(event.getVelocity())
                .track(event.getTrack())
                .verticalRate(event.getVerticalRate())
                .onGround(event.isOnGround())
                .lastSeen(event.getOccurredAt())
                .lastUpdated(event.getOccurredAt())
                .totalUpdates(current.getTotalUpdates() + 1);
        aircraft.put(event.getIcao24(), builder.build());
    }

    private void identityUpdated(AircraftIdentityUpdatedEvent event) {
        AircraftView.Builder builder = builderOf(event);
        AircraftView current = builder.build();
        nonEmpty(event.getRegistration()).ifPresent(builder::registration);
        nonEmpty(event.getTypeCode()).ifPresent(builder::typeCode);
        nonEmpty(event.getCallsign()).ifPresent(builder::callsign);
        nonEmpty(event.getSquawk()).ifPresent(builder::squawk);
        nonEmpty(event.getOrigin()).ifPresent(builder::origin);
        nonEmpty(event.getDestination()).ifPresent(builder::destination);
        builder.lastUpdated(event.getOccurredAt())
                .totalUpdates(current.getTotalUpdates() + 1);
        aircraft.put(event.getIcao24(), builder.build());
    }

    private void lastSeen(AircraftLastSeenEvent event) {
        AircraftView.Builder builder = builderOf(event);
        event.getLastLatitude().ifPresent(builder::latitude);
        event.getLastLongitude().ifPresent(builder::longitude);
        event.getLastAltitude().ifPresent(builder::altitude);
        builder.lastSeen(event.getOccurredAt());
        aircraft.put(event.getIcao24(), builder.build());
    }

    /**
     * Builder initialized from known state, or a fresh aircraft first seen at the time of the event.
     */
    private AircraftView.Builder builderOf(TrackingEvent event) {
        AircraftView.Builder builder = new AircraftView.Builder();
        AircraftView known = aircraft.get(event.getIcao24());
        if (known != null) {
            builder.from(known);
        } else {
            builder.icao24(event.getIcao24())
                    .firstSeen(event.getOccurredAt())
                    .lastSeen(event.getOccurredAt())
                    .lastUpdated(event.getOccurredAt());
        }
        return builder;
    }

    private static Optional<String> nonEmpty(Optional<String> value) {
        return value.map(String::trim).filter(s -> !s.isEmpty());
    }

    @Override
    protected void clear() {
        aircraft.clear();
    }

    @Override
    protected void clearEntity(String entityType, String entityId) {
        if (EntityKind.AIRCRAFT.getName().equalsIgnoreCase(entityType)) {
            aircraft.remove(entityId);
        }
    }

    @Override
    protected boolean concerns(Event event, String entityType, String entityId) {
        return event instanceof TrackingEvent
                && EntityKind.AIRCRAFT.getName().equalsIgnoreCase(entityType)
                && ((TrackingEvent) event).getIcao24().equals(entityId);
    }

    public Optional<AircraftView> getAircraft(String icao24) {
        return query(() -> Optional.ofNullable(aircraft.get(icao24)));
    }

    public List<AircraftView> getAllAircraft() {
        return query(() -> new ArrayList<>(aircraft.values()));
    }

    /**
     * @param since lower bound, inclusive
     * @return aircraft last seen at or after given instant
     */
    public List<AircraftView> getAircraftSeenSince(Instant since) {
        return query(() -> aircraft.values().stream()
                .filter(a -> !a.getLastSeen().isBefore(since))
                .collect(toList()));
    }

    public int count() {
        return query(aircraft::size);
    }
}
