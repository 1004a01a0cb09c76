package io.github.goodees.planecrazy.tracking;

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

import io.github.goodees.planecrazy.core.dispatch.BatchDispatchResult;
import io.github.goodees.planecrazy.core.dispatch.EventDispatcher;
import io.github.goodees.planecrazy.event.AircraftFirstSeenEvent;
import io.github.goodees.planecrazy.event.AircraftIdentityUpdatedEvent;
import io.github.goodees.planecrazy.event.AircraftLastSeenEvent;
import io.github.goodees.planecrazy.event.AircraftPositionUpdatedEvent;
import io.github.goodees.planecrazy.event.TrackingEvent;
import io.github.goodees.planecrazy.projection.AircraftProjection;
import io.github.goodees.planecrazy.projection.AircraftView;
import io.github.goodees.planecrazy.validation.FieldValidation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Turns observations into tracking events. Known state of the aircraft is taken from {@link AircraftProjection},
 * which therefore has to be registered with the dispatcher.
 */
public class TrackingEventRecorder {
    private static final Logger logger = LoggerFactory.getLogger(TrackingEventRecorder.class);

    private final EventDispatcher dispatcher;
    private final AircraftProjection aircraft;

    public TrackingEventRecorder(EventDispatcher dispatcher, AircraftProjection aircraft) {
        this.dispatcher = dispatcher;
        this.aircraft = aircraft;
    }

    /**
     * Record an observation. Emits first seen event for unknown aircraft, position and identity updates when they
     * differ from known state, and last seen event in any case.
     * @param observation the observation
     * @return result of dispatching the events
     */
    public synchronized BatchDispatchResult record(AircraftObservation observation) {
        String icao24 = FieldValidation.normalizeCode(observation.getIcao24());
        Optional<AircraftView> known = aircraft.getAircraft(icao24);
        List<TrackingEvent> events = new ArrayList<>();

        if (!known.isPresent()) {
            events.add(AircraftFirstSeenEvent.builder()
                    .icao24(icao24)
                    .occurredAt(observation.getObservedAt())
                    .initialLatitude(observation.getLatitude())
                    .initialLongitude(observation.getLongitude())
                    .build());
        }
        if (positionChanged(known, observation)) {
            events.add(AircraftPositionUpdatedEvent.builder()
                    .icao24(icao24)
                    .occurredAt(observation.getObservedAt())
                    .latitude(observation.getLatitude())
                    .longitude(observation.getLongitude())
                    .altitude(observation.getAltitude())
                    .velocity(observation.getVelocity())
                    .track(observation.getTrack())
                    .verticalRate(observation.getVerticalRate())
                    .onGround(observation.isOnGround())
                    .build());
        }
        if (identityChanged(known, observation)) {
            events.add(AircraftIdentityUpdatedEvent.builder()
                    .icao24(icao24)
                    .occurredAt(observation.getObservedAt())
                    .registration(observation.getRegistration())
                    .typeCode(observation.getTypeCode())
                    .callsign(observation.getCallsign())
                    .squawk(observation.getSquawk())
                    .origin(observation.getOrigin())
                    .destination(observation.getDestination())
                    .build());
        }
        events.add(AircraftLastSeenEvent.builder()
                .icao24(icao24)
                .occurredAt(observation.getObservedAt())
                .lastLatitude(observation.getLatitude())
                .lastLongitude(observation.getLongitude())
                .lastAltitude(observation.getAltitude())
                .build());

        BatchDispatchResult result = dispatcher.dispatchBatch(events);
        if (result.isHalted()) {
            logger.error("Recording observation of {} halted after {} of {} events", icao24,
                    result.getDispatchedEvents(), result.getTotalEvents());
        } else {
            logger.debug("Recorded {} events for {}", events.size(), icao24);
        }
        return result;
    }

    private static boolean positionChanged(Optional<AircraftView> known, AircraftObservation observation) {
        if (!observation.hasPosition()) {
            return false;
        }
        if (!known.isPresent()) {
            return true;
        }
        AircraftView view = known.get();
        return differs(view, observation, AircraftView::getLatitude, AircraftObservation::getLatitude)
                || differs(view, observation, AircraftView::getLongitude, AircraftObservation::getLongitude)
                || differs(view, observation, AircraftView::getAltitude, AircraftObservation::getAltitude)
                || differs(view, observation, AircraftView::getVelocity, AircraftObservation::getVelocity)
                || differs(view, observation, AircraftView::getTrack, AircraftObservation::getTrack)
                || differs(view, observation, AircraftView::getVerticalRate, AircraftObservation::getVerticalRate)
                || view.isOnGround() != observation.isOnGround();
    }

    private static boolean identityChanged(Optional<AircraftView> known, AircraftObservation observation) {
        return changedValue(known, observation, AircraftView::getRegistration, AircraftObservation::getRegistration)
                || changedValue(known, observation, AircraftView::getTypeCode, AircraftObservation::getTypeCode)
                || changedValue(known, observation, AircraftView::getCallsign, AircraftObservation::getCallsign)
                || changedValue(known, observation, AircraftView::getSquawk, AircraftObservation::getSquawk)
                || changedValue(known, observation, AircraftView::getOrigin, AircraftObservation::getOrigin)
                || changedValue(known, observation, AircraftView::getDestination,
                        AircraftObservation::getDestination);
    }

    private static <T> boolean differs(AircraftView view, AircraftObservation observation,
                                       Function<AircraftView, Optional<T>> known,
                                       Function<AircraftObservation, Optional<T>> observed) {
        return !Objects.equals(known.apply(view), observed.apply(observation));
    }

    // absent or blank observed values never count as a change
    private static boolean changedValue(Optional<AircraftView> view, AircraftObservation observation,
                                        Function<AircraftView, Optional<String>> known,
                                        Function<AircraftObservation, Optional<String>> observed) {
        Optional<String> value = observed.apply(observation).map(String::trim).filter(s -> !s.isEmpty());
        if (!value.isPresent()) {
            return false;
        }
        return !view.isPresent() || !value.equals(known.apply(view.get()));
    }
}
