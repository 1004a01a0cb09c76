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

import org.immutables.value.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * Last known state of a tracked aircraft.
 */
@Value.Immutable
public interface AircraftView {
    String getIcao24();

    Optional<String> getRegistration();

    Optional<String> getTypeCode();

    Optional<String> getCallsign();

    Optional<String> getSquawk();

    Optional<String> getOrigin();

    Optional<String> getDestination();

    Optional<Double> getLatitude();

    Optional<Double> getLongitude();

    Optional<Double> getAltitude();

    Optional<Double> getVelocity();

    Optional<Double> getTrack();

    Optional<Double> getVerticalRate();

    @Value.Default
    default boolean isOnGround() {
        return false;
    }

    Instant getFirstSeen();

    Instant getLastSeen();

    Instant getLastUpdated();

    @Value.Default
    default long getTotalUpdates() {
        return 0;
    }

    class Builder extends ImmutableAircraftView.Builder {

    }
}
