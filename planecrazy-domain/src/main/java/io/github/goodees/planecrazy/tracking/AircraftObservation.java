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

import org.immutables.value.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * Single observation of an aircraft, as received from the data source.
 */
@Value.Immutable
public interface AircraftObservation {
    String getIcao24();

    @Value.Default
    default Instant getObservedAt() {
        return Instant.now();
    }

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

    Optional<String> getRegistration();

    Optional<String> getTypeCode();

    Optional<String> getCallsign();

    Optional<String> getSquawk();

    Optional<String> getOrigin();

    Optional<String> getDestination();

    default boolean hasPosition() {
        return getLatitude().isPresent() && getLongitude().isPresent();
    }

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableAircraftObservation.Builder {

    }
}
