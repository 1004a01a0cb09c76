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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

import java.util.Optional;

/**
 * New position and motion of an aircraft.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableAircraftPositionUpdatedEvent.class)
@JsonDeserialize(as = ImmutableAircraftPositionUpdatedEvent.class)
public interface AircraftPositionUpdatedEvent extends TrackingEvent {
    Optional<Double> getLatitude();

    Optional<Double> getLongitude();

    /**
     * @return barometric altitude in meters
     */
    Optional<Double> getAltitude();

    /**
     * @return ground speed in m/s
     */
    Optional<Double> getVelocity();

    /**
     * @return true track in degrees clockwise from north
     */
    Optional<Double> getTrack();

    Optional<Double> getVerticalRate();

    boolean isOnGround();

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableAircraftPositionUpdatedEvent.Builder {

    }
}
