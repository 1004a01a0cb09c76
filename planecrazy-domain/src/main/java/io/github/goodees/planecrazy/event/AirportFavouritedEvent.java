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
 * Airport was added to favourites.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableAirportFavouritedEvent.class)
@JsonDeserialize(as = ImmutableAirportFavouritedEvent.class)
public interface AirportFavouritedEvent extends FavouriteEvent {
    String getIcaoCode();

    Optional<String> getName();

    Optional<Double> getLatitude();

    Optional<Double> getLongitude();

    @Override
    default EntityKey subject() {
        return EntityKey.of(EntityKind.AIRPORT, getIcaoCode());
    }

    @Override
    default boolean favourited() {
        return true;
    }

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableAirportFavouritedEvent.Builder {

    }
}
