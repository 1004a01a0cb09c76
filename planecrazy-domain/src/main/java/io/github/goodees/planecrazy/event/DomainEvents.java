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

import io.github.goodees.planecrazy.core.store.EventTypeRegistry;
import io.github.goodees.planecrazy.core.store.JacksonEventSerialization;

/**
 * Catalogue of persisted event types.
 */
public final class DomainEvents {
    private DomainEvents() {

    }

    public static EventTypeRegistry registry() {
        return EventTypeRegistry.builder()
                .registerAll(CommentAddedEvent.class, CommentEditedEvent.class, CommentDeletedEvent.class)
                .registerAll(AircraftFavouritedEvent.class, AircraftUnfavouritedEvent.class,
                        TypeFavouritedEvent.class, TypeUnfavouritedEvent.class,
                        AirportFavouritedEvent.class, AirportUnfavouritedEvent.class)
                .registerAll(AircraftFirstSeenEvent.class, AircraftPositionUpdatedEvent.class,
                        AircraftIdentityUpdatedEvent.class, AircraftLastSeenEvent.class)
                .build();
    }

    public static JacksonEventSerialization serialization() {
        return new JacksonEventSerialization(registry());
    }
}
