package io.github.goodees.planecrazy.core;

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

import java.time.Instant;

/**
 * Immutable fact about something that happened in the business domain.
 *
 * <p>Events are the only unit of persisted truth. Once created they are never changed or removed; every other piece
 * of state (aggregates, read models) is derived by replaying them.</p>
 *
 * <p>The serialization format is not prescribed, but events may define annotations to support specific serialization
 * kinds, e. g. Jackson annotations. The actual serialization is the task of the EventStore and EventLog
 * implementations.</p>
 *
 * Support for events based on <a href="http://immutables.github.io">Immutables</a> is in package
 * {@link io.github.goodees.planecrazy.core.immutables}.
 */
public interface Event {
    /**
     * The type of event. It must uniquely identify the event class within an application, as it is the discriminator
     * stored next to the payload.
     * @return textual description of the type of event, uses class name by default, stripped from suffix Event
     */
    default String getType() {
        return EventType.defaultTypeName(getClass());
    }

    /**
     * Globally unique identity of this event.
     * @return the event id
     */
    String getId();

    /**
     * The time when an event occurred, in UTC. Replay folds events in non-decreasing order of this instant.
     * @return the instant of event creation
     */
    Instant getOccurredAt();
}
