package io.github.goodees.planecrazy.core.store;

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
import io.github.goodees.planecrazy.core.immutables.ImmutablesSupport;
import org.immutables.value.Value;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Criteria of {@link EventLog#readFiltered(EventFilter)}. Absent criteria match everything, time bounds are inclusive.
 */
@Value.Immutable
@ImmutablesSupport
public interface EventFilter extends Predicate<Event> {
    Optional<String> getEventType();

    Optional<Instant> getFrom();

    Optional<Instant> getTo();

    @Override
    default boolean test(Event event) {
        if (getEventType().isPresent() && !getEventType().get().equals(event.getType())) {
            return false;
        }
        if (getFrom().isPresent() && event.getOccurredAt().isBefore(getFrom().get())) {
            return false;
        }
        return !getTo().isPresent() || !event.getOccurredAt().isAfter(getTo().get());
    }

    static EventFilter all() {
        return builder().build();
    }

    static EventFilter ofType(String eventType) {
        return builder().eventType(eventType).build();
    }

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableEventFilter.Builder {

    }
}
