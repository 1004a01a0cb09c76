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
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Summary of an event log: volume per type and time span.
 */
@Value.Immutable
@ImmutablesSupport
public interface EventStreamStatistics {
    long getTotalEvents();

    Map<String, Long> getEventCountsByType();

    Optional<Instant> getOldestEvent();

    Optional<Instant> getNewestEvent();

    /**
     * Most frequent type, ties resolved by alphabetical order.
     * @return the type, absent for empty log
     */
    @Value.Derived
    default Optional<String> getMostCommonType() {
        String best = null;
        long bestCount = 0;
        for (Map.Entry<String, Long> entry : getEventCountsByType().entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    static EventStreamStatistics of(Iterable<? extends Event> events) {
        Map<String, Long> counts = new TreeMap<>();
        long total = 0;
        Instant oldest = null;
        Instant newest = null;
        for (Event event : events) {
            total++;
            counts.merge(event.getType(), 1L, Long::sum);
            Instant at = event.getOccurredAt();
            if (oldest == null || at.isBefore(oldest)) {
                oldest = at;
            }
            if (newest == null || at.isAfter(newest)) {
                newest = at;
            }
        }
        return new Builder().totalEvents(total)
                .eventCountsByType(counts)
                .oldestEvent(Optional.ofNullable(oldest))
                .newestEvent(Optional.ofNullable(newest))
                .build();
    }

    static EventStreamStatistics of(EventLog log) throws EventStoreException {
        try (EventLog.StoredEvents<Event> events = log.readAll()) {
            return of(events.toList());
        }
    }

    class Builder extends ImmutableEventStreamStatistics.Builder {

    }
}
