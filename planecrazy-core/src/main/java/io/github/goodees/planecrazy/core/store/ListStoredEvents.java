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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Stored events materialized in a list.
 */
public class ListStoredEvents<E extends Event> implements EventLog.StoredEvents<E> {
    private final List<E> events;
    private volatile boolean stop = false;

    public ListStoredEvents(List<E> events) {
        this.events = events;
    }

    /**
     * Order events by occurrence. The sort is stable, events with same instant keep their relative order.
     * @param events events in order of insertion
     * @param <E> type of events
     * @return new list sorted by occurrence
     */
    public static <E extends Event> List<E> chronological(List<E> events) {
        List<E> result = new ArrayList<>(events);
        result.sort(Comparator.comparing(Event::getOccurredAt));
        return result;
    }

    @Override
    public void foreach(Consumer<? super E> consumer) {
        for (E event : events) {
            if (stop) {
                break;
            }
            consumer.accept(event);
        }
    }

    @Override
    public <R> R reduce(R initial, BiFunction<R, ? super E, R> reducer) {
        R result = initial;
        for (E event : events) {
            if (stop) {
                break;
            }
            result = reducer.apply(result, event);
        }
        return result;
    }

    @Override
    public void stop() {
        stop = true;
    }

    @Override
    public void close() {
    }
}
