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
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Read side of event store.
 *
 * <p>Events are always returned in non-decreasing order of {@link Event#getOccurredAt()}; events sharing the same
 * instant keep the order in which they were appended. Records that cannot be read are skipped and reported to
 * {@link EventLogDiagnostics}, unless the implementation is configured to be strict.</p>
 */
public interface EventLog {
    /**
     * Read entire history.
     * @return accessor for the events in order they appeared in history
     * @throws EventStoreException when the log itself cannot be accessed
     */
    StoredEvents<Event> readAll() throws EventStoreException;

    /**
     * Read the history matching a filter. Same semantics as {@link #readAll()}, with the filter applied afterwards.
     * @param filter the filter to apply
     * @return accessor for matching events in order they appeared in history
     * @throws EventStoreException when the log itself cannot be accessed
     */
    StoredEvents<Event> readFiltered(EventFilter filter) throws EventStoreException;

    /**
     * Accessor that enables single iteration over found events.
     * Only one of methods foreach, reduce and toList may be called on single instance, and only once.
     * Reads have no side effects, therefore stopping an iteration early is a safe way of cancelling it.
     */
    interface StoredEvents<E extends Event> extends AutoCloseable {
        /**
         * Iterate over all found events. Consumer may call {@link #stop()} to stop the iteration.
         * @param consumer consumer that will receive the events
         */
        void foreach(Consumer<? super E> consumer);

        /**
         * Perform a reduction over all found events. Reducer may call {@link #stop()} to stop the process.
         * @param initial Initial value for reduction
         * @param reducer the reducer function
         * @param <R> type of result
         * @return result of reduction.
         */
        <R> R reduce(R initial, BiFunction<R, ? super E, R> reducer);

        /**
         * Can be called from within the lambda functions to stop the iteration after current step.
         */
        void stop();

        default List<E> toList() {
            return reduce(new ArrayList<E>(), (list, e) -> {
                list.add(e);
                return list;
            });
        }

        // will not throw exception
        @Override
        void close();
    }
}
