package io.github.goodees.planecrazy.core.aggregate;

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
import io.github.goodees.planecrazy.core.store.EventStoreException;

import java.util.List;
import java.util.function.Predicate;

/**
 * Loads the substream of history relevant to one aggregate instance. Separated from the aggregates so that
 * an indexed implementation may replace the full scan.
 *
 * @param <E> base type of events of the aggregate
 */
@FunctionalInterface
public interface EventStreamLoader<E extends Event> {
    /**
     * Load matching events.
     * @param selector selection predicate of the aggregate instance
     * @return matching events in the order they occurred
     * @throws EventStoreException if log cannot be read
     */
    List<E> loadStream(Predicate<? super E> selector) throws EventStoreException;
}
