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

/**
 * Durable, append-only store of events. Appends are atomic and serialized: the persisted order matches the order
 * in which calls were issued, and no two appends interleave.
 */
public interface EventStore {
    /**
     * Persist single event.
     * @param event event to store
     * @throws EventStoreException when store failed. Nothing is recorded in such case.
     */
    void persist(Event event) throws EventStoreException;

    /**
     * Persist multiple events in order. No other append interleaves with them; each event is still durable on its
     * own, so a failure leaves the events before the failing one stored.
     * @param events events to store
     * @throws EventStoreException when store failed
     */
    void persist(Event... events) throws EventStoreException;

    /**
     * Persist multiple events in order.
     * @param events events to store
     * @throws EventStoreException when store failed
     * @see #persist(Event...)
     */
    void persist(Iterable<? extends Event> events) throws EventStoreException;
}
