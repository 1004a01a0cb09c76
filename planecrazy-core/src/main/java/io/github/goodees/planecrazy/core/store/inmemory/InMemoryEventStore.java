package io.github.goodees.planecrazy.core.store.inmemory;

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
import io.github.goodees.planecrazy.core.store.EventFilter;
import io.github.goodees.planecrazy.core.store.EventLog;
import io.github.goodees.planecrazy.core.store.EventStore;
import io.github.goodees.planecrazy.core.store.EventStoreException;
import io.github.goodees.planecrazy.core.store.ListStoredEvents;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.util.stream.Collectors.toList;

/**
 * Event store keeping the log in memory. Same ordering semantics as the durable stores, intended for tests and
 * embedding.
 */
public class InMemoryEventStore implements EventStore, EventLog {
    private final List<Event> storage = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void persist(Event event) throws EventStoreException {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        storage.add(event);
    }

    @Override
    public void persist(Event... events) throws EventStoreException {
        synchronized (storage) {
            for (Event event : events) {
                persist(event);
            }
        }
    }

    @Override
    public void persist(Iterable<? extends Event> events) throws EventStoreException {
        synchronized (storage) {
            for (Event event : events) {
                persist(event);
            }
        }
    }

    @Override
    public StoredEvents<Event> readAll() {
        return new ListStoredEvents<>(ListStoredEvents.chronological(snapshot()));
    }

    @Override
    public StoredEvents<Event> readFiltered(EventFilter filter) {
        List<Event> matching = snapshot().stream().filter(filter).collect(toList());
        return new ListStoredEvents<>(ListStoredEvents.chronological(matching));
    }

    public int size() {
        return storage.size();
    }

    private List<Event> snapshot() {
        //ad SynchronizedList - It is imperative that the user manually synchronize on the returned list when iterating over it.
        synchronized (storage) {
            return new ArrayList<>(storage);
        }
    }
}
