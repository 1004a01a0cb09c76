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
import io.github.goodees.planecrazy.core.store.EventLog;
import io.github.goodees.planecrazy.core.store.EventStoreException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Reads entire log and filters it. Cost is linear to the size of the log for every load.
 */
public class FullScanStreamLoader<E extends Event> implements EventStreamLoader<E> {
    private final EventLog log;
    private final Class<E> eventClass;

    public FullScanStreamLoader(EventLog log, Class<E> eventClass) {
        this.log = log;
        this.eventClass = eventClass;
    }

    @Override
    public List<E> loadStream(Predicate<? super E> selector) throws EventStoreException {
        try (EventLog.StoredEvents<Event> events = log.readAll()) {
            return events.reduce(new ArrayList<E>(), (result, event) -> {
                if (eventClass.isInstance(event)) {
                    E candidate = eventClass.cast(event);
                    if (selector.test(candidate)) {
                        result.add(candidate);
                    }
                }
                return result;
            });
        }
    }
}
