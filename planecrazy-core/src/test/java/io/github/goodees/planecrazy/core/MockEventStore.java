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

import io.github.goodees.planecrazy.core.store.EventStoreException;
import io.github.goodees.planecrazy.core.store.inmemory.InMemoryEventStore;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

public class MockEventStore extends InMemoryEventStore {
    private final AtomicReference<EventStoreException> exception = new AtomicReference<>();
    private final AtomicInteger failAfter = new AtomicInteger(-1);

    @Override
    public void persist(Event event) throws EventStoreException {
        if (failAfter.getAndDecrement() == 0) {
            EventStoreException ex = exception.getAndSet(null);
            if (ex != null) {
                throw ex;
            }
        }
        super.persist(event);
    }

    public void throwExceptionOnce(EventStoreException ex) {
        throwExceptionAfter(0, ex);
    }

    /**
     * Fail the write following given number of successful writes.
     */
    public void throwExceptionAfter(int successfulWrites, EventStoreException ex) {
        exception.set(ex);
        failAfter.set(successfulWrites);
    }

    public static EventStoreException diskFull() {
        return EventStoreException.storeFailed("test", new java.io.IOException("No space left on device"));
    }
}
