package io.github.goodees.planecrazy.core.dispatch;

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
import io.github.goodees.planecrazy.core.projection.Projection;
import io.github.goodees.planecrazy.core.store.EventStore;
import io.github.goodees.planecrazy.core.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Stores events and feeds them to every registered projection.
 *
 * <p>Dispatch of an event first persists it. When that fails, no projection is touched and the failure is reported in
 * the result. Otherwise every projection applies the event; a failing projection is recorded and doesn't stop the
 * others, nor does it undo the store write. The log stays authoritative and failed projections catch up on
 * {@link Projection#rebuild()}.</p>
 *
 * <p>Dispatches are serialized, so each event is fully applied to all projections before the next one is stored.</p>
 */
public class EventDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(EventDispatcher.class);

    private final EventStore store;
    private final List<Projection> projections = new CopyOnWriteArrayList<>();
    private final ReentrantLock dispatchLock = new ReentrantLock(true);

    public EventDispatcher(EventStore store) {
        this.store = store;
    }

    public EventDispatcher register(Projection projection) {
        projections.add(projection);
        logger.debug("Registered projection {}", projection.getName());
        return this;
    }

    public List<Projection> getProjections() {
        return Collections.unmodifiableList(new ArrayList<>(projections));
    }

    /**
     * Store the event and apply it to all projections.
     * @param event event to dispatch
     * @return the result, never throws for store or projection failures
     */
    public DispatchResult dispatch(Event event) {
        dispatchLock.lock();
        try {
            long start = System.nanoTime();
            try {
                store.persist(event);
            } catch (EventStoreException e) {
                logger.error("Event {} of type {} could not be stored, projections are not updated", event.getId(),
                        event.getType(), e);
                return DispatchResult.storeFailed(event, e, elapsedMs(start));
            }
            long storeWriteTime = elapsedMs(start);
            List<ProjectionUpdateResult> results = new ArrayList<>(projections.size());
            for (Projection projection : projections) {
                results.add(apply(projection, event));
            }
            DispatchResult result = DispatchResult.dispatched(event, results, storeWriteTime, elapsedMs(start));
            logger.debug("Dispatched {}", result);
            return result;
        } finally {
            dispatchLock.unlock();
        }
    }

    /**
     * Dispatch events in order. Stops at first store failure, projection failures don't stop the batch.
     * @param events events to dispatch
     * @return the result of the batch
     */
    public BatchDispatchResult dispatchBatch(List<? extends Event> events) {
        dispatchLock.lock();
        try {
            List<DispatchResult> results = new ArrayList<>(events.size());
            for (Event event : events) {
                DispatchResult result = dispatch(event);
                results.add(result);
                if (!result.isStored()) {
                    logger.warn("Batch dispatch halted after {} of {} events", results.size(), events.size());
                    break;
                }
            }
            return new BatchDispatchResult(events.size(), results);
        } finally {
            dispatchLock.unlock();
        }
    }

    private ProjectionUpdateResult apply(Projection projection, Event event) {
        long start = System.nanoTime();
        try {
            boolean handled = projection.applyEvent(event);
            return ProjectionUpdateResult.applied(projection.getName(), handled, elapsedMs(start));
        } catch (RuntimeException e) {
            logger.warn("Projection {} failed to apply event {} of type {}", projection.getName(), event.getId(),
                    event.getType(), e);
            return ProjectionUpdateResult.failed(projection.getName(), e, elapsedMs(start));
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
