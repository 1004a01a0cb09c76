package io.github.goodees.planecrazy.core.projection;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import static java.util.stream.Collectors.toList;

/**
 * Base of in-memory projections. The state is owned by the subclass and guarded by a read-write lock: events and
 * rebuilds are applied under the write lock, queries should run through {@link #query(Supplier)}.
 *
 * <p>Rebuild reads the log while holding the write lock, so no event dispatched in the meantime is lost. Ids of
 * folded events are remembered until the next full rebuild: an event stored before a rebuild read the log and
 * delivered after it is not folded a second time.</p>
 */
public abstract class AbstractProjection implements Projection {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final String name;
    private final EventLog log;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Set<String> folded = new HashSet<>();

    protected AbstractProjection(String name, EventLog log) {
        this.name = name;
        this.log = log;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public final boolean applyEvent(Event event) {
        lock.writeLock().lock();
        try {
            if (!folded.add(event.getId())) {
                logger.debug("Projection {} already folded event {}, ignoring it", name, event.getId());
                return false;
            }
            return handle(event);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void rebuild() throws EventStoreException {
        lock.writeLock().lock();
        try {
            List<Event> history;
            try (EventLog.StoredEvents<Event> events = log.readAll()) {
                history = events.toList();
            }
            clear();
            folded.clear();
            int handled = replay(history);
            logger.info("Projection {} rebuilt from {} events, {} handled", name, history.size(), handled);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void rebuildForEntity(String entityType, String entityId) throws EventStoreException {
        lock.writeLock().lock();
        try {
            List<Event> history;
            try (EventLog.StoredEvents<Event> events = log.readAll()) {
                history = events.toList().stream().filter(e -> concerns(e, entityType, entityId)).collect(toList());
            }
            clearEntity(entityType, entityId);
            history.forEach(e -> folded.remove(e.getId()));
            int handled = replay(history);
            logger.debug("Projection {} rebuilt {} {} from {} events", name, entityType, entityId, handled);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private int replay(List<Event> history) {
        int handled = 0;
        for (Event event : history) {
            if (folded.add(event.getId()) && handle(event)) {
                handled++;
            }
        }
        return handled;
    }

    /**
     * Run a query under the read lock.
     * @param query the query, must not modify the state
     * @param <T> type of result
     * @return query result
     */
    protected <T> T query(Supplier<T> query) {
        lock.readLock().lock();
        try {
            return query.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Fold single event into the state. Called under write lock.
     * @param event the event
     * @return whether the event was recognized
     */
    protected abstract boolean handle(Event event);

    /**
     * Remove all state. Called under write lock.
     */
    protected abstract void clear();

    /**
     * Remove the state of single entity. Called under write lock.
     * @param entityType type of entity
     * @param entityId id of entity
     */
    protected abstract void clearEntity(String entityType, String entityId);

    /**
     * Whether event belongs to history of an entity.
     * @param event the event
     * @param entityType type of entity
     * @param entityId id of entity
     * @return true if event affects the entity
     */
    protected abstract boolean concerns(Event event, String entityType, String entityId);
}
