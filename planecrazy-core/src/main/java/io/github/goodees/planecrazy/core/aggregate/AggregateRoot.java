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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Transient object reconstructing the state of one entity from its event substream, and gatekeeping new changes.
 *
 * <p>An aggregate is created fresh for every command. It first {@linkplain #loadFromHistory(Iterable) replays} the
 * history, then a command method checks its precondition, and if it holds, {@linkplain #raise(Event) raises} exactly
 * one new event. Both replayed and raised events go through the same {@link #updateState(Event)} transition, so
 * replaying the same history always yields the same state.</p>
 *
 * @param <E> the base type of events this aggregate consumes
 */
public abstract class AggregateRoot<E extends Event> {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final String id;
    private long version;
    private final List<E> uncommittedEvents = new ArrayList<>();

    protected AggregateRoot(String id) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Aggregate id must be specified");
        }
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Count of events applied to this instance, historical as well as new ones.
     * @return the version
     */
    public long getVersion() {
        return version;
    }

    /**
     * Apply historical events. Business rules are not checked, history is a fact. Events are not recorded as
     * uncommitted. May be called multiple times, the effect is the same as a single call with concatenated history.
     * @param history events in the order they occurred
     */
    public void loadFromHistory(Iterable<? extends E> history) {
        for (E event : history) {
            applyEvent(event);
        }
        logger.trace("Aggregate {} loaded history up to version {}", id, version);
    }

    public List<E> getUncommittedEvents() {
        return Collections.unmodifiableList(new ArrayList<>(uncommittedEvents));
    }

    public boolean hasUncommittedEvents() {
        return !uncommittedEvents.isEmpty();
    }

    /**
     * Forget uncommitted events, after they were persisted.
     */
    public void markEventsAsCommitted() {
        uncommittedEvents.clear();
    }

    /**
     * Apply new event and record it as uncommitted. To be called by command methods after their precondition holds.
     * @param event the new event
     */
    protected void raise(E event) {
        applyEvent(event);
        uncommittedEvents.add(event);
    }

    private void applyEvent(E event) {
        updateState(event);
        version++;
    }

    /**
     * State transition function. Must be deterministic and must not check business rules.
     * @param event event to apply
     */
    protected abstract void updateState(E event);

    protected InvalidStateException invalidState(String message) {
        return new InvalidStateException(id, message);
    }
}
