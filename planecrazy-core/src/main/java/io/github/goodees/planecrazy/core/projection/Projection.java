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
import io.github.goodees.planecrazy.core.store.EventStoreException;

/**
 * Read model built by folding events. Its state must be reproducible by replaying the log from empty state.
 */
public interface Projection {
    /**
     * Name used in dispatch results and logs.
     * @return name of the projection
     */
    String getName();

    /**
     * Apply single event. An event already folded since the last rebuild is not applied again.
     * @param event the event
     * @return true if the event was recognized and applied, false if this projection doesn't handle its type or
     *         already folded it. No state changes in either case.
     */
    boolean applyEvent(Event event);

    /**
     * Clear the state and replay entire history. Calling it twice over unchanged log yields the same state.
     * @throws EventStoreException if log cannot be read, the state is left untouched then
     */
    void rebuild() throws EventStoreException;

    /**
     * Clear and replay the state of a single entity.
     * @param entityType the type of entity, e. g. Aircraft
     * @param entityId the id of entity
     * @throws EventStoreException if log cannot be read, the state is left untouched then
     */
    void rebuildForEntity(String entityType, String entityId) throws EventStoreException;
}
