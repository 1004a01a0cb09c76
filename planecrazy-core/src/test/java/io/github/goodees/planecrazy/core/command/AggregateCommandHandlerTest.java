package io.github.goodees.planecrazy.core.command;

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

import io.github.goodees.planecrazy.core.AdjustCounter;
import io.github.goodees.planecrazy.core.CounterHandler;
import io.github.goodees.planecrazy.core.CounterProjection;
import io.github.goodees.planecrazy.core.MockEventStore;
import io.github.goodees.planecrazy.core.SampleEvent;
import io.github.goodees.planecrazy.core.dispatch.EventDispatcher;
import io.github.goodees.planecrazy.core.store.EventStoreException;
import org.junit.Test;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class AggregateCommandHandlerTest {
    private final MockEventStore store = new MockEventStore();
    private final CounterProjection projection = new CounterProjection(store);
    private final EventDispatcher dispatcher = new EventDispatcher(store).register(projection);
    private final CounterHandler handler = new CounterHandler(store, dispatcher, projection);

    @Test
    public void accepted_command_stores_its_event() throws EventStoreException {
        CommandResult result = handler.handle(AdjustCounter.of("a", 2));

        assertEquals(CommandResult.Status.ACCEPTED, result.getStatus());
        assertThat(result.getEvents(), hasSize(1));
        assertTrue(result.isFullyProjected());
        assertEquals("a", result.getAggregateId());
        assertEquals(1, store.size());
        assertEquals(2, projection.total("a"));
        assertEquals(1, handler.getRefreshes());
    }

    @Test
    public void history_of_the_aggregate_is_replayed() throws EventStoreException {
        handler.handle(AdjustCounter.of("a", 2));
        handler.handle(AdjustCounter.of("b", 5));

        CommandResult result = handler.handle(AdjustCounter.of("a", -2));
        assertTrue(result.isAccepted());

        CommandResult rejected = handler.handle(AdjustCounter.of("a", -1));
        assertEquals(CommandResult.Status.REJECTED, rejected.getStatus());
        assertEquals("Counter cannot go below zero.", rejected.getMessage());
        assertEquals(3, store.size());
    }

    @Test
    public void invalid_command_touches_nothing() throws EventStoreException {
        CommandResult result = handler.handle(AdjustCounter.of(" ", 0));

        assertEquals(CommandResult.Status.INVALID, result.getStatus());
        assertThat(result.getMessages(), contains("Counter is required.", "Delta must not be zero."));
        assertEquals(0, store.size());
        assertEquals(0, handler.getRefreshes());
    }

    @Test
    public void store_failure_is_thrown_and_nothing_is_projected() {
        store.throwExceptionOnce(MockEventStore.diskFull());
        try {
            handler.handle(AdjustCounter.of("a", 2));
            fail("Store failure should be thrown");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.IO_ERROR, e.getFault());
        }
        assertEquals(0, store.size());
        assertEquals(0, projection.total("a"));
        assertEquals(0, handler.getRefreshes());
    }

    @Test
    public void refresh_repairs_drifted_projection() throws EventStoreException {
        handler.handle(AdjustCounter.of("a", 2));
        projection.applyEvent(SampleEvent.of("a", 40));

        handler.handle(AdjustCounter.of("a", 1));

        assertEquals(3, projection.total("a"));
    }
}
