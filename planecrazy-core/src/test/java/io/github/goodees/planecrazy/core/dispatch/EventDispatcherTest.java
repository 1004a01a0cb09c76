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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import io.github.goodees.planecrazy.core.CounterProjection;
import io.github.goodees.planecrazy.core.Event;
import io.github.goodees.planecrazy.core.MockEventStore;
import io.github.goodees.planecrazy.core.SampleEvent;
import io.github.goodees.planecrazy.core.projection.AbstractProjection;
import io.github.goodees.planecrazy.core.store.EventStoreException;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class EventDispatcherTest {
    private final MockEventStore store = new MockEventStore();
    private final CounterProjection counters = new CounterProjection(store);
    private final FailingProjection failing = new FailingProjection();
    private final EventDispatcher dispatcher = new EventDispatcher(store);

    private final List<ILoggingEvent> warnings = new ArrayList<>();
    private AppenderBase<ILoggingEvent> appender;

    /**
     * Projection that blows up on negative values.
     */
    class FailingProjection extends AbstractProjection {
        int applied;

        FailingProjection() {
            super("Failing", store);
        }

        @Override
        protected boolean handle(Event event) {
            if (event instanceof SampleEvent && ((SampleEvent) event).getValue() < 0) {
                throw new IllegalStateException("Negative values are not supported");
            }
            applied++;
            return true;
        }

        @Override
        protected void clear() {
            applied = 0;
        }

        @Override
        protected void clearEntity(String entityType, String entityId) {
        }

        @Override
        protected boolean concerns(Event event, String entityType, String entityId) {
            return false;
        }
    }

    @Before
    public void setUp() {
        dispatcher.register(failing).register(counters);
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        appender = new AppenderBase<ILoggingEvent>() {
            @Override
            protected void append(ILoggingEvent event) {
                if (event.getLevel().isGreaterOrEqual(Level.WARN)) {
                    warnings.add(event);
                }
            }
        };
        appender.start();
        ctx.getLogger(EventDispatcher.class).addAppender(appender);
    }

    @After
    public void tearDown() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger(EventDispatcher.class).detachAppender(appender);
    }

    @Test
    public void event_is_stored_and_applied_to_all_projections() {
        DispatchResult result = dispatcher.dispatch(SampleEvent.of("a", 3));

        assertTrue(result.isSuccessful());
        assertTrue(result.isStored());
        assertEquals(2, result.getProjectionsUpdated());
        assertEquals(1, store.size());
        assertEquals(3, counters.total("a"));
        assertEquals(1, failing.applied);
    }

    @Test
    public void failing_projection_does_not_affect_others_nor_the_store() {
        DispatchResult result = dispatcher.dispatch(SampleEvent.of("a", -1));

        assertTrue(result.isStored());
        assertFalse(result.isSuccessful());
        assertEquals(1, result.getProjectionsFailed());
        assertEquals(1, result.getProjectionsUpdated());
        ProjectionUpdateResult failure = result.getFailedProjections().get(0);
        assertEquals("Failing", failure.getProjectionName());
        assertThat(failure.getError().get(), containsString("Negative values"));
        assertEquals(-1, counters.total("a"));
        assertEquals(1, store.size());
        assertThat(warnings, hasSize(1));
    }

    @Test
    public void store_failure_touches_no_projection() {
        store.throwExceptionOnce(MockEventStore.diskFull());

        DispatchResult result = dispatcher.dispatch(SampleEvent.of("a", 3));

        assertFalse(result.isStored());
        assertFalse(result.isSuccessful());
        assertTrue(result.getStoreFailure().isPresent());
        assertTrue(result.getProjectionResults().isEmpty());
        assertEquals(0, counters.total("a"));
        assertEquals(0, failing.applied);
        assertEquals(0, store.size());
        assertTrue(warnings.stream().anyMatch(e -> e.getLevel() == Level.ERROR));
    }

    @Test
    public void batch_continues_after_projection_failure() {
        BatchDispatchResult result = dispatcher.dispatchBatch(Arrays.asList(
                SampleEvent.of("a", 1), SampleEvent.of("a", -1), SampleEvent.of("a", 5)));

        assertEquals(3, result.getTotalEvents());
        assertEquals(3, result.getDispatchedEvents());
        assertEquals(2, result.getSuccessfulEvents());
        assertEquals(1, result.getFailedEvents());
        assertFalse(result.isHalted());
        assertFalse(result.isAllSuccessful());
        assertEquals(3, store.size());
        assertEquals(5, counters.total("a"));
    }

    @Test
    public void batch_halts_at_store_failure() {
        store.throwExceptionAfter(1, MockEventStore.diskFull());

        BatchDispatchResult result = dispatcher.dispatchBatch(Arrays.asList(
                SampleEvent.of("a", 1), SampleEvent.of("a", 2), SampleEvent.of("a", 3)));

        assertTrue(result.isHalted());
        assertEquals(2, result.getDispatchedEvents());
        assertEquals(1, result.getSuccessfulEvents());
        assertEquals(EventStoreException.Fault.IO_ERROR, result.getStoreFailure().get().getFault());
        assertEquals(1, store.size());
        assertEquals(1, counters.total("a"));
    }

    @Test
    public void projections_are_listed_in_registration_order() {
        assertEquals("Failing", dispatcher.getProjections().get(0).getName());
        assertEquals("Counters", dispatcher.getProjections().get(1).getName());
    }
}
