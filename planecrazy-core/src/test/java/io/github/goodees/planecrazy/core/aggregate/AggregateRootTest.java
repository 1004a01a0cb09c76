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

import io.github.goodees.planecrazy.core.Counter;
import io.github.goodees.planecrazy.core.SampleEvent;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class AggregateRootTest {
    private final List<SampleEvent> history = Arrays.asList(
            SampleEvent.of("c", 5), SampleEvent.of("c", -2), SampleEvent.of("c", 4));

    @Test
    public void replay_of_same_history_yields_same_state() {
        Counter first = new Counter("c");
        first.loadFromHistory(history);
        Counter second = new Counter("c");
        second.loadFromHistory(history);

        assertEquals(7, first.getValue());
        assertEquals(first.getValue(), second.getValue());
        assertEquals(3, first.getVersion());
    }

    @Test
    public void history_loaded_in_chunks_equals_history_loaded_at_once() {
        Counter chunked = new Counter("c");
        chunked.loadFromHistory(history.subList(0, 1));
        chunked.loadFromHistory(history.subList(1, 3));

        Counter whole = new Counter("c");
        whole.loadFromHistory(history);

        assertEquals(whole.getValue(), chunked.getValue());
        assertEquals(whole.getVersion(), chunked.getVersion());
    }

    @Test
    public void replayed_events_are_not_uncommitted() {
        Counter counter = new Counter("c");
        counter.loadFromHistory(history);
        assertFalse(counter.hasUncommittedEvents());
    }

    @Test
    public void raised_event_is_applied_and_uncommitted_until_marked() {
        Counter counter = new Counter("c");
        counter.loadFromHistory(history);

        counter.adjust(3);

        assertEquals(10, counter.getValue());
        assertEquals(4, counter.getVersion());
        assertThat(counter.getUncommittedEvents(), hasSize(1));
        assertEquals(3, counter.getUncommittedEvents().get(0).getValue());

        counter.markEventsAsCommitted();
        assertThat(counter.getUncommittedEvents(), empty());
        assertEquals(4, counter.getVersion());
    }

    @Test
    public void violated_precondition_raises_nothing() {
        Counter counter = new Counter("c");
        try {
            counter.adjust(-1);
            fail("Counter should not go below zero");
        } catch (InvalidStateException e) {
            assertEquals("c", e.getAggregateId());
            assertEquals("Counter cannot go below zero.", e.getMessage());
        }
        assertFalse(counter.hasUncommittedEvents());
        assertEquals(0, counter.getVersion());
    }

    @Test
    public void history_is_not_validated() {
        Counter counter = new Counter("c");
        counter.loadFromHistory(Arrays.asList(SampleEvent.of("c", -5)));
        assertEquals(-5, counter.getValue());
    }

    @Test(expected = IllegalArgumentException.class)
    public void aggregate_requires_id() {
        new Counter("");
    }

    @Test
    public void uncommitted_events_cannot_be_modified_by_caller() {
        Counter counter = new Counter("c");
        counter.adjust(1);
        try {
            counter.getUncommittedEvents().clear();
            fail("List of uncommitted events should be read only");
        } catch (UnsupportedOperationException e) {
            assertTrue(counter.hasUncommittedEvents());
        }
    }
}
