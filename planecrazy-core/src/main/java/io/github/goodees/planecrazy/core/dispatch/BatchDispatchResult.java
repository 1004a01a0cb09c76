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

import io.github.goodees.planecrazy.core.store.EventStoreException;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of dispatching a sequence of events. Dispatch stops at the first store failure, events after it are
 * neither stored nor counted as dispatched.
 */
public final class BatchDispatchResult {
    private final int totalEvents;
    private final List<DispatchResult> results;

    BatchDispatchResult(int totalEvents, List<DispatchResult> results) {
        this.totalEvents = totalEvents;
        this.results = Collections.unmodifiableList(results);
    }

    public int getTotalEvents() {
        return totalEvents;
    }

    public List<DispatchResult> getResults() {
        return results;
    }

    public int getDispatchedEvents() {
        return results.size();
    }

    public int getSuccessfulEvents() {
        return (int) results.stream().filter(DispatchResult::isSuccessful).count();
    }

    /**
     * Events that failed in any way, including those not dispatched because of a store failure.
     * @return the count
     */
    public int getFailedEvents() {
        return totalEvents - getSuccessfulEvents();
    }

    public double getSuccessRate() {
        return totalEvents == 0 ? 1.0 : (double) getSuccessfulEvents() / totalEvents;
    }

    public boolean isAllSuccessful() {
        return getSuccessfulEvents() == totalEvents;
    }

    public boolean isHalted() {
        return getStoreFailure().isPresent();
    }

    public Optional<EventStoreException> getStoreFailure() {
        return results.isEmpty() ? Optional.empty() : results.get(results.size() - 1).getStoreFailure();
    }

    @Override
    public String toString() {
        return "BatchDispatchResult[total=" + totalEvents + ", dispatched=" + getDispatchedEvents()
                + ", successful=" + getSuccessfulEvents() + ", halted=" + isHalted() + "]";
    }
}
