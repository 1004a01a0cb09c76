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
import io.github.goodees.planecrazy.core.store.EventStoreException;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static java.util.stream.Collectors.toList;

/**
 * Outcome of dispatching one event. The event is durably stored whenever {@link #isStored()} holds, even if some
 * projections failed; those can be recovered by rebuilding them.
 */
public final class DispatchResult {
    private final Event event;
    private final EventStoreException storeFailure;
    private final List<ProjectionUpdateResult> projectionResults;
    private final long storeWriteTimeMs;
    private final long totalTimeMs;

    private DispatchResult(Event event, EventStoreException storeFailure, List<ProjectionUpdateResult> projectionResults,
                           long storeWriteTimeMs, long totalTimeMs) {
        this.event = event;
        this.storeFailure = storeFailure;
        this.projectionResults = Collections.unmodifiableList(projectionResults);
        this.storeWriteTimeMs = storeWriteTimeMs;
        this.totalTimeMs = totalTimeMs;
    }

    static DispatchResult storeFailed(Event event, EventStoreException failure, long storeWriteTimeMs) {
        return new DispatchResult(event, failure, Collections.emptyList(), storeWriteTimeMs, storeWriteTimeMs);
    }

    static DispatchResult dispatched(Event event, List<ProjectionUpdateResult> projectionResults, long storeWriteTimeMs,
                                     long totalTimeMs) {
        return new DispatchResult(event, null, projectionResults, storeWriteTimeMs, totalTimeMs);
    }

    public Event getEvent() {
        return event;
    }

    public String getEventId() {
        return event.getId();
    }

    public String getEventType() {
        return event.getType();
    }

    /**
     * Successful only if event was stored and every projection applied it without failure.
     * @return true on complete success
     */
    public boolean isSuccessful() {
        return isStored() && projectionResults.stream().allMatch(ProjectionUpdateResult::isSuccess);
    }

    public boolean isStored() {
        return storeFailure == null;
    }

    public Optional<EventStoreException> getStoreFailure() {
        return Optional.ofNullable(storeFailure);
    }

    public List<ProjectionUpdateResult> getProjectionResults() {
        return projectionResults;
    }

    public List<ProjectionUpdateResult> getFailedProjections() {
        return projectionResults.stream().filter(r -> !r.isSuccess()).collect(toList());
    }

    /**
     * Count of projections that recognized and applied the event.
     * @return the count
     */
    public int getProjectionsUpdated() {
        return (int) projectionResults.stream().filter(r -> r.isSuccess() && r.isEventHandled()).count();
    }

    public int getProjectionsFailed() {
        return getFailedProjections().size();
    }

    public long getStoreWriteTimeMs() {
        return storeWriteTimeMs;
    }

    public long getTotalTimeMs() {
        return totalTimeMs;
    }

    @Override
    public String toString() {
        return "DispatchResult[event=" + event.getId() + ", type=" + event.getType() + ", stored=" + isStored()
                + ", projectionsUpdated=" + getProjectionsUpdated() + ", projectionsFailed=" + getProjectionsFailed()
                + ", totalTimeMs=" + totalTimeMs + "]";
    }
}
