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

import java.util.Optional;

/**
 * Outcome of applying one event to one projection.
 */
public final class ProjectionUpdateResult {
    private final String projectionName;
    private final boolean eventHandled;
    private final RuntimeException failure;
    private final long updateTimeMs;

    private ProjectionUpdateResult(String projectionName, boolean eventHandled, RuntimeException failure,
                                   long updateTimeMs) {
        this.projectionName = projectionName;
        this.eventHandled = eventHandled;
        this.failure = failure;
        this.updateTimeMs = updateTimeMs;
    }

    static ProjectionUpdateResult applied(String projectionName, boolean handled, long updateTimeMs) {
        return new ProjectionUpdateResult(projectionName, handled, null, updateTimeMs);
    }

    static ProjectionUpdateResult failed(String projectionName, RuntimeException failure, long updateTimeMs) {
        return new ProjectionUpdateResult(projectionName, false, failure, updateTimeMs);
    }

    public String getProjectionName() {
        return projectionName;
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * Whether the projection recognized the event.
     * @return false for failed updates, and for event types the projection doesn't handle
     */
    public boolean isEventHandled() {
        return eventHandled;
    }

    public Optional<RuntimeException> getFailure() {
        return Optional.ofNullable(failure);
    }

    public Optional<String> getError() {
        return getFailure().map(f -> f.getClass().getSimpleName() + ": " + f.getMessage());
    }

    public long getUpdateTimeMs() {
        return updateTimeMs;
    }

    @Override
    public String toString() {
        return "ProjectionUpdateResult[" + projectionName + ", success=" + isSuccess() + ", handled=" + eventHandled
                + getError().map(e -> ", error=" + e).orElse("") + "]";
    }
}
