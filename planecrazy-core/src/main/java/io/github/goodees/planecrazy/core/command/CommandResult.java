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

import io.github.goodees.planecrazy.core.Event;
import io.github.goodees.planecrazy.core.dispatch.DispatchResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of handling a command. Invalid and rejected commands are expected outcomes and are reported here rather
 * than thrown. Store failures are thrown as {@link io.github.goodees.planecrazy.core.store.EventStoreException}.
 */
public final class CommandResult {
    public enum Status {
        /**
         * Events were stored.
         */
        ACCEPTED,
        /**
         * Payload was malformed, nothing was touched.
         */
        INVALID,
        /**
         * Command was not allowed in current state, nothing was stored.
         */
        REJECTED
    }

    private final Status status;
    private final String commandId;
    private final String aggregateId;
    private final List<String> messages;
    private final List<Event> events;
    private final List<DispatchResult> dispatchResults;

    private CommandResult(Status status, Command command, List<String> messages, List<? extends Event> events,
                          List<DispatchResult> dispatchResults) {
        this.status = status;
        this.commandId = command.getCommandId();
        this.aggregateId = command.aggregateId();
        this.messages = Collections.unmodifiableList(new ArrayList<>(messages));
        this.events = Collections.unmodifiableList(new ArrayList<>(events));
        this.dispatchResults = Collections.unmodifiableList(new ArrayList<>(dispatchResults));
    }

    public static CommandResult accepted(Command command, List<? extends Event> events,
                                         List<DispatchResult> dispatchResults) {
        return new CommandResult(Status.ACCEPTED, command, Collections.emptyList(), events, dispatchResults);
    }

    public static CommandResult invalid(Command command, ValidationResult validation) {
        return new CommandResult(Status.INVALID, command, validation.getErrors(), Collections.emptyList(),
                Collections.emptyList());
    }

    public static CommandResult rejected(Command command, String reason) {
        return new CommandResult(Status.REJECTED, command, Collections.singletonList(reason), Collections.emptyList(),
                Collections.emptyList());
    }

    public Status getStatus() {
        return status;
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }

    public String getCommandId() {
        return commandId;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public List<String> getMessages() {
        return messages;
    }

    public String getMessage() {
        return String.join("; ", messages);
    }

    public List<Event> getEvents() {
        return events;
    }

    public List<DispatchResult> getDispatchResults() {
        return dispatchResults;
    }

    /**
     * Whether all projections took the events. False for accepted commands whose events are stored but some
     * projection failed on them.
     * @return true if every dispatch was successful
     */
    public boolean isFullyProjected() {
        return dispatchResults.stream().allMatch(DispatchResult::isSuccessful);
    }

    @Override
    public String toString() {
        return "CommandResult[" + status + ", command=" + commandId + ", aggregate=" + aggregateId
                + (messages.isEmpty() ? "" : ", messages=" + messages) + ", events=" + events.size() + "]";
    }
}
