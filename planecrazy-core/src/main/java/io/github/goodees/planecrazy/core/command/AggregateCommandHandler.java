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
import io.github.goodees.planecrazy.core.aggregate.AggregateRoot;
import io.github.goodees.planecrazy.core.aggregate.EventStreamLoader;
import io.github.goodees.planecrazy.core.aggregate.InvalidStateException;
import io.github.goodees.planecrazy.core.dispatch.BatchDispatchResult;
import io.github.goodees.planecrazy.core.dispatch.EventDispatcher;
import io.github.goodees.planecrazy.core.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Round trip of a command against an aggregate. Every command goes through the same steps:
 * <ol>
 *     <li>validate the payload, invalid commands touch nothing</li>
 *     <li>load the substream of the aggregate instance</li>
 *     <li>create fresh aggregate and replay the substream</li>
 *     <li>execute the command, a violated precondition rejects the command and nothing is stored</li>
 *     <li>dispatch uncommitted events, store failure is thrown</li>
 *     <li>mark events committed</li>
 *     <li>refresh the read model owned by the aggregate type</li>
 * </ol>
 *
 * @param <C> type of command
 * @param <A> type of aggregate
 * @param <E> base type of events of the aggregate
 */
public abstract class AggregateCommandHandler<C extends Command, A extends AggregateRoot<E>, E extends Event>
        implements CommandHandler<C> {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final EventStreamLoader<E> streamLoader;
    private final EventDispatcher dispatcher;

    protected AggregateCommandHandler(EventStreamLoader<E> streamLoader, EventDispatcher dispatcher) {
        this.streamLoader = streamLoader;
        this.dispatcher = dispatcher;
    }

    @Override
    public final CommandResult handle(C command) throws EventStoreException {
        ValidationResult validation = command.validate();
        if (!validation.isValid()) {
            logger.warn("Invalid {} {}: {}", commandName(command), command.getCommandId(),
                    validation.getErrorMessage());
            return CommandResult.invalid(command, validation);
        }

        A aggregate = newAggregate(command);
        aggregate.loadFromHistory(streamLoader.loadStream(substream(command)));

        try {
            execute(aggregate, command);
        } catch (InvalidStateException e) {
            logger.warn("Rejected {} {} on {}: {}", commandName(command), command.getCommandId(), aggregate.getId(),
                    e.getMessage());
            return CommandResult.rejected(command, e.getMessage());
        }

        List<E> events = aggregate.getUncommittedEvents();
        BatchDispatchResult dispatch = dispatcher.dispatchBatch(events);
        Optional<EventStoreException> storeFailure = dispatch.getStoreFailure();
        if (storeFailure.isPresent()) {
            logger.error("Storing events of {} {} on {} failed", commandName(command), command.getCommandId(),
                    aggregate.getId());
            throw storeFailure.get();
        }
        aggregate.markEventsAsCommitted();

        try {
            refresh(command, aggregate);
        } catch (EventStoreException e) {
            // events are stored, read model catches up on next rebuild
            logger.warn("Refreshing read model after {} {} failed", commandName(command), command.getCommandId(), e);
        }
        logger.debug("Accepted {} {} on {}, version {}", commandName(command), command.getCommandId(),
                aggregate.getId(), aggregate.getVersion());
        return CommandResult.accepted(command, events, dispatch.getResults());
    }

    private static String commandName(Command command) {
        return command.getClass().getSimpleName();
    }

    /**
     * Create empty aggregate for the command.
     * @param command the command
     * @return new aggregate instance
     */
    protected abstract A newAggregate(C command);

    /**
     * Selection predicate of the events of the aggregate instance.
     * @param command the command
     * @return predicate matching the substream
     */
    protected abstract Predicate<? super E> substream(C command);

    /**
     * Invoke command method of the aggregate.
     * @param aggregate aggregate with replayed history
     * @param command the command
     * @throws InvalidStateException when precondition doesn't hold
     */
    protected abstract void execute(A aggregate, C command);

    /**
     * Bring the read model of the aggregate up to date.
     * @param command the command just handled
     * @param aggregate the aggregate after the command
     * @throws EventStoreException when log cannot be read
     */
    protected abstract void refresh(C command, A aggregate) throws EventStoreException;
}
