package io.github.goodees.planecrazy.handler;

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

import io.github.goodees.planecrazy.aggregate.FavouriteAggregate;
import io.github.goodees.planecrazy.command.FavouriteAircraftCommand;
import io.github.goodees.planecrazy.command.FavouriteAircraftTypeCommand;
import io.github.goodees.planecrazy.command.FavouriteAirportCommand;
import io.github.goodees.planecrazy.command.FavouriteCommand;
import io.github.goodees.planecrazy.command.UnfavouriteAircraftCommand;
import io.github.goodees.planecrazy.command.UnfavouriteAircraftTypeCommand;
import io.github.goodees.planecrazy.command.UnfavouriteAirportCommand;
import io.github.goodees.planecrazy.core.aggregate.FullScanStreamLoader;
import io.github.goodees.planecrazy.core.command.AggregateCommandHandler;
import io.github.goodees.planecrazy.core.dispatch.EventDispatcher;
import io.github.goodees.planecrazy.core.store.EventLog;
import io.github.goodees.planecrazy.core.store.EventStoreException;
import io.github.goodees.planecrazy.event.EntityKey;
import io.github.goodees.planecrazy.event.FavouriteEvent;
import io.github.goodees.planecrazy.projection.FavouriteProjection;

import java.util.function.BiConsumer;
import java.util.function.Predicate;

/**
 * Handles favourite commands. The favourite aggregate of an entity is identified by the entity itself, so the
 * handlers differ only in the aggregate method they invoke.
 *
 * @param <C> type of command
 */
public class FavouriteCommandHandler<C extends FavouriteCommand>
        extends AggregateCommandHandler<C, FavouriteAggregate, FavouriteEvent> {

    private final BiConsumer<FavouriteAggregate, C> action;
    private final FavouriteProjection projection;

    public FavouriteCommandHandler(EventLog log, EventDispatcher dispatcher, FavouriteProjection projection,
                                   BiConsumer<FavouriteAggregate, C> action) {
        super(new FullScanStreamLoader<>(log, FavouriteEvent.class), dispatcher);
        this.projection = projection;
        this.action = action;
    }

    @Override
    protected FavouriteAggregate newAggregate(C command) {
        return new FavouriteAggregate(command.target());
    }

    @Override
    protected Predicate<? super FavouriteEvent> substream(C command) {
        return FavouriteAggregate.streamOf(command.target());
    }

    @Override
    protected void execute(FavouriteAggregate aggregate, C command) {
        action.accept(aggregate, command);
    }

    @Override
    protected void refresh(C command, FavouriteAggregate aggregate) throws EventStoreException {
        EntityKey target = aggregate.getTarget();
        projection.rebuildForEntity(target.getType(), target.getId());
    }

    public static FavouriteCommandHandler<FavouriteAircraftCommand> favouriteAircraft(
            EventLog log, EventDispatcher dispatcher, FavouriteProjection projection) {
        return new FavouriteCommandHandler<>(log, dispatcher, projection,
                (a, c) -> a.favouriteAircraft(c.getRegistration().orElse(null), c.getTypeCode().orElse(null)));
    }

    public static FavouriteCommandHandler<UnfavouriteAircraftCommand> unfavouriteAircraft(
            EventLog log, EventDispatcher dispatcher, FavouriteProjection projection) {
        return new FavouriteCommandHandler<>(log, dispatcher, projection, (a, c) -> a.unfavouriteAircraft());
    }

    public static FavouriteCommandHandler<FavouriteAircraftTypeCommand> favouriteType(
            EventLog log, EventDispatcher dispatcher, FavouriteProjection projection) {
        return new FavouriteCommandHandler<>(log, dispatcher, projection,
                (a, c) -> a.favouriteType(c.getTypeName().orElse(null)));
    }

    public static FavouriteCommandHandler<UnfavouriteAircraftTypeCommand> unfavouriteType(
            EventLog log, EventDispatcher dispatcher, FavouriteProjection projection) {
        return new FavouriteCommandHandler<>(log, dispatcher, projection, (a, c) -> a.unfavouriteType());
    }

    public static FavouriteCommandHandler<FavouriteAirportCommand> favouriteAirport(
            EventLog log, EventDispatcher dispatcher, FavouriteProjection projection) {
        return new FavouriteCommandHandler<>(log, dispatcher, projection,
                (a, c) -> a.favouriteAirport(c.getName().orElse(null), c.getLatitude().orElse(null),
                        c.getLongitude().orElse(null)));
    }

    public static FavouriteCommandHandler<UnfavouriteAirportCommand> unfavouriteAirport(
            EventLog log, EventDispatcher dispatcher, FavouriteProjection projection) {
        return new FavouriteCommandHandler<>(log, dispatcher, projection, (a, c) -> a.unfavouriteAirport());
    }
}
