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

import io.github.goodees.planecrazy.aggregate.CommentAggregate;
import io.github.goodees.planecrazy.command.CommentCommand;
import io.github.goodees.planecrazy.core.aggregate.FullScanStreamLoader;
import io.github.goodees.planecrazy.core.command.AggregateCommandHandler;
import io.github.goodees.planecrazy.core.dispatch.EventDispatcher;
import io.github.goodees.planecrazy.core.store.EventLog;
import io.github.goodees.planecrazy.core.store.EventStoreException;
import io.github.goodees.planecrazy.event.CommentEvent;
import io.github.goodees.planecrazy.projection.CommentProjection;

import java.util.function.Predicate;

/**
 * Common part of comment handlers: the substream is keyed by comment id, and the comments of the commented entity
 * are rebuilt afterwards.
 */
abstract class CommentCommandHandler<C extends CommentCommand>
        extends AggregateCommandHandler<C, CommentAggregate, CommentEvent> {

    private final CommentProjection projection;

    CommentCommandHandler(EventLog log, EventDispatcher dispatcher, CommentProjection projection) {
        super(new FullScanStreamLoader<>(log, CommentEvent.class), dispatcher);
        this.projection = projection;
    }

    @Override
    protected CommentAggregate newAggregate(C command) {
        return new CommentAggregate(command.getCommentId());
    }

    @Override
    protected Predicate<? super CommentEvent> substream(C command) {
        return CommentAggregate.streamOf(command.getCommentId());
    }

    @Override
    protected void refresh(C command, CommentAggregate aggregate) throws EventStoreException {
        projection.rebuildForEntity(aggregate.getEntityType(), aggregate.getEntityId());
    }
}
