package io.github.goodees.planecrazy.runtime;

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

import io.github.goodees.planecrazy.command.AddCommentCommand;
import io.github.goodees.planecrazy.command.DeleteCommentCommand;
import io.github.goodees.planecrazy.command.EditCommentCommand;
import io.github.goodees.planecrazy.command.FavouriteAircraftCommand;
import io.github.goodees.planecrazy.command.FavouriteAircraftTypeCommand;
import io.github.goodees.planecrazy.command.FavouriteAirportCommand;
import io.github.goodees.planecrazy.command.UnfavouriteAircraftCommand;
import io.github.goodees.planecrazy.command.UnfavouriteAircraftTypeCommand;
import io.github.goodees.planecrazy.command.UnfavouriteAirportCommand;
import io.github.goodees.planecrazy.core.command.Command;
import io.github.goodees.planecrazy.core.command.CommandBus;
import io.github.goodees.planecrazy.core.command.CommandResult;
import io.github.goodees.planecrazy.core.command.CommandRouter;
import io.github.goodees.planecrazy.core.command.SimpleCommandBusConfiguration;
import io.github.goodees.planecrazy.core.dispatch.EventDispatcher;
import io.github.goodees.planecrazy.core.projection.Projection;
import io.github.goodees.planecrazy.core.store.CollectingDiagnostics;
import io.github.goodees.planecrazy.core.store.EventStoreException;
import io.github.goodees.planecrazy.core.store.file.FileSystemEventStore;
import io.github.goodees.planecrazy.event.DomainEvents;
import io.github.goodees.planecrazy.handler.AddCommentHandler;
import io.github.goodees.planecrazy.handler.DeleteCommentHandler;
import io.github.goodees.planecrazy.handler.EditCommentHandler;
import io.github.goodees.planecrazy.handler.FavouriteCommandHandler;
import io.github.goodees.planecrazy.projection.AircraftProjection;
import io.github.goodees.planecrazy.projection.CommentProjection;
import io.github.goodees.planecrazy.projection.FavouriteProjection;
import io.github.goodees.planecrazy.tracking.TrackingEventRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * The assembled application: file system store, projections, dispatcher, command handlers and the command bus.
 * Projections are rebuilt from the store on {@link #start()}.
 */
public class PlaneCrazyRuntime implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PlaneCrazyRuntime.class);

    private final PlaneCrazyConfiguration configuration;
    private final CollectingDiagnostics diagnostics;
    private final FileSystemEventStore store;
    private final CommentProjection comments;
    private final FavouriteProjection favourites;
    private final AircraftProjection aircraft;
    private final EventDispatcher dispatcher;
    private final CommandRouter router;
    private final TrackingEventRecorder trackingRecorder;
    private final ExecutorService commandExecutor;
    private final ScheduledExecutorService scheduler;
    private final CommandBus commandBus;

    public PlaneCrazyRuntime(PlaneCrazyConfiguration configuration) {
        this.configuration = configuration;
        this.diagnostics = new CollectingDiagnostics();
        this.store = new FileSystemEventStore(configuration.getEventDirectory(), DomainEvents.serialization(),
                diagnostics, configuration.isStrictReads());

        this.comments = new CommentProjection(store);
        this.favourites = new FavouriteProjection(store);
        this.aircraft = new AircraftProjection(store);
        this.dispatcher = new EventDispatcher(store)
                .register(comments)
                .register(favourites)
                .register(aircraft);

        this.router = CommandRouter.builder()
                .on(AddCommentCommand.class, new AddCommentHandler(store, dispatcher, comments))
                .on(EditCommentCommand.class, new EditCommentHandler(store, dispatcher, comments))
                .on(DeleteCommentCommand.class, new DeleteCommentHandler(store, dispatcher, comments))
                .on(FavouriteAircraftCommand.class,
                        FavouriteCommandHandler.favouriteAircraft(store, dispatcher, favourites))
                .on(UnfavouriteAircraftCommand.class,
                        FavouriteCommandHandler.unfavouriteAircraft(store, dispatcher, favourites))
                .on(FavouriteAircraftTypeCommand.class,
                        FavouriteCommandHandler.favouriteType(store, dispatcher, favourites))
                .on(UnfavouriteAircraftTypeCommand.class,
                        FavouriteCommandHandler.unfavouriteType(store, dispatcher, favourites))
                .on(FavouriteAirportCommand.class,
                        FavouriteCommandHandler.favouriteAirport(store, dispatcher, favourites))
                .on(UnfavouriteAirportCommand.class,
                        FavouriteCommandHandler.unfavouriteAirport(store, dispatcher, favourites))
                .build();
        this.trackingRecorder = new TrackingEventRecorder(dispatcher, aircraft);

        this.commandExecutor = Executors.newFixedThreadPool(configuration.getCommandThreads());
        this.scheduler = Executors.newSingleThreadScheduledExecutor();
        this.commandBus = new CommandBus(new SimpleCommandBusConfiguration("planecrazy", commandExecutor, scheduler,
                SimpleCommandBusConfiguration.synchronous(router),
                SimpleCommandBusConfiguration.retryStoreFailures(configuration.getCommandRetries(),
                        configuration.getCommandRetryDelayMs(), TimeUnit.MILLISECONDS)));
    }

    /**
     * Rebuild all projections from the store.
     * @return this runtime
     * @throws EventStoreException when the store cannot be read
     */
    public PlaneCrazyRuntime start() throws EventStoreException {
        logger.info("Starting PlaneCrazy with {}", configuration);
        for (Projection projection : dispatcher.getProjections()) {
            projection.rebuild();
        }
        return this;
    }

    /**
     * Submit command to the bus with configured timeout.
     * @param command the command
     * @return promise of the result
     */
    public CompletableFuture<CommandResult> submit(Command command) {
        return commandBus.submitWithTimeout(command, configuration.getCommandTimeoutMs(), TimeUnit.MILLISECONDS);
    }

    /**
     * @return records of the event log skipped as unreadable since this runtime was created
     */
    public CollectingDiagnostics getDiagnostics() {
        return diagnostics;
    }

    public FileSystemEventStore getStore() {
        return store;
    }

    public CommentProjection getComments() {
        return comments;
    }

    public FavouriteProjection getFavourites() {
        return favourites;
    }

    public AircraftProjection getAircraft() {
        return aircraft;
    }

    public EventDispatcher getDispatcher() {
        return dispatcher;
    }

    public CommandRouter getRouter() {
        return router;
    }

    public TrackingEventRecorder getTrackingRecorder() {
        return trackingRecorder;
    }

    public CommandBus getCommandBus() {
        return commandBus;
    }

    @Override
    public void close() {
        commandExecutor.shutdown();
        scheduler.shutdown();
        try {
            if (!commandExecutor.awaitTermination(configuration.getCommandTimeoutMs(), TimeUnit.MILLISECONDS)) {
                logger.warn("Commands still running after {} ms, forcing shutdown",
                        configuration.getCommandTimeoutMs());
                commandExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            commandExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler.shutdownNow();
        logger.info("PlaneCrazy stopped");
    }
}
