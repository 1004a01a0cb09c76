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

import io.github.goodees.planecrazy.core.store.EventStoreException;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * General CommandBus configuration implementation, as alternative to defining own subclass. Its dependencies are
 * passed to constructor, and {@linkplain CommandExecutor execution} and {@linkplain RetryStrategy retries} are
 * separated into strategies represented by functional interfaces.
 */
public class SimpleCommandBusConfiguration implements CommandBusConfiguration {
    private final String name;
    private final ExecutorService executorService;
    private final ScheduledExecutorService schedulerService;
    private final CommandExecutor commandExecutor;
    private final RetryStrategy retryStrategy;

    /**
     * Create bus configuration.
     * @param name The name of the bus
     * @param executorService executor service to use
     * @param schedulerService scheduler service to use
     * @param commandExecutor executor to delegate command execution to
     * @param retryStrategy retry strategy to delegate retryDelay to
     */
    public SimpleCommandBusConfiguration(String name, ExecutorService executorService,
                                         ScheduledExecutorService schedulerService, CommandExecutor commandExecutor,
                                         RetryStrategy retryStrategy) {
        this.name = Objects.requireNonNull(name, "Bus name is required");
        this.executorService = Objects.requireNonNull(executorService, "Command executor is required");
        this.schedulerService = Objects.requireNonNull(schedulerService, "Scheduler is required");
        this.commandExecutor = Objects.requireNonNull(commandExecutor, "Command executor must be specified");
        this.retryStrategy = Objects.requireNonNull(retryStrategy, "Retry strategy is required");
    }

    /**
     * Create bus configuration without retries.
     * @param name the name of the bus
     * @param executorService executor service to use
     * @param schedulerService scheduler service to use
     * @param commandExecutor executor to delegate command execution to
     */
    public SimpleCommandBusConfiguration(String name, ExecutorService executorService,
                                         ScheduledExecutorService schedulerService, CommandExecutor commandExecutor) {
        this(name, executorService, schedulerService, commandExecutor, noRetries());
    }

    @Override
    public String busName() {
        return this.name;
    }

    @Override
    public ExecutorService executorService() {
        return executorService;
    }

    @Override
    public ScheduledExecutorService schedulerService() {
        return schedulerService;
    }

    @Override
    public void execute(String aggregateId, Command command, BiConsumer<CommandResult, Throwable> callback) {
        commandExecutor.execute(aggregateId, command, callback);
    }

    @Override
    public long retryDelay(String aggregateId, Command command, Throwable t, int completedAttempts) {
        return retryStrategy.retryDelay(aggregateId, command, t, completedAttempts);
    }

    /**
     * Strategy for executing a command
     * @see CommandBusConfiguration#execute(String, Command, BiConsumer)
     */
    @FunctionalInterface
    public interface CommandExecutor {
        void execute(String aggregateId, Command command, BiConsumer<CommandResult, Throwable> callback);
    }

    /**
     * Strategy for retrying a command
     * @see CommandBusConfiguration#retryDelay(String, Command, Throwable, int)
     */
    @FunctionalInterface
    public interface RetryStrategy {
        long DO_NOT_RETRY = -1;
        long RETRY_NOW = 0;
        long retryDelay(String aggregateId, Command command, Throwable t, int completedAttempts);
    }

    /**
     * Executor invoking a handler synchronously on the calling executor thread.
     * @param handler the handler, usually a {@link CommandRouter}
     * @return a command executor
     */
    public static CommandExecutor synchronous(CommandHandler<Command> handler) {
        return (aggregateId, command, callback) -> {
            CommandResult result;
            try {
                result = handler.handle(command);
            } catch (EventStoreException | RuntimeException e) {
                callback.accept(null, e);
                return;
            }
            callback.accept(result, null);
        };
    }

    static final RetryStrategy NO_RETRIES = (id, command, t, attempts) -> RetryStrategy.DO_NOT_RETRY;

    /**
     * Retry strategy that doesn't retry any failed command.
     * @return a retry strategy
     */
    public static RetryStrategy noRetries() {
        return NO_RETRIES;
    }

    /**
     * Create retry strategy that allows fix number of attempts before failing the command, with delay of 100
     * milliseconds.
     * @param attempts number of attempts to allow
     * @return a retry strategy
     */
    public static RetryStrategy fixedRetries(int attempts) {
        return new FixedAttempts(attempts, 100);
    }

    /**
     * Create retry strategy that allows fix number of attempts with defined retry delay.
     * @param attempts number of attempt to allow
     * @param delay delay before retrying the command
     * @param unit unit of delay
     * @return a retry strategy
     */
    public static RetryStrategy fixedRetries(int attempts, long delay, TimeUnit unit) {
        return new FixedAttempts(attempts, unit.toMillis(delay));
    }

    /**
     * Retry only failures to write the event store, other failures are not transient.
     * @param attempts number of attempts to allow
     * @param delay delay before retrying the command
     * @param unit unit of delay
     * @return a retry strategy
     */
    public static RetryStrategy retryStoreFailures(int attempts, long delay, TimeUnit unit) {
        RetryStrategy fixed = fixedRetries(attempts, delay, unit);
        return (id, command, t, completedAttempts) -> {
            Throwable cause = CommandBus.unwrapCompletionException(t);
            if (cause instanceof EventStoreException
                    && ((EventStoreException) cause).getFault() == EventStoreException.Fault.IO_ERROR) {
                return fixed.retryDelay(id, command, cause, completedAttempts);
            }
            return RetryStrategy.DO_NOT_RETRY;
        };
    }

    static class FixedAttempts implements RetryStrategy {
        final int attempts;
        final long delay;

        FixedAttempts(int attempts, long delay) {
            this.attempts = attempts;
            this.delay = delay;
        }

        @Override
        public long retryDelay(String aggregateId, Command command, Throwable t, int completedAttempts) {
            return completedAttempts < attempts ? delay : DO_NOT_RETRY;
        }
    }
}
