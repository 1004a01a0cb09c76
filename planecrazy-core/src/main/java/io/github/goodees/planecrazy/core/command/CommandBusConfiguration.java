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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.BiConsumer;

/**
 * Dependencies and strategies for CommandBus.
 */
public interface CommandBusConfiguration {
    String busName();

    /**
     * The thread pool commands execute on.
     * @return the executor service instance
     */
    ExecutorService executorService();

    /**
     * Threadpool for scheduling retries and handling timeouts. <strong>Should be different from
     * executorService!</strong>. When same thread pools would be used, and the execution would block, the unsatisfied
     * commands would not be cancelled as there would be no free threads to perform the cancellation.
     * @return scheduled executor service instance
     */
    ScheduledExecutorService schedulerService();

    /**
     * Handle the command, pass the result to the callback.
     * <p>This method will be called on the executor thread when the command is due for execution.</p>
     * @param aggregateId id of the aggregate
     * @param command command to handle
     * @param callback callback to call upon completion
     */
    void execute(String aggregateId, Command command, BiConsumer<CommandResult, Throwable> callback);

    /**
     * Decide whether and when the command should be retried in case of failure.
     * Should return redelivery delay in milliseconds. Returning {@code 0} means to retry immediately, returning less
     * than {@code 0} means not to retry.
     * <p>If retry is greater than zero, the bus may execute other commands of same aggregate before the wait period
     * expires</p>
     * @param aggregateId identity of the aggregate
     * @param command command that failed
     * @param t the throwable the command failed with
     * @param completedAttempts number of attempts for execution of that command. Greater than {@code 1}.
     * @return negative in order to fail the command, zero to immediately retry it, positive for delay in ms until next
     *         attempt
     */
    long retryDelay(String aggregateId, Command command, Throwable t, int completedAttempts);
}
