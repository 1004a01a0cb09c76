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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Asynchronous command submission. Guarantees to handle at most one command at time per aggregate, so that two
 * commands never replay the same history and both append on top of it. Commands for different aggregates run
 * concurrently on the configured executor.
 *
 * <p>Internally, the bus maintains a mailbox of pending commands for every aggregate id. Whenever a command is
 * submitted, the bus checks whether the mailbox is not being processed already. A mailbox is dropped once every
 * command submitted to it has settled, and a later command for the same aggregate gets a fresh one.</p>
 */
public class CommandBus {

    private final CommandBusConfiguration conf;
    private final ConcurrentMap<String, Mailbox> mailboxes = new ConcurrentHashMap<>();
    private final Logger logger;

    public CommandBus(CommandBusConfiguration conf) {
        this.conf = conf;
        this.logger = LoggerFactory.getLogger(getClass().getName() + "." + conf.busName());
    }

    /**
     * Submit a command. It is added to the mailbox of its {@linkplain Command#aggregateId() aggregate} and the
     * mailbox is scheduled for processing.
     *
     * @param command command to handle
     * @return the promise for the result. Store failures complete it exceptionally once retries are exhausted.
     */
    public CompletableFuture<CommandResult> submit(Command command) {
        Mailbox mailbox = mailboxFor(command);
        return mailbox.enqueue(mailbox.new Invocation(command));
    }

    /**
     * Submit a command with timeout. If the command doesn't finish until timeout, the result completes exceptionally
     * with {@code CancellationException}. A command already executing is not interrupted.
     * @param command the command
     * @param timeout timeout for completion
     * @param unit timeout unit
     * @return the promise for the result
     */
    public CompletableFuture<CommandResult> submitWithTimeout(Command command, long timeout, TimeUnit unit) {
        Mailbox mailbox = mailboxFor(command);
        return mailbox.enqueue(mailbox.new Invocation(command).withTimeout(timeout, unit));
    }

    /**
     * Number of aggregates with commands that have not settled yet.
     * @return count of mailboxes
     */
    public int getMailboxCount() {
        return mailboxes.size();
    }

    // registration and retirement both run under the map's lock of the aggregate id
    private Mailbox mailboxFor(Command command) {
        return mailboxes.compute(command.aggregateId(), (aggregateId, existing) -> {
            Mailbox mailbox = existing == null ? new Mailbox(aggregateId) : existing;
            mailbox.outstanding.incrementAndGet();
            return mailbox;
        });
    }

    private void retireIfIdle(Mailbox mailbox) {
        mailboxes.computeIfPresent(mailbox.aggregateId, (aggregateId, registered) ->
                registered == mailbox && mailbox.outstanding.get() == 0 ? null : registered);
    }

    public static Throwable unwrapCompletionException(Throwable ex) {
        while (ex != null && ex.getCause() != null && ex instanceof CompletionException) {
            ex = ex.getCause();
        }
        return ex;
    }

    /**
     * Queue of commands for single aggregate. At this level we're handling the concurrency between adding new
     * command, and executing only single command.
     */
    class Mailbox implements Runnable {
        private final String aggregateId;
        private final Deque<Invocation> queue = new ConcurrentLinkedDeque<>();
        private final AtomicInteger enqueuesWhileBusy = new AtomicInteger();
        private final AtomicReference<Invocation> current = new AtomicReference<>();
        private final AtomicInteger outstanding = new AtomicInteger();

        Mailbox(String aggregateId) {
            this.aggregateId = aggregateId;
        }

        CompletableFuture<CommandResult> enqueue(Invocation inv) {
            queue.add(inv);
            if (claimProcessing()) {
                conf.executorService().submit(this);
            }
            return inv.result;
        }

        private boolean claimProcessing() {
            int pending = enqueuesWhileBusy.getAndIncrement();
            if (pending == 0) {
                logger.debug("Will start processing mailbox of {}", aggregateId);
                return true;
            }
            logger.debug("Mailbox of {} is busy, {} commands enqueued during current execution", aggregateId,
                    pending);
            return false;
        }

        /**
         * Process single command. Called when the mailbox is submitted for execution, and again at end of every
         * command, so that commands arriving during processing are handled as well.
         */
        @Override
        public void run() {
            Invocation inv = next();
            if (inv == null) {
                return;
            }
            if (current.compareAndSet(null, inv)) {
                inv.run();
            } else {
                logger.error("Mailbox of {} ran while command is in progress. Current: {}, dequeued: {}",
                        aggregateId, current.get(), inv);
                queue.addFirst(inv);
            }
        }

        private Invocation next() {
            while (true) {
                int observed = enqueuesWhileBusy.get();
                Invocation inv = queue.poll();
                if (inv != null) {
                    return inv;
                }
                // a command may have been enqueued right after the poll. Stop only if no enqueue happened since
                // we read the counter, otherwise poll again.
                if (enqueuesWhileBusy.compareAndSet(observed, 0)) {
                    logger.debug("Stopping processing of mailbox of {}", aggregateId);
                    return null;
                }
            }
        }

        /**
         * One submitted command together with the future of its result. Handles retries, timeout and the race
         * between cancellation and the start of execution.
         */
        class Invocation implements Runnable {
            private final Command command;
            private final PendingResult result = new PendingResult(this);
            private final AtomicBoolean settled = new AtomicBoolean();
            private final Instant submission = Instant.now();
            private ScheduledFuture<?> timeout;
            private int completedAttempts = 0;
            private Instant executionStart;

            Invocation(Command command) {
                this.command = command;
            }

            Invocation withTimeout(long amount, TimeUnit unit) {
                this.timeout = conf.schedulerService().schedule(this::timedOut, amount, unit);
                return this;
            }

            @Override
            public void run() {
                if (result.claimExecution()) {
                    completedAttempts++;
                    executionStart = Instant.now();
                    conf.execute(aggregateId, command, this::completed);
                } else {
                    logger.info("Command attempted to run after it was cancelled: {}", this);
                    finish();
                }
            }

            private void completed(CommandResult response, Throwable failure) {
                if (failure == null) {
                    cancelTimeout();
                    settle();
                    result.succeed(response);
                } else {
                    long delay = conf.retryDelay(aggregateId, command, failure, completedAttempts);
                    if (delay == 0) {
                        queue.add(this);
                    } else if (delay > 0) {
                        logger.info("Retrying {} in {} ms after {}", this, delay, failure.toString());
                        conf.schedulerService().schedule(() -> enqueue(this), delay, TimeUnit.MILLISECONDS);
                    } else {
                        cancelTimeout();
                        settle();
                        result.fail(unwrapCompletionException(failure));
                    }
                }
                finish();
            }

            private void finish() {
                if (current.compareAndSet(this, null)) {
                    executionStart = null;
                    result.releaseExecution();
                    conf.executorService().submit(Mailbox.this);
                } else {
                    logger.error("Command finished, but wasn't current command: {}", this);
                }
            }

            void cancelled() {
                queue.remove(this);
                settle();
            }

            private void settle() {
                if (settled.compareAndSet(false, true) && outstanding.decrementAndGet() == 0) {
                    retireIfIdle(Mailbox.this);
                }
            }

            private void timedOut() {
                if (result.cancel(true)) {
                    logger.info("Command timed out: {}. Current command is {}", this, current.get());
                } else if (!result.isDone()) {
                    // handler is running, it cannot be stopped from here
                    logger.warn("ACTIVE command timed out: {}", this);
                }
            }

            private void cancelTimeout() {
                if (timeout != null && !timeout.isDone()) {
                    timeout.cancel(false);
                }
            }

            @Override
            public String toString() {
                return "Invocation[aggregate=" + aggregateId + ", command=" + command.getClass().getSimpleName()
                        + "(" + command.getCommandId() + "), submissionTime=" + submission
                        + ", attempts=" + completedAttempts + ", executionStart=" + executionStart + "]";
            }
        }
    }

    /**
     * Future handed to clients. Clients may cancel it while it waits in the mailbox, but cannot complete it.
     */
    static final class PendingResult extends CompletableFuture<CommandResult> {
        private final AtomicBoolean idle = new AtomicBoolean(true);
        private final Mailbox.Invocation invocation;

        PendingResult(Mailbox.Invocation invocation) {
            this.invocation = invocation;
        }

        boolean claimExecution() {
            return idle.compareAndSet(true, false);
        }

        void releaseExecution() {
            idle.set(true);
        }

        void succeed(CommandResult value) {
            super.complete(value);
        }

        void fail(Throwable t) {
            super.completeExceptionally(t);
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (!claimExecution()) {
                return false;
            }
            if (isDone()) {
                releaseExecution();
                return false;
            }
            invocation.cancelled();
            return super.cancel(mayInterruptIfRunning);
        }

        @Override
        public boolean complete(CommandResult value) {
            throw new UnsupportedOperationException("Result of a command cannot be completed by client");
        }

        @Override
        public boolean completeExceptionally(Throwable ex) {
            throw new UnsupportedOperationException("Result of a command cannot be completed by client");
        }

        @Override
        public void obtrudeValue(CommandResult value) {
            throw new UnsupportedOperationException("Result of a command cannot be completed by client");
        }

        @Override
        public void obtrudeException(Throwable ex) {
            throw new UnsupportedOperationException("Result of a command cannot be completed by client");
        }
    }
}
