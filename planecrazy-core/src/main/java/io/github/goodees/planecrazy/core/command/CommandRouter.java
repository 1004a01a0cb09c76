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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Type switch from commands to their handlers. The first handler registered for a matching class handles the command.
 */
public class CommandRouter implements CommandHandler<Command> {

    private final List<Route<?>> routes;

    private CommandRouter(Builder builder) {
        this.routes = new ArrayList<>(builder.routes);
    }

    /**
     * Handle the command with matching handler.
     * @param command command to route
     * @return the result of handler
     * @throws EventStoreException propagated from the handler
     * @throws UnsupportedOperationException when no handler is registered for the command
     */
    @Override
    public CommandResult handle(Command command) throws EventStoreException {
        for (Route<?> route : routes) {
            if (route.matches(command)) {
                return route.handle(command);
            }
        }
        throw new UnsupportedOperationException("Command of type " + command.getClass().getSimpleName()
                + " is not supported");
    }

    public boolean supports(Command command) {
        return routes.stream().anyMatch(r -> r.matches(command));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<Route<?>> routes = new ArrayList<>();

        /**
         * When command matches class, invoke the handler
         * @param clazz command class
         * @param handler the handler
         * @param <C> type of command
         * @return this builder
         */
        public <C extends Command> Builder on(Class<C> clazz, CommandHandler<? super C> handler) {
            routes.add(new Route<>(clazz, handler));
            return this;
        }

        public CommandRouter build() {
            return new CommandRouter(this);
        }
    }

    static class Route<C extends Command> {
        private final Class<C> commandClass;
        private final CommandHandler<? super C> handler;

        Route(Class<C> commandClass, CommandHandler<? super C> handler) {
            this.commandClass = Objects.requireNonNull(commandClass, "Command class must be defined");
            this.handler = Objects.requireNonNull(handler, "Handler must be defined");
        }

        boolean matches(Command command) {
            return command != null && commandClass.isInstance(command);
        }

        CommandResult handle(Command command) throws EventStoreException {
            return handler.handle(commandClass.cast(command));
        }
    }
}
