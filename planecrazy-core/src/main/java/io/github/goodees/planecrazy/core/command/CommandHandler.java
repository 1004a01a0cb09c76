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

/**
 * Handles one type of command.
 * @param <C> type of command
 */
@FunctionalInterface
public interface CommandHandler<C extends Command> {
    /**
     * Handle the command.
     * @param command the command
     * @return the result, describing invalid and rejected commands as well
     * @throws EventStoreException when events could not be stored. Nothing is considered recorded then, and command may
     *         be retried from scratch.
     */
    CommandResult handle(C command) throws EventStoreException;
}
