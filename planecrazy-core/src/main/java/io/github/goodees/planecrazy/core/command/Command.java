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

import java.time.Instant;
import java.util.Optional;

/**
 * Intent to change state. Commands are not persisted, the events they result in are.
 *
 * Base for immutables-based commands is {@link io.github.goodees.planecrazy.core.immutables.ImmutableCommand}.
 */
public interface Command {
    String getCommandId();

    Instant getCreatedAt();

    /**
     * The user issuing the command, if known.
     * @return user name
     */
    Optional<String> getIssuedBy();

    Optional<String> getCorrelationId();

    /**
     * Identity of the aggregate instance the command targets. Commands with the same aggregate id are never
     * executed concurrently by {@link CommandBus}.
     * @return aggregate id
     */
    String aggregateId();

    /**
     * Check the payload for well-formedness, without looking at any state.
     * @return validation result
     */
    ValidationResult validate();
}
