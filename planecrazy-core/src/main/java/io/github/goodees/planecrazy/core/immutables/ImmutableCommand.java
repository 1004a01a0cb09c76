package io.github.goodees.planecrazy.core.immutables;

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

import io.github.goodees.planecrazy.core.command.Command;
import org.immutables.value.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Base class for commands using <a href="http://immutables.github.io">Immutables library</a>. Command id and creation
 * time default to fresh values.
 */
public interface ImmutableCommand extends Command {
    @Override
    @Value.Default
    default String getCommandId() {
        return UUID.randomUUID().toString();
    }

    @Override
    @Value.Default
    default Instant getCreatedAt() {
        return Instant.now();
    }
}
