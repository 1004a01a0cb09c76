package io.github.goodees.planecrazy.core;

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

import io.github.goodees.planecrazy.core.command.ValidationResult;
import io.github.goodees.planecrazy.core.immutables.ImmutableCommand;
import io.github.goodees.planecrazy.core.immutables.ImmutablesSupport;
import org.immutables.value.Value;

@Value.Immutable
@ImmutablesSupport
public interface AdjustCounter extends ImmutableCommand {
    String getCounter();

    int getDelta();

    @Override
    default String aggregateId() {
        return getCounter();
    }

    @Override
    default ValidationResult validate() {
        return ValidationResult.builder()
                .require(!getCounter().trim().isEmpty(), "Counter is required.")
                .require(getDelta() != 0, "Delta must not be zero.")
                .build();
    }

    static AdjustCounter of(String counter, int delta) {
        return new Builder().counter(counter).delta(delta).build();
    }

    class Builder extends ImmutableAdjustCounter.Builder {

    }
}
