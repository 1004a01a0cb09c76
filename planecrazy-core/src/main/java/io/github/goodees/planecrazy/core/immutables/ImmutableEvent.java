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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.github.goodees.planecrazy.core.Event;
import io.github.goodees.planecrazy.core.EventType;
import org.immutables.value.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Base class for events using <a href="http://immutables.github.io">Immutables library</a>.
 * An application defines its base class of events, that extends ImmutableEvent.
 * <p>Events should be defined in a package annotated with {@link ImmutablesSupport} in its {@code package-info.java}.
 * Identity and occurrence time default to a random UUID and the time of building the event, so that builders only
 * need to fill in the payload.</p>
 * <p>The type discriminator is not part of the payload, stores keep it in the record envelope.</p>
 */
// allow for future changes in an event
@JsonIgnoreProperties(ignoreUnknown = true)
// Put key values at the front
@JsonPropertyOrder({ "id", "occurredAt" })
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public interface ImmutableEvent extends Event {

    @Override
    @Value.Default
    default String getId() {
        return UUID.randomUUID().toString();
    }

    @Override
    @Value.Default
    default Instant getOccurredAt() {
        return Instant.now();
    }

    @Override
    @Value.Auxiliary
    @JsonIgnore
    default String getType() {
        return EventType.immutableTypeName(getClass());
    }

}
