package io.github.goodees.planecrazy.event;

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

import org.immutables.value.Value;

/**
 * Identity of an entity comments and favourites refer to, e. g. {@code (Aircraft, ABCDEF)}.
 */
@Value.Immutable
public interface EntityKey {
    @Value.Parameter
    String getType();

    @Value.Parameter
    String getId();

    default boolean is(String type, String id) {
        return getType().equals(type) && getId().equals(id);
    }

    /**
     * @return {@code type_id}, the id of the favourite aggregate of this entity
     */
    default String asAggregateId() {
        return getType() + "_" + getId();
    }

    static EntityKey of(String type, String id) {
        return ImmutableEntityKey.of(type, id);
    }

    static EntityKey of(EntityKind kind, String id) {
        return of(kind.getName(), id);
    }
}
