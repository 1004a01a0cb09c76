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

import java.util.Optional;

/**
 * Kinds of entities users comment on and favourite.
 */
public enum EntityKind {
    AIRCRAFT("Aircraft"),
    TYPE("Type"),
    AIRPORT("Airport");

    private final String name;

    EntityKind(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Look up kind by its name, ignoring case.
     * @param name name such as {@code aircraft}
     * @return the kind, empty for unknown names
     */
    public static Optional<EntityKind> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (EntityKind kind : values()) {
            if (kind.name.equalsIgnoreCase(name.trim())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
