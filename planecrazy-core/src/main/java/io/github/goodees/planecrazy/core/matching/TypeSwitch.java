package io.github.goodees.planecrazy.core.matching;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Type based dispatch over event variants. Cases are tried in registration order and the first case whose class
 * (and guard, if any) accepts the value handles it. The {@code otherwise} case, when present, only runs after no
 * regular case accepted the value.
 *
 * <p>Aggregates use it as their transition function, projections as their fold step:</p>
 * <pre>
 * TypeSwitch.builder()
 *     .on(CommentAddedEvent.class, this::added)
 *     .on(CommentDeletedEvent.class, e -&gt; e.getReason().isPresent(), this::deletedWithReason)
 *     .build()
 *     .executeMatching(event);
 * </pre>
 */
public final class TypeSwitch {

    private final List<Case<?>> cases;
    private final Optional<Case<Object>> otherwise;

    private TypeSwitch(List<Case<?>> cases, Optional<Case<Object>> otherwise) {
        this.cases = cases;
        this.otherwise = otherwise;
    }

    /**
     * Run the first case accepting the value.
     * @param value the value to match, null matches nothing
     * @return false when neither a case nor the fallback handled the value
     */
    public boolean executeMatching(Object value) {
        if (value == null) {
            return false;
        }
        for (Case<?> c : cases) {
            if (c.tryHandle(value)) {
                return true;
            }
        }
        return otherwise.map(c -> c.tryHandle(value)).orElse(false);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<Case<?>> cases = new ArrayList<>();
        private Case<Object> otherwise;

        public <T> Builder on(Class<T> type, Consumer<? super T> handler) {
            cases.add(new Case<>(type, null, handler));
            return this;
        }

        public <T> Builder on(Class<T> type, Predicate<? super T> guard, Consumer<? super T> handler) {
            cases.add(new Case<>(type, Objects.requireNonNull(guard, "Guard cannot be null"), handler));
            return this;
        }

        public Builder otherwise(Consumer<Object> handler) {
            this.otherwise = new Case<>(Object.class, null, handler);
            return this;
        }

        public TypeSwitch build() {
            return new TypeSwitch(Collections.unmodifiableList(new ArrayList<>(cases)), Optional.ofNullable(otherwise));
        }
    }

    private static final class Case<T> {
        private final Class<T> type;
        private final Predicate<? super T> guard;
        private final Consumer<? super T> handler;

        Case(Class<T> type, Predicate<? super T> guard, Consumer<? super T> handler) {
            this.type = Objects.requireNonNull(type, "Case type cannot be null");
            this.guard = guard;
            this.handler = Objects.requireNonNull(handler, "Handler cannot be null");
        }

        boolean tryHandle(Object value) {
            if (!type.isInstance(value)) {
                return false;
            }
            T typed = type.cast(value);
            if (guard != null && !guard.test(typed)) {
                return false;
            }
            handler.accept(typed);
            return true;
        }
    }
}
