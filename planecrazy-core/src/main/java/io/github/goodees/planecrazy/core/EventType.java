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

/**
 * Naming scheme of event discriminators. The discriminator is the simple class name without the {@code Event}
 * suffix, so {@code CommentAddedEvent} is stored as {@code CommentAdded}.
 */
public final class EventType {
    private static final String EVENT_SUFFIX = "Event";
    private static final String IMMUTABLE_PREFIX = "Immutable";

    private EventType() {
    }

    public static String defaultTypeName(Class<?> clazz) {
        return strip(clazz.getSimpleName(), "", EVENT_SUFFIX);
    }

    /**
     * Type name of generated immutable implementations.
     * @param clazz the event class, either the abstract value type or its generated implementation
     * @return {@code CommentAdded} for both {@code ImmutableCommentAddedEvent} and {@code CommentAddedEvent}
     */
    public static String immutableTypeName(Class<?> clazz) {
        return strip(clazz.getSimpleName(), IMMUTABLE_PREFIX, EVENT_SUFFIX);
    }

    private static String strip(String name, String prefix, String suffix) {
        String result = name.startsWith(prefix) ? name.substring(prefix.length()) : name;
        return result.endsWith(suffix) && result.length() > suffix.length()
                ? result.substring(0, result.length() - suffix.length())
                : result;
    }
}
