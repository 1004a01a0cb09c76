package io.github.goodees.planecrazy.projection;

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

import java.time.Instant;
import java.util.Optional;

/**
 * Current state of a comment, including deleted ones.
 */
@Value.Immutable
public interface CommentView {
    String getId();

    String getEntityType();

    String getEntityId();

    String getText();

    Optional<String> getCreatedBy();

    Instant getCreatedAt();

    Optional<String> getUpdatedBy();

    Optional<Instant> getUpdatedAt();

    boolean isDeleted();

    Optional<String> getDeletedBy();

    Optional<Instant> getDeletedAt();

    Optional<String> getDeleteReason();

    class Builder extends ImmutableCommentView.Builder {

    }
}
