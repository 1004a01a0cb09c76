package io.github.goodees.planecrazy.command;

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
import io.github.goodees.planecrazy.event.EntityKind;
import io.github.goodees.planecrazy.validation.FieldValidation;
import org.immutables.value.Value;

import java.util.UUID;

/**
 * Add comment to an entity. A fresh comment id is generated unless given.
 */
@Value.Immutable
public interface AddCommentCommand extends CommentCommand {
    @Override
    @Value.Default
    default String getCommentId() {
        return UUID.randomUUID().toString();
    }

    String getEntityType();

    String getEntityId();

    String getText();

    /**
     * @return entity type spelled as the {@link EntityKind} name, e. g. {@code aircraft} becomes {@code Aircraft}
     */
    default String canonicalEntityType() {
        return EntityKind.fromName(getEntityType()).map(EntityKind::getName).orElse(getEntityType());
    }

    /**
     * @return entity id trimmed, and upper-cased for the code based kinds, matching the keys of favourites
     */
    default String canonicalEntityId() {
        return EntityKind.fromName(getEntityType()).isPresent()
                ? FieldValidation.normalizeCode(getEntityId())
                : getEntityId().trim();
    }

    @Override
    default ValidationResult validate() {
        ValidationResult.Builder errors = ValidationResult.builder();
        validateCommon(errors);
        FieldValidation.entityType(errors, getEntityType());
        FieldValidation.required(errors, "EntityId", getEntityId());
        FieldValidation.text(errors, "Comment text", getText(), FieldValidation.COMMENT_TEXT_MAX_LENGTH);
        return errors.build();
    }

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableAddCommentCommand.Builder {

    }
}
