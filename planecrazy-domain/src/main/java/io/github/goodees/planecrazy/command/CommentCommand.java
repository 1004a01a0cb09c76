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
import io.github.goodees.planecrazy.core.immutables.ImmutableCommand;
import io.github.goodees.planecrazy.validation.FieldValidation;

import java.util.Optional;

/**
 * Commands targeting a single comment.
 */
public interface CommentCommand extends ImmutableCommand {
    String getCommentId();

    /**
     * Author of the change, if different from the issuer.
     * @return user name
     */
    Optional<String> getUser();

    /**
     * @return the user recorded in the event, explicit user or the issuer
     */
    default String effectiveUser() {
        return getUser().orElse(getIssuedBy().orElse(null));
    }

    @Override
    default String aggregateId() {
        return getCommentId();
    }

    default void validateCommon(ValidationResult.Builder errors) {
        FieldValidation.required(errors, "CommentId", getCommentId());
        FieldValidation.maxLength(errors, "User name", effectiveUser(), FieldValidation.USER_NAME_MAX_LENGTH);
    }
}
