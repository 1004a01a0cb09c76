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
import io.github.goodees.planecrazy.validation.FieldValidation;
import org.immutables.value.Value;

import java.util.Optional;

/**
 * Delete a comment. The comment remains in history.
 */
@Value.Immutable
public interface DeleteCommentCommand extends CommentCommand {
    Optional<String> getReason();

    @Override
    default ValidationResult validate() {
        ValidationResult.Builder errors = ValidationResult.builder();
        validateCommon(errors);
        FieldValidation.maxLength(errors, "Reason", getReason().orElse(null), FieldValidation.REASON_MAX_LENGTH);
        return errors.build();
    }

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableDeleteCommentCommand.Builder {

    }
}
