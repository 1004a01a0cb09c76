package io.github.goodees.planecrazy.core.command;

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

/**
 * Result of checking a command's payload.
 */
public final class ValidationResult {
    private static final ValidationResult VALID = new ValidationResult(Collections.emptyList());

    private final List<String> errors;

    private ValidationResult(List<String> errors) {
        this.errors = Collections.unmodifiableList(errors);
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult invalid(String... errors) {
        List<String> list = new ArrayList<>();
        Collections.addAll(list, errors);
        return new ValidationResult(list);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }

    /**
     * All errors in one message.
     * @return errors separated by "; ", empty string for valid result
     */
    public String getErrorMessage() {
        return String.join("; ", errors);
    }

    public void throwIfInvalid() {
        if (!isValid()) {
            throw new ValidationException(this);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult[valid]" : "ValidationResult[" + getErrorMessage() + "]";
    }

    public static class Builder {
        private final List<String> errors = new ArrayList<>();

        public Builder error(String error) {
            errors.add(error);
            return this;
        }

        /**
         * Record error unless condition holds.
         * @param condition the condition
         * @param error error to record when condition is false
         * @return this builder
         */
        public Builder require(boolean condition, String error) {
            if (!condition) {
                errors.add(error);
            }
            return this;
        }

        public Builder merge(ValidationResult result) {
            errors.addAll(result.getErrors());
            return this;
        }

        public ValidationResult build() {
            return errors.isEmpty() ? VALID : new ValidationResult(new ArrayList<>(errors));
        }
    }
}
