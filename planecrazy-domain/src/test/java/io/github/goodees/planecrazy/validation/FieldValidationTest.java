package io.github.goodees.planecrazy.validation;

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
import org.junit.Test;

import java.util.function.Consumer;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;

public class FieldValidationTest {

    private static ValidationResult check(Consumer<ValidationResult.Builder> rule) {
        ValidationResult.Builder errors = ValidationResult.builder();
        rule.accept(errors);
        return errors.build();
    }

    @Test
    public void icao24_is_six_hex_characters() {
        assertThat(check(e -> FieldValidation.icao24(e, "4ca7B5")).getErrors(), empty());
        assertThat(check(e -> FieldValidation.icao24(e, "")).getErrors(), contains("ICAO24 cannot be empty"));
        assertThat(check(e -> FieldValidation.icao24(e, "4CA7BG")).getErrors(),
                contains("ICAO24 must contain only hexadecimal characters (0-9, A-F)"));
    }

    @Test
    public void registration_allows_hyphen() {
        assertThat(check(e -> FieldValidation.optionalRegistration(e, "OK-TVR")).getErrors(), empty());
        assertThat(check(e -> FieldValidation.optionalRegistration(e, null)).getErrors(), empty());
        assertThat(check(e -> FieldValidation.optionalRegistration(e, "OK TVR")).getErrors(),
                contains("Registration must contain only alphanumeric characters and hyphens"));
        assertThat(check(e -> FieldValidation.optionalRegistration(e, "ABCDEFGHIJK")).getErrors(),
                contains("Registration cannot exceed 10 characters (found 11)"));
    }

    @Test
    public void text_is_required_and_limited() {
        StringBuilder longText = new StringBuilder();
        for (int i = 0; i <= FieldValidation.COMMENT_TEXT_MAX_LENGTH; i++) {
            longText.append('x');
        }
        String text = longText.toString();
        assertThat(check(e -> FieldValidation.text(e, "Comment text", text, FieldValidation.COMMENT_TEXT_MAX_LENGTH))
                .getErrors(), contains("Comment text cannot exceed 5000 characters (found 5001)"));
        assertThat(check(e -> FieldValidation.text(e, "Comment text", "\t", 10)).getErrors(),
                contains("Comment text cannot be empty"));
    }

    @Test
    public void coordinates_are_bounded() {
        assertThat(check(e -> FieldValidation.latitude(e, -90.0)).getErrors(), empty());
        assertThat(check(e -> FieldValidation.longitude(e, 180.5)).getErrors(),
                contains("Longitude must be between -180 and 180"));
    }

    @Test
    public void entity_type_is_matched_ignoring_case() {
        assertThat(check(e -> FieldValidation.entityType(e, "aircraft")).getErrors(), empty());
        assertThat(check(e -> FieldValidation.entityType(e, " ")).getErrors(),
                contains("Entity type cannot be empty"));
    }

    @Test
    public void codes_are_normalized_to_upper_case() {
        assertEquals("EGLL", FieldValidation.normalizeCode(" egll "));
    }
}
