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
import io.github.goodees.planecrazy.event.EntityKind;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Format checks of command fields. Every check appends its errors to the builder, so that a command reports all
 * problems at once.
 */
public final class FieldValidation {
    public static final int COMMENT_TEXT_MAX_LENGTH = 5000;
    public static final int USER_NAME_MAX_LENGTH = 100;
    public static final int REASON_MAX_LENGTH = 500;
    public static final int NAME_MAX_LENGTH = 200;

    private static final Pattern ICAO24 = Pattern.compile("^[A-Fa-f0-9]{6}$");
    private static final Pattern AIRPORT_ICAO = Pattern.compile("^[A-Z]{4}$");
    private static final Pattern TYPE_CODE = Pattern.compile("^[A-Za-z0-9]{2,10}$");
    private static final Pattern REGISTRATION = Pattern.compile("^[A-Za-z0-9-]{1,10}$");

    private FieldValidation() {

    }

    /**
     * Uppercase and trim a code, so that {@code abcdef} and {@code ABCDEF } refer to same entity.
     * @param code the code, may be null
     * @return normalized code, or null
     */
    public static String normalizeCode(String code) {
        return code == null ? null : code.trim().toUpperCase(Locale.ROOT);
    }

    public static void icao24(ValidationResult.Builder errors, String value) {
        if (isBlank(value)) {
            errors.error("ICAO24 cannot be empty");
        } else if (value.length() != 6) {
            errors.error("ICAO24 must be exactly 6 characters (found " + value.length() + ")");
        } else if (!ICAO24.matcher(value).matches()) {
            errors.error("ICAO24 must contain only hexadecimal characters (0-9, A-F)");
        }
    }

    public static void airportIcaoCode(ValidationResult.Builder errors, String value) {
        if (isBlank(value)) {
            errors.error("ICAO airport code cannot be empty");
        } else if (value.length() != 4) {
            errors.error("ICAO airport code must be exactly 4 characters (found " + value.length() + ")");
        } else if (!AIRPORT_ICAO.matcher(value).matches()) {
            errors.error("ICAO airport code must be 4 uppercase letters");
        }
    }

    public static void typeCode(ValidationResult.Builder errors, String value) {
        if (isBlank(value)) {
            errors.error("Type code cannot be empty");
        } else if (!TYPE_CODE.matcher(value).matches()) {
            errors.error("Type code must be 2 to 10 alphanumeric characters (found '" + value + "')");
        }
    }

    /**
     * Optional type code, only checked when present.
     * @param errors collected errors
     * @param value the value, may be null
     */
    public static void optionalTypeCode(ValidationResult.Builder errors, String value) {
        if (value != null) {
            typeCode(errors, value);
        }
    }

    public static void optionalRegistration(ValidationResult.Builder errors, String value) {
        if (value == null) {
            return;
        }
        if (value.length() > 10) {
            errors.error("Registration cannot exceed 10 characters (found " + value.length() + ")");
        } else if (!REGISTRATION.matcher(value).matches()) {
            errors.error("Registration must contain only alphanumeric characters and hyphens");
        }
    }

    public static void entityType(ValidationResult.Builder errors, String value) {
        if (isBlank(value)) {
            errors.error("Entity type cannot be empty");
        } else if (!EntityKind.fromName(value).isPresent()) {
            errors.error("Entity type must be one of: Aircraft, Type, Airport (found '" + value + "')");
        }
    }

    public static void required(ValidationResult.Builder errors, String field, String value) {
        errors.require(!isBlank(value), field + " cannot be empty");
    }

    public static void text(ValidationResult.Builder errors, String field, String value, int maxLength) {
        if (isBlank(value)) {
            errors.error(field + " cannot be empty");
        } else {
            maxLength(errors, field, value, maxLength);
        }
    }

    /**
     * Length check of optional text, absent value passes.
     * @param errors collected errors
     * @param field name of the field for the message
     * @param value the value, may be null
     * @param maxLength maximum length
     */
    public static void maxLength(ValidationResult.Builder errors, String field, String value, int maxLength) {
        if (value != null && value.length() > maxLength) {
            errors.error(field + " cannot exceed " + maxLength + " characters (found " + value.length() + ")");
        }
    }

    public static void latitude(ValidationResult.Builder errors, Double value) {
        errors.require(value == null || (value >= -90 && value <= 90), "Latitude must be between -90 and 90");
    }

    public static void longitude(ValidationResult.Builder errors, Double value) {
        errors.require(value == null || (value >= -180 && value <= 180), "Longitude must be between -180 and 180");
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
