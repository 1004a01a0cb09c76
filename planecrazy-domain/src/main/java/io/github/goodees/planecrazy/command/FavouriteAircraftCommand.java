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
import io.github.goodees.planecrazy.event.EntityKey;
import io.github.goodees.planecrazy.event.EntityKind;
import io.github.goodees.planecrazy.validation.FieldValidation;
import org.immutables.value.Value;

import java.util.Optional;

/**
 * Add aircraft to favourites. Registration and type code are stored with the favourite.
 */
@Value.Immutable
public interface FavouriteAircraftCommand extends FavouriteCommand {
    String getIcao24();

    Optional<String> getRegistration();

    Optional<String> getTypeCode();

    @Override
    default EntityKey target() {
        return EntityKey.of(EntityKind.AIRCRAFT, FieldValidation.normalizeCode(getIcao24()));
    }

    @Override
    default ValidationResult validate() {
        ValidationResult.Builder errors = ValidationResult.builder();
        FieldValidation.icao24(errors, getIcao24().trim());
        FieldValidation.optionalRegistration(errors, getRegistration().orElse(null));
        FieldValidation.optionalTypeCode(errors, getTypeCode().orElse(null));
        return errors.build();
    }

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableFavouriteAircraftCommand.Builder {

    }
}
