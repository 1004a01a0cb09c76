package io.github.goodees.planecrazy.event;

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
 * Facts about a tracked aircraft, as observed by the data acquisition.
 */
public interface TrackingEvent extends DomainEvent {
    /**
     * @return ICAO 24-bit transponder address in hex
     */
    String getIcao24();

    @Override
    default EntityKey subject() {
        return EntityKey.of(EntityKind.AIRCRAFT, getIcao24());
    }
}
