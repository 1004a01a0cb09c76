package io.github.goodees.planecrazy.core.store;

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
 * Channel reporting records an {@link EventLog} skipped because they could not be read. Skipping keeps the rest of
 * the log available; this channel lets operators notice the corruption nevertheless.
 */
@FunctionalInterface
public interface EventLogDiagnostics {
    /**
     * Called for every record skipped during a read. Will be called while the log holds its read lock, and must not
     * call back into the log.
     * @param record the name of the record, e. g. a file name
     * @param cause why the record could not be read
     */
    void recordSkipped(String record, Throwable cause);

    EventLogDiagnostics NONE = (record, cause) -> { };
}
