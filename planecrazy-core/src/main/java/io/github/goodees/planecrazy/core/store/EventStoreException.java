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

import io.github.goodees.planecrazy.core.Event;

/**
 * Failure of the event store. A store failure is the single fatal outcome of a write: nothing was recorded and the
 * caller should treat the whole operation as failed.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        /**
         * Underlying storage could not be written or read.
         */
        IO_ERROR,
        /**
         * Event could not be converted to or from its persisted form.
         */
        SERIALIZATION_ERROR,
        /**
         * A persisted record is damaged and the log was asked to be strict about it.
         */
        CORRUPT_RECORD,
        PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public static EventStoreException storeFailed(String eventId, Throwable cause) {
        return new EventStoreException(Fault.IO_ERROR,
            "Store of event " + eventId + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException readFailed(String location, Throwable cause) {
        return new EventStoreException(Fault.IO_ERROR,
            "Reading event log at " + location + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException serializationFailed(Event event, Throwable cause) {
        return new EventStoreException(Fault.SERIALIZATION_ERROR,
            "Event " + event.getId() + " of type " + event.getType() + " could not be serialized. " + cause.getMessage(),
            cause);
    }

    public static EventStoreException corruptRecord(String record, Throwable cause) {
        return new EventStoreException(Fault.CORRUPT_RECORD, "Event record " + record + " cannot be read. "
                + cause.getMessage(), cause);
    }

    public static EventStoreException unsupported(Event event) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Unsupported event type: " + event, null);
    }
}
