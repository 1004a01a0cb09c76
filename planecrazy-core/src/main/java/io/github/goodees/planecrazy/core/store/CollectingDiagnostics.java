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

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Diagnostics keeping skipped records for later inspection. A record skipped by several reads is kept once,
 * with the time it was first detected.
 */
public class CollectingDiagnostics implements EventLogDiagnostics {
    private final Map<String, SkippedRecord> skipped = new LinkedHashMap<>();

    @Override
    public synchronized void recordSkipped(String record, Throwable cause) {
        skipped.putIfAbsent(record, new SkippedRecord(record, String.valueOf(cause.getMessage()), Instant.now()));
    }

    public synchronized List<SkippedRecord> getSkippedRecords() {
        return new ArrayList<>(skipped.values());
    }

    public synchronized boolean hasSkippedRecords() {
        return !skipped.isEmpty();
    }

    public synchronized void clear() {
        skipped.clear();
    }

    public static class SkippedRecord {
        private final String record;
        private final String reason;
        private final Instant detectedAt;

        SkippedRecord(String record, String reason, Instant detectedAt) {
            this.record = record;
            this.reason = reason;
            this.detectedAt = detectedAt;
        }

        public String getRecord() {
            return record;
        }

        public String getReason() {
            return reason;
        }

        public Instant getDetectedAt() {
            return detectedAt;
        }

        @Override
        public String toString() {
            return "SkippedRecord[" + record + ", reason=" + reason + ", detectedAt=" + detectedAt + "]";
        }
    }
}
