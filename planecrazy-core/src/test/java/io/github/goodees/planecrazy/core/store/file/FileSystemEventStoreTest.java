package io.github.goodees.planecrazy.core.store.file;

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
import io.github.goodees.planecrazy.core.SampleEvent;
import io.github.goodees.planecrazy.core.store.CollectingDiagnostics;
import io.github.goodees.planecrazy.core.store.EventFilter;
import io.github.goodees.planecrazy.core.store.EventLog;
import io.github.goodees.planecrazy.core.store.EventStoreException;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Arrays.asList;
import static java.util.stream.Collectors.toList;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class FileSystemEventStoreTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path directory;
    private CollectingDiagnostics diagnostics;
    private FileSystemEventStore store;

    @Before
    public void setUp() throws IOException {
        directory = folder.newFolder("events").toPath();
        diagnostics = new CollectingDiagnostics();
        store = new FileSystemEventStore(directory, SampleEvent.serialization(), diagnostics, false);
    }

    private List<Event> readAll(EventLog log) throws EventStoreException {
        try (EventLog.StoredEvents<Event> events = log.readAll()) {
            return events.toList();
        }
    }

    private List<String> recordNames() throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(p -> p.getFileName().toString()).sorted().collect(toList());
        }
    }

    @Test
    public void persisted_events_are_read_back() throws EventStoreException {
        SampleEvent first = SampleEvent.of("a", 1);
        SampleEvent second = SampleEvent.of("b", 2);
        store.persist(first, second);

        List<Event> events = readAll(store);
        assertEquals(asList(first, second), events);
        assertEquals("Sample", events.get(0).getType());
    }

    @Test
    public void one_file_per_event_named_by_time_and_sequence() throws Exception {
        SampleEvent event = SampleEvent.of("a", 1);
        store.persist(event);
        store.persist(SampleEvent.of("b", 2));

        List<String> names = recordNames();
        assertThat(names, hasSize(2));
        assertThat(names.get(0), endsWith("-0000000001-" + event.getId() + ".json"));
        assertTrue(names.get(0).matches("\\d{17}-\\d{10}-.+\\.json"));
        String content = new String(Files.readAllBytes(directory.resolve(names.get(0))), StandardCharsets.UTF_8);
        assertThat(content, startsWith("{\"eventType\":\"Sample\",\"payloadVersion\":1,\"data\":{"));
    }

    @Test
    public void corrupt_record_is_skipped() throws Exception {
        store.persist(SampleEvent.of("a", 1), SampleEvent.of("b", 2), SampleEvent.of("c", 3));
        Files.write(directory.resolve("99999999999999999-9999999999-broken.json"),
                "{\"eventType\":\"Sample\",\"da".getBytes(StandardCharsets.UTF_8));

        List<Event> events = readAll(store);

        assertThat(events, hasSize(3));
        assertThat(diagnostics.getSkippedRecords(), hasSize(1));
        assertThat(diagnostics.getSkippedRecords().get(0).getRecord(), containsString("broken"));
    }

    @Test
    public void record_of_unknown_type_is_skipped() throws Exception {
        store.persist(SampleEvent.of("a", 1));
        Files.write(directory.resolve("00000000000000000-0000000000-unknown.json"),
                "{\"eventType\":\"Unknown\",\"payloadVersion\":1,\"data\":{}}".getBytes(StandardCharsets.UTF_8));

        assertThat(readAll(store), hasSize(1));
        assertTrue(diagnostics.hasSkippedRecords());
    }

    @Test
    public void record_without_identity_or_time_is_skipped() throws Exception {
        SampleEvent valid = SampleEvent.of("a", 1);
        store.persist(valid);
        Files.write(directory.resolve("00000000000000000-0000000000-noid.json"),
                ("{\"eventType\":\"Sample\",\"payloadVersion\":1,\"data\":"
                        + "{\"occurredAt\":\"2024-06-01T12:00:00Z\",\"subject\":\"a\",\"value\":1}}")
                        .getBytes(StandardCharsets.UTF_8));
        Files.write(directory.resolve("00000000000000000-0000000000-notime.json"),
                "{\"eventType\":\"Sample\",\"payloadVersion\":1,\"data\":{\"id\":\"e1\",\"subject\":\"a\",\"value\":1}}"
                        .getBytes(StandardCharsets.UTF_8));

        assertEquals(asList(valid), readAll(store));
        assertEquals(asList(valid), readAll(store));
        assertThat(diagnostics.getSkippedRecords(), hasSize(2));
        assertThat(diagnostics.getSkippedRecords().get(0).getReason(), containsString("lacks id"));
        assertThat(diagnostics.getSkippedRecords().get(1).getReason(), containsString("lacks occurredAt"));
    }

    @Test
    public void strict_store_fails_on_corrupt_record() throws Exception {
        store.persist(SampleEvent.of("a", 1));
        Files.write(directory.resolve("99999999999999999-9999999999-broken.json"),
                "not json at all".getBytes(StandardCharsets.UTF_8));
        FileSystemEventStore strict = new FileSystemEventStore(directory, SampleEvent.serialization(),
                diagnostics, true);
        try {
            readAll(strict);
            fail("Strict store should fail on corrupt record");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.CORRUPT_RECORD, e.getFault());
        }
    }

    @Test
    public void events_are_returned_in_order_of_occurrence() throws EventStoreException {
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        SampleEvent late = SampleEvent.at(now.plusSeconds(10), "late", 1);
        SampleEvent early = SampleEvent.at(now, "early", 2);
        SampleEvent sameAsEarly = SampleEvent.at(now, "same", 3);
        store.persist(late, early, sameAsEarly);

        assertEquals(asList(early, sameAsEarly, late), readAll(store));
    }

    @Test
    public void filtered_read_applies_type_and_inclusive_time_bounds() throws EventStoreException {
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        SampleEvent first = SampleEvent.at(now, "a", 1);
        SampleEvent second = SampleEvent.at(now.plusSeconds(1), "b", 2);
        SampleEvent third = SampleEvent.at(now.plusSeconds(2), "c", 3);
        store.persist(first, second, third);

        try (EventLog.StoredEvents<Event> events = store.readFiltered(EventFilter.builder()
                .from(now.plusSeconds(1)).to(now.plusSeconds(2)).build())) {
            assertEquals(asList(second, third), events.toList());
        }
        try (EventLog.StoredEvents<Event> events = store.readFiltered(EventFilter.ofType("Other"))) {
            assertThat(events.toList(), empty());
        }
        try (EventLog.StoredEvents<Event> events = store.readFiltered(EventFilter.ofType("Sample"))) {
            assertThat(events.toList(), hasSize(3));
        }
    }

    @Test
    public void missing_directory_reads_empty_log() throws EventStoreException {
        FileSystemEventStore missing = new FileSystemEventStore(directory.resolve("not-there"),
                SampleEvent.serialization());
        assertThat(readAll(missing), empty());
        assertFalse(Files.exists(directory.resolve("not-there")));
    }

    @Test
    public void directory_is_created_on_first_write() throws EventStoreException {
        Path nested = directory.resolve("nested").resolve("log");
        FileSystemEventStore created = new FileSystemEventStore(nested, SampleEvent.serialization());
        created.persist(SampleEvent.of("a", 1));
        assertTrue(Files.isDirectory(nested));
        assertThat(readAll(created), hasSize(1));
    }

    @Test
    public void sequence_continues_after_reopening() throws Exception {
        store.persist(SampleEvent.of("a", 1), SampleEvent.of("b", 2));

        FileSystemEventStore reopened = new FileSystemEventStore(directory, SampleEvent.serialization());
        reopened.persist(SampleEvent.of("c", 3));

        List<String> names = recordNames();
        assertThat(names, hasSize(3));
        assertThat(names.get(2), containsString("-0000000003-"));
        List<Integer> values = readAll(reopened).stream().map(e -> ((SampleEvent) e).getValue())
                .collect(Collectors.toList());
        assertThat(values, contains(1, 2, 3));
    }

    @Test
    public void temporary_files_are_not_read() throws Exception {
        store.persist(SampleEvent.of("a", 1));
        Files.write(directory.resolve("99999999999999999-9999999999-pending.json.tmp"),
                "{".getBytes(StandardCharsets.UTF_8));

        assertThat(readAll(store), hasSize(1));
        assertFalse(diagnostics.hasSkippedRecords());
    }

    @Test
    public void no_temporary_files_remain_after_write() throws Exception {
        store.persist(SampleEvent.of("a", 1), SampleEvent.of("b", 2));
        assertTrue(recordNames().stream().noneMatch(n -> n.endsWith(".tmp")));
    }
}
