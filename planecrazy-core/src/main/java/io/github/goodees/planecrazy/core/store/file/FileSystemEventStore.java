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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.goodees.planecrazy.core.Event;
import io.github.goodees.planecrazy.core.store.EventFilter;
import io.github.goodees.planecrazy.core.store.EventLog;
import io.github.goodees.planecrazy.core.store.EventLogDiagnostics;
import io.github.goodees.planecrazy.core.store.EventStore;
import io.github.goodees.planecrazy.core.store.EventStoreException;
import io.github.goodees.planecrazy.core.store.ListStoredEvents;
import io.github.goodees.planecrazy.core.store.Serialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;

import static java.util.stream.Collectors.toList;

/**
 * Event store keeping one JSON file per event in a directory.
 *
 * <p>File names start with the write time and a sequence number, therefore lexicographic listing of the directory
 * yields the order of writes. Every file contains an envelope with the type discriminator, payload version and the
 * payload produced by {@link Serialization}:</p>
 * <pre>
 * {"eventType":"CommentAdded","payloadVersion":1,"data":{...}}
 * </pre>
 *
 * <p>Writes are serialized by a single write lock, the record is first written to a temporary file and then atomically
 * moved into place, so a crash never leaves a partial record visible. Readers share a read lock.</p>
 *
 * <p>Records that cannot be read are logged, reported to {@link EventLogDiagnostics} and skipped. In strict mode
 * they fail the read instead.</p>
 */
public class FileSystemEventStore implements EventStore, EventLog {
    static final String EXTENSION = ".json";
    static final String TEMP_EXTENSION = ".tmp";
    static final String EVENT_TYPE = "eventType";
    static final String PAYLOAD_VERSION = "payloadVersion";
    static final String DATA = "data";
    private static final DateTimeFormatter FILE_TIME = DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS")
            .withZone(ZoneOffset.UTC);

    private static final Logger logger = LoggerFactory.getLogger(FileSystemEventStore.class);

    private final Path directory;
    private final Serialization<Event> serialization;
    private final EventLogDiagnostics diagnostics;
    private final boolean strict;
    private final ObjectMapper envelopeMapper = new ObjectMapper();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    // guarded by write lock
    private boolean initialized;
    private long sequence;
    private String lastWriteTime = "";

    public FileSystemEventStore(Path directory, Serialization<Event> serialization) {
        this(directory, serialization, EventLogDiagnostics.NONE, false);
    }

    public FileSystemEventStore(Path directory, Serialization<Event> serialization, EventLogDiagnostics diagnostics,
                                boolean strict) {
        this.directory = directory;
        this.serialization = serialization;
        this.diagnostics = diagnostics;
        this.strict = strict;
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public void persist(Event event) throws EventStoreException {
        Event serializable = serialization.toSerializable(event);
        if (serializable == null) {
            throw EventStoreException.unsupported(event);
        }
        byte[] record = toRecord(serializable);
        lock.writeLock().lock();
        try {
            ensureInitialized();
            String fileName = nextFileName(serializable);
            write(serializable, fileName, record);
            logger.debug("Stored event {} of type {} as {}", serializable.getId(), serializable.getType(), fileName);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void persist(Event... events) throws EventStoreException {
        lock.writeLock().lock();
        try {
            for (Event event : events) {
                persist(event);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void persist(Iterable<? extends Event> events) throws EventStoreException {
        lock.writeLock().lock();
        try {
            for (Event event : events) {
                persist(event);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private byte[] toRecord(Event event) throws EventStoreException {
        try {
            ObjectNode envelope = envelopeMapper.createObjectNode();
            envelope.put(EVENT_TYPE, event.getType());
            envelope.put(PAYLOAD_VERSION, serialization.payloadVersion(event));
            envelope.set(DATA, envelopeMapper.readTree(serialization.serialize(event)));
            return envelopeMapper.writeValueAsBytes(envelope);
        } catch (IOException | IllegalArgumentException e) {
            throw EventStoreException.serializationFailed(event, e);
        }
    }

    private void write(Event event, String fileName, byte[] record) throws EventStoreException {
        Path target = directory.resolve(fileName);
        Path temp = directory.resolve(fileName + TEMP_EXTENSION);
        try {
            Files.write(temp, record);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target);
            }
        } catch (IOException e) {
            EventStoreException failure = EventStoreException.storeFailed(event.getId(), e);
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                failure.addSuppressed(cleanup);
            }
            throw failure;
        }
    }

    private void ensureInitialized() throws EventStoreException {
        if (initialized) {
            return;
        }
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw EventStoreException.readFailed(directory.toString(), e);
        }
        for (Path file : listRecords()) {
            String name = file.getFileName().toString();
            String[] parts = name.split("-", 3);
            if (parts.length == 3 && parts[0].length() == 17 && parts[1].length() == 10) {
                try {
                    sequence = Math.max(sequence, Long.parseLong(parts[1]));
                    if (parts[0].compareTo(lastWriteTime) > 0) {
                        lastWriteTime = parts[0];
                    }
                } catch (NumberFormatException e) {
                    logger.debug("Record {} does not follow naming scheme, ignoring it for sequencing", name);
                }
            }
        }
        initialized = true;
        logger.info("Opened event store at {}, last sequence is {}", directory, sequence);
    }

    private String nextFileName(Event event) {
        String now = FILE_TIME.format(Instant.now());
        // clock may go backwards, names must not
        if (now.compareTo(lastWriteTime) > 0) {
            lastWriteTime = now;
        }
        sequence++;
        return lastWriteTime + "-" + String.format("%010d", sequence) + "-" + event.getId() + EXTENSION;
    }

    @Override
    public StoredEvents<Event> readAll() throws EventStoreException {
        lock.readLock().lock();
        try {
            return new ListStoredEvents<>(ListStoredEvents.chronological(readRecords()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public StoredEvents<Event> readFiltered(EventFilter filter) throws EventStoreException {
        lock.readLock().lock();
        try {
            List<Event> matching = readRecords().stream().filter(filter).collect(toList());
            return new ListStoredEvents<>(ListStoredEvents.chronological(matching));
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<Path> listRecords() throws EventStoreException {
        if (!Files.isDirectory(directory)) {
            return Collections.emptyList();
        }
        try (Stream<Path> listing = Files.list(directory)) {
            return listing.filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                    .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                    .collect(toList());
        } catch (IOException e) {
            throw EventStoreException.readFailed(directory.toString(), e);
        }
    }

    private List<Event> readRecords() throws EventStoreException {
        List<Path> files = listRecords();
        List<Event> events = new ArrayList<>(files.size());
        for (Path file : files) {
            Event event = readRecord(file);
            if (event != null) {
                events.add(event);
            }
        }
        return events;
    }

    private Event readRecord(Path file) throws EventStoreException {
        String name = file.getFileName().toString();
        try {
            JsonNode envelope = envelopeMapper.readTree(file.toFile());
            if (envelope == null || !envelope.isObject()) {
                throw new IllegalArgumentException("Record is not a JSON object");
            }
            JsonNode type = envelope.get(EVENT_TYPE);
            JsonNode data = envelope.get(DATA);
            if (type == null || !type.isTextual() || data == null || !data.isObject()) {
                throw new IllegalArgumentException("Record lacks " + EVENT_TYPE + " or " + DATA);
            }
            int payloadVersion = envelope.path(PAYLOAD_VERSION).asInt(1);
            return serialization.deserialize(payloadVersion, data.toString(), type.asText());
        } catch (IOException | IllegalArgumentException e) {
            if (strict) {
                throw EventStoreException.corruptRecord(name, e);
            }
            logger.warn("Could not deserialize event record {}, skipping it: {}", name, e.getMessage());
            diagnostics.recordSkipped(name, e);
            return null;
        }
    }
}
