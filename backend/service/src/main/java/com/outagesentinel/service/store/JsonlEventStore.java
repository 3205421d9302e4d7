package com.outagesentinel.service.store;

import com.outagesentinel.core.events.Event;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Append-only event log, one {@link EventCodec} line per event. Lines that no longer
 * decode (older formats, partial writes) are skipped when querying.
 */
public class JsonlEventStore implements EventStore {
    private static final Logger LOGGER = Logger.getLogger(JsonlEventStore.class.getName());

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlEventStore(Path file) {
        this.file = file;
    }

    @Override
    public void append(Event event) {
        String line = EventCodec.toJsonLine(event);
        lock.lock();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending event to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Event> query(Instant since, Optional<String> type, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return List.of();
            }
            Deque<Event> newest = new ArrayDeque<>(Math.min(limit, 1024));
            int lineNumber = 0;
            int skipped = 0;
            try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    if (line.isBlank()) {
                        continue;
                    }
                    Event event;
                    try {
                        event = EventCodec.fromJsonLine(line);
                    } catch (IllegalArgumentException undecodable) {
                        skipped++;
                        continue;
                    }
                    if (event.timestamp() == null || event.timestamp().isBefore(since)) {
                        continue;
                    }
                    if (type.isPresent() && !type.get().equals(event.type())) {
                        continue;
                    }
                    if (newest.size() == limit) {
                        newest.removeFirst();
                    }
                    newest.addLast(event);
                }
            }
            if (skipped > 0) {
                int total = lineNumber;
                int count = skipped;
                LOGGER.warning(() -> "Skipped " + count + " of " + total + " lines in " + file);
            }
            return new ArrayList<>(newest);
        } catch (IOException e) {
            throw new IllegalStateException("Failed querying events from " + file, e);
        } finally {
            lock.unlock();
        }
    }
}
