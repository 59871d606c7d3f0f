package com.wingman.core.annotation;

import com.wingman.core.model.AnnotationRecord;
import com.wingman.core.model.SerialNumbers;
import com.wingman.logging.AppLogger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Annotation store kept in one JSON object file, {@code {"<serial>": {birthDate, birthPlace, notes,
 * photoReference}}}.
 * <p>
 * Every write replaces the whole file: the new content goes to a temporary sibling which is then
 * moved over the target. Content that cannot be read as such an object leaves the store empty and
 * flags {@link #wasRecoveredFromCorruption()} until the next successful write replaces the damaged file.
 */
public final class JsonFileAnnotationStore implements AnnotationStore {
    private static final Logger LOGGER = AppLogger.get();

    private static final String BIRTH_DATE = "birthDate";
    private static final String BIRTH_PLACE = "birthPlace";
    private static final String NOTES = "notes";
    private static final String PHOTO = "photoReference";

    private final Path file;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private Map<String, AnnotationRecord> records;
    private volatile boolean recoveredFromCorruption;

    public JsonFileAnnotationStore(Path file) {
        this.file = Objects.requireNonNull(file, "file");
        Map<String, AnnotationRecord> loaded;
        boolean corrupt = false;
        try {
            loaded = read(file);
        } catch (IOException | JSONException ex) {
            LOGGER.log(Level.WARNING, "Annotation file " + file + " is unreadable; starting with an empty store", ex);
            loaded = new TreeMap<>(SerialNumbers.ORDER);
            corrupt = true;
        }
        this.records = loaded;
        this.recoveredFromCorruption = corrupt;
    }

    public Path file() {
        return file;
    }

    @Override
    public boolean wasRecoveredFromCorruption() {
        return recoveredFromCorruption;
    }

    @Override
    public Optional<AnnotationRecord> get(String serialNumber) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(records.get(serialNumber));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean put(String serialNumber, AnnotationRecord record) {
        Objects.requireNonNull(serialNumber, "serialNumber");
        Objects.requireNonNull(record, "record");
        lock.writeLock().lock();
        try {
            Map<String, AnnotationRecord> updated = new TreeMap<>(SerialNumbers.ORDER);
            updated.putAll(records);
            updated.put(serialNumber, record.withSerialNumber(serialNumber));
            write(updated);
            records = updated;
            recoveredFromCorruption = false;
            return true;
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Unable to save annotation for pilot " + serialNumber + " to " + file, ex);
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Map<String, AnnotationRecord> snapshot() {
        lock.readLock().lock();
        try {
            Map<String, AnnotationRecord> copy = new TreeMap<>(SerialNumbers.ORDER);
            copy.putAll(records);
            return Collections.unmodifiableMap(copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    private static Map<String, AnnotationRecord> read(Path file) throws IOException {
        Map<String, AnnotationRecord> result = new TreeMap<>(SerialNumbers.ORDER);
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException missing) {
            return result;
        }
        if (content.isBlank()) {
            return result;
        }
        JSONObject root = new JSONObject(content);
        for (String serial : root.keySet()) {
            JSONObject entry = root.optJSONObject(serial);
            if (entry == null) {
                LOGGER.warning("Ignoring annotation for " + serial + " in " + file + ": not an object");
                continue;
            }
            result.put(serial, new AnnotationRecord(
                serial,
                text(entry, BIRTH_DATE),
                text(entry, BIRTH_PLACE),
                text(entry, NOTES),
                text(entry, PHOTO)
            ));
        }
        return result;
    }

    private void write(Map<String, AnnotationRecord> snapshot) throws IOException {
        JSONObject root = new JSONObject();
        snapshot.forEach((serial, record) -> {
            JSONObject entry = new JSONObject();
            record.birthDate().ifPresent(v -> entry.put(BIRTH_DATE, v));
            record.birthPlace().ifPresent(v -> entry.put(BIRTH_PLACE, v));
            record.notes().ifPresent(v -> entry.put(NOTES, v));
            record.photoReference().ifPresent(v -> entry.put(PHOTO, v));
            root.put(serial, entry);
        });

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, root.toString(2), StandardCharsets.UTF_8);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                LOGGER.fine("Atomic move unsupported for " + file + ", replacing in place");
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static Optional<String> text(JSONObject entry, String key) {
        Object value = entry.opt(key);
        if (value == null || JSONObject.NULL.equals(value)) {
            return Optional.empty();
        }
        return Optional.of(value.toString());
    }
}
