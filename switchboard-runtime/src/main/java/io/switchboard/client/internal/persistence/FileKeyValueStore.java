/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.switchboard.client.internal.persistence;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.switchboard.client.service.KeyValueStore;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A {@link KeyValueStore} backed by a properties file.
 * <p>
 * Every mutation rewrites the whole file through a sibling temporary file that is then moved over
 * the original, so a crash leaves either the old or the new contents, never a torn file.
 * </p>
 * <p>
 * Thread-safety: all operations are synchronized on the store.
 * </p>
 */
public class FileKeyValueStore implements KeyValueStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileKeyValueStore.class);

    private final Path file;
    private final Path tempFile;
    private final Properties properties = new Properties();

    /**
     * Opens the store, reading the file if it exists. An unreadable file is treated as empty and
     * is replaced on the next write.
     *
     * @param file the backing file; its parent directory is created on first write
     */
    public FileKeyValueStore(Path file) {
        this.file = Objects.requireNonNull(file);
        this.tempFile = file.resolveSibling(file.getFileName() + ".tmp");
        if (Files.exists(file)) {
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
            catch (IOException | IllegalArgumentException e) {
                LOGGER.warn("Ignoring unreadable store file {}: {}", file, e.getMessage());
                properties.clear();
            }
        }
        LOGGER.debug("Opened store {} with {} keys", file, properties.size());
    }

    @Nullable
    @Override
    public synchronized String get(String key) {
        return properties.getProperty(key);
    }

    @Override
    public synchronized void set(String key, String value) {
        Objects.requireNonNull(key);
        Objects.requireNonNull(value);
        Object previous = properties.setProperty(key, value);
        try {
            flush();
        }
        catch (PersistenceException e) {
            restore(key, previous);
            throw e;
        }
    }

    @Override
    public synchronized void remove(String key) {
        Object previous = properties.remove(key);
        if (previous == null) {
            return;
        }
        try {
            flush();
        }
        catch (PersistenceException e) {
            restore(key, previous);
            throw e;
        }
    }

    private void restore(String key, @Nullable Object previous) {
        if (previous == null) {
            properties.remove(key);
        }
        else {
            properties.put(key, previous);
        }
    }

    private void flush() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
                properties.store(writer, null);
            }
            try {
                Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            }
            catch (AtomicMoveNotSupportedException e) {
                LOGGER.trace("Atomic move not supported for {}, falling back to replace", file);
                Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING);
            }
        }
        catch (IOException e) {
            throw new PersistenceException("Failed to write store file " + file, e);
        }
    }

    @Override
    public String toString() {
        return "FileKeyValueStore{file=" + file + '}';
    }
}
