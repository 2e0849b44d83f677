package com.phillippitts.peercall.service.store;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Store backed by a single JSON object file. Every write rewrites the file through a temp file
 * and a move, so a crash leaves either the old or the new content.
 *
 * <p>A missing file starts empty; an unreadable one is logged and also starts empty rather than
 * blocking startup.
 */
public class FileKeyValueStore implements KeyValueStore {

    private static final Logger LOG = LogManager.getLogger(FileKeyValueStore.class);

    private final Path file;
    private final JSONObject values;

    public FileKeyValueStore(Path file) {
        this.file = Objects.requireNonNull(file, "file");
        this.values = load(file);
    }

    @Override
    public synchronized Optional<String> get(String key) {
        return values.has(key) ? Optional.of(values.getString(key)) : Optional.empty();
    }

    @Override
    public synchronized void put(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        values.put(key, value);
        flush();
    }

    @Override
    public synchronized void remove(String key) {
        if (values.remove(key) != null) {
            flush();
        }
    }

    private void flush() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(tmp, values.toString(2), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write store file " + file, e);
        }
    }

    private static JSONObject load(Path file) {
        if (!Files.exists(file)) {
            LOG.info("Store file {} does not exist yet; starting empty", file);
            return new JSONObject();
        }
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return content.isBlank() ? new JSONObject() : new JSONObject(content);
        } catch (IOException | JSONException e) {
            LOG.error("Store file {} unreadable; starting empty", file, e);
            return new JSONObject();
        }
    }
}
