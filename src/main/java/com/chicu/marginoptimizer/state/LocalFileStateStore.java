package com.chicu.marginoptimizer.state;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Локальный JSON-файл. Авторитетное хранилище: запись через временный файл + move.
 */
@Slf4j
public class LocalFileStateStore implements StateStore {

    private final Path path;

    public LocalFileStateStore(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    public boolean exists() {
        return Files.exists(path);
    }

    @Override
    public Optional<String> load() {
        if (!exists()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            // файл есть, но не читается: дальше это обработается как битое состояние
            log.warn("⚠️ Cannot read state file {}: {}", path, e.getMessage());
            return Optional.of("");
        }
    }

    @Override
    public void save(String blob) {
        try {
            Path dir = path.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }

            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            Files.writeString(tmp, blob, StandardCharsets.UTF_8);

            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot write state file " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "file:" + path;
    }
}
