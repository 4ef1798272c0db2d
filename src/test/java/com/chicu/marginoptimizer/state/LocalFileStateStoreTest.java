package com.chicu.marginoptimizer.state;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LocalFileStateStoreTest {

    @TempDir
    Path dir;

    @Test
    void load_shouldReturnEmpty_whenFileMissing() {
        LocalFileStateStore store = new LocalFileStateStore(dir.resolve("state.json"));

        assertFalse(store.exists());
        assertTrue(store.load().isEmpty());
    }

    @Test
    void save_shouldWriteAndOverwrite() throws Exception {
        Path file = dir.resolve("nested/state.json");
        LocalFileStateStore store = new LocalFileStateStore(file);

        store.save("{\"a\":1}");
        store.save("{\"a\":2}");

        assertTrue(store.exists());
        assertEquals("{\"a\":2}", Files.readString(file));
        assertEquals("{\"a\":2}", store.load().orElseThrow());
        assertFalse(Files.exists(dir.resolve("nested/state.json.tmp")), "временный файл не должен оставаться");
    }

    @Test
    void describe_shouldContainPath() {
        LocalFileStateStore store = new LocalFileStateStore(dir.resolve("x.json"));
        assertTrue(store.describe().contains("x.json"));
    }
}
