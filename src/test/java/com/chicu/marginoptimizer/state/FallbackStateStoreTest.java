package com.chicu.marginoptimizer.state;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FallbackStateStoreTest {

    @TempDir
    Path dir;

    @Mock
    StateStore remote;

    @Test
    void load_shouldPreferLocal_andNotTouchRemote() throws Exception {
        Path file = dir.resolve("state.json");
        Files.writeString(file, "local");
        FallbackStateStore store = new FallbackStateStore(new LocalFileStateStore(file), remote);

        assertEquals("local", store.load().orElseThrow());
        verify(remote, never()).load();
    }

    @Test
    void load_shouldFallBackToRemote_whenLocalMissing() {
        when(remote.load()).thenReturn(Optional.of("remote"));
        when(remote.describe()).thenReturn("remote");
        FallbackStateStore store = new FallbackStateStore(new LocalFileStateStore(dir.resolve("state.json")), remote);

        assertEquals("remote", store.load().orElseThrow());
    }

    @Test
    void load_shouldReturnEmpty_whenRemoteFails() {
        when(remote.load()).thenThrow(new IllegalStateException("boom"));
        when(remote.describe()).thenReturn("remote");
        FallbackStateStore store = new FallbackStateStore(new LocalFileStateStore(dir.resolve("state.json")), remote);

        assertTrue(store.load().isEmpty());
    }

    @Test
    void save_shouldWriteLocal_evenWhenRemoteFails() throws Exception {
        doThrow(new IllegalStateException("remote down")).when(remote).save(anyString());
        when(remote.describe()).thenReturn("remote");
        Path file = dir.resolve("state.json");
        FallbackStateStore store = new FallbackStateStore(new LocalFileStateStore(file), remote);

        assertDoesNotThrow(() -> store.save("blob"));

        assertEquals("blob", Files.readString(file));
        verify(remote).save("blob");
    }
}
