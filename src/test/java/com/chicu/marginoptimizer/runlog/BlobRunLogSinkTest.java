package com.chicu.marginoptimizer.runlog;

import com.chicu.marginoptimizer.metrics.PerformanceWindow;
import com.chicu.marginoptimizer.optimizer.DecisionType;
import com.chicu.marginoptimizer.remote.BlobStorage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BlobRunLogSinkTest {

    @Mock
    BlobStorage storage;

    private final ObjectMapper om = new ObjectMapper();

    private static RunLogEntry entry() {
        return RunLogEntry.builder()
                .timestamp(Instant.parse("2026-10-19T10:05:07Z"))
                .currentMargin(35.0)
                .nextMargin(36.0)
                .decision(DecisionType.COLD_START)
                .metrics(PerformanceWindow.builder().margin(35).impressions(55_000).revenue(25).cost(16).bidRate(1.5).responses(28_000).build())
                .success(true)
                .build();
    }

    @Test
    void keyName_shouldUseUtcTimestamp() {
        assertEquals("runs/2026-10-19T10-05-07Z.json", BlobRunLogSink.keyName(entry()));
    }

    @Test
    void record_shouldPutJsonUnderPrefixedKey() throws Exception {
        when(storage.keyFor(anyString())).thenAnswer(inv -> "margin-optimizer/" + inv.getArgument(0));

        assertTrue(new BlobRunLogSink(storage, om).record(entry()));

        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        verify(storage).put(eq("margin-optimizer/runs/2026-10-19T10-05-07Z.json"), body.capture(), eq("application/json"));

        JsonNode json = om.readTree(body.getValue());
        assertEquals(35.0, json.get("current_margin").asDouble());
        assertEquals(36.0, json.get("next_margin").asDouble());
        assertEquals("COLD_START", json.get("decision").asText());
        assertTrue(json.get("success").asBoolean());
        assertEquals("2026-10-19T10:05:07Z", json.get("timestamp").asText());
        assertEquals(55_000.0, json.get("metrics").get("impressions").asDouble());
    }

    @Test
    void record_shouldReturnFalse_whenUploadFails() {
        when(storage.keyFor(anyString())).thenReturn("k");
        doThrow(new IllegalStateException("down")).when(storage).put(anyString(), any(byte[].class), anyString());

        assertFalse(new BlobRunLogSink(storage, om).record(entry()));
    }

    @Test
    void noopSink_shouldAlwaysSucceed() {
        assertTrue(new NoopRunLogSink().record(entry()));
    }
}
