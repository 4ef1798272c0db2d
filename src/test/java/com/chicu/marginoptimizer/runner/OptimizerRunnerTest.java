package com.chicu.marginoptimizer.runner;

import com.chicu.marginoptimizer.analysis.AnalyticsCsvReader;
import com.chicu.marginoptimizer.metrics.PerformanceWindow;
import com.chicu.marginoptimizer.optimizer.DecisionType;
import com.chicu.marginoptimizer.optimizer.config.OptimizerProperties;
import com.chicu.marginoptimizer.platform.MarginPlatformClient;
import com.chicu.marginoptimizer.remote.BlobStorage;
import com.chicu.marginoptimizer.runlog.RunLogEntry;
import com.chicu.marginoptimizer.runlog.RunLogSink;
import com.chicu.marginoptimizer.state.StateCodec;
import com.chicu.marginoptimizer.state.StateStoreFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OptimizerRunnerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T11:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    @Mock MarginPlatformClient platform;
    @Mock RunLogSink runLog;

    private OptimizerProperties props;
    private OptimizerRunner runner;

    private static final PerformanceWindow WINDOW = PerformanceWindow.builder()
            .margin(35).impressions(55_000).revenue(25.0).cost(16.0).bidRate(1.5).responses(28_000)
            .build();

    @BeforeEach
    void setUp() {
        props = new OptimizerProperties();
        props.setStatePath(dir.resolve("optimizer_state.json").toString());
        props.setCsvRunStatePath(dir.resolve("optimizer_state_csv_run.json").toString());

        runner = new OptimizerRunner(
                props,
                new StateStoreFactory(props, BlobStorage.disabled()),
                new StateCodec(new ObjectMapper(), props.getHistoryLimit()),
                platform,
                runLog,
                new AnalyticsCsvReader(),
                CLOCK);
    }

    @Test
    void runHourly_shouldDecideApplyAndLog() {
        when(platform.fetchHourlyWindow()).thenReturn(WINDOW);
        when(platform.updateMargin(36.0)).thenReturn(true);
        when(runLog.record(any())).thenReturn(true);

        RunResult result = runner.runHourly();

        assertEquals(35.0, result.currentMargin());
        assertEquals(36.0, result.nextMargin());
        assertEquals(DecisionType.COLD_START, result.decision().type());
        assertTrue(result.applied());
        assertTrue(result.runLogged());
        assertTrue(Files.exists(dir.resolve("optimizer_state.json")));

        ArgumentCaptor<RunLogEntry> entry = ArgumentCaptor.forClass(RunLogEntry.class);
        verify(runLog).record(entry.capture());
        assertEquals(CLOCK.instant(), entry.getValue().timestamp());
        assertEquals(WINDOW, entry.getValue().metrics());
        assertTrue(entry.getValue().success());
    }

    @Test
    void runHourly_shouldContinueFromPersistedState() {
        when(platform.fetchHourlyWindow())
                .thenReturn(WINDOW)
                .thenReturn(WINDOW.toBuilder().margin(36).revenue(20.0).build());
        when(platform.updateMargin(anyDouble())).thenReturn(true);

        runner.runHourly();
        RunResult second = runner.runHourly();

        assertEquals(DecisionType.ROLLBACK, second.decision().type());
        assertEquals(35.0, second.nextMargin());
    }

    @Test
    void runOnce_shouldReportFailure_whenApplyFails() {
        when(platform.updateMargin(anyDouble())).thenReturn(false);

        RunResult result = runner.runOnce(WINDOW, props.getStatePath());

        assertFalse(result.applied());
        ArgumentCaptor<RunLogEntry> entry = ArgumentCaptor.forClass(RunLogEntry.class);
        verify(runLog).record(entry.capture());
        assertFalse(entry.getValue().success());
    }

    @Test
    void runFromCsv_shouldUseArmRowAndSeparateState() throws Exception {
        Path csv = Path.of(getClass().getResource("/analytics/margin_test_report.csv").toURI());
        when(platform.updateMargin(anyDouble())).thenReturn(true);

        RunResult result = runner.runFromCsv(csv, null);

        // первая строка LowMar: маржа 33.33
        assertEquals(33.33, result.currentMargin());
        assertEquals(34.33, result.nextMargin(), 1e-9);
        assertTrue(Files.exists(dir.resolve("optimizer_state_csv_run.json")));
        assertFalse(Files.exists(dir.resolve("optimizer_state.json")));
        verify(platform, never()).fetchHourlyWindow();
    }
}
