package com.chicu.marginoptimizer.runner;

import com.chicu.marginoptimizer.analysis.AnalyticsCsvReader;
import com.chicu.marginoptimizer.analysis.ArmRow;
import com.chicu.marginoptimizer.metrics.PerformanceWindow;
import com.chicu.marginoptimizer.optimizer.MarginDecision;
import com.chicu.marginoptimizer.optimizer.MarginOptimizer;
import com.chicu.marginoptimizer.optimizer.config.OptimizerProperties;
import com.chicu.marginoptimizer.platform.MarginPlatformClient;
import com.chicu.marginoptimizer.runlog.RunLogEntry;
import com.chicu.marginoptimizer.runlog.RunLogSink;
import com.chicu.marginoptimizer.state.StateCodec;
import com.chicu.marginoptimizer.state.StateStoreFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Один часовой тик оптимизатора. Расписание внешнее (cron), внутри процесса ничего не планируется.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OptimizerRunner {

    public static final String DEFAULT_ARM = "LowMar";

    private final OptimizerProperties props;
    private final StateStoreFactory storeFactory;
    private final StateCodec codec;
    private final MarginPlatformClient platform;
    private final RunLogSink runLog;
    private final AnalyticsCsvReader csvReader;
    private final Clock clock;

    /**
     * Окно с платформы, боевой файл состояния.
     */
    public RunResult runHourly() {
        PerformanceWindow window = platform.fetchHourlyWindow();
        return runOnce(window, props.getStatePath());
    }

    /**
     * Окно из CSV-выгрузки (строка arm-а по подстроке имени), отдельный файл состояния.
     */
    public RunResult runFromCsv(Path csv, String arm) {
        String armContains = arm == null || arm.isBlank() ? DEFAULT_ARM : arm;

        List<ArmRow> rows = csvReader.read(csv);
        ArmRow row = AnalyticsCsvReader.findArm(rows, armContains);
        log.info("📄 CSV window: {} arm={} ({})", csv, armContains, row.demandName());

        return runOnce(row.toWindow(), props.getCsvRunStatePath());
    }

    RunResult runOnce(PerformanceWindow window, String statePath) {
        MarginOptimizer optimizer = new MarginOptimizer(props, storeFactory.create(statePath), codec, clock);

        double currentMargin = window.margin();
        MarginDecision decision = optimizer.decide(window);
        double nextMargin = decision.nextMargin();

        boolean applied = platform.updateMargin(nextMargin);
        if (!applied) {
            log.warn("⚠️ Failed to update margin to {}%", nextMargin);
        }

        // аудит не влияет на результат тика
        boolean logged = runLog.record(RunLogEntry.builder()
                .timestamp(clock.instant())
                .currentMargin(currentMargin)
                .nextMargin(nextMargin)
                .decision(decision.type())
                .metrics(window)
                .success(applied)
                .build());

        if (applied) {
            log.info("Margin updated: {}% -> {}%", currentMargin, nextMargin);
        }

        return RunResult.builder()
                .currentMargin(currentMargin)
                .nextMargin(nextMargin)
                .decision(decision)
                .applied(applied)
                .runLogged(logged)
                .build();
    }
}
