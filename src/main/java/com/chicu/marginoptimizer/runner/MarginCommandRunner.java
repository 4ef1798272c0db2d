package com.chicu.marginoptimizer.runner;

import com.chicu.marginoptimizer.analysis.AnalysisProperties;
import com.chicu.marginoptimizer.analysis.AnalysisReport;
import com.chicu.marginoptimizer.analysis.AnalysisReportPrinter;
import com.chicu.marginoptimizer.analysis.AnalysisThresholds;
import com.chicu.marginoptimizer.analysis.AnalyticsCsvReader;
import com.chicu.marginoptimizer.analysis.ArmRow;
import com.chicu.marginoptimizer.analysis.BracketPlan;
import com.chicu.marginoptimizer.analysis.BracketRecommender;
import com.chicu.marginoptimizer.analysis.MarginTestAnalyzer;
import com.chicu.marginoptimizer.analysis.RecommendationOutput;
import com.chicu.marginoptimizer.analysis.RecommendationWriter;
import com.chicu.marginoptimizer.remote.BlobStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Точка входа CLI.
 * <ul>
 *     <li>без флагов: часовой тик (или {@code --csv=<path> [--arm=LowMar]})</li>
 *     <li>{@code --analyze --csv=<path>}: отчёт по A/B тесту</li>
 *     <li>{@code --recommend --csv=<path>} или {@code --recommend [--source-key=<key>]}: вилка маржи на следующий раунд</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "margin.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MarginCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private final OptimizerRunner optimizerRunner;
    private final AnalyticsCsvReader csvReader;
    private final MarginTestAnalyzer analyzer;
    private final BracketRecommender bracketRecommender;
    private final RecommendationWriter recommendationWriter;
    private final BlobStorage blobStorage;
    private final AnalysisProperties analysisProps;

    private int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) {
        try {
            if (args.containsOption("analyze")) {
                exitCode = analyze(args);
            } else if (args.containsOption("recommend")) {
                exitCode = recommend(args);
            } else {
                exitCode = hourly(args);
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("❌ Run failed: {}", e.getMessage(), e);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    // =====================================================================
    // modes
    // =====================================================================

    int hourly(ApplicationArguments args) {
        String csv = option(args, "csv");

        RunResult result = csv == null
                ? optimizerRunner.runHourly()
                : optimizerRunner.runFromCsv(Path.of(csv), option(args, "arm"));

        return result.applied() ? 0 : 1;
    }

    int analyze(ApplicationArguments args) {
        String csv = required(args, "csv");

        AnalysisThresholds defaults = AnalysisThresholds.defaults();
        AnalysisThresholds t = defaults.toBuilder()
                .controlContains(option(args, "control-contains"))
                .minImpressions(intOption(args, "min-impressions", defaults.minImpressions()))
                .minProfit(doubleOption(args, "min-profit", defaults.minProfit()))
                .maxImprDropPct(doubleOption(args, "max-impr-drop-pct", defaults.maxImprDropPct()))
                .maxSrpmDropPct(doubleOption(args, "max-srpm-drop-pct", defaults.maxSrpmDropPct()))
                .minSrpmPctOfControl(doubleOption(args, "min-srpm-pct-of-control", defaults.minSrpmPctOfControl()))
                .build();

        AnalysisReport report = analyzer.analyze(csvReader.read(Path.of(csv)), t);
        System.out.print(AnalysisReportPrinter.format(report));
        return 0;
    }

    int recommend(ApplicationArguments args) {
        String csv = option(args, "csv");

        List<ArmRow> all;
        String source;
        if (csv != null) {
            source = csv;
            all = csvReader.read(Path.of(csv));
        } else {
            source = option(args, "source-key") != null ? option(args, "source-key") : analysisProps.getSourceKey();
            all = download(source);
        }

        int hour = AnalyticsCsvReader.lastHour(all);
        List<ArmRow> rows = AnalyticsCsvReader.lastHourWithData(all);
        log.info("🕐 Using last hour with data: {} ({} rows)", hour, rows.size());

        AnalysisReport report = analyzer.analyze(rows, analysisProps.thresholds());
        BracketPlan plan = bracketRecommender.recommend(report.arms(), rows, report.control(),
                analysisProps.getSrpmGuardrailPct());

        RecommendationOutput out = recommendationWriter.write(
                Path.of(analysisProps.getOutputDir()), source, hour, report, plan);

        log.info("✅ Recommendations: winner={} recommended={} growing={} files={}, {} uploaded={}",
                report.winner().name(), report.recommendedName(), plan.profitStillGrowing(),
                out.csvFile(), out.jsonFile(), out.uploadedKeys());
        return 0;
    }

    private List<ArmRow> download(String key) {
        if (!blobStorage.enabled()) {
            throw new IllegalStateException("--source-key needs margin.remote.base-url; use --csv for local files");
        }
        byte[] body = blobStorage.get(key)
                .orElseThrow(() -> new IllegalStateException("Remote object not found: " + key));
        log.info("☁️ Downloaded {} ({} bytes)", key, body.length);

        try (Reader r = new InputStreamReader(new ByteArrayInputStream(body), StandardCharsets.UTF_8)) {
            return csvReader.read(r, key);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot parse CSV " + key + ": " + e.getMessage(), e);
        }
    }

    // =====================================================================
    // options
    // =====================================================================

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) return null;
        String v = values.get(values.size() - 1);
        return v == null || v.isBlank() ? null : v.trim();
    }

    private static String required(ApplicationArguments args, String name) {
        String v = option(args, name);
        if (v == null) {
            throw new IllegalArgumentException("--" + name + " is required");
        }
        return v;
    }

    private static int intOption(ApplicationArguments args, String name, int def) {
        String v = option(args, name);
        if (v == null) return def;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be an integer, got '" + v + "'", e);
        }
    }

    private static double doubleOption(ApplicationArguments args, String name, double def) {
        String v = option(args, name);
        if (v == null) return def;
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be a number, got '" + v + "'", e);
        }
    }
}
