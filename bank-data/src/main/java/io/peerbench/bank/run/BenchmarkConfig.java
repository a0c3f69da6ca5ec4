package io.peerbench.bank.run;

import io.peerbench.bank.fdic.HttpFdicClient;
import io.peerbench.bank.ffiec.BulkDownloadSession;

import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Run settings. Each value resolves from a system property, then an environment variable, then a default.
 *
 * @param peerGroups group definitions in {@code KEY:Name:cert,...} form; empty means the built-in groups
 * @param quarters   quarters of history to analyze; four more are fetched so trailing windows fill
 */
public record BenchmarkConfig(
        String apiKey,
        int subject,
        List<String> peerGroups,
        int quarters,
        Path outputDir,
        Path cacheDir,
        URI fdicBase,
        URI ffiecUrl,
        int workers,
        long requestSpacingMillis,
        boolean healEnabled,
        int healPeriods,
        int healParallelism,
        int ttmWindow,
        int longRunWindow,
        int fiscalYearStartMonth
) {
    public BenchmarkConfig {
        peerGroups = List.copyOf(peerGroups);
        if (quarters < 1) throw new IllegalArgumentException("quarters must be positive: " + quarters);
        if (fiscalYearStartMonth < 1 || fiscalYearStartMonth > 12) {
            throw new IllegalArgumentException("fiscal year start month must be 1..12: " + fiscalYearStartMonth);
        }
    }

    public static BenchmarkConfig fromEnv() {
        String apiKey = System.getProperty("peerbench.apiKey", System.getenv().getOrDefault("PEERBENCH_API_KEY", ""));
        int subject = Integer.parseInt(System.getProperty("peerbench.subject", System.getenv().getOrDefault("PEERBENCH_SUBJECT", "34221")));
        String peers = System.getProperty("peerbench.peers", System.getenv().getOrDefault("PEERBENCH_PEERS", ""));
        int quarters = Integer.parseInt(System.getProperty("peerbench.quarters", System.getenv().getOrDefault("PEERBENCH_QUARTERS", "30")));
        Path out = Path.of(System.getProperty("peerbench.out", System.getenv().getOrDefault("PEERBENCH_OUT", "./output")));
        Path cache = Path.of(System.getProperty("peerbench.cache", System.getenv().getOrDefault("PEERBENCH_CACHE", "./cache")));
        URI fdic = URI.create(System.getProperty("peerbench.fdicBase", System.getenv().getOrDefault("PEERBENCH_FDIC_BASE", HttpFdicClient.DEFAULT_BASE)));
        URI ffiec = URI.create(System.getProperty("peerbench.ffiecUrl", System.getenv().getOrDefault("PEERBENCH_FFIEC_URL", BulkDownloadSession.DEFAULT_URL)));
        int workers = Integer.parseInt(System.getProperty("peerbench.workers", System.getenv().getOrDefault("PEERBENCH_WORKERS", "3")));
        long spacing = Long.parseLong(System.getProperty("peerbench.requestSpacingMillis", System.getenv().getOrDefault("PEERBENCH_REQUEST_SPACING_MILLIS", "200")));
        boolean heal = Boolean.parseBoolean(System.getProperty("peerbench.heal", System.getenv().getOrDefault("PEERBENCH_HEAL", "true")));
        int healPeriods = Integer.parseInt(System.getProperty("peerbench.healPeriods", System.getenv().getOrDefault("PEERBENCH_HEAL_PERIODS", "8")));
        int healParallelism = Integer.parseInt(System.getProperty("peerbench.healParallelism", System.getenv().getOrDefault("PEERBENCH_HEAL_PARALLELISM", "2")));
        int ttm = Integer.parseInt(System.getProperty("peerbench.ttmWindow", System.getenv().getOrDefault("PEERBENCH_TTM_WINDOW", "4")));
        int longRun = Integer.parseInt(System.getProperty("peerbench.longRunWindow", System.getenv().getOrDefault("PEERBENCH_LONG_RUN_WINDOW", "8")));
        int fiscalStart = Integer.parseInt(System.getProperty("peerbench.fiscalYearStartMonth", System.getenv().getOrDefault("PEERBENCH_FISCAL_YEAR_START_MONTH", "1")));
        return new BenchmarkConfig(apiKey, subject, splitGroups(peers), quarters, out, cache, fdic, ffiec,
                workers, spacing, heal, healPeriods, healParallelism, ttm, longRun, fiscalStart);
    }

    /** Groups are separated by {@code ;} since members are comma-separated. */
    static List<String> splitGroups(String raw) {
        List<String> out = new ArrayList<>();
        for (String s : raw.split(";")) {
            if (!s.isBlank()) out.add(s.trim());
        }
        return out;
    }

    public Path deadLetterFile() {
        return outputDir.resolve("dlq_fetch.jsonl");
    }

    public Path debugDir() {
        return cacheDir.resolve("debug");
    }

    /** Rows requested per institution. */
    public int fetchLimit() {
        return quarters + 4;
    }

    public BenchmarkConfig withOverrides(Integer subject, List<String> peerGroups, Integer quarters,
                                         Path outputDir, Path cacheDir, Boolean healEnabled) {
        return new BenchmarkConfig(apiKey,
                subject == null ? this.subject : subject,
                peerGroups == null || peerGroups.isEmpty() ? this.peerGroups : peerGroups,
                quarters == null ? this.quarters : quarters,
                outputDir == null ? this.outputDir : outputDir,
                cacheDir == null ? this.cacheDir : cacheDir,
                fdicBase, ffiecUrl, workers, requestSpacingMillis,
                healEnabled == null ? this.healEnabled : healEnabled,
                healPeriods, healParallelism, ttmWindow, longRunWindow, fiscalYearStartMonth);
    }
}
