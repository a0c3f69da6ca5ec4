package io.peerbench.bank.cli;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import io.peerbench.bank.error.JoinIntegrityException;
import io.peerbench.bank.output.CsvTableWriter;
import io.peerbench.bank.run.BenchmarkConfig;
import io.peerbench.bank.run.BenchmarkModule;
import io.peerbench.bank.run.BenchmarkResult;
import io.peerbench.bank.run.BenchmarkRun;
import io.peerbench.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI that benchmarks one institution against its peer groups and writes the result tables as CSVs.
 */
@CommandLine.Command(name = "peerbench", mixinStandardHelpOptions = true, description = "Benchmark a bank against peer groups from FDIC and FFIEC call report data")
public final class BenchmarkMain implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(BenchmarkMain.class);

    static final int EXIT_FAILED = 1;
    static final int EXIT_BAD_CONFIG = 2;
    static final int EXIT_JOIN_INTEGRITY = 3;

    @CommandLine.Option(names = {"-s", "--subject"}, description = "Subject institution CERT")
    Integer subject;

    @CommandLine.Option(names = {"-g", "--group"}, description = "Peer group as KEY:Name:cert,cert,... (repeatable; replaces the built-in groups)")
    List<String> groups = new ArrayList<>();

    @CommandLine.Option(names = {"-q", "--quarters"}, description = "Quarters of history to analyze")
    Integer quarters;

    @CommandLine.Option(names = {"-o", "--out"}, description = "Output directory")
    Path outDir;

    @CommandLine.Option(names = {"-c", "--cache"}, description = "Bulk archive cache directory")
    Path cacheDir;

    @CommandLine.Option(names = "--no-heal", description = "Skip the FFIEC bulk source")
    boolean noHeal;

    public static void main(String[] args) {
        int code = new CommandLine(new BenchmarkMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        BenchmarkConfig config;
        try {
            config = BenchmarkConfig.fromEnv().withOverrides(subject, groups, quarters, outDir, cacheDir, noHeal ? Boolean.FALSE : null);
        } catch (IllegalArgumentException e) {
            LOGGER.error("Invalid configuration: {}", e.getMessage());
            return EXIT_BAD_CONFIG;
        }

        BenchmarkRun run;
        MetricRegistry registry;
        try {
            Injector injector = Guice.createInjector(new BenchmarkModule(config));
            run = injector.getInstance(BenchmarkRun.class);
            registry = injector.getInstance(MetricRegistry.class);
            run.institutionsToFetch();
        } catch (ProvisionException e) {
            if (!(e.getCause() instanceof IllegalArgumentException)) throw e;
            LOGGER.error("Invalid peer groups: {}", e.getCause().getMessage());
            return EXIT_BAD_CONFIG;
        } catch (IllegalArgumentException e) {
            LOGGER.error("Invalid institution list: {}", e.getMessage());
            return EXIT_BAD_CONFIG;
        }

        try {
            BenchmarkResult result = run.run();
            List<Path> files = new CsvTableWriter(config.outputDir()).writeAll(result);
            LOGGER.info("Saved {} table(s) for CERT {} to {}", files.size(), result.subject(), config.outputDir());
            return 0;
        } catch (JoinIntegrityException e) {
            LOGGER.error("Aborting: the two-call LNCI join failed; the data would be misaligned. {}", e.getMessage());
            return EXIT_JOIN_INTEGRITY;
        } catch (IllegalStateException e) {
            LOGGER.error("Run failed: {}", e.getMessage());
            return EXIT_FAILED;
        } finally {
            Metrics.reportOnce(registry);
        }
    }
}
