package io.peerbench.bank.output;

import io.peerbench.bank.derive.CoverageReport;
import io.peerbench.bank.derive.MetricsDerivationEngine.YtdGapFlag;
import io.peerbench.bank.ffiec.HealingReport;
import io.peerbench.bank.model.Institution;
import io.peerbench.bank.model.InstitutionTable;
import io.peerbench.bank.model.MetricFrame;
import io.peerbench.bank.model.ObservationKey;
import io.peerbench.bank.peer.GroupStats;
import io.peerbench.bank.peer.PercentileRecord;
import io.peerbench.bank.run.BenchmarkResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes each result table as a CSV file in the output directory.
 */
public class CsvTableWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(CsvTableWriter.class);

    public static final String DATASET = "dataset.csv";
    public static final String PEER_COMPARISON = "peer_comparison.csv";
    public static final String LATEST_SNAPSHOT = "latest_snapshot.csv";
    public static final String LONG_RUN = "long_run_averages.csv";
    public static final String COVERAGE = "field_coverage.csv";
    public static final String RUN_REPORT = "run_report.csv";

    private final Path outDir;

    public CsvTableWriter(Path outDir) throws IOException {
        this.outDir = outDir;
        Files.createDirectories(outDir);
    }

    public List<Path> writeAll(BenchmarkResult result) throws IOException {
        List<Path> written = new ArrayList<>();
        Map<Integer, Institution> institutions = new LinkedHashMap<>(result.institutions());
        result.composites().forEach(c -> institutions.put(c.cert(), c));
        written.add(writeDataset(result.dataset(), institutions));
        written.add(writePeerComparison(result.peerComparison()));
        written.add(writeInstitutionTable(LATEST_SNAPSHOT, result.latestSnapshot()));
        written.add(writeInstitutionTable(LONG_RUN, result.longRunAverages()));
        written.add(writeCoverage(result.coverage()));
        written.add(writeRunReport(result.fetchReport().failures(), result.healingReport(), result.ytdGapFlags()));
        LOGGER.info("Wrote {} table(s) to {}", written.size(), outDir);
        return written;
    }

    public Path writeDataset(MetricFrame frame, Map<Integer, Institution> institutions) throws IOException {
        List<String> columns = new ArrayList<>(frame.columns());
        Path out = outDir.resolve(DATASET);
        try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            List<String> header = new ArrayList<>(List.of("CERT", "REPDTE", "NAME", "HQ_STATE"));
            header.addAll(columns);
            line(w, header);
            for (ObservationKey key : frame.keys()) {
                Institution inst = institutions.get(key.cert());
                List<String> cells = new ArrayList<>();
                cells.add(Integer.toString(key.cert()));
                cells.add(key.period().toString());
                cells.add(frame.name(key.cert()));
                cells.add(inst == null ? "" : inst.hqState());
                Map<String, Double> row = frame.row(key);
                for (String c : columns) cells.add(number(row.get(c)));
                line(w, cells);
            }
        }
        return out;
    }

    public Path writePeerComparison(List<PercentileRecord> records) throws IOException {
        List<String> groups = new ArrayList<>();
        Map<String, String> shortNames = new LinkedHashMap<>();
        for (PercentileRecord r : records) {
            for (GroupStats g : r.groups()) {
                if (!shortNames.containsKey(g.groupKey())) {
                    shortNames.put(g.groupKey(), g.shortName());
                    groups.add(g.groupKey());
                }
            }
        }
        Path out = outDir.resolve(PEER_COMPARISON);
        try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            List<String> header = new ArrayList<>(List.of("Metric Code", "Metric", "Subject"));
            for (String g : groups) {
                String s = shortNames.get(g);
                header.addAll(List.of(s + " Count", s + " Mean", s + " Median", s + " P25", s + " P75", s + " Percentile"));
            }
            header.add("Performance");
            line(w, header);
            for (PercentileRecord r : records) {
                Map<String, GroupStats> byKey = new LinkedHashMap<>();
                r.groups().forEach(g -> byKey.put(g.groupKey(), g));
                List<String> cells = new ArrayList<>(List.of(r.metric(), r.metricName(), number(r.subjectValue())));
                for (String g : groups) {
                    GroupStats s = byKey.get(g);
                    if (s == null) {
                        cells.addAll(List.of("", "", "", "", "", ""));
                        continue;
                    }
                    cells.addAll(List.of(Integer.toString(s.count()), number(s.mean()), number(s.median()),
                            number(s.p25()), number(s.p75()), number(s.percentile())));
                }
                cells.add(r.flagLabel());
                line(w, cells);
            }
        }
        return out;
    }

    public Path writeInstitutionTable(String fileName, InstitutionTable table) throws IOException {
        List<String> columns = new ArrayList<>(table.columns());
        Path out = outDir.resolve(fileName);
        try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            List<String> header = new ArrayList<>(List.of("CERT", "NAME"));
            header.addAll(columns);
            line(w, header);
            for (int cert : table.certs()) {
                List<String> cells = new ArrayList<>(List.of(Integer.toString(cert), nullToEmpty(table.name(cert))));
                for (String c : columns) cells.add(number(table.get(cert, c)));
                line(w, cells);
            }
        }
        return out;
    }

    public Path writeCoverage(CoverageReport report) throws IOException {
        Path out = outDir.resolve(COVERAGE);
        try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            line(w, List.of("Field", "Description", "Status", "Coverage %"));
            for (CoverageReport.Entry e : report.entries()) {
                line(w, List.of(e.field(), nullToEmpty(e.description()), e.status().name(),
                        String.format(Locale.ROOT, "%.1f", e.coveragePct())));
            }
        }
        return out;
    }

    /** One line per notable event: skipped institutions, bulk period outcomes and YTD gaps. */
    public Path writeRunReport(Map<Integer, String> failures, HealingReport healing, List<YtdGapFlag> flags)
            throws IOException {
        Path out = outDir.resolve(RUN_REPORT);
        try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            line(w, List.of("Kind", "CERT", "Period", "Field", "Status", "Detail"));
            for (Map.Entry<Integer, String> f : failures.entrySet()) {
                line(w, List.of("FETCH_FAILURE", f.getKey().toString(), "", "", "FAILED", nullToEmpty(f.getValue())));
            }
            for (HealingReport.PeriodOutcome p : healing.periods()) {
                line(w, List.of("BULK_PERIOD", "", p.period().toString(), "", p.status().name(),
                        p.cellsMerged() + " cell(s) merged" + (p.detail() == null || p.detail().isBlank() ? "" : "; " + p.detail())));
            }
            for (YtdGapFlag g : flags) {
                line(w, List.of("YTD_GAP", Integer.toString(g.cert()), g.period().toString(), g.field(), "REVIEW",
                        "quarterly value spans more than one quarter"));
            }
        }
        return out;
    }

    private static void line(Writer w, List<String> cells) throws IOException {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(escape(cells.get(i)));
        }
        sb.append('\n');
        w.write(sb.toString());
    }

    static String escape(String cell) {
        if (cell == null) return "";
        if (cell.indexOf(',') < 0 && cell.indexOf('"') < 0 && cell.indexOf('\n') < 0) return cell;
        return '"' + cell.replace("\"", "\"\"") + '"';
    }

    static String number(Double v) {
        if (v == null || v.isNaN()) return "";
        if (v == Math.rint(v) && Math.abs(v) < 1e15) return Long.toString(v.longValue());
        return Double.toString(v);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
