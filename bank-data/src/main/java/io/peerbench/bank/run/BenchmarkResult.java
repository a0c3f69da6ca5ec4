package io.peerbench.bank.run;

import io.peerbench.bank.derive.CoverageReport;
import io.peerbench.bank.derive.MetricsDerivationEngine.YtdGapFlag;
import io.peerbench.bank.fdic.FetchReport;
import io.peerbench.bank.ffiec.HealingReport;
import io.peerbench.bank.model.Institution;
import io.peerbench.bank.model.InstitutionTable;
import io.peerbench.bank.model.MetricFrame;
import io.peerbench.bank.peer.PercentileRecord;

import java.util.List;
import java.util.Map;

/**
 * Everything one benchmark run produces.
 */
public record BenchmarkResult(
        int subject,
        MetricFrame dataset,
        Map<Integer, Institution> institutions,
        List<Institution> composites,
        List<PercentileRecord> peerComparison,
        InstitutionTable latestSnapshot,
        InstitutionTable longRunAverages,
        CoverageReport coverage,
        FetchReport fetchReport,
        HealingReport healingReport,
        List<YtdGapFlag> ytdGapFlags
) {
}
