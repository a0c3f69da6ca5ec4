package io.peerbench.bank.ffiec;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Per-period outcome of a healing pass, newest period first.
 */
public record HealingReport(List<PeriodOutcome> periods) {
    public enum Status { SKIPPED, CACHED, PARSED, FAILED }

    /**
     * @param cellsMerged cells of the raw table the recovered values changed
     * @param detail      failure reason, or null
     */
    public record PeriodOutcome(LocalDate period, Status status, int cellsMerged, String detail) {
    }

    public HealingReport {
        periods = List.copyOf(periods);
    }

    public Optional<Status> statusOf(LocalDate period) {
        return periods.stream().filter(p -> p.period().equals(period)).map(PeriodOutcome::status).findFirst();
    }

    public List<LocalDate> failedPeriods() {
        return periods.stream().filter(p -> p.status() == Status.FAILED).map(PeriodOutcome::period).collect(Collectors.toList());
    }

    public int totalMerged() {
        return periods.stream().mapToInt(PeriodOutcome::cellsMerged).sum();
    }
}
