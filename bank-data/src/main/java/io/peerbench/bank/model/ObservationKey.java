package io.peerbench.bank.model;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

/**
 * (institution, quarter-end) key shared by raw, resolved and derived tables. Orders by cert, then period.
 */
public record ObservationKey(int cert, LocalDate period) implements Comparable<ObservationKey> {
    private static final Comparator<ObservationKey> ORDER =
            Comparator.comparingInt(ObservationKey::cert).thenComparing(ObservationKey::period);

    public ObservationKey {
        Objects.requireNonNull(period, "period");
    }

    @Override
    public int compareTo(ObservationKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return cert + "@" + period;
    }
}
