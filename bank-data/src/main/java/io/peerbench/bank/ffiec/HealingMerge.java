package io.peerbench.bank.ffiec;

/**
 * Cell fusion rule for recovered values: fill an absent cell, or replace an exact zero with a present
 * non-zero value. A present non-zero value is never replaced.
 */
public final class HealingMerge {
    private HealingMerge() {}

    public static Double merge(Double existing, Double recovered) {
        if (existing == null) return recovered;
        if (existing == 0.0 && recovered != null && recovered != 0.0) return recovered;
        return existing;
    }
}
