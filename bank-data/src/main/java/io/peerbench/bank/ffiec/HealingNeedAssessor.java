package io.peerbench.bank.ffiec;

import io.peerbench.bank.model.ObservationKey;
import io.peerbench.bank.model.RawTable;

import java.time.LocalDate;
import java.util.List;

/**
 * Decides per period whether the primary data is thin enough to warrant a bulk download.
 */
public class HealingNeedAssessor {
    private final List<String> canaryFields;

    public HealingNeedAssessor() {
        this(BulkFields.CANARY_FIELDS);
    }

    public HealingNeedAssessor(List<String> canaryFields) {
        this.canaryFields = List.copyOf(canaryFields);
    }

    /** False for a period without rows, or when more than half of the canary cells are present and non-zero. */
    public boolean needsHealing(RawTable table, LocalDate period) {
        List<ObservationKey> keys = table.keysForPeriod(period);
        if (keys.isEmpty() || canaryFields.isEmpty()) return false;
        long total = (long) keys.size() * canaryFields.size();
        long filled = 0;
        for (ObservationKey key : keys) {
            for (String field : canaryFields) {
                Double v = table.get(key, field);
                if (v != null && v != 0.0) filled++;
            }
        }
        return filled * 2 <= total;
    }
}
