package io.peerbench.bank.fdic;

import java.util.Map;

/**
 * Outcome of a batch fetch.
 *
 * @param failures institution id to the last error message, for institutions skipped after retries
 */
public record FetchReport(int requested, Map<Integer, String> failures) {
    public FetchReport {
        failures = Map.copyOf(failures);
    }

    public int succeeded() {
        return requested - failures.size();
    }
}
