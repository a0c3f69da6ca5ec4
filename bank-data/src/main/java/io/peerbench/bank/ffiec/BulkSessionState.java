package io.peerbench.bank.ffiec;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of one bulk-download handshake. Only {@link BulkDownloadProtocol} creates successors.
 *
 * @param tokens       hidden form fields from the last page seen
 * @param archive      downloaded archive bytes, set from {@code DOWNLOADED} on
 * @param observations parsed cells, set in {@code PARSED}
 */
public record BulkSessionState(Phase phase,
                               LocalDate targetDate,
                               Map<String, String> tokens,
                               byte[] archive,
                               List<BulkObservation> observations,
                               String failureReason) {
    public enum Phase { INIT, DATE_SELECTED, DOWNLOADED, PARSED, FAILED }

    public BulkSessionState {
        tokens = Map.copyOf(tokens);
        observations = List.copyOf(observations);
    }

    public static BulkSessionState init(LocalDate targetDate) {
        return new BulkSessionState(Phase.INIT, targetDate, Map.of(), null, List.of(), null);
    }

    public boolean isFailed() {
        return phase == Phase.FAILED;
    }
}
