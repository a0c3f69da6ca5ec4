package io.peerbench.bank.derive;

import io.peerbench.bank.model.InstitutionTable;
import io.peerbench.bank.model.MetricFrame;

import java.util.ArrayList;
import java.util.List;

/**
 * Mean of the last {@code window} observations of every metric, for institutions with at least that many
 * observations. A metric with a gap inside the window is null.
 */
public class LongRunAverages {
    public static final int DEFAULT_WINDOW = 8;

    private final int window;

    public LongRunAverages(int window) {
        if (window < 1) throw new IllegalArgumentException("window must be positive: " + window);
        this.window = window;
    }

    public InstitutionTable compute(MetricFrame frame) {
        InstitutionTable out = new InstitutionTable();
        List<String> columns = new ArrayList<>(frame.columns());
        for (int cert : frame.certs()) {
            if (frame.periods(cert).size() < window) continue;
            out.setName(cert, frame.name(cert));
            for (String column : columns) {
                List<Double> series = frame.series(cert, column);
                List<Double> means = RollingWindows.mean(series, window);
                out.put(cert, column, means.get(means.size() - 1));
            }
        }
        return out;
    }
}
