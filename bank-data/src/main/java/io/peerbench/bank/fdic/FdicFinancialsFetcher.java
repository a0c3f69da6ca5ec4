package io.peerbench.bank.fdic;

import io.peerbench.bank.error.JoinIntegrityException;
import io.peerbench.bank.error.TransientFetchException;
import io.peerbench.bank.model.ObservationKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fetches one institution's quarterly series. The API rejects {@value #SEPARATE_FIELD} inside a wide
 * field list, so that field is requested on its own and joined back on (cert, report date).
 */
public class FdicFinancialsFetcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(FdicFinancialsFetcher.class);

    static final String SEPARATE_FIELD = "LNCI";
    private static final int SAMPLE_KEYS = 3;

    private final FdicApi api;

    public FdicFinancialsFetcher(FdicApi api) {
        this.api = api;
    }

    public List<RawRow> fetchSeries(int cert, List<String> fields, int periodLimit)
            throws TransientFetchException, InterruptedException {
        Set<String> main = new LinkedHashSet<>();
        main.add("CERT");
        main.add("REPDTE");
        main.addAll(fields);
        boolean separate = main.remove(SEPARATE_FIELD);

        List<RawRow> rows = FdicResponseParser.financials(api.financials(cert, new ArrayList<>(main), periodLimit), cert);
        LOGGER.debug("CERT {}: {} quarter(s) from the main request", cert, rows.size());
        if (!separate) return rows;

        List<String> narrow = List.of("CERT", "REPDTE", SEPARATE_FIELD);
        List<RawRow> secondary = FdicResponseParser.financials(api.financials(cert, narrow, periodLimit), cert);
        return join(cert, rows, secondary, SEPARATE_FIELD);
    }

    static List<RawRow> join(int cert, List<RawRow> primary, List<RawRow> secondary, String field) {
        if (secondary.isEmpty()) {
            LOGGER.warn("CERT {}: no {} rows returned; field stays absent", cert, field);
            return primary;
        }
        Map<ObservationKey, Double> recovered = new LinkedHashMap<>();
        for (RawRow r : secondary) {
            Double v = r.values().get(field);
            recovered.put(new ObservationKey(r.cert(), r.period()), v);
        }
        List<RawRow> out = new ArrayList<>(primary.size());
        int matched = 0;
        for (RawRow r : primary) {
            ObservationKey key = new ObservationKey(r.cert(), r.period());
            if (recovered.containsKey(key)) {
                matched++;
                out.add(r.with(field, recovered.get(key)));
            } else {
                out.add(r);
            }
        }
        if (matched == 0 && !primary.isEmpty()) {
            throw new JoinIntegrityException(String.format(
                    "CERT %d: none of %d %s row(s) matched %d primary row(s); primary keys %s, %s keys %s",
                    cert, secondary.size(), field, primary.size(),
                    sample(primary.stream().map(r -> new ObservationKey(r.cert(), r.period())).collect(Collectors.toList())),
                    field, sample(new ArrayList<>(recovered.keySet()))));
        }
        if (matched < secondary.size()) {
            LOGGER.info("CERT {}: {} of {} {} row(s) joined", cert, matched, secondary.size(), field);
        }
        return out;
    }

    private static String sample(List<ObservationKey> keys) {
        return keys.stream().limit(SAMPLE_KEYS).map(ObservationKey::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
