package io.peerbench.bank.fdic;

import io.peerbench.bank.error.TransientFetchException;
import io.peerbench.bank.model.Institution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Looks up names and jurisdictions. Lookups never fail the run: anything missing falls back to
 * {@link Institution#placeholder(int)} values.
 */
public class InstitutionDirectory {
    private static final Logger LOGGER = LoggerFactory.getLogger(InstitutionDirectory.class);

    private final FdicApi api;

    public InstitutionDirectory(FdicApi api) {
        this.api = api;
    }

    public Institution lookup(int cert) throws InterruptedException {
        Institution fallback = Institution.placeholder(cert);
        String name = fallback.name();
        String hq = Institution.UNKNOWN_STATE;
        try {
            String body = api.institution(cert);
            List<String> names = FdicResponseParser.attribute(body, "NAME");
            List<String> states = FdicResponseParser.attribute(body, "STALP");
            if (!names.isEmpty()) name = names.get(0);
            if (!states.isEmpty()) hq = states.get(0);
        } catch (TransientFetchException e) {
            LOGGER.warn("Institution profile for CERT {} unavailable: {}", cert, e.getMessage());
        }

        TreeSet<String> operating = new TreeSet<>();
        if (!Institution.UNKNOWN_STATE.equals(hq)) operating.add(hq);
        try {
            operating.addAll(FdicResponseParser.attribute(api.locations(cert), "STALP"));
        } catch (TransientFetchException e) {
            LOGGER.warn("Branch locations for CERT {} unavailable: {}", cert, e.getMessage());
        }
        return new Institution(cert, name, hq, new ArrayList<>(operating));
    }

    public Map<Integer, Institution> lookupAll(List<Integer> certs) throws InterruptedException {
        Map<Integer, Institution> out = new LinkedHashMap<>();
        for (int cert : certs) out.put(cert, lookup(cert));
        return out;
    }
}
