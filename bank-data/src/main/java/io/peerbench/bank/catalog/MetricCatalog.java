package io.peerbench.bank.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Short and long descriptions of every metric shown in peer comparisons, in display order.
 */
public class MetricCatalog {
    public static final String DEFAULT_RESOURCE = "/metric-catalog.json";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public record Description(String code, String shortName, String longName) {
    }

    private final Map<String, Description> entries;

    public MetricCatalog(List<Description> descriptions) {
        Map<String, Description> m = new LinkedHashMap<>();
        for (Description d : descriptions) {
            if (m.putIfAbsent(d.code(), d) != null) {
                throw new IllegalArgumentException("duplicate metric code " + d.code());
            }
        }
        this.entries = m;
    }

    public static MetricCatalog defaults() {
        return load(DEFAULT_RESOURCE);
    }

    public static MetricCatalog load(String resource) {
        try (InputStream in = MetricCatalog.class.getResourceAsStream(resource)) {
            if (in == null) throw new IllegalStateException("metric catalog not found: " + resource);
            return parse(MAPPER.readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("could not read metric catalog " + resource, e);
        }
    }

    static MetricCatalog parse(JsonNode root) {
        JsonNode metrics = root.path("metrics");
        if (!metrics.isArray()) throw new IllegalArgumentException("metric catalog has no 'metrics' array");
        List<Description> out = new ArrayList<>();
        for (JsonNode n : metrics) {
            String code = n.path("code").asText("");
            if (code.isBlank()) throw new IllegalArgumentException("metric entry without code: " + n);
            out.add(new Description(code, n.path("short").asText(code), n.path("long").asText("")));
        }
        return new MetricCatalog(out);
    }

    public List<String> codes() {
        return List.copyOf(entries.keySet());
    }

    public boolean contains(String code) {
        return entries.containsKey(code);
    }

    /** Short display name, or the code itself for unknown metrics. */
    public String shortName(String code) {
        Description d = entries.get(code);
        return d == null ? code : d.shortName();
    }

    public String longName(String code) {
        Description d = entries.get(code);
        return d == null ? null : d.longName();
    }

    /** Short name for known codes, null otherwise. */
    public String describe(String code) {
        Description d = entries.get(code);
        return d == null ? null : d.shortName();
    }
}
