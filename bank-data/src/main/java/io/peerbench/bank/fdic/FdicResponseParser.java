package io.peerbench.bank.fdic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.peerbench.bank.error.TransientFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the {@code {"data":[{"data":{...}}]}} envelope shared by the BankFind endpoints.
 */
final class FdicResponseParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(FdicResponseParser.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Set<String> NON_NUMERIC = Set.of("CERT", "REPDTE", "NAME", "ID");

    private FdicResponseParser() {}

    static List<RawRow> financials(String body, int requestedCert) throws TransientFetchException {
        List<RawRow> rows = new ArrayList<>();
        for (JsonNode item : records(body)) {
            JsonNode dateNode = item.get("REPDTE");
            if (dateNode == null || dateNode.isNull()) {
                LOGGER.warn("Skipping row without REPDTE for cert {}", requestedCert);
                continue;
            }
            LocalDate period = ReportDates.normalize(dateNode.asText());
            int cert = item.hasNonNull("CERT") ? item.get("CERT").asInt(requestedCert) : requestedCert;
            String name = item.hasNonNull("NAME") ? item.get("NAME").asText() : null;
            Map<String, Double> values = new HashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> f = fields.next();
                if (NON_NUMERIC.contains(f.getKey())) continue;
                Double v = number(f.getValue());
                if (v != null) values.put(f.getKey(), v);
            }
            rows.add(new RawRow(cert, period, name, values));
        }
        return rows;
    }

    /** Text values of one attribute across all records, nulls and blanks skipped. */
    static List<String> attribute(String body, String field) throws TransientFetchException {
        List<String> out = new ArrayList<>();
        for (JsonNode item : records(body)) {
            JsonNode v = item.get(field);
            if (v != null && !v.isNull() && !v.asText().isBlank()) out.add(v.asText().trim());
        }
        return out;
    }

    private static List<JsonNode> records(String body) throws TransientFetchException {
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TransientFetchException("malformed JSON response: " + e.getOriginalMessage(), e);
        }
        List<JsonNode> out = new ArrayList<>();
        JsonNode data = root == null ? null : root.get("data");
        if (data == null || !data.isArray()) return out;
        for (JsonNode wrapper : data) {
            JsonNode inner = wrapper.get("data");
            if (inner != null && inner.isObject()) out.add(inner);
        }
        return out;
    }

    private static Double number(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isNumber()) return node.asDouble();
        if (node.isTextual()) {
            String s = node.asText().trim().replace(",", "");
            if (s.isEmpty()) return null;
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
