package io.peerbench.bank.ffiec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntPredicate;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Reads the tab-delimited schedule files of a call report archive. Files are Latin-1; the header is the
 * first of the leading lines that names the certificate column, and description rows after it are skipped.
 */
public class TabDelimitedArchiveParser implements ArchiveParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(TabDelimitedArchiveParser.class);

    static final String CERT_COLUMN = "FDIC Certificate Number";
    private static final List<String> MEMBER_MARKERS = List.of("Schedule RC-C I", "Schedule RI-C");
    private static final int HEADER_SEARCH_LINES = 5;

    private final List<String> targetFields;

    public TabDelimitedArchiveParser() {
        this(BulkFields.TARGET_FIELDS);
    }

    public TabDelimitedArchiveParser(List<String> targetFields) {
        this.targetFields = List.copyOf(targetFields);
    }

    @Override
    public List<BulkObservation> parse(byte[] archive, IntPredicate certFilter) throws IOException {
        Map<Integer, Map<String, Double>> byCert = new LinkedHashMap<>();
        int members = 0;
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (entry.isDirectory() || !isScheduleMember(entry.getName())) continue;
                members++;
                String text = new String(zip.readAllBytes(), StandardCharsets.ISO_8859_1);
                readMember(entry.getName(), text, certFilter, byCert);
            }
        }
        if (members == 0) {
            throw new IOException("archive holds no RC-C Part I or RI-C schedule");
        }
        List<BulkObservation> out = new ArrayList<>();
        byCert.forEach((cert, values) -> values.forEach((field, v) -> out.add(new BulkObservation(cert, field, v))));
        LOGGER.debug("Parsed {} schedule file(s): {} cell(s) for {} institution(s)", members, out.size(), byCert.size());
        return out;
    }

    static boolean isScheduleMember(String name) {
        if (!name.endsWith(".txt")) return false;
        for (String marker : MEMBER_MARKERS) {
            if (name.contains(marker)) return true;
        }
        return false;
    }

    private void readMember(String member, String text, IntPredicate certFilter, Map<Integer, Map<String, Double>> byCert)
            throws IOException {
        String[] lines = text.split("\r?\n");
        int headerAt = -1;
        List<String> header = null;
        for (int i = 0; i < Math.min(HEADER_SEARCH_LINES, lines.length); i++) {
            List<String> cells = split(lines[i]);
            if (cells.contains(CERT_COLUMN)) {
                headerAt = i;
                header = cells;
                break;
            }
        }
        if (header == null) throw new IOException(member + ": no header naming '" + CERT_COLUMN + "'");

        int certIdx = header.indexOf(CERT_COLUMN);
        Map<String, Integer> columns = new LinkedHashMap<>();
        Set<String> wanted = new HashSet<>(targetFields);
        for (int i = 0; i < header.size(); i++) {
            if (wanted.contains(header.get(i))) columns.putIfAbsent(header.get(i), i);
        }

        for (int i = headerAt + 1; i < lines.length; i++) {
            List<String> cells = split(lines[i]);
            if (certIdx >= cells.size()) continue;
            String certText = cells.get(certIdx);
            if (certText.isEmpty() || !certText.chars().allMatch(Character::isDigit)) continue;
            int cert = Integer.parseInt(certText);
            if (!certFilter.test(cert)) continue;
            for (Map.Entry<String, Integer> col : columns.entrySet()) {
                if (col.getValue() >= cells.size()) continue;
                Double v = number(cells.get(col.getValue()));
                if (v != null) byCert.computeIfAbsent(cert, c -> new LinkedHashMap<>()).put(col.getKey(), v);
            }
        }
    }

    static List<String> split(String line) {
        List<String> out = new ArrayList<>();
        for (String cell : line.split("\t", -1)) {
            String s = cell.trim();
            if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) s = s.substring(1, s.length() - 1).trim();
            out.add(s);
        }
        return out;
    }

    private static Double number(String raw) {
        String s = raw.replace(",", "").trim();
        if (s.isEmpty()) return null;
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
