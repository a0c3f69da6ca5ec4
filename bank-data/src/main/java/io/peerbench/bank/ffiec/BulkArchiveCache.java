package io.peerbench.bank.ffiec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parsed bulk cells per period in {@code ffiec-bulk-{date}.csv} ({@code cert,field,value}). Files are written
 * to a temp file and moved into place, so a reader sees either nothing or a complete file.
 * <p>
 * A file holds only the institutions that were of interest when it was written; readers filter again on merge.
 */
public class BulkArchiveCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(BulkArchiveCache.class);
    private static final String HEADER = "cert,field,value";

    private final Path dir;

    public BulkArchiveCache(Path dir) {
        this.dir = dir;
    }

    public Path fileFor(LocalDate period) {
        return dir.resolve("ffiec-bulk-" + period + ".csv");
    }

    /** Cached cells, or empty when there is no usable file. An unreadable file counts as a miss. */
    public Optional<List<BulkObservation>> read(LocalDate period) {
        Path file = fileFor(period);
        if (!Files.isRegularFile(file)) return Optional.empty();
        List<BulkObservation> out = new ArrayList<>();
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String header = br.readLine();
            if (!HEADER.equals(header)) throw new IOException("unexpected header: " + header);
            String line;
            while ((line = br.readLine()) != null) {
                if (line.isBlank()) continue;
                String[] parts = line.split(",", -1);
                if (parts.length != 3) throw new IOException("malformed line: " + line);
                out.add(new BulkObservation(Integer.parseInt(parts[0]), parts[1], Double.parseDouble(parts[2])));
            }
        } catch (IOException | NumberFormatException e) {
            LOGGER.warn("Ignoring unreadable cache file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
        return Optional.of(out);
    }

    public void write(LocalDate period, List<BulkObservation> observations) throws IOException {
        Files.createDirectories(dir);
        Path target = fileFor(period);
        Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            try (BufferedWriter w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                w.write(HEADER);
                w.newLine();
                for (BulkObservation o : observations) {
                    w.write(o.cert() + "," + o.field() + "," + o.value());
                    w.newLine();
                }
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
