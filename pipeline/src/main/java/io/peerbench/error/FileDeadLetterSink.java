package io.peerbench.error;

import io.peerbench.core.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

/**
 * Appends one JSON line per failed record: time, stage, seq, payload and error.
 */
public class FileDeadLetterSink<T> implements DeadLetterSink<T> {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileDeadLetterSink.class);

    private final Path file;

    public FileDeadLetterSink(Path file) throws IOException {
        this.file = file;
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    @Override
    public synchronized void acceptFailure(String stage, Record<T> record, Exception e) {
        String json = String.format(
                "{\"ts\":\"%s\",\"stage\":\"%s\",\"seq\":%d,\"payload\":\"%s\",\"error\":\"%s\"}%n",
                Instant.now(), stage, record == null ? -1 : record.seq(),
                record == null ? "" : escape(String.valueOf(record.payload())),
                escape(e.toString())
        );
        try {
            Files.writeString(file, json, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException io) {
            LOGGER.error("Could not append dead letter to {}", file, io);
            throw new UncheckedIOException(io);
        }
    }

    public Path file() { return file; }

    static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
