package io.peerbench.bank.ffiec;

import java.time.LocalDate;

/**
 * Downloads the bulk archive of one reporting period.
 */
public interface BulkDownloader {
    /** Returns a {@code DOWNLOADED} state holding the archive, or a {@code FAILED} state; never throws for remote errors. */
    BulkSessionState download(LocalDate period) throws InterruptedException;
}
