package io.peerbench.bank.fdic;

import io.peerbench.bank.error.TransientFetchException;

import java.util.List;

/**
 * Raw JSON access to the BankFind endpoints used by the run.
 */
public interface FdicApi {
    /** Newest-first quarterly financials for one institution. */
    String financials(int cert, List<String> fields, int limit) throws TransientFetchException, InterruptedException;

    /** Institution profile ({@code NAME}, {@code STALP}). */
    String institution(int cert) throws TransientFetchException, InterruptedException;

    /** Branch locations ({@code STALP}). */
    String locations(int cert) throws TransientFetchException, InterruptedException;
}
