package io.peerbench.bank.error;

/**
 * The separately fetched field came back with rows but none of them matched a primary row on
 * (institution, report date). Treated as a systemic fault that ends the run.
 */
public class JoinIntegrityException extends RuntimeException {
    public JoinIntegrityException(String message) {
        super(message);
    }
}
