package io.peerbench.bank.resolve;

/**
 * Read access to one (institution, period) row while its rules are being evaluated.
 * Values resolved earlier in the pass shadow the raw field of the same code.
 */
public interface ResolutionContext {
    /** The value for the code, or null if absent. */
    Double value(String code);

    default double valueOrZero(String code) {
        Double v = value(code);
        return v == null ? 0.0 : v;
    }
}
