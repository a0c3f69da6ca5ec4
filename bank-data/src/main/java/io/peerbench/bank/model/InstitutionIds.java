package io.peerbench.bank.model;

/**
 * Identifier ranges. Real certificates sit below {@link #COMPOSITE_BASE}; peer composites take
 * {@code COMPOSITE_BASE + displayOrder}.
 */
public final class InstitutionIds {
    public static final int COMPOSITE_BASE = 90_000;

    private InstitutionIds() {}

    public static boolean isComposite(int cert) {
        return cert > COMPOSITE_BASE;
    }

    public static int compositeId(int displayOrder) {
        if (displayOrder <= 0) throw new IllegalArgumentException("display order must be positive: " + displayOrder);
        return COMPOSITE_BASE + displayOrder;
    }

    /** Rejects ids that are not positive or that collide with the composite range. */
    public static int requireReal(int cert) {
        if (cert <= 0 || cert >= COMPOSITE_BASE) {
            throw new IllegalArgumentException("institution id must be in 1.." + (COMPOSITE_BASE - 1) + ": " + cert);
        }
        return cert;
    }
}
