package io.peerbench.bank.ffiec;

import java.util.List;

/**
 * Call report items recovered from the bulk archive: small-business and fund-finance balances plus the
 * RI-C allowance breakdown, each in its consolidated (RCFD) and domestic (RCON) form.
 */
public final class BulkFields {
    public static final List<String> TARGET_FIELDS = List.of(
            "RCFD1545", "RCON1545", "RCFDJ454", "RCONJ454",
            "RCFDJ466", "RCONJ466", "RCFDJ467", "RCONJ467",
            "RCFDJ468", "RCONJ468", "RCFDJ469", "RCONJ469",
            "RCFDJ470", "RCONJ470", "RCFDJ471", "RCONJ471",
            "RCFDJ472", "RCONJ472", "RCFDJ474", "RCONJ474");

    /** Fields whose fill rate decides whether a period needs the bulk source at all. */
    public static final List<String> CANARY_FIELDS = List.of("RCFD1545", "LNOTHPCS", "RCFDJ466");

    private BulkFields() {}
}
