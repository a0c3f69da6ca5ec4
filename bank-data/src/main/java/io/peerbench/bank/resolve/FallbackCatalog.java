package io.peerbench.bank.resolve;

import java.util.ArrayList;
import java.util.List;

/**
 * Default resolution rules. Legacy codes map onto the authoritative call report series, consolidated
 * before domestic.
 */
public final class FallbackCatalog {
    /** Suffix and consolidated/domestic codes of the RI-C allowance breakdown. */
    public static final String[][] RIC_SOURCES = {
            {"Constr", "RCFDJ466", "RCONJ466"},
            {"CommRE", "RCFDJ467", "RCONJ467"},
            {"Resi", "RCFDJ468", "RCONJ468"},
            {"Comm", "RCFDJ469", "RCONJ469"},
            {"Card", "RCFDJ470", "RCONJ470"},
            {"OthCons", "RCFDJ471", "RCONJ471"},
            {"Unalloc", "RCFDJ472", "RCONJ472"},
            {"Other", "RCFDJ474", "RCONJ474"},
    };

    private FallbackCatalog() {}

    public static String ricBest(String suffix) {
        return "RIC_" + suffix + "_Best";
    }

    public static List<ResolutionRule> defaultRules() {
        List<ResolutionRule> rules = new ArrayList<>();
        rules.add(ResolutionRule.fields("LNOTHPCS", "RCFD1545", "RCON1545", "LNOTHER"));
        rules.add(ResolutionRule.fields("LNOTHNONDEP", "RCFDJ454", "RCONJ454"));
        rules.add(ResolutionRule.fields("LNCONAUTO", "LNAUTO"));
        rules.add(ResolutionRule.fields("LNCONCC", "LNCRCD"));
        rules.add(ResolutionRule.of("LNCONOTHX", Candidate.derived("LNCON - LNAUTO - LNCRCD, floored at 0",
                row -> Math.max(0.0, row.valueOrZero("LNCON") - row.valueOrZero("LNAUTO") - row.valueOrZero("LNCRCD")))));
        rules.add(ResolutionRule.fields("LNREOTH", "LNRENROT"));
        rules.add(ResolutionRule.fields("NALRERES", "NARERES"));
        rules.add(ResolutionRule.fields("P9RENRES", "P9RENROT"));
        rules.add(ResolutionRule.fields("Total_ACL", "RB2LNRES", "LNATRES"));
        for (String[] ric : RIC_SOURCES) {
            rules.add(ResolutionRule.fields(ricBest(ric[0]), ric[1], ric[2]));
        }
        return rules;
    }
}
