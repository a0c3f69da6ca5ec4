package io.peerbench.bank.derive;

import java.util.List;

/**
 * The eight private-bank lending segments.
 */
public final class CategoryTaxonomy {
    private CategoryTaxonomy() {}

    public static List<LoanCategory> defaults() {
        return List.of(
                new LoanCategory("SBL", List.of("LNOTHPCS"), List.of(), List.of(), List.of(), List.of()),
                new LoanCategory("Fund_Finance", List.of("LNOTHNONDEP"),
                        List.of(), List.of("P3NDFI"), List.of("P9NDFI"), List.of("NANDFI")),
                new LoanCategory("Wealth_Resi", List.of("LNRERES", "LNRELOC"),
                        List.of("NTRERES", "NTRELOC"), List.of("P3RERES", "P3RELOC"),
                        List.of("P9RERES", "P9RELOC"), List.of("NARERES", "NARELOC")),
                new LoanCategory("Corp_CI", List.of("LNCI"),
                        List.of("NTCI"), List.of("P3CI"), List.of("P9CI"), List.of("NACI")),
                new LoanCategory("CRE_OO", List.of("LNRENROW"),
                        List.of("NTRENROT"), List.of("P3RENROW"), List.of("P9RENROW"), List.of("NARENROW")),
                new LoanCategory("CRE_Investment", List.of("LNRECONS", "LNREMULT", "LNRENROT"),
                        List.of("NTRECONS", "NTREMULT"), List.of("P3RECONS", "P3LREMUL"),
                        List.of("P9RECONS", "P9REMULT"), List.of("NARECONS", "NAREMULT")),
                new LoanCategory("Consumer_Auto", List.of("LNAUTO"),
                        List.of("NTAUTO"), List.of("P3AUTO"), List.of("P9AUTO"), List.of("NAAUTO")),
                new LoanCategory("Consumer_Other", List.of("LNCONOTHX", "LNCRCD"),
                        List.of("NTCON", "NTCRCD"), List.of("P3CON", "P3CRCD"),
                        List.of("P9CON", "P9CRCD"), List.of("NACON", "NACRCD")));
    }
}
