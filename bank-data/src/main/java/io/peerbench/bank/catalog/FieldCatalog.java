package io.peerbench.bank.catalog;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * FDIC financial series requested for every institution. CERT and REPDTE are added by the fetcher.
 */
public final class FieldCatalog {
    private static final List<String> GROUPS = List.of(
            // balance sheet
            "ASSET,LIAB,DEP,EQ",
            // profitability
            "ROA,ROE,NIMY,EEFFR,NONIIAY,ELNATRY,EINTEXP",
            // capital
            "RBCT1CER,RBCT1J,RBCT2,RWAJ,RBCRWAJ,RB2LNRES,EQCS,EQSUR,EQUP,EQCCOMPI,EQPP",
            // reserves and funding
            "LNATRES,OTHBOR,MUTUAL,FREPP",
            // balances
            "LNLS,LNLSNET,LNCI,LNRECONS,LNREMULT,LNRENROW,LNRENROT,LNREAG,LNRERES,LNRELOC,"
                    + "LNCON,LNCRCD,LNAUTO,LNOTHER,LS,LNAG",
            // legacy balances, resolved through fallbacks
            "LNREOTH,LNOTHPCS,LNOTHNONDEP,LNCONAUTO,LNCONCC,LNCONOTHX",
            // net charge-offs
            "NTLNLS,NCLNLS,NTCI,NTRECONS,NTREMULT,NTRENROT,NTREAG,NTRENRES,NTRERES,NTRELOC,"
                    + "NTCON,NTCRCD,NTAUTO,NTLS,NTOTHER,NTAG,NTCONOTH",
            // past due 30-89
            "P3LNLS,P3CI,P3RECONS,P3LREMUL,P3RENROT,P3RENROW,P3REAG,P3RENRES,P3RERES,P3RELOC,"
                    + "P3CON,P3CRCD,P3AUTO,P3LS,P3AG,P3OTHLN,P3CONOTH,P3NDFI",
            // past due 90+
            "P9LNLS,P9CI,P9RECONS,P9REMULT,P9RENROT,P9RENROW,P9REAG,P9RENRES,P9RERES,P9RELOC,"
                    + "P9CON,P9CRCD,P9AUTO,P9LS,P9AG,P9OTHLN,P9CONOTH,P9NDFI",
            // nonaccrual
            "NACI,NARECONS,NAREMULT,NARENROT,NARENROW,NAREAG,NARENRES,NARERES,NARELOC,"
                    + "NACON,NACRCD,NAAUTO,NALS,NAAG,NAOTHLN,NACONOTH,NALRERES,NANDFI");

    public static final List<String> FDIC_FIELDS_TO_FETCH = flatten(GROUPS);

    private FieldCatalog() {}

    private static List<String> flatten(List<String> groups) {
        LinkedHashSet<String> fields = new LinkedHashSet<>();
        for (String g : groups) {
            for (String f : g.split(",")) fields.add(f.trim());
        }
        return List.copyOf(new ArrayList<>(fields));
    }
}
