package io.peerbench.bank.derive;

import java.util.List;

/**
 * A lending segment and the fields summed into its balance, charge-offs, past-due and nonaccrual amounts.
 * Charge-off fields are year-to-date codes; their quarterly {@code _Q} forms are summed.
 */
public record LoanCategory(String key,
                           List<String> balance,
                           List<String> nco,
                           List<String> pd30,
                           List<String> pd90,
                           List<String> nonaccrual) {
    public LoanCategory {
        balance = List.copyOf(balance);
        nco = List.copyOf(nco);
        pd30 = List.copyOf(pd30);
        pd90 = List.copyOf(pd90);
        nonaccrual = List.copyOf(nonaccrual);
    }

    public String balanceColumn() { return key + "_Balance"; }
    public String ncoColumn() { return key + "_NCO"; }
    public String pd30Column() { return key + "_PD30"; }
    public String pd90Column() { return key + "_PD90"; }
    public String nonaccrualColumn() { return key + "_NA"; }
}
