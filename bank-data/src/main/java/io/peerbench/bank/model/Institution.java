package io.peerbench.bank.model;

import java.util.List;

/**
 * Static attributes of a tracked institution.
 *
 * @param operatingStates sorted state codes where the institution has offices, HQ state included
 */
public record Institution(int cert, String name, String hqState, List<String> operatingStates) {
    public static final String UNKNOWN_STATE = "N/A";

    public Institution {
        operatingStates = List.copyOf(operatingStates);
    }

    public static Institution placeholder(int cert) {
        return new Institution(cert, "Bank with CERT " + cert, UNKNOWN_STATE, List.of());
    }

    public String operatingStatesJoined() {
        return String.join(", ", operatingStates);
    }
}
