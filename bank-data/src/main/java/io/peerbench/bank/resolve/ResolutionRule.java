package io.peerbench.bank.resolve;

import java.util.List;

/** Ordered candidates for one metric; earlier candidates take precedence. */
public record ResolutionRule(String metric, List<Candidate> candidates) {
    public ResolutionRule {
        if (candidates.isEmpty()) throw new IllegalArgumentException("rule for " + metric + " has no candidates");
        candidates = List.copyOf(candidates);
    }

    public static ResolutionRule of(String metric, Candidate... candidates) {
        return new ResolutionRule(metric, List.of(candidates));
    }

    /** Shorthand for a rule made only of raw fields. */
    public static ResolutionRule fields(String metric, String... codes) {
        Candidate[] c = new Candidate[codes.length];
        for (int i = 0; i < codes.length; i++) c[i] = Candidate.raw(codes[i]);
        return of(metric, c);
    }
}
