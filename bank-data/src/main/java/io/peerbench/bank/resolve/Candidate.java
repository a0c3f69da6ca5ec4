package io.peerbench.bank.resolve;

import java.util.function.Function;

/**
 * One source a metric may be resolved from: either a raw field or a computation over the row.
 */
public interface Candidate {
    Double evaluate(ResolutionContext row);

    static Candidate raw(String code) {
        return new RawField(code);
    }

    static Candidate derived(String description, Function<ResolutionContext, Double> fn) {
        return new Derived(description, fn);
    }

    record RawField(String code) implements Candidate {
        @Override
        public Double evaluate(ResolutionContext row) {
            return row.value(code);
        }

        @Override
        public String toString() {
            return code;
        }
    }

    record Derived(String description, Function<ResolutionContext, Double> fn) implements Candidate {
        @Override
        public Double evaluate(ResolutionContext row) {
            return fn.apply(row);
        }

        @Override
        public String toString() {
            return "derived(" + description + ")";
        }
    }
}
