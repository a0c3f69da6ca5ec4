package io.peerbench.core;

import java.util.List;

/**
 * Transform converts an input record into zero or more output records.
 * Outputs keep the input's seq; subSeq orders them.
 */
@FunctionalInterface
public interface Transform<I, O> {
    List<Record<O>> apply(Record<I> input) throws Exception;

    /** Lifts a one-to-one function into a transform; a null result emits nothing. */
    static <I, O> Transform<I, O> mapping(Mapper<I, O> fn) {
        return in -> {
            O out = fn.map(in.payload());
            return out == null ? List.of() : List.of(in.withPayload(out));
        };
    }

    @FunctionalInterface
    interface Mapper<I, O> {
        O map(I input) throws Exception;
    }
}
