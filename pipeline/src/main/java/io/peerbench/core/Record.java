package io.peerbench.core;

/**
 * Carries a payload with the source-assigned sequence number used to restore input order at the sink.
 * {@code subSeq} orders the outputs a transform fans out from one input.
 */
public record Record<T>(long seq, int subSeq, T payload) implements Comparable<Record<?>> {

    public static <T> Record<T> of(long seq, T payload) { return new Record<>(seq, 0, payload); }

    public <R> Record<R> withPayload(R next) { return new Record<>(seq, subSeq, next); }

    @Override
    public int compareTo(Record<?> o) {
        int c = Long.compare(this.seq, o.seq);
        if (c != 0) return c;
        return Integer.compare(this.subSeq, o.subSeq);
    }
}
