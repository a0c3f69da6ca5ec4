package io.peerbench.bank.ffiec;

/** One recovered cell of the bulk archive. */
public record BulkObservation(int cert, String field, double value) {
}
