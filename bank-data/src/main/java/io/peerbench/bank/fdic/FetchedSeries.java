package io.peerbench.bank.fdic;

import java.util.List;

/** All quarters returned for one institution. */
public record FetchedSeries(int cert, List<RawRow> rows) {
    public FetchedSeries {
        rows = List.copyOf(rows);
    }
}
