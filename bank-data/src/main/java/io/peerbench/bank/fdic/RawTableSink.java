package io.peerbench.bank.fdic;

import io.peerbench.bank.model.ObservationKey;
import io.peerbench.bank.model.RawTable;
import io.peerbench.core.BatchSink;
import io.peerbench.core.Record;
import io.peerbench.core.Sink;

import java.util.List;

/**
 * Writes fetched quarters into the shared raw table. The newest quarter's name wins.
 */
class RawTableSink implements Sink<FetchedSeries>, BatchSink<FetchedSeries> {
    private final RawTable table;

    RawTableSink(RawTable table) {
        this.table = table;
    }

    @Override
    public void accept(Record<FetchedSeries> record) {
        FetchedSeries series = record.payload();
        String name = null;
        for (RawRow row : series.rows()) {
            table.putRow(new ObservationKey(row.cert(), row.period()), row.values());
            if (name == null && row.name() != null) name = row.name();
        }
        if (name != null) table.setName(series.cert(), name);
    }

    @Override
    public void acceptBatch(List<Record<FetchedSeries>> records) {
        records.forEach(this::accept);
    }
}
