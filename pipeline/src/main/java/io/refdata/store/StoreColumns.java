package io.refdata.store;

import io.refdata.dataset.Column;
import io.refdata.dataset.ColumnType;
import io.refdata.dataset.SchemaException;
import io.refdata.dataset.TypedDataset;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * The three columns every stored row carries: a constant source tag, a naive timestamp and the month partition.
 */
public final class StoreColumns {
    public static final String SYMBOL = "symbol";
    public static final String DT = "dt";
    public static final String PARTITION_DT = "partition_dt";

    public static final List<Column> COLUMNS = List.of(
            Column.of(SYMBOL, ColumnType.STRING),
            Column.of(DT, ColumnType.TIMESTAMP),
            Column.of(PARTITION_DT, ColumnType.DATE));

    private StoreColumns() {}

    public static void require(TypedDataset rows) throws SchemaException {
        for (Column c : COLUMNS) {
            if (!rows.hasColumn(c.name())) {
                throw new SchemaException("column " + c.name() + " must be given with type " + c.type().label());
            }
            if (rows.column(c.name()).type() != c.type()) {
                throw new SchemaException("column " + c.name() + " must have type " + c.type().label()
                        + " but is " + rows.column(c.name()).type().label());
            }
        }
    }

    /**
     * Appends symbol, dt (start of the row date) and partition_dt (first day of its month) derived from
     * {@code dateColumn}.
     *
     * @throws SchemaException when a row has no date to derive them from
     */
    public static TypedDataset decorate(TypedDataset data, String dateColumn, String symbol) throws SchemaException {
        int di = data.indexOf(dateColumn);
        for (int r = 0; r < data.size(); r++) {
            if (!(data.rows().get(r).get(di) instanceof LocalDate)) {
                throw new SchemaException("row " + r + " has no " + dateColumn + " to partition by");
            }
        }
        return data.withColumns(COLUMNS, row -> {
            LocalDate d = (LocalDate) row.get(di);
            return TypedDataset.row(symbol, d.atStartOfDay(), partitionOf(d));
        });
    }

    public static LocalDate partitionOf(LocalDate d) {
        return d.withDayOfMonth(1);
    }

    static LocalDateTime dtOf(TypedDataset rows, int r) {
        return (LocalDateTime) rows.rows().get(r).get(rows.indexOf(DT));
    }
}
