package io.refdata.dataset;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Immutable table: an ordered column schema plus rows of typed cells (LocalDate, LocalDateTime, Long, Double,
 * String or null). The schema is kept even when there are no rows.
 */
public final class TypedDataset {
    private final List<Column> columns;
    private final List<List<Object>> rows;
    private final Map<String, Integer> index;

    public TypedDataset(List<Column> columns, List<List<Object>> rows) {
        this.columns = List.copyOf(columns);
        this.index = new HashMap<>();
        for (int i = 0; i < this.columns.size(); i++) {
            if (index.put(this.columns.get(i).name(), i) != null) {
                throw new IllegalArgumentException("duplicate column " + this.columns.get(i).name());
            }
        }
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            if (row.size() != this.columns.size()) {
                throw new IllegalArgumentException("row has " + row.size() + " cells, schema has " + this.columns.size());
            }
            copy.add(row(row.toArray()));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static TypedDataset empty(List<Column> columns) {
        return new TypedDataset(columns, List.of());
    }

    /** Null-tolerant unmodifiable row. */
    public static List<Object> row(Object... values) {
        return Collections.unmodifiableList(Arrays.asList(values.clone()));
    }

    public List<Column> columns() { return columns; }
    public List<List<Object>> rows() { return rows; }
    public int size() { return rows.size(); }
    public boolean isEmpty() { return rows.isEmpty(); }
    public int columnCount() { return columns.size(); }

    public List<String> columnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (Column c : columns) names.add(c.name());
        return names;
    }

    public boolean hasColumn(String name) { return index.containsKey(name); }

    public int indexOf(String name) {
        Integer i = index.get(name);
        if (i == null) throw new IllegalArgumentException("unknown column " + name + " in " + columnNames());
        return i;
    }

    public Column column(String name) { return columns.get(indexOf(name)); }

    public Object value(int row, String column) { return rows.get(row).get(indexOf(column)); }

    public List<Object> columnValues(String column) {
        int i = indexOf(column);
        List<Object> out = new ArrayList<>(rows.size());
        for (List<Object> r : rows) out.add(r.get(i));
        return out;
    }

    /** Largest non-null value of a column. */
    public Optional<Object> max(String column) {
        int i = indexOf(column);
        Object best = null;
        for (List<Object> r : rows) {
            Object v = r.get(i);
            if (v != null && (best == null || compareCells(v, best) > 0)) best = v;
        }
        return Optional.ofNullable(best);
    }

    /** Stable ascending sort on the given key columns, nulls first. */
    public TypedDataset sortedBy(List<String> keys) {
        if (keys.isEmpty() || rows.size() < 2) return this;
        int[] idx = keys.stream().mapToInt(this::indexOf).toArray();
        Comparator<List<Object>> cmp = (a, b) -> {
            for (int i : idx) {
                int c = compareCells(a.get(i), b.get(i));
                if (c != 0) return c;
            }
            return 0;
        };
        List<List<Object>> sorted = new ArrayList<>(rows);
        sorted.sort(cmp);
        return new TypedDataset(columns, sorted);
    }

    /**
     * Appends the rows of another dataset with the same schema.
     *
     * @throws SchemaException when the column lists differ in names, order or types
     */
    public TypedDataset concat(TypedDataset other) throws SchemaException {
        if (!columns.equals(other.columns)) {
            throw new SchemaException("cannot concatenate " + columns + " with " + other.columns);
        }
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        List<List<Object>> all = new ArrayList<>(rows.size() + other.rows.size());
        all.addAll(rows);
        all.addAll(other.rows);
        return new TypedDataset(columns, all);
    }

    public static TypedDataset concatAll(List<Column> columns, List<TypedDataset> parts) throws SchemaException {
        TypedDataset out = empty(columns);
        for (TypedDataset p : parts) out = out.concat(p);
        return out;
    }

    /**
     * Removes rows sharing a key with a later row. Surviving rows keep their relative order.
     */
    public TypedDataset dropDuplicatesKeepLast(List<String> keys) {
        int[] idx = keys.stream().mapToInt(this::indexOf).toArray();
        Map<List<Object>, Integer> last = new LinkedHashMap<>();
        for (int r = 0; r < rows.size(); r++) {
            Object[] key = new Object[idx.length];
            for (int k = 0; k < idx.length; k++) key[k] = rows.get(r).get(idx[k]);
            last.put(Arrays.asList(key), r);
        }
        if (last.size() == rows.size()) return this;
        boolean[] keep = new boolean[rows.size()];
        for (int r : last.values()) keep[r] = true;
        List<List<Object>> out = new ArrayList<>(last.size());
        for (int r = 0; r < rows.size(); r++) if (keep[r]) out.add(rows.get(r));
        return new TypedDataset(columns, out);
    }

    public TypedDataset filter(Predicate<List<Object>> predicate) {
        List<List<Object>> out = new ArrayList<>();
        for (List<Object> r : rows) if (predicate.test(r)) out.add(r);
        return out.size() == rows.size() ? this : new TypedDataset(columns, out);
    }

    /** Adds columns at the end; {@code valuesFor} receives each existing row and returns the new cells. */
    public TypedDataset withColumns(List<Column> added, Function<List<Object>, List<Object>> valuesFor) {
        List<Column> cols = new ArrayList<>(columns);
        cols.addAll(added);
        List<List<Object>> out = new ArrayList<>(rows.size());
        for (List<Object> r : rows) {
            List<Object> extra = valuesFor.apply(r);
            Object[] cells = new Object[cols.size()];
            for (int i = 0; i < r.size(); i++) cells[i] = r.get(i);
            for (int i = 0; i < added.size(); i++) cells[r.size() + i] = extra.get(i);
            out.add(row(cells));
        }
        return new TypedDataset(cols, out);
    }

    /** Same rows restricted to the named columns, in the given order. */
    public TypedDataset select(List<String> names) {
        int[] idx = names.stream().mapToInt(this::indexOf).toArray();
        List<Column> cols = new ArrayList<>(idx.length);
        for (int i : idx) cols.add(columns.get(i));
        List<List<Object>> out = new ArrayList<>(rows.size());
        for (List<Object> r : rows) {
            Object[] cells = new Object[idx.length];
            for (int k = 0; k < idx.length; k++) cells[k] = r.get(idx[k]);
            out.add(row(cells));
        }
        return new TypedDataset(cols, out);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    static int compareCells(Object a, Object b) {
        if (a == b) return 0;
        if (a == null) return -1;
        if (b == null) return 1;
        return ((Comparable) a).compareTo(b);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypedDataset that)) return false;
        return columns.equals(that.columns) && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return 31 * columns.hashCode() + rows.hashCode();
    }

    @Override
    public String toString() {
        return "TypedDataset{columns=" + columns.size() + ", rows=" + rows.size() + "}";
    }
}
