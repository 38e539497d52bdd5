package io.refdata.financial.merge;

import io.refdata.dataset.TypedDataset;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reports codes whose {@code AdjustmentFactor} differs from 1 (splits, consolidations): their history in the
 * store is no longer comparable with the new rows.
 */
public class AdjustmentFactorCheck implements FetchCheck {
    static final String FACTOR = "AdjustmentFactor";
    static final String CODE = "Code";

    @Override
    public List<String> inspect(TableSpec table, TypedDataset fetched) {
        if (!fetched.hasColumn(FACTOR) || !fetched.hasColumn(CODE)) return List.of();
        int fi = fetched.indexOf(FACTOR);
        int ci = fetched.indexOf(CODE);
        Set<String> codes = new TreeSet<>();
        for (List<Object> r : fetched.rows()) {
            Object f = r.get(fi);
            if (f instanceof Number n && n.doubleValue() != 1.0) codes.add(String.valueOf(r.get(ci)));
        }
        if (codes.isEmpty()) return List.of();
        return List.of("adjustment factor is not 1 in " + table.name() + ": " + codes);
    }
}
