package io.refdata.financial.merge;

import io.refdata.dataset.TypedDataset;

import java.util.List;

/** Inspects freshly fetched rows before they are merged; each returned line is sent to the notifier. */
@FunctionalInterface
public interface FetchCheck {
    List<String> inspect(TableSpec table, TypedDataset fetched);
}
