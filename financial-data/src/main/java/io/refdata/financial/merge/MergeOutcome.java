package io.refdata.financial.merge;

public record MergeOutcome(String table, MergeState state, FetchWindow window, int rowsFetched, int rowsPersisted) {
    public boolean persisted() { return state == MergeState.PERSIST; }
}
