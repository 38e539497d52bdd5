package io.refdata.financial.merge;

/**
 * Stages of one table update. A run ends in {@link #PERSIST} after a successful write or in {@link #NO_NEW_DATA}
 * when there was nothing to fetch or the fetch came back empty.
 */
public enum MergeState {
    LOAD_PRIOR,
    COMPUTE_WINDOW,
    FETCH,
    MERGE,
    PERSIST,
    NO_NEW_DATA
}
