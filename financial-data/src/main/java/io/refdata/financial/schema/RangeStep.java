package io.refdata.financial.schema;

/**
 * How a date range is split into requests for one endpoint.
 */
public enum RangeStep {
    /** One {@code date=} request per calendar day. */
    DAILY,
    /** One {@code date=} request per Monday in the range; for slowly changing data. */
    WEEKLY_MONDAY,
    /** A single {@code from=}/{@code to=} request covering the whole range. */
    SPAN,
    /** The endpoint takes no date; one request regardless of the range. */
    NONE
}
