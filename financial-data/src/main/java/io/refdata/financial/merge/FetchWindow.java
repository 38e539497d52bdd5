package io.refdata.financial.merge;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/** Inclusive date window; empty when start is after end. */
public record FetchWindow(LocalDate start, LocalDate end) {
    public boolean isEmpty() { return start.isAfter(end); }

    @Override
    public String toString() {
        DateTimeFormatter f = DateTimeFormatter.BASIC_ISO_DATE;
        return f.format(start) + " to " + f.format(end);
    }
}
