package io.refdata.financial.range;

import io.refdata.financial.schema.RangeStep;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One request's worth of a range: the query parameters plus the day it stands for ({@code null} for span and
 * undated requests, which are never cached).
 */
public record FetchUnit(LocalDate date, Map<String, String> params) {
    static final DateTimeFormatter BASIC = DateTimeFormatter.BASIC_ISO_DATE;

    public FetchUnit {
        params = Map.copyOf(params);
    }

    /** Units covering {@code [start, end]} inclusive, in date order. Empty when start is after end. */
    public static List<FetchUnit> plan(RangeStep step, LocalDate start, LocalDate end) {
        List<FetchUnit> out = new ArrayList<>();
        if (start.isAfter(end)) return out;
        switch (step) {
            case DAILY -> {
                for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) out.add(onDate(d));
            }
            case WEEKLY_MONDAY -> {
                LocalDate d = start;
                while (d.getDayOfWeek() != DayOfWeek.MONDAY) d = d.plusDays(1);
                for (; !d.isAfter(end); d = d.plusWeeks(1)) out.add(onDate(d));
            }
            case SPAN -> {
                Map<String, String> p = new LinkedHashMap<>();
                p.put("from", BASIC.format(start));
                p.put("to", BASIC.format(end));
                out.add(new FetchUnit(null, p));
            }
            case NONE -> out.add(new FetchUnit(null, Map.of()));
        }
        return out;
    }

    static FetchUnit onDate(LocalDate d) {
        return new FetchUnit(d, Map.of("date", BASIC.format(d)));
    }
}
