package io.refdata.financial.merge;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/** The tables this job knows how to keep up to date. */
public final class TableCatalog {
    public static final List<String> DEFAULT_TABLES = List.of("list", "price", "topix");

    private final Map<String, TableSpec> tables;

    public TableCatalog(Collection<TableSpec> specs) {
        Map<String, TableSpec> m = new LinkedHashMap<>();
        for (TableSpec s : specs) m.put(s.name(), s);
        this.tables = Collections.unmodifiableMap(m);
    }

    public static TableCatalog defaults(LocalTime cutoff) {
        return new TableCatalog(List.of(
                new TableSpec("list", "listed_info", List.of("Code", "Date"), "Date", cutoff),
                new TableSpec("price", "daily_quotes", List.of("Code", "Date"), "Date", cutoff),
                new TableSpec("topix", "topix", List.of("Date"), "Date", cutoff),
                new TableSpec("statements", "statements", List.of("DisclosureNumber"), "DisclosedDate", cutoff),
                new TableSpec("dividend", "dividend", List.of("Code", "ReferenceNumber"), "AnnouncementDate", cutoff),
                new TableSpec("index_option", "index_option", List.of("Code", "Date", "EmergencyMarginTriggerDivision"), "Date", cutoff),
                new TableSpec("weekly_margin_interest", "weekly_margin_interest", List.of("Code", "Date"), "Date", cutoff),
                new TableSpec("short_selling", "short_selling", List.of("Date", "Sector33Code"), "Date", cutoff),
                new TableSpec("breakdown", "breakdown", List.of("Code", "Date"), "Date", cutoff),
                new TableSpec("trades_spec", "trades_spec", List.of("Section", "StartDate", "EndDate"), "PublishedDate", cutoff)));
    }

    public TableSpec get(String name) {
        TableSpec s = tables.get(name);
        if (s == null) throw new NoSuchElementException("unknown table " + name + ", known: " + names());
        return s;
    }

    public boolean contains(String name) { return tables.containsKey(name); }

    public List<String> names() { return new ArrayList<>(tables.keySet()); }
}
