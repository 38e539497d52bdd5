package io.refdata.financial.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.refdata.dataset.Column;
import io.refdata.dataset.ColumnType;
import io.refdata.financial.ApiFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class EndpointCatalogTest {
    final EndpointCatalog catalog = ApiFixtures.CATALOG;

    @Test
    void loads_every_endpoint_from_the_classpath() {
        Set<String> ids = catalog.all().stream().map(EndpointSchema::id).collect(Collectors.toSet());
        assertEquals(Set.of("listed_info", "daily_quotes", "statements", "announcement", "dividend", "index_option",
                "trades_spec", "weekly_margin_interest", "short_selling", "breakdown", "topix"), ids);
    }

    @Test
    void endpoint_entries_carry_paths_steps_and_types() {
        EndpointSchema quotes = catalog.get("daily_quotes");
        assertEquals("prices/daily_quotes", quotes.path());
        assertEquals("daily_quotes", quotes.resultKey());
        assertEquals(RangeStep.DAILY, quotes.step());
        assertEquals(List.of("Date", "Code"), quotes.sortKey());
        assertEquals(Column.of("Date", ColumnType.DATE), quotes.columnsFor(SubscriptionPlan.LIGHT).get(0));

        assertEquals(RangeStep.WEEKLY_MONDAY, catalog.get("listed_info").step());
        assertEquals(RangeStep.SPAN, catalog.get("topix").step());
        assertEquals(RangeStep.NONE, catalog.get("announcement").step());
        assertEquals("PublishedDate", catalog.get("trades_spec").dateColumn());
    }

    @Test
    void higher_plans_see_more_columns() {
        EndpointSchema quotes = catalog.get("daily_quotes");
        int light = quotes.columnsFor(SubscriptionPlan.LIGHT).size();
        int premium = quotes.columnsFor(SubscriptionPlan.PREMIUM).size();
        assertTrue(premium > light);
        assertTrue(quotes.columnsFor(SubscriptionPlan.LIGHT).stream().noneMatch(c -> c.name().startsWith("Morning")));

        EndpointSchema info = catalog.get("listed_info");
        assertFalse(info.columnsFor(SubscriptionPlan.LIGHT).stream().anyMatch(c -> c.name().equals("MarginCode")));
        assertTrue(info.columnsFor(SubscriptionPlan.STANDARD).stream().anyMatch(c -> c.name().equals("MarginCode")));
    }

    @Test
    void unknown_endpoint_fails() {
        assertThrows(NoSuchElementException.class, () -> catalog.get("nope"));
    }

    @Test
    void date_column_must_be_declared() throws Exception {
        JsonNode bad = ApiFixtures.MAPPER.readTree("{\"endpoints\":[{\"id\":\"x\",\"path\":\"x\",\"resultKey\":\"x\","
                + "\"step\":\"DAILY\",\"dateColumn\":\"Date\",\"sortKey\":[],\"columns\":[{\"name\":\"Code\",\"type\":\"string\"}]}]}");
        assertThrows(IllegalStateException.class, () -> EndpointCatalog.parse(bad));
    }

    @Test
    void plan_names_are_case_insensitive() {
        assertEquals(SubscriptionPlan.STANDARD, SubscriptionPlan.of(" standard "));
        assertTrue(SubscriptionPlan.PREMIUM.includes(SubscriptionPlan.LIGHT));
        assertFalse(SubscriptionPlan.LIGHT.includes(SubscriptionPlan.STANDARD));
        assertThrows(IllegalArgumentException.class, () -> SubscriptionPlan.of("gold"));
    }
}
