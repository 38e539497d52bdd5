package io.refdata.financial.range;

import io.refdata.financial.schema.RangeStep;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FetchUnitTest {
    static final LocalDate FRI = LocalDate.of(2024, 3, 1);

    @Test
    void daily_plans_one_unit_per_day_inclusive() {
        List<FetchUnit> units = FetchUnit.plan(RangeStep.DAILY, FRI, LocalDate.of(2024, 3, 3));
        assertEquals(3, units.size());
        assertEquals(Map.of("date", "20240301"), units.get(0).params());
        assertEquals(LocalDate.of(2024, 3, 3), units.get(2).date());
    }

    @Test
    void weekly_plans_mondays_only() {
        List<FetchUnit> units = FetchUnit.plan(RangeStep.WEEKLY_MONDAY, FRI, LocalDate.of(2024, 3, 18));
        assertEquals(List.of(LocalDate.of(2024, 3, 4), LocalDate.of(2024, 3, 11), LocalDate.of(2024, 3, 18)),
                units.stream().map(FetchUnit::date).toList());
        assertTrue(FetchUnit.plan(RangeStep.WEEKLY_MONDAY, FRI, LocalDate.of(2024, 3, 3)).isEmpty());
    }

    @Test
    void span_is_a_single_undated_request() {
        List<FetchUnit> units = FetchUnit.plan(RangeStep.SPAN, FRI, LocalDate.of(2024, 3, 31));
        assertEquals(1, units.size());
        assertNull(units.get(0).date());
        assertEquals(Map.of("from", "20240301", "to", "20240331"), units.get(0).params());
    }

    @Test
    void undated_endpoints_take_no_params() {
        assertEquals(List.of(new FetchUnit(null, Map.of())), FetchUnit.plan(RangeStep.NONE, FRI, FRI));
    }

    @Test
    void inverted_range_plans_nothing() {
        for (RangeStep step : RangeStep.values()) {
            assertTrue(FetchUnit.plan(step, FRI, FRI.minusDays(1)).isEmpty(), step.name());
        }
    }
}
