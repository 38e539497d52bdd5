package io.refdata.metrics;

import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MetricsTest {
    @Test
    void scoped_names_share_one_registry() {
        MetricRegistry registry = new MetricRegistry();
        Metrics root = new Metrics(registry);
        Metrics http = root.scoped("http");
        http.counter("attempts").inc();
        http.scoped("inner").counter("attempts").inc(2);
        root.counter("attempts").inc(5);

        assertEquals(1, registry.counter("http.attempts").getCount());
        assertEquals(2, registry.counter("http.inner.attempts").getCount());
        assertEquals(5, registry.counter("attempts").getCount());
        assertSame(registry, http.registry());
    }
}
