package io.refdata.budget;

import java.util.concurrent.TimeUnit;

/**
 * Naive token bucket for the external QPS budget. A non-positive qps disables the limit.
 * The bucket starts full, so the first second allows a burst of {@code externalQps} calls.
 */
public class SimpleBudgetManager implements Budget {
    private final long externalQps;

    private long qpsTokens;
    private long lastQpsRefillNanos;

    public SimpleBudgetManager(long externalQps) {
        this.externalQps = Math.max(0, externalQps);
        this.lastQpsRefillNanos = System.nanoTime();
        this.qpsTokens = this.externalQps;
    }

    @Override
    public synchronized void acquireExternalOp() throws InterruptedException {
        if (externalQps <= 0) return; // no limit
        while (true) {
            refillQps();
            if (qpsTokens > 0) {
                qpsTokens--;
                return;
            }
            // releases the monitor while waiting
            wait(1);
        }
    }

    private void refillQps() {
        long now = System.nanoTime();
        long elapsed = now - lastQpsRefillNanos;
        if (elapsed <= 0) return;
        long add = (externalQps * elapsed) / TimeUnit.SECONDS.toNanos(1);
        if (add > 0) {
            qpsTokens = Math.min(externalQps, qpsTokens + add);
            lastQpsRefillNanos = now;
        }
    }
}
