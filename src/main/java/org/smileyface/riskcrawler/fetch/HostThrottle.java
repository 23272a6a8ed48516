package org.smileyface.riskcrawler.fetch;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Per-host politeness gate. Each request to a host reserves the next free slot for that host, and
 * slots are at least {@code delayMs} apart, so concurrent workers hitting the same host queue up
 * instead of firing together.
 */
public class HostThrottle {

    private static final int PRUNE_THRESHOLD = 4096;

    private final long delayMs;
    private final LongSupplier millis;
    /** host -> earliest time (millis) the next request may start */
    private final Map<String, Long> nextSlot = new ConcurrentHashMap<>();

    public HostThrottle(long delayMs) {
        this(delayMs, System::currentTimeMillis);
    }

    HostThrottle(long delayMs, LongSupplier millis) {
        this.delayMs = Math.max(0, delayMs);
        this.millis = millis;
    }

    /**
     * Blocks until the caller may send a request to {@code host}.
     */
    public void acquire(String host) throws InterruptedException {
        long waitMs = reserve(host);
        if (waitMs > 0) {
            Thread.sleep(waitMs);
        }
    }

    /**
     * Takes the next slot for {@code host} and returns how many milliseconds from now it starts.
     */
    long reserve(String host) {
        if (delayMs == 0 || host == null || host.isBlank()) return 0;
        long now = millis.getAsLong();
        long[] start = new long[1];
        nextSlot.compute(host.toLowerCase(Locale.ROOT), (h, next) -> {
            start[0] = next == null || next <= now ? now : next;
            return start[0] + delayMs;
        });
        if (nextSlot.size() > PRUNE_THRESHOLD) {
            nextSlot.values().removeIf(next -> next <= now);
        }
        return start[0] - now;
    }

    public long getDelayMs() {
        return delayMs;
    }
}
