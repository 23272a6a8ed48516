package org.smileyface.riskcrawler.fetch;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class HostThrottleTest {

    private final AtomicLong now = new AtomicLong(1_000_000L);
    private final HostThrottle throttle = new HostThrottle(2_000, now::get);

    @Test
    void firstRequestToAHostGoesImmediately() {
        assertThat(throttle.reserve("a.example")).isZero();
        assertThat(throttle.reserve("b.example")).isZero();
    }

    @Test
    void backToBackRequestsQueueBehindEachOther() {
        assertThat(throttle.reserve("a.example")).isZero();
        assertThat(throttle.reserve("a.example")).isEqualTo(2_000);
        assertThat(throttle.reserve("A.Example")).isEqualTo(4_000);
    }

    @Test
    void waitShrinksAsTimePasses() {
        throttle.reserve("a.example");
        now.addAndGet(1_500);
        assertThat(throttle.reserve("a.example")).isEqualTo(500);
        now.addAndGet(10_000);
        assertThat(throttle.reserve("a.example")).isZero();
    }

    @Test
    void zeroDelayAndMissingHostNeverWait() {
        HostThrottle off = new HostThrottle(0, now::get);
        assertThat(off.reserve("a.example")).isZero();
        assertThat(off.reserve("a.example")).isZero();
        assertThat(throttle.reserve(null)).isZero();
        assertThat(throttle.reserve(null)).isZero();
    }
}
