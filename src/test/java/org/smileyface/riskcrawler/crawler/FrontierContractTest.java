package org.smileyface.riskcrawler.crawler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.smileyface.riskcrawler.model.FetchOutcome;
import org.smileyface.riskcrawler.model.FrontierEntry;
import org.smileyface.riskcrawler.model.RiskLabel;
import org.smileyface.riskcrawler.model.TargetKind;
import org.smileyface.riskcrawler.model.TargetStatus;
import org.smileyface.riskcrawler.model.Verdict;
import org.smileyface.riskcrawler.testutil.MutableClock;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract tests run against every Frontier implementation. The Redis variant is only added when
 * Docker is available.
 */
class FrontierContractTest {

    private static final Logger logger = LogManager.getLogger(FrontierContractTest.class);
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private static GenericContainer<?> redisContainer;
    private static List<Arguments> IMPLEMENTATIONS;

    /** Builds a fresh frontier for the given clock. */
    interface FrontierFactory extends Function<MutableClock, Frontier> {
    }

    static Stream<Arguments> frontiers() {
        if (IMPLEMENTATIONS == null) {
            synchronized (FrontierContractTest.class) {
                if (IMPLEMENTATIONS == null) {
                    IMPLEMENTATIONS = new ArrayList<>();
                    IMPLEMENTATIONS.add(Arguments.of("InMemoryFrontier",
                            (FrontierFactory) clock -> new InMemoryFrontier(new RevisitPolicy(props()), clock)));
                    try {
                        redisContainer = new GenericContainer<>("redis:7.2.4").withExposedPorts(6379);
                        redisContainer.start();
                        FrontierFactory redis = clock -> {
                            LettuceConnectionFactory cf = new LettuceConnectionFactory(
                                    redisContainer.getHost(), redisContainer.getMappedPort(6379));
                            cf.afterPropertiesSet();
                            StringRedisTemplate template = new StringRedisTemplate(cf);
                            CrawlerProperties p = props();
                            p.setQueueNamespace("test:" + UUID.randomUUID());
                            return new RedisFrontier(template, p, new RevisitPolicy(p), clock);
                        };
                        IMPLEMENTATIONS.add(Arguments.of("RedisFrontier", redis));
                    } catch (Throwable t) {
                        logger.warn("Redis Testcontainer unavailable, RedisFrontier skipped: {}", t.getMessage());
                    }
                }
            }
        }
        return IMPLEMENTATIONS.stream();
    }

    @AfterAll
    static void tearDown() {
        if (redisContainer != null) {
            try {
                redisContainer.stop();
            } finally {
                redisContainer = null;
            }
        }
    }

    private static CrawlerProperties props() {
        CrawlerProperties p = new CrawlerProperties();
        p.getFrontier().setMaxRetries(3);
        p.getFrontier().setBackoffBaseMs(30_000);
        p.getFrontier().setBackoffMaxMs(3_600_000);
        return p;
    }

    private static Verdict verdict(String id, RiskLabel label, double p) {
        return new Verdict(id, label, p, List.of(), null, T0, "hash");
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("frontiers")
    void emptyFrontierDequeuesNothing(String impl, FrontierFactory factory) {
        Frontier f = factory.apply(new MutableClock(T0));
        assertThat(f.dequeueBatch(5)).isEmpty();
        assertThat(f.size()).isZero();
        assertThat(f.inProgressCount()).isZero();
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("frontiers")
    void enqueueIsDeduplicatedAndOnlyRaisesPriority(String impl, FrontierFactory factory) {
        Frontier f = factory.apply(new MutableClock(T0));
        assertThat(f.enqueue("https://a.example/", TargetKind.PAGE, 2.0)).isTrue();
        assertThat(f.enqueue("https://a.example/", TargetKind.PAGE, 1.0)).isFalse();
        assertThat(f.find("https://a.example/")).get().extracting(FrontierEntry::priority).isEqualTo(2.0);

        assertThat(f.enqueue("https://a.example/", TargetKind.PAGE, 5.0)).isFalse();
        assertThat(f.find("https://a.example/")).get().extracting(FrontierEntry::priority).isEqualTo(5.0);
        assertThat(f.size()).isEqualTo(1);
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("frontiers")
    void blankIdentifiersAreIgnored(String impl, FrontierFactory factory) {
        Frontier f = factory.apply(new MutableClock(T0));
        assertThat(f.enqueue(null, TargetKind.PAGE, 1.0)).isFalse();
        assertThat(f.enqueue("  ", TargetKind.PAGE, 1.0)).isFalse();
        assertThat(f.size()).isZero();
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("frontiers")
    void dequeueOrdersByPriorityThenDiscoveryTime(String impl, FrontierFactory factory) {
        MutableClock clock = new MutableClock(T0);
        Frontier f = factory.apply(clock);
        f.enqueue("https://low.example/", TargetKind.PAGE, 1.0);
        clock.advance(Duration.ofSeconds(1));
        f.enqueue("@first_chan", TargetKind.CHANNEL, 3.0);
        clock.advance(Duration.ofSeconds(1));
        f.enqueue("@second_chan", TargetKind.CHANNEL, 3.0);

        List<FrontierEntry> batch = f.dequeueBatch(2);
        assertThat(batch).extracting(FrontierEntry::identifier).containsExactly("@first_chan", "@second_chan");
        assertThat(batch.get(0).kind()).isEqualTo(TargetKind.CHANNEL);
        assertThat(f.inProgressCount()).isEqualTo(2);
        assertThat(f.dequeueBatch(5)).extracting(FrontierEntry::identifier).containsExactly("https://low.example/");
        assertThat(f.dequeueBatch(5)).isEmpty();
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("frontiers")
    void claimedEntriesAreNotReEnqueued(String impl, FrontierFactory factory) {
        Frontier f = factory.apply(new MutableClock(T0));
        f.enqueue("https://a.example/", TargetKind.PAGE, 1.0);
        assertThat(f.dequeueBatch(1)).hasSize(1);
        assertThat(f.enqueue("https://a.example/", TargetKind.PAGE, 9.0)).isFalse();
        assertThat(f.dequeueBatch(1)).isEmpty();
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("frontiers")
    void successSchedulesRevisitByRiskBand(String impl, FrontierFactory factory) {
        MutableClock clock = new MutableClock(T0);
        Frontier f = factory.apply(clock);
        String id = "https://risky.example/";
        f.enqueue(id, TargetKind.PAGE, 1.0);
        f.dequeueBatch(1);

        FrontierRelease r = f.release(id, FetchOutcome.SUCCESS, verdict(id, RiskLabel.FRAUD, 0.9));
        assertThat(r.status()).isEqualTo(TargetStatus.DONE);
        assertThat(r.failures()).isZero();
        assertThat(r.notBefore()).isEqualTo(T0.plus(Duration.ofHours(6)));
        assertThat(f.find(id)).get().extracting(FrontierEntry::priority).isEqualTo(1.0 + 0.9 * 10.0);

        clock.advance(Duration.ofHours(6).minusSeconds(1));
        assertThat(f.dequeueBatch(1)).isEmpty();
        clock.advance(Duration.ofSeconds(1));
        assertThat(f.dequeueBatch(1)).extracting(FrontierEntry::identifier).containsExactly(id);
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("frontiers")
    void benignVerdictUsesLowRiskInterval(String impl, FrontierFactory factory) {
        Frontier f = factory.apply(new MutableClock(T0));
        String id = "https://fine.example/";
        f.enqueue(id, TargetKind.PAGE, 1.0);
        f.dequeueBatch(1);
        FrontierRelease r = f.release(id, FetchOutcome.SUCCESS, verdict(id, RiskLabel.BENIGN, 0.95));
        assertThat(r.notBefore()).isEqualTo(T0.plus(Duration.ofHours(72)));
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("frontiers")
    void transientFailuresBackOffThenFailPermanentlyAtRetryCap(String impl, FrontierFactory factory) {
        MutableClock clock = new MutableClock(T0);
        Frontier f = factory.apply(clock);
        String id = "https://flaky.example/";
        f.enqueue(id, TargetKind.PAGE, 1.0);

        f.dequeueBatch(1);
        FrontierRelease first = f.release(id, FetchOutcome.TRANSIENT_FAILURE, null);
        assertThat(first.status()).isEqualTo(TargetStatus.PENDING);
        assertThat(first.failures()).isEqualTo(1);
        assertThat(first.notBefore()).isEqualTo(T0.plusSeconds(30));
        assertThat(f.dequeueBatch(1)).isEmpty();

        clock.advance(Duration.ofSeconds(30));
        f.dequeueBatch(1);
        FrontierRelease second = f.release(id, FetchOutcome.TRANSIENT_FAILURE, null);
        assertThat(second.failures()).isEqualTo(2);
        assertThat(second.notBefore()).isEqualTo(clock.instant().plusSeconds(60));

        clock.advance(Duration.ofSeconds(60));
        f.dequeueBatch(1);
        FrontierRelease third = f.release(id, FetchOutcome.TRANSIENT_FAILURE, null);
        assertThat(third.status()).isEqualTo(TargetStatus.PERMANENTLY_FAILED);
        assertThat(third.isTerminal()).isTrue();
        assertThat(f.isPermanentlyFailed(id)).isTrue();

        assertThat(f.enqueue(id, TargetKind.PAGE, 1.0)).isFalse();
        clock.advance(Duration.ofDays(10));
        assertThat(f.dequeueBatch(1)).isEmpty();
        assertThat(f.size()).isZero();
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("frontiers")
    void permanentFailureIsTerminalImmediately(String impl, FrontierFactory factory) {
        Frontier f = factory.apply(new MutableClock(T0));
        f.enqueue("https://gone.example/", TargetKind.PAGE, 1.0);
        f.dequeueBatch(1);
        FrontierRelease r = f.release("https://gone.example/", FetchOutcome.PERMANENT_FAILURE, null);
        assertThat(r.status()).isEqualTo(TargetStatus.PERMANENTLY_FAILED);
        assertThat(f.isPermanentlyFailed("https://gone.example/")).isTrue();
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("frontiers")
    void successResetsFailureCount(String impl, FrontierFactory factory) {
        MutableClock clock = new MutableClock(T0);
        Frontier f = factory.apply(clock);
        String id = "https://recovering.example/";
        f.enqueue(id, TargetKind.PAGE, 1.0);
        f.dequeueBatch(1);
        f.release(id, FetchOutcome.TRANSIENT_FAILURE, null);
        clock.advance(Duration.ofMinutes(1));
        f.dequeueBatch(1);
        FrontierRelease ok = f.release(id, FetchOutcome.SUCCESS, null);
        assertThat(ok.failures()).isZero();
        assertThat(f.find(id)).get().extracting(FrontierEntry::failures).isEqualTo(0);
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("frontiers")
    void releaseOfUnclaimedIdentifierIsRejected(String impl, FrontierFactory factory) {
        Frontier f = factory.apply(new MutableClock(T0));
        f.enqueue("https://a.example/", TargetKind.PAGE, 1.0);
        assertThatThrownBy(() -> f.release("https://a.example/", FetchOutcome.SUCCESS, null))
                .isInstanceOf(IllegalStateException.class);
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("frontiers")
    void requeueReturnsClaimedEntryWithoutCountingFailure(String impl, FrontierFactory factory) {
        Frontier f = factory.apply(new MutableClock(T0));
        f.enqueue("https://a.example/", TargetKind.PAGE, 4.0);
        f.dequeueBatch(1);
        assertThat(f.requeue("https://a.example/")).isTrue();
        assertThat(f.requeue("https://a.example/")).isFalse();
        assertThat(f.inProgressCount()).isZero();

        List<FrontierEntry> again = f.dequeueBatch(1);
        assertThat(again).hasSize(1);
        assertThat(again.get(0).failures()).isZero();
        assertThat(again.get(0).priority()).isEqualTo(4.0);
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("frontiers")
    void delayedRequeueHoldsEntryBackUntilItsTime(String impl, FrontierFactory factory) {
        MutableClock clock = new MutableClock(T0);
        Frontier f = factory.apply(clock);
        f.enqueue("https://a.example/", TargetKind.PAGE, 2.0);
        f.dequeueBatch(1);
        assertThat(f.requeue("https://a.example/", T0.plusSeconds(30))).isTrue();

        assertThat(f.find("https://a.example/")).get()
                .satisfies(e -> {
                    assertThat(e.notBefore()).isEqualTo(T0.plusSeconds(30));
                    assertThat(e.failures()).isZero();
                });
        assertThat(f.dequeueBatch(1)).isEmpty();
        clock.advance(Duration.ofSeconds(30));
        assertThat(f.dequeueBatch(1)).extracting(FrontierEntry::identifier).containsExactly("https://a.example/");
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("frontiers")
    void highPriorityEntryWinsOverALargeBacklogOfOlderEntries(String impl, FrontierFactory factory) {
        MutableClock clock = new MutableClock(T0);
        Frontier f = factory.apply(clock);
        for (int i = 0; i < 1_200; i++) {
            f.enqueue("https://backlog.example/" + i, TargetKind.PAGE, 1.0);
        }
        clock.advance(Duration.ofSeconds(1));
        f.enqueue("https://urgent.example/", TargetKind.PAGE, 100.0);

        assertThat(f.dequeueBatch(1)).extracting(FrontierEntry::identifier)
                .containsExactly("https://urgent.example/");
        assertThat(f.dequeueBatch(2)).extracting(FrontierEntry::identifier)
                .containsExactly("https://backlog.example/0", "https://backlog.example/1");
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("frontiers")
    void priorityRaiseReordersAnAlreadyEligibleEntry(String impl, FrontierFactory factory) {
        MutableClock clock = new MutableClock(T0);
        Frontier f = factory.apply(clock);
        f.enqueue("https://a.example/", TargetKind.PAGE, 3.0);
        f.enqueue("https://b.example/", TargetKind.PAGE, 2.0);
        f.enqueue("https://c.example/", TargetKind.PAGE, 1.0);
        assertThat(f.dequeueBatch(1)).extracting(FrontierEntry::identifier).containsExactly("https://a.example/");

        f.enqueue("https://c.example/", TargetKind.PAGE, 9.0);
        assertThat(f.dequeueBatch(2)).extracting(FrontierEntry::identifier)
                .containsExactly("https://c.example/", "https://b.example/");
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("frontiers")
    void scheduleRestoresEntryVerbatim(String impl, FrontierFactory factory) {
        MutableClock clock = new MutableClock(T0);
        Frontier f = factory.apply(clock);
        FrontierEntry e = new FrontierEntry("@restored_chan", TargetKind.CHANNEL, 7.5, T0.minusSeconds(3600),
                T0.plusSeconds(120), 0);
        f.schedule(e);
        assertThat(f.find("@restored_chan")).contains(e);
        assertThat(f.dequeueBatch(1)).isEmpty();
        clock.advance(Duration.ofMinutes(2));
        assertThat(f.dequeueBatch(1)).containsExactly(e);
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("frontiers")
    void initClearsEverythingIncludingTombstones(String impl, FrontierFactory factory) {
        Frontier f = factory.apply(new MutableClock(T0));
        f.enqueue("https://a.example/", TargetKind.PAGE, 2.0);
        f.enqueue("https://b.example/", TargetKind.PAGE, 1.0);
        assertThat(f.dequeueBatch(1)).extracting(FrontierEntry::identifier).containsExactly("https://a.example/");
        f.release("https://a.example/", FetchOutcome.PERMANENT_FAILURE, null);
        assertThat(f.isPermanentlyFailed("https://a.example/")).isTrue();

        f.init();
        assertThat(f.size()).isZero();
        assertThat(f.isPermanentlyFailed("https://a.example/")).isFalse();
        assertThat(f.enqueue("https://a.example/", TargetKind.PAGE, 1.0)).isTrue();
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("frontiers")
    void concurrentWorkersNeverClaimTheSameEntryTwice(String impl, FrontierFactory factory) throws Exception {
        Frontier f = factory.apply(new MutableClock(T0));
        int total = 200;
        for (int i = 0; i < total; i++) {
            f.enqueue("https://site.example/p" + i, TargetKind.PAGE, i % 7);
        }
        Set<String> claimed = ConcurrentHashMap.newKeySet();
        List<String> duplicates = Collections.synchronizedList(new ArrayList<>());
        int workers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        for (int w = 0; w < workers; w++) {
            pool.submit(() -> {
                start.await();
                List<FrontierEntry> batch;
                while (!(batch = f.dequeueBatch(3)).isEmpty()) {
                    for (FrontierEntry e : batch) {
                        if (!claimed.add(e.identifier())) duplicates.add(e.identifier());
                    }
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
        assertThat(duplicates).isEmpty();
        assertThat(claimed).hasSize(total);
        assertThat(f.inProgressCount()).isEqualTo(total);
    }
}
