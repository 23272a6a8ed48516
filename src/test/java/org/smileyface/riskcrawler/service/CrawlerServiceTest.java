package org.smileyface.riskcrawler.service;

import org.junit.jupiter.api.Test;
import org.smileyface.riskcrawler.crawler.CrawlerProperties;
import org.smileyface.riskcrawler.crawler.Frontier;
import org.smileyface.riskcrawler.crawler.TargetCanonicalizer;
import org.smileyface.riskcrawler.model.FetchOutcome;
import org.smileyface.riskcrawler.model.FrontierEntry;
import org.smileyface.riskcrawler.model.RiskLabel;
import org.smileyface.riskcrawler.model.RuleSignal;
import org.smileyface.riskcrawler.model.Target;
import org.smileyface.riskcrawler.model.TargetKind;
import org.smileyface.riskcrawler.model.TargetStatus;
import org.smileyface.riskcrawler.model.Verdict;
import org.smileyface.riskcrawler.store.StateStore;
import org.smileyface.riskcrawler.testutil.MutableClock;
import org.smileyface.riskcrawler.testutil.StubHttpServer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class CrawlerServiceTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock(T0);
        }
    }

    @Autowired
    private CrawlerService crawlerService;

    @Autowired
    private Frontier frontier;

    @Autowired
    private StateStore store;

    @Autowired
    private CrawlerProperties props;

    /**
     * Restart recovery: due and interrupted targets become eligible now, fresh verdicts wait for their
     * revisit time and permanently failed targets stay out of the frontier.
     */
    @Test
    void resume_rebuildsFrontierFromStateStore() {
        Target fresh = page("https://fresh.example/", T0.minus(Duration.ofDays(1)));
        Target busy = page("https://busy.example/a", T0.minus(Duration.ofDays(1))).withStatus(TargetStatus.IN_PROGRESS);
        Target high = page("https://high.example/x", T0.minus(Duration.ofDays(2))).visited(T0.minus(Duration.ofHours(1)));
        Target stale = page("https://benign.example/", T0.minus(Duration.ofDays(5))).visited(T0.minus(Duration.ofHours(73)));
        Target dead = page("https://dead.example/", T0.minus(Duration.ofDays(3)))
                .failed(TargetStatus.PERMANENTLY_FAILED, "HTTP 404");
        for (Target t : List.of(fresh, busy, high, stale, dead)) {
            store.putTarget(t);
        }
        store.recordVerdict(high, new Verdict(high.identifier(), RiskLabel.FRAUD, 0.9,
                List.of(new RuleSignal("bank-details-request", RiskLabel.FRAUD, 0.9, "send bank details")),
                null, T0.minus(Duration.ofHours(1)), "h1"));
        store.recordVerdict(stale, new Verdict(stale.identifier(), RiskLabel.BENIGN, 1.0, List.of(), null,
                T0.minus(Duration.ofHours(73)), "h2"));

        assertThat(crawlerService.resume()).isEqualTo(4);
        assertThat(frontier.size()).isEqualTo(4);

        assertThat(frontier.find(fresh.identifier())).get().satisfies(e -> {
            assertThat(e.notBefore()).isEqualTo(T0);
            assertThat(e.priority()).isEqualTo(1.0);
        });
        assertThat(frontier.find(busy.identifier())).get().extracting(FrontierEntry::notBefore).isEqualTo(T0);
        assertThat(store.getTarget(busy.identifier())).get().extracting(Target::status).isEqualTo(TargetStatus.PENDING);

        assertThat(frontier.find(high.identifier())).get().satisfies(e -> {
            assertThat(e.notBefore()).isEqualTo(T0.plus(Duration.ofHours(5)));
            assertThat(e.priority()).isEqualTo(10.0);
        });
        assertThat(frontier.find(stale.identifier())).get().satisfies(e -> {
            assertThat(e.notBefore()).isEqualTo(T0);
            assertThat(e.priority()).isEqualTo(1.0);
        });
        assertThat(frontier.find(dead.identifier())).isEmpty();

        List<FrontierEntry> batch = frontier.dequeueBatch(10);
        assertThat(batch).extracting(FrontierEntry::identifier)
                .containsExactlyInAnyOrder(fresh.identifier(), busy.identifier(), stale.identifier());
    }

    @Test
    void resume_afterRestartReleasesStaleClaims() {
        crawlerService.seed("https://claimed.example/", null, null);
        assertThat(frontier.dequeueBatch(1)).hasSize(1);
        assertThat(frontier.inProgressCount()).isEqualTo(1);

        crawlerService.resume();

        assertThat(frontier.inProgressCount()).isZero();
        assertThat(frontier.dequeueBatch(1)).extracting(FrontierEntry::identifier)
                .containsExactly("https://claimed.example/");
    }

    @Test
    void seed_infersKindAndCanonicalizes() {
        Target channel = crawlerService.seed("t.me/Crypto_Signals", null, null);
        assertThat(channel.identifier()).isEqualTo("@crypto_signals");
        assertThat(channel.kind()).isEqualTo(TargetKind.CHANNEL);
        assertThat(channel.status()).isEqualTo(TargetStatus.PENDING);
        assertThat(channel.discoveredAt()).isEqualTo(T0);

        Target page = crawlerService.seed("HTTPS://Shop.Example/deals/?utm_campaign=x", null, null);
        assertThat(page.identifier()).isEqualTo("https://shop.example/deals");
        assertThat(page.kind()).isEqualTo(TargetKind.PAGE);
        assertThat(page.domain()).isEqualTo("shop.example");
    }

    @Test
    void seed_isIdempotentAndOnlyRaisesPriority() {
        crawlerService.seed("@crypto_signals", null, null);
        crawlerService.seed("https://t.me/crypto_signals", null, 5.0);
        crawlerService.seed("@Crypto_Signals", null, 2.0);

        assertThat(store.listTargets(null)).hasSize(1);
        assertThat(frontier.size()).isEqualTo(1);
        assertThat(frontier.find("@crypto_signals")).get().extracting(FrontierEntry::priority).isEqualTo(5.0);
    }

    @Test
    void seed_rejectsInvalidIdentifiers() {
        assertThatThrownBy(() -> crawlerService.seed("ftp://files.example/list", null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> crawlerService.seed("  ", null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> crawlerService.seed("@abc", TargetKind.CHANNEL, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.listTargets(null)).isEmpty();
    }

    @Test
    void seed_refusesPermanentlyFailedTarget() {
        crawlerService.seed("https://gone.example/", null, null);
        FrontierEntry claimed = frontier.dequeueBatch(1).get(0);
        frontier.release(claimed.identifier(), FetchOutcome.PERMANENT_FAILURE, null);
        store.putTarget(store.getTarget(claimed.identifier()).orElseThrow()
                .failed(TargetStatus.PERMANENTLY_FAILED, "HTTP 410"));

        assertThatThrownBy(() -> crawlerService.seed("https://gone.example", null, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("HTTP 410");
        assertThat(frontier.find("https://gone.example/")).isEmpty();
    }

    @Test
    void applyConfiguredSeeds_readsIdentifiersAndFile() {
        props.getSeeds().setIdentifiers(List.of("https://news.example/a", "@x", "@fast_money_hub"));
        props.getSeeds().setFile("classpath:seeds/test-seeds.txt");

        // "@x" and the ftp url are skipped, the repeated shop url is deduplicated
        assertThat(crawlerService.applyConfiguredSeeds()).isEqualTo(5);

        assertThat(store.listTargets(null)).extracting(Target::identifier).containsExactly(
                "@crypto_pumps", "@fast_money_hub", "https://news.example/a", "https://shop.example/deals");
        assertThat(frontier.size()).isEqualTo(4);
    }

    @Test
    void readSeedsFile_skipsCommentsAndBlankLines() {
        assertThat(crawlerService.readSeedsFile("classpath:seeds/test-seeds.txt")).containsExactly(
                "https://Shop.Example/deals?utm_source=feed",
                "@Crypto_Pumps",
                "ftp://files.example/list",
                "https://shop.example/deals");
    }

    @Test
    void start_drainsConfiguredSeedsAndCompletes() throws Exception {
        try (StubHttpServer server = new StubHttpServer()) {
            server.html("/", "<html><body><p>Weekly recipes: lemon cake.</p></body></html>");
            String url = server.url("/");
            props.getSeeds().setIdentifiers(List.of(url));

            crawlerService.start();
            // second start while running is ignored
            crawlerService.start();

            assertThat(crawlerService.awaitCompletion(Duration.ofSeconds(30))).isTrue();
            assertThat(crawlerService.getProcessorManager().isRunning()).isFalse();
            assertThat(store.currentVerdict(TargetCanonicalizer.canonicalUrl(url))).get()
                    .extracting(Verdict::label).isEqualTo(RiskLabel.BENIGN);
            assertThat(server.hits("/")).isEqualTo(1);
        }
    }

    private static Target page(String url, Instant discoveredAt) {
        String id = TargetCanonicalizer.canonicalUrl(url);
        return Target.discovered(id, TargetKind.PAGE, TargetCanonicalizer.domainOf(id), discoveredAt);
    }
}
