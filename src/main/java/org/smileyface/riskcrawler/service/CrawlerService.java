package org.smileyface.riskcrawler.service;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.riskcrawler.crawler.CrawlerProperties;
import org.smileyface.riskcrawler.crawler.Frontier;
import org.smileyface.riskcrawler.crawler.RevisitPolicy;
import org.smileyface.riskcrawler.crawler.TargetCanonicalizer;
import org.smileyface.riskcrawler.model.FrontierEntry;
import org.smileyface.riskcrawler.model.PipelineStats;
import org.smileyface.riskcrawler.model.Target;
import org.smileyface.riskcrawler.model.TargetKind;
import org.smileyface.riskcrawler.model.TargetStatus;
import org.smileyface.riskcrawler.model.Verdict;
import org.smileyface.riskcrawler.processor.ProcessorManager;
import org.smileyface.riskcrawler.store.StateStore;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Pipeline lifecycle: rebuilds the Frontier from the State Store, applies seeds and runs the
 * worker pool.
 */
@Service
public class CrawlerService {

    private static final Logger log = LoggerFactory.getLogger(CrawlerService.class);

    private final Frontier frontier;
    private final StateStore store;
    private final ProcessorManager processorManager;
    private final RevisitPolicy policy;
    private final CrawlerProperties properties;
    private final ResourceLoader resourceLoader;
    private final Clock clock;

    public CrawlerService(Frontier frontier,
                          StateStore store,
                          ProcessorManager processorManager,
                          RevisitPolicy policy,
                          CrawlerProperties properties,
                          ResourceLoader resourceLoader,
                          Clock clock) {
        this.frontier = Objects.requireNonNull(frontier, "frontier");
        this.store = Objects.requireNonNull(store, "store");
        this.processorManager = Objects.requireNonNull(processorManager, "processorManager");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.resourceLoader = Objects.requireNonNull(resourceLoader, "resourceLoader");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ProcessorManager getProcessorManager() { return processorManager; }

    /**
     * Rebuilds the Frontier from the State Store: pending targets (never visited, interrupted, retrying
     * or due for revisit) become eligible now, other completed targets are scheduled for their next
     * visit. Permanently failed targets are not scheduled.
     *
     * @return number of entries scheduled
     */
    public synchronized int resume() {
        frontier.init();
        Instant now = clock.instant();
        Set<String> due = new HashSet<>();
        for (Target t : store.listPending(now, policy)) {
            due.add(t.identifier());
        }
        int scheduled = 0;
        for (Target t : store.listTargets(null)) {
            if (t.status() == TargetStatus.PERMANENTLY_FAILED) continue;
            Verdict current = store.currentVerdict(t.identifier()).orElse(null);
            if (due.contains(t.identifier())) {
                if (t.status() == TargetStatus.IN_PROGRESS) {
                    store.putTarget(t.withStatus(TargetStatus.PENDING));
                }
                double priority = current == null ? policy.defaultPriority() : policy.priorityAfterVisit(current);
                frontier.schedule(new FrontierEntry(t.identifier(), t.kind(), priority, t.discoveredAt(), now, 0));
            } else {
                Instant next = policy.nextVisit(t, current);
                frontier.schedule(new FrontierEntry(t.identifier(), t.kind(), policy.priorityAfterVisit(current),
                        t.discoveredAt(), next == null ? now : next, 0));
            }
            scheduled++;
        }
        log.info("Resumed frontier from state store: {} targets scheduled, {} due now", scheduled, due.size());
        return scheduled;
    }

    /**
     * Registers and enqueues a target. The kind is inferred from the spelling when null and the
     * default priority applies when {@code priority} is null.
     *
     * @return the stored target
     * @throws IllegalArgumentException when the identifier cannot be canonicalized
     * @throws IllegalStateException    when the target is permanently failed
     */
    public Target seed(String identifier, TargetKind kind, Double priority) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier must not be null/blank");
        }
        TargetKind k = kind == null ? TargetCanonicalizer.inferKind(identifier) : kind;
        String canonical = TargetCanonicalizer.canonicalize(identifier, k);
        Target fresh = Target.discovered(canonical, k, TargetCanonicalizer.domainOf(canonical), clock.instant());
        if (!store.registerIfAbsent(fresh)) {
            Target existing = store.getTarget(canonical).orElse(fresh);
            if (existing.status() == TargetStatus.PERMANENTLY_FAILED) {
                throw new IllegalStateException(canonical + " is permanently failed: " + existing.lastError());
            }
        }
        double p = priority == null ? policy.defaultPriority() : priority;
        boolean created = frontier.enqueue(canonical, k, p);
        log.info("Seeded {} ({}, priority={}, new frontier entry={})", canonical, k, p, created);
        return store.getTarget(canonical).orElse(fresh);
    }

    /**
     * Seeds from {@code crawler.seeds.identifiers} and the optional seeds file. Invalid entries are
     * logged and skipped.
     *
     * @return number of seeds accepted
     */
    public int applyConfiguredSeeds() {
        List<String> seeds = new ArrayList<>();
        CrawlerProperties.SeedsConfig cfg = properties.getSeeds();
        if (cfg.getIdentifiers() != null) seeds.addAll(cfg.getIdentifiers());
        if (cfg.getFile() != null && !cfg.getFile().isBlank()) seeds.addAll(readSeedsFile(cfg.getFile()));
        int accepted = 0;
        for (String s : seeds) {
            if (s == null || s.isBlank()) continue;
            try {
                seed(s.trim(), null, null);
                accepted++;
            } catch (IllegalArgumentException | IllegalStateException e) {
                log.warn("Skipping seed {}: {}", s, e.getMessage());
            }
        }
        return accepted;
    }

    /**
     * One identifier per line; blank lines and {@code #} comments are ignored. Plain paths resolve
     * against the classpath, {@code file:} prefixes against the file system.
     */
    List<String> readSeedsFile(String location) {
        Resource resource = resourceLoader.getResource(location);
        List<String> out = new ArrayList<>();
        try (BufferedReader r = new BufferedReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = r.readLine()) != null) {
                String s = line.trim();
                if (s.isEmpty() || s.startsWith("#")) continue;
                out.add(s);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read seeds file " + location, e);
        }
        return out;
    }

    /**
     * Resumes, applies configured seeds and starts the worker pool.
     */
    public synchronized void start() {
        if (processorManager.isRunning()) {
            log.debug("Worker pool already running; start ignored");
            return;
        }
        resume();
        int seeded = applyConfiguredSeeds();
        log.info("Starting pipeline: {} configured seeds, frontier size {}", seeded, frontier.size());
        processorManager.start();
    }

    public synchronized void stop() {
        if (!processorManager.isRunning()) return;
        processorManager.stopAll();
    }

    /**
     * Blocks until the worker pool exits (drain mode) or the timeout elapses.
     */
    public boolean awaitCompletion(Duration timeout) {
        return processorManager.awaitAll(timeout);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.isAutoStart()) {
            start();
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    @Scheduled(fixedDelayString = "${crawler.stats-log-interval-ms:60000}",
            initialDelayString = "${crawler.stats-log-interval-ms:60000}")
    public void logStats() {
        if (!processorManager.isRunning()) return;
        PipelineStats s = store.stats(clock.instant());
        log.info("Pipeline stats: targets={}, byStatus={}, flagged={} {}, frontier={}, inProgress={}, openFeedback={}",
                s.totalTargets(), s.byStatus(), s.flagged(), s.flaggedByBand(), frontier.size(),
                frontier.inProgressCount(), s.unresolvedFeedback());
    }
}
