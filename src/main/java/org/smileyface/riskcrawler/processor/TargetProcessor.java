package org.smileyface.riskcrawler.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.riskcrawler.crawler.CrawlerProperties;
import org.smileyface.riskcrawler.crawler.Frontier;
import org.smileyface.riskcrawler.model.FrontierEntry;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A worker that repeatedly claims a batch from the Frontier and runs each entry through the
 * {@link TargetPipeline}, one at a time. On stop it finishes the current target and hands the rest of
 * its batch back to the Frontier.
 */
public class TargetProcessor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TargetProcessor.class);

    private final String id;
    private final Frontier frontier;
    private final TargetPipeline pipeline;
    private final CrawlerProperties properties;
    private final Clock clock;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicLong processedCount = new AtomicLong(0);
    private final AtomicLong failedCount = new AtomicLong(0);
    private final Object idleMonitor = new Object();

    private volatile ProcessorState state = ProcessorState.NEW;
    private volatile String lastIdentifier;
    private volatile String lastError;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    public TargetProcessor(String id,
                           Frontier frontier,
                           TargetPipeline pipeline,
                           CrawlerProperties properties,
                           Clock clock) {
        this.id = Objects.requireNonNull(id, "id");
        this.frontier = Objects.requireNonNull(frontier, "frontier");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String getId() {
        return id;
    }

    public void stop() {
        stopRequested.set(true);
        synchronized (idleMonitor) {
            idleMonitor.notifyAll();
        }
        if (state == ProcessorState.NEW) {
            transitionTo(ProcessorState.STOPPED, null);
        }
    }

    public ProcessorStatus getStatus() {
        return new ProcessorStatus(id, state, processedCount.get(), failedCount.get(), lastIdentifier, lastError,
                startedAt, finishedAt);
    }

    @Override
    public void run() {
        if (stopRequested.get()) {
            return;
        }
        transitionTo(ProcessorState.RUNNING, null);
        CrawlerProperties.WorkerConfig worker = properties.getWorker();
        int batchSize = properties.getFrontier().getBatchSize();
        try {
            for (;;) {
                if (stopRequested.get()) {
                    transitionTo(ProcessorState.STOPPED, null);
                    return;
                }
                List<FrontierEntry> batch = frontier.dequeueBatch(batchSize);
                if (batch.isEmpty()) {
                    if (worker.isDrain() && frontier.inProgressCount() == 0) {
                        transitionTo(ProcessorState.COMPLETED, null);
                        return;
                    }
                    idle(worker.getIdlePollMs());
                    continue;
                }
                for (int i = 0; i < batch.size(); i++) {
                    if (stopRequested.get()) {
                        handBack(batch.subList(i, batch.size()));
                        break;
                    }
                    FrontierEntry entry = batch.get(i);
                    lastIdentifier = entry.identifier();
                    CycleResult result = pipeline.process(entry);
                    processedCount.incrementAndGet();
                    if (result.isFailure()) failedCount.incrementAndGet();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            transitionTo(ProcessorState.STOPPED, null);
        } catch (Throwable t) {
            lastError = t.getMessage();
            transitionTo(ProcessorState.ERROR, t);
        }
    }

    private void handBack(List<FrontierEntry> rest) {
        for (FrontierEntry e : rest) {
            frontier.requeue(e.identifier());
        }
        log.info("Processor {} handed {} claimed entries back on stop", id, rest.size());
    }

    private void idle(long millis) throws InterruptedException {
        synchronized (idleMonitor) {
            if (!stopRequested.get()) {
                idleMonitor.wait(Math.max(1L, millis));
            }
        }
    }

    /**
     * Centralized state transition with structured logging. Terminal states carry duration and counts.
     */
    private void transitionTo(ProcessorState newState, Throwable error) {
        ProcessorState old = this.state;
        if (newState == ProcessorState.RUNNING) {
            if (this.startedAt == null) {
                this.startedAt = clock.instant();
            }
            this.state = ProcessorState.RUNNING;
            log.info("Processor {} state {} -> {} (startedAt={})", id, old, this.state, startedAt);
            return;
        }

        this.finishedAt = clock.instant();
        this.state = newState;
        long dur = startedAt != null ? Math.max(0, finishedAt.toEpochMilli() - startedAt.toEpochMilli()) : 0L;
        long count = processedCount.get();
        switch (newState) {
            case STOPPED -> log.info("Processor {} state {} -> STOPPED after {} ms (processed={}, failed={}, last={})",
                    id, old, dur, count, failedCount.get(), lastIdentifier);
            case COMPLETED -> log.info("Processor {} state {} -> COMPLETED after {} ms (processed={}, failed={})",
                    id, old, dur, count, failedCount.get());
            case ERROR -> log.error("Processor {} state {} -> ERROR after {} ms (processed={}, last={}, error={})",
                    id, old, dur, count, lastIdentifier, lastError, error);
            default -> log.info("Processor {} state {} -> {}", id, old, newState);
        }
    }
}
