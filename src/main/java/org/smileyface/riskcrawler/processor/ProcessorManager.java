package org.smileyface.riskcrawler.processor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.riskcrawler.crawler.CrawlerProperties;
import org.smileyface.riskcrawler.crawler.Frontier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Manages a fixed-size pool of TargetProcessor workers pulling from the shared Frontier.
 * Provides APIs to start, stop and query statuses of processors.
 */
@Component
public class ProcessorManager {

    private static final Logger log = LogManager.getLogger();

    private final Frontier frontier;
    private final TargetPipeline pipeline;
    private final CrawlerProperties properties;
    private final Clock clock;

    private final List<TargetProcessor> processors = new CopyOnWriteArrayList<>();
    private final List<Future<?>> futures = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ExecutorService executor;

    public ProcessorManager(Frontier frontier, TargetPipeline pipeline, CrawlerProperties properties, Clock clock) {
        this.frontier = Objects.requireNonNull(frontier, "frontier");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized void start() {
        start(properties.getWorker().getCount());
    }

    public synchronized void start(int numWorkers) {
        if (isRunning()) {
            throw new IllegalStateException("ProcessorManager already running");
        }
        int n = Math.max(1, numWorkers);
        processors.clear();
        futures.clear();
        AtomicInteger threadIndex = new AtomicInteger();
        executor = Executors.newFixedThreadPool(n, r -> {
            Thread t = new Thread(r, "risk-worker-" + threadIndex.incrementAndGet());
            t.setDaemon(false);
            return t;
        });
        for (int i = 0; i < n; i++) {
            TargetProcessor p = new TargetProcessor("proc-" + (i + 1), frontier, pipeline, properties, clock);
            processors.add(p);
            futures.add(executor.submit(p));
        }
        executor.shutdown();
        running.set(true);
        log.info("ProcessorManager STARTED with {} workers (batchSize={}, drain={})", n,
                properties.getFrontier().getBatchSize(), properties.getWorker().isDrain());
    }

    /**
     * Requests every worker to stop after its current target and waits for them to exit.
     */
    public synchronized void stopAll() {
        if (processors.isEmpty()) return;
        for (TargetProcessor p : processors) {
            p.stop();
        }
        for (Future<?> f : futures) {
            try {
                f.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ExecutionException e) {
                log.error("Processor task failed", e.getCause());
            }
        }
        running.set(false);
        logAggregate("STOPPED");
    }

    public List<ProcessorStatus> getStatuses() {
        List<ProcessorStatus> list = new ArrayList<>(processors.size());
        for (TargetProcessor p : processors) {
            list.add(p.getStatus());
        }
        return list;
    }

    public boolean isRunning() {
        if (!running.get()) return false;
        for (Future<?> f : futures) {
            if (!f.isDone()) return true;
        }
        return false;
    }

    /**
     * Wait until all processors exit or the timeout elapses.
     * @return true if all processors finished before timeout, false otherwise.
     */
    public boolean awaitAll(Duration timeout) {
        long remainingMs = timeout == null ? Long.MAX_VALUE / 2 : Math.max(0, timeout.toMillis());
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(remainingMs);
        for (Future<?> f : futures) {
            long nanosLeft = deadline - System.nanoTime();
            if (nanosLeft <= 0) {
                logAggregate("AWAIT TIMEOUT");
                return false;
            }
            try {
                f.get(nanosLeft, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                logAggregate("AWAIT TIMEOUT");
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logAggregate("AWAIT INTERRUPTED");
                return false;
            } catch (ExecutionException e) {
                log.error("Processor task failed", e.getCause());
            }
        }
        running.set(false);
        logAggregate("ALL COMPLETED");
        return true;
    }

    private void logAggregate(String event) {
        int completed = 0;
        int stopped = 0;
        int error = 0;
        long processed = 0L;
        long failed = 0L;
        List<ProcessorStatus> statuses = getStatuses();
        for (ProcessorStatus s : statuses) {
            processed += s.getProcessedCount();
            failed += s.getFailedCount();
            ProcessorState st = s.getState();
            if (st == ProcessorState.COMPLETED) completed++;
            else if (st == ProcessorState.STOPPED) stopped++;
            else if (st == ProcessorState.ERROR) error++;
        }
        log.info("ProcessorManager {}: processors -> completed={}, stopped={}, error={}, totalProcessed={}, totalFailed={} (workers={})",
                event, completed, stopped, error, processed, failed, statuses.size());
    }
}
