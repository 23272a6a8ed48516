package org.smileyface.riskcrawler.crawler;

import org.smileyface.riskcrawler.model.FetchOutcome;
import org.smileyface.riskcrawler.model.FrontierEntry;
import org.smileyface.riskcrawler.model.TargetKind;
import org.smileyface.riskcrawler.model.Verdict;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-process frontier. Queued entries live in one of two ordered sets: {@code ready}
 * (eligible, ordered for dispatch) or {@code waiting} (ordered by notBefore). A dequeue first
 * promotes waiting entries whose time has come. One lock guards all state, so claim-and-mark
 * is atomic with respect to concurrent workers.
 */
public class InMemoryFrontier implements Frontier {

    static final Comparator<FrontierEntry> DISPATCH_ORDER = Comparator
            .comparingDouble(FrontierEntry::priority).reversed()
            .thenComparing(FrontierEntry::discoveredAt)
            .thenComparing(FrontierEntry::identifier);

    private static final Comparator<FrontierEntry> WAKE_ORDER = Comparator
            .comparing(FrontierEntry::notBefore)
            .thenComparing(FrontierEntry::identifier);

    private final RevisitPolicy policy;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, FrontierEntry> queued = new HashMap<>();
    private final NavigableSet<FrontierEntry> ready = new TreeSet<>(DISPATCH_ORDER);
    private final NavigableSet<FrontierEntry> waiting = new TreeSet<>(WAKE_ORDER);
    private final Map<String, FrontierEntry> claimed = new HashMap<>();
    private final Set<String> tombstones = new HashSet<>();

    public InMemoryFrontier(RevisitPolicy policy, Clock clock) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public boolean enqueue(String identifier, TargetKind kind, double priority) {
        if (identifier == null || identifier.isBlank()) return false;
        Objects.requireNonNull(kind, "kind");
        lock.lock();
        try {
            if (tombstones.contains(identifier) || claimed.containsKey(identifier)) {
                return false;
            }
            FrontierEntry existing = queued.get(identifier);
            if (existing != null) {
                if (priority > existing.priority()) {
                    unlink(existing);
                    link(new FrontierEntry(identifier, existing.kind(), priority, existing.discoveredAt(),
                            existing.notBefore(), existing.failures()));
                }
                return false;
            }
            Instant now = clock.instant();
            link(new FrontierEntry(identifier, kind, priority, now, now, 0));
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<FrontierEntry> dequeueBatch(int n) {
        if (n <= 0) return List.of();
        lock.lock();
        try {
            Instant now = clock.instant();
            while (!waiting.isEmpty() && waiting.first().isEligible(now)) {
                ready.add(waiting.pollFirst());
            }
            List<FrontierEntry> batch = new ArrayList<>(Math.min(n, ready.size()));
            while (batch.size() < n && !ready.isEmpty()) {
                FrontierEntry e = ready.pollFirst();
                queued.remove(e.identifier());
                claimed.put(e.identifier(), e);
                batch.add(e);
            }
            return batch;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public FrontierRelease release(String identifier, FetchOutcome outcome, Verdict verdict) {
        lock.lock();
        try {
            FrontierEntry entry = claimed.remove(identifier);
            if (entry == null) {
                throw new IllegalStateException("Not in progress: " + identifier);
            }
            RevisitPolicy.Rescheduling r = policy.reschedule(entry, outcome, verdict, clock.instant());
            if (r.next() == null) {
                tombstones.add(identifier);
            } else {
                link(r.next());
            }
            return r.release();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean requeue(String identifier) {
        return requeue(identifier, clock.instant());
    }

    @Override
    public boolean requeue(String identifier, Instant notBefore) {
        Objects.requireNonNull(notBefore, "notBefore");
        lock.lock();
        try {
            FrontierEntry entry = claimed.remove(identifier);
            if (entry == null) return false;
            link(new FrontierEntry(identifier, entry.kind(), entry.priority(), entry.discoveredAt(),
                    notBefore, entry.failures()));
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void schedule(FrontierEntry entry) {
        Objects.requireNonNull(entry, "entry");
        lock.lock();
        try {
            FrontierEntry existing = queued.get(entry.identifier());
            if (existing != null) unlink(existing);
            claimed.remove(entry.identifier());
            tombstones.remove(entry.identifier());
            link(entry);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<FrontierEntry> find(String identifier) {
        lock.lock();
        try {
            FrontierEntry e = queued.get(identifier);
            return Optional.ofNullable(e != null ? e : claimed.get(identifier));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isPermanentlyFailed(String identifier) {
        lock.lock();
        try {
            return tombstones.contains(identifier);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void init() {
        lock.lock();
        try {
            queued.clear();
            ready.clear();
            waiting.clear();
            claimed.clear();
            tombstones.clear();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long size() {
        lock.lock();
        try {
            return queued.size() + claimed.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long inProgressCount() {
        lock.lock();
        try {
            return claimed.size();
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private void link(FrontierEntry e) {
        queued.put(e.identifier(), e);
        if (e.isEligible(clock.instant())) {
            ready.add(e);
        } else {
            waiting.add(e);
        }
    }

    // caller holds the lock
    private void unlink(FrontierEntry e) {
        queued.remove(e.identifier());
        if (!ready.remove(e)) {
            waiting.remove(e);
        }
    }
}
