package org.smileyface.riskcrawler.store;

import org.smileyface.riskcrawler.model.FeedbackItem;
import org.smileyface.riskcrawler.model.PipelineStats;
import org.smileyface.riskcrawler.model.RiskBand;
import org.smileyface.riskcrawler.model.Target;
import org.smileyface.riskcrawler.model.TargetKind;
import org.smileyface.riskcrawler.model.TargetPage;
import org.smileyface.riskcrawler.model.TargetStatus;
import org.smileyface.riskcrawler.model.TargetView;
import org.smileyface.riskcrawler.model.Verdict;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local State Store. Each target is one immutable record (target, current verdict, history)
 * swapped with {@link ConcurrentHashMap#compute}, so a verdict write replaces all three at once.
 */
public class InMemoryStateStore implements StateStore {

    static final Comparator<TargetView> LISTING_ORDER = Comparator
            .comparingDouble((TargetView v) -> v.verdict() == null ? -1.0 : v.verdict().riskScore()).reversed()
            .thenComparing((TargetView v) -> v.verdict() == null ? Instant.MIN : v.verdict().producedAt(),
                    Comparator.reverseOrder())
            .thenComparing(v -> v.target().identifier());

    private final Map<String, Entry> targets = new ConcurrentHashMap<>();
    private final Map<String, FeedbackItem> feedback = new ConcurrentHashMap<>();

    @Override
    public Optional<Target> getTarget(String identifier) {
        Entry e = targets.get(identifier);
        return e == null ? Optional.empty() : Optional.of(e.target());
    }

    @Override
    public boolean registerIfAbsent(Target target) {
        Objects.requireNonNull(target, "target");
        return targets.putIfAbsent(target.identifier(), new Entry(target, null, List.of())) == null;
    }

    @Override
    public void putTarget(Target target) {
        Objects.requireNonNull(target, "target");
        targets.compute(target.identifier(), (id, old) -> old == null
                ? new Entry(target, null, List.of())
                : new Entry(target, old.current(), old.history()));
    }

    @Override
    public void recordVerdict(Target target, Verdict verdict) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(verdict, "verdict");
        if (!target.identifier().equals(verdict.target())) {
            throw new IllegalArgumentException("verdict " + verdict.target() + " does not belong to " + target.identifier());
        }
        targets.compute(target.identifier(), (id, old) -> {
            List<Verdict> history = new ArrayList<>(old == null ? List.of() : old.history());
            // a repeated write for the same visit replaces that visit's entry
            if (old != null && old.current() != null && !history.isEmpty()
                    && old.target().visitCount() == target.visitCount()) {
                history.remove(history.size() - 1);
            }
            history.add(verdict);
            return new Entry(target, verdict, List.copyOf(history));
        });
    }

    @Override
    public Optional<Verdict> currentVerdict(String identifier) {
        Entry e = targets.get(identifier);
        return e == null ? Optional.empty() : Optional.ofNullable(e.current());
    }

    @Override
    public List<Verdict> verdictHistory(String identifier) {
        Entry e = targets.get(identifier);
        return e == null ? List.of() : e.history();
    }

    @Override
    public List<Target> listTargets(TargetStatus status) {
        List<Target> out = new ArrayList<>();
        for (Entry e : targets.values()) {
            if (status == null || e.target().status() == status) out.add(e.target());
        }
        out.sort(Comparator.comparing(Target::identifier));
        return out;
    }

    @Override
    public TargetPage listByRiskBand(RiskBand band, TargetKind kind, int offset, int limit) {
        List<TargetView> matching = new ArrayList<>();
        for (Entry e : targets.values()) {
            if (kind != null && e.target().kind() != kind) continue;
            if (band != null && (e.current() == null || e.current().band() != band)) continue;
            matching.add(TargetView.of(e.target(), e.current()));
        }
        matching.sort(LISTING_ORDER);
        int from = Math.min(Math.max(0, offset), matching.size());
        int to = Math.min(matching.size(), from + Math.max(0, limit));
        return new TargetPage(matching.subList(from, to), matching.size(), offset, limit);
    }

    @Override
    public void putFeedback(FeedbackItem item) {
        Objects.requireNonNull(item, "item");
        feedback.put(item.id(), item);
    }

    @Override
    public Optional<FeedbackItem> getFeedback(String id) {
        return Optional.ofNullable(feedback.get(id));
    }

    @Override
    public List<FeedbackItem> listFeedback(boolean unresolvedOnly, int limit) {
        return feedback.values().stream()
                .filter(f -> !unresolvedOnly || !f.resolved())
                .sorted(Comparator.comparing(FeedbackItem::enqueuedAt).thenComparing(FeedbackItem::id))
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public PipelineStats stats(Instant now) {
        Map<TargetStatus, Long> byStatus = new EnumMap<>(TargetStatus.class);
        Map<RiskBand, Long> byBand = new EnumMap<>(RiskBand.class);
        for (TargetStatus s : TargetStatus.values()) byStatus.put(s, 0L);
        for (RiskBand b : RiskBand.values()) byBand.put(b, 0L);
        Instant startOfDay = now.truncatedTo(ChronoUnit.DAYS);
        Instant weekAgo = now.minus(Duration.ofDays(7));

        long flagged = 0;
        long today = 0;
        long week = 0;
        double riskSum = 0.0;
        Set<String> domains = new HashSet<>();
        for (Entry e : targets.values()) {
            byStatus.merge(e.target().status(), 1L, Long::sum);
            if (e.target().domain() != null) domains.add(e.target().domain());
            Verdict v = e.current();
            if (v == null || !v.label().isRisky()) continue;
            flagged++;
            riskSum += v.riskScore();
            byBand.merge(v.band(), 1L, Long::sum);
            if (!v.producedAt().isBefore(startOfDay)) today++;
            if (!v.producedAt().isBefore(weekAgo)) week++;
        }
        long unresolved = feedback.values().stream().filter(f -> !f.resolved()).count();
        double avg = flagged == 0 ? 0.0 : riskSum / flagged;
        return new PipelineStats(targets.size(), byStatus, flagged, byBand, today, week, avg, domains.size(), unresolved);
    }

    private record Entry(Target target, Verdict current, List<Verdict> history) {
    }
}
