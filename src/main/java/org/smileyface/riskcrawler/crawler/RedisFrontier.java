package org.smileyface.riskcrawler.crawler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.riskcrawler.model.FetchOutcome;
import org.smileyface.riskcrawler.model.FrontierEntry;
import org.smileyface.riskcrawler.model.TargetKind;
import org.smileyface.riskcrawler.model.Verdict;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.scripting.support.ResourceScriptSource;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Redis-backed distributed implementation of Frontier.
 *
 * Keys under the configured namespace:
 * "{ns}:frontier:entries" hash identifier -> entry JSON for queued entries,
 * "{ns}:frontier:schedule" sorted set identifier scored by notBefore millis, for entries not yet due,
 * "{ns}:frontier:ready" sorted set of due entries, member "discoveredAt|identifier" scored by
 * -priority so the set itself is in dispatch order,
 * "{ns}:frontier:claimed" hash identifier -> entry JSON for entries held by a worker,
 * "{ns}:frontier:failed" set of permanently failed identifiers.
 * Every mutation runs as a Lua script so dedup, claim-and-mark and release are atomic across processes.
 */
public class RedisFrontier implements Frontier {

    private static final Logger log = LogManager.getLogger();

    private final StringRedisTemplate redis;
    private final RevisitPolicy policy;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();

    private final String entriesKey;
    private final String scheduleKey;
    private final String claimedKey;
    private final String failedKey;
    private final String readyKey;

    private final DefaultRedisScript<Long> enqueueScript;
    private final DefaultRedisScript<String> dequeueScript;
    private final DefaultRedisScript<Long> storeScript;

    public RedisFrontier(StringRedisTemplate redisTemplate, CrawlerProperties properties,
                         RevisitPolicy policy, Clock clock) {
        this.redis = Objects.requireNonNull(redisTemplate, "redisTemplate");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
        String ns = properties.getQueueNamespace() + ":frontier";
        this.entriesKey = ns + ":entries";
        this.scheduleKey = ns + ":schedule";
        this.claimedKey = ns + ":claimed";
        this.failedKey = ns + ":failed";
        this.readyKey = ns + ":ready";

        this.enqueueScript = script("scripts/frontier-enqueue.lua", Long.class);
        this.dequeueScript = script("scripts/frontier-dequeue.lua", String.class);
        this.storeScript = script("scripts/frontier-store.lua", Long.class);
    }

    private static <T> DefaultRedisScript<T> script(String path, Class<T> resultType) {
        DefaultRedisScript<T> script = new DefaultRedisScript<>();
        script.setScriptSource(new ResourceScriptSource(new ClassPathResource(path)));
        script.setResultType(resultType);
        return script;
    }

    @Override
    public boolean enqueue(String identifier, TargetKind kind, double priority) {
        if (identifier == null || identifier.isBlank()) return false;
        Objects.requireNonNull(kind, "kind");
        Instant now = clock.instant();
        FrontierEntry entry = new FrontierEntry(identifier, kind, priority, now, now, 0);
        Long created = redis.execute(enqueueScript,
                List.of(entriesKey, scheduleKey, claimedKey, failedKey, readyKey),
                identifier, toJson(entry), Double.toString(priority), Long.toString(now.toEpochMilli()));
        return created != null && created > 0;
    }

    @Override
    public List<FrontierEntry> dequeueBatch(int n) {
        if (n <= 0) return List.of();
        String raw = redis.execute(dequeueScript,
                List.of(entriesKey, scheduleKey, claimedKey, readyKey),
                Long.toString(clock.millis()), Integer.toString(n));
        if (raw == null || raw.isEmpty()) return List.of();
        List<FrontierEntry> out = new ArrayList<>();
        for (String json : raw.split("\n")) {
            out.add(fromJson(json));
        }
        return out;
    }

    @Override
    public FrontierRelease release(String identifier, FetchOutcome outcome, Verdict verdict) {
        String json = (String) redis.opsForHash().get(claimedKey, identifier);
        if (json == null) {
            throw new IllegalStateException("Not in progress: " + identifier);
        }
        RevisitPolicy.Rescheduling r = policy.reschedule(fromJson(json), outcome, verdict, clock.instant());
        FrontierEntry next = r.next();
        if (next == null) {
            store(identifier, "", 0L, false);
        } else {
            store(identifier, toJson(next), next.notBefore().toEpochMilli(), false);
        }
        return r.release();
    }

    @Override
    public boolean requeue(String identifier) {
        return requeue(identifier, clock.instant());
    }

    @Override
    public boolean requeue(String identifier, Instant notBefore) {
        Objects.requireNonNull(notBefore, "notBefore");
        String json = (String) redis.opsForHash().get(claimedKey, identifier);
        if (json == null) return false;
        FrontierEntry e = fromJson(json);
        FrontierEntry back = new FrontierEntry(identifier, e.kind(), e.priority(), e.discoveredAt(), notBefore, e.failures());
        store(identifier, toJson(back), notBefore.toEpochMilli(), false);
        return true;
    }

    @Override
    public void schedule(FrontierEntry entry) {
        Objects.requireNonNull(entry, "entry");
        store(entry.identifier(), toJson(entry), entry.notBefore().toEpochMilli(), true);
    }

    @Override
    public Optional<FrontierEntry> find(String identifier) {
        Object json = redis.opsForHash().get(entriesKey, identifier);
        if (json == null) json = redis.opsForHash().get(claimedKey, identifier);
        return json == null ? Optional.empty() : Optional.of(fromJson(json.toString()));
    }

    @Override
    public boolean isPermanentlyFailed(String identifier) {
        return Boolean.TRUE.equals(redis.opsForSet().isMember(failedKey, identifier));
    }

    @Override
    public void init() {
        redis.delete(List.of(entriesKey, scheduleKey, claimedKey, failedKey, readyKey));
        log.debug("Frontier keys under {} cleared", entriesKey);
    }

    @Override
    public long size() {
        Long queued = redis.opsForHash().size(entriesKey);
        Long claimed = redis.opsForHash().size(claimedKey);
        return (queued == null ? 0 : queued) + (claimed == null ? 0 : claimed);
    }

    @Override
    public long inProgressCount() {
        Long claimed = redis.opsForHash().size(claimedKey);
        return claimed == null ? 0 : claimed;
    }

    /** Clears the claim and writes the entry back, or tombstones the identifier when json is empty. */
    private void store(String identifier, String json, long notBeforeMillis, boolean clearTombstone) {
        redis.execute(storeScript,
                List.of(entriesKey, scheduleKey, claimedKey, failedKey, readyKey),
                identifier, json, Long.toString(notBeforeMillis), clearTombstone ? "1" : "0");
    }

    private String toJson(FrontierEntry e) {
        try {
            return mapper.writeValueAsString(new StoredEntry(e.identifier(), e.kind().name(), e.priority(),
                    e.discoveredAt().toEpochMilli(), e.notBefore().toEpochMilli(), e.failures()));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize frontier entry " + e.identifier(), ex);
        }
    }

    private FrontierEntry fromJson(String json) {
        try {
            StoredEntry s = mapper.readValue(json, StoredEntry.class);
            return new FrontierEntry(s.identifier(), TargetKind.valueOf(s.kind()), s.priority(),
                    Instant.ofEpochMilli(s.discoveredAt()), Instant.ofEpochMilli(s.notBefore()), s.failures());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Corrupt frontier entry: " + json, ex);
        }
    }

    /** Wire shape of an entry; times in epoch millis so the Lua scripts can compare them. */
    record StoredEntry(String identifier, String kind, double priority, long discoveredAt, long notBefore,
                       int failures) {
    }
}
