package org.smileyface.riskcrawler.controller;

import org.smileyface.riskcrawler.feedback.FeedbackQueue;
import org.smileyface.riskcrawler.model.FeedbackItem;
import org.smileyface.riskcrawler.model.PipelineHealth;
import org.smileyface.riskcrawler.model.PipelineStats;
import org.smileyface.riskcrawler.model.RiskBand;
import org.smileyface.riskcrawler.model.RiskLabel;
import org.smileyface.riskcrawler.model.Target;
import org.smileyface.riskcrawler.model.TargetDetails;
import org.smileyface.riskcrawler.model.TargetKind;
import org.smileyface.riskcrawler.model.TargetPage;
import org.smileyface.riskcrawler.service.CrawlerService;
import org.smileyface.riskcrawler.service.PipelineQueryService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

/**
 * Stateless read API over the State Store plus the feedback boundary used by review tooling.
 */
@RestController
@RequestMapping("/api")
class RiskController {

    private final PipelineQueryService queries;
    private final CrawlerService crawlerService;
    private final FeedbackQueue feedbackQueue;

    RiskController(PipelineQueryService queries, CrawlerService crawlerService, FeedbackQueue feedbackQueue) {
        this.queries = queries;
        this.crawlerService = crawlerService;
        this.feedbackQueue = feedbackQueue;
    }

    @GetMapping("/targets")
    public TargetPage listTargets(@RequestParam(required = false) String band,
                                  @RequestParam(required = false) String kind,
                                  @RequestParam(defaultValue = "0") int offset,
                                  @RequestParam(defaultValue = "" + PipelineQueryService.DEFAULT_LIMIT) int limit) {
        return queries.listTargets(parseEnum(RiskBand.class, band, "band"), parseEnum(TargetKind.class, kind, "kind"),
                offset, limit);
    }

    @GetMapping("/targets/lookup")
    public TargetDetails lookup(@RequestParam("id") String id) {
        return queries.lookup(id);
    }

    @PostMapping("/targets")
    @ResponseStatus(HttpStatus.CREATED)
    public Target seed(@RequestBody SeedRequest request) {
        if (request == null) throw new IllegalArgumentException("request body required");
        return crawlerService.seed(request.identifier(), parseEnum(TargetKind.class, request.kind(), "kind"),
                request.priority());
    }

    @GetMapping("/stats")
    public PipelineStats stats() {
        return queries.stats();
    }

    @GetMapping("/health")
    public PipelineHealth health() {
        return queries.health();
    }

    @GetMapping("/feedback")
    public List<FeedbackItem> drainFeedback(@RequestParam(defaultValue = "" + PipelineQueryService.DEFAULT_LIMIT) int limit) {
        return feedbackQueue.drain(limit);
    }

    @PostMapping("/feedback/{id}/resolve")
    public FeedbackItem resolve(@PathVariable("id") String id, @RequestBody ResolveRequest request) {
        if (request == null || request.label() == null) throw new IllegalArgumentException("label required");
        return feedbackQueue.resolve(id, RiskLabel.fromName(request.label()));
    }

    @PostMapping("/feedback/flag")
    @ResponseStatus(HttpStatus.CREATED)
    public FeedbackItem flag(@RequestBody FlagRequest request) {
        if (request == null || request.identifier() == null) throw new IllegalArgumentException("identifier required");
        return feedbackQueue.flag(queries.lookup(request.identifier()).target().identifier());
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String raw, String name) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + name + ": " + raw, e);
        }
    }

    record SeedRequest(String identifier, String kind, Double priority) {
    }

    record ResolveRequest(String label) {
    }

    record FlagRequest(String identifier) {
    }
}
