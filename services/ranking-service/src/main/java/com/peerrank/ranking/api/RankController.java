package com.peerrank.ranking.api;

import com.peerrank.ranking.api.dto.ErrorResponse;
import com.peerrank.ranking.api.dto.RankRequest;
import com.peerrank.ranking.api.dto.RankResponse;
import com.peerrank.ranking.model.Candidate;
import com.peerrank.ranking.policy.RankingPolicy;
import com.peerrank.ranking.policy.RankingPolicyService;
import com.peerrank.ranking.service.RankingEngine;
import com.peerrank.ranking.service.RankingResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RankController {
    private final RankingEngine rankingEngine;
    private final RankingPolicyService policyService;

    public RankController(RankingEngine rankingEngine, RankingPolicyService policyService) {
        this.rankingEngine = rankingEngine;
        this.policyService = policyService;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @GetMapping("/policy")
    public Map<String, Object> policy() {
        return policyView(policyService.getPolicy());
    }

    @PostMapping("/rank")
    public ResponseEntity<?> rank(
        @RequestBody(required = false) RankRequest request,
        @RequestHeader(value = "x-trace-id", required = false) String traceHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestHeader
    ) {
        long started = System.nanoTime();
        String traceId = RequestIdUtil.resolveOrGenerate(traceHeader);
        String requestId = RequestIdUtil.resolveOrGenerate(requestHeader);

        if (request == null || request.getTarget() == null) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", "target is required", traceId, requestId)
            );
        }
        if (request.getCandidates() == null || request.getCandidates().isEmpty()) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", "candidates is required", traceId, requestId)
            );
        }

        RankRequest.Options options = request.getOptions();
        boolean debugEnabled = options != null && Boolean.TRUE.equals(options.getDebug());
        RankingPolicy policy = policyService.resolve(options == null ? null : options.getPriority());
        String queryText = request.getQuery() == null ? null : request.getQuery().getText();

        RankingResult result = rankingEngine.rank(
            RankRequestMapper.toTarget(request.getTarget()),
            queryText,
            RankRequestMapper.toCandidates(request.getCandidates()),
            policy
        );

        List<Candidate> ranked = result.ranked();
        int limit = ranked.size();
        if (options != null && options.getSize() != null) {
            limit = Math.min(limit, Math.max(options.getSize(), 0));
        }
        List<RankResponse.Hit> hits = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            hits.add(toHit(ranked.get(i), i + 1, debugEnabled));
        }

        RankResponse response = new RankResponse();
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        response.setPriority(result.policy().priority().name().toLowerCase(Locale.ROOT));
        response.setRejectedCount(result.rejectedCount());
        response.setTrashCount(result.trashCount());
        response.setHits(hits);
        if (debugEnabled) {
            RankResponse.DebugInfo debug = new RankResponse.DebugInfo();
            debug.setRejectionsByReason(result.rejectionsByReason());
            debug.setPolicy(policyView(result.policy()));
            response.setDebug(debug);
        }
        response.setTookMs((System.nanoTime() - started) / 1_000_000L);
        return ResponseEntity.ok(response);
    }

    private RankResponse.Hit toHit(Candidate candidate, int rank, boolean debugEnabled) {
        RankResponse.Hit hit = new RankResponse.Hit();
        hit.setRank(rank);
        hit.setSourceId(candidate.getSourceId());
        hit.setFilename(candidate.getFilename());
        hit.setTier(candidate.getTier() == null ? null : candidate.getTier().name().toLowerCase(Locale.ROOT));
        hit.setRankScore(candidate.getRankScore());
        hit.setRankBreakdown(candidate.getRankBreakdown());
        hit.setOriginalIndex(candidate.getOriginalIndex());
        if (debugEnabled) {
            RankResponse.Debug debug = new RankResponse.Debug();
            debug.setForensicReasons(candidate.getForensicReasons());
            hit.setDebug(debug);
        }
        return hit;
    }

    private Map<String, Object> policyView(RankingPolicy policy) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("priority", policy.priority().name().toLowerCase(Locale.ROOT));
        view.put("enforce_duration_match", policy.enforceDurationMatch());
        view.put("duration_tolerance_seconds", policy.durationToleranceSeconds());
        view.put("significant_bitrate_gap_kbps", policy.significantBitrateGapKbps());
        view.put("significant_queue_gap", policy.significantQueueGap());
        view.put("enforce_strict_title_match", policy.enforceStrictTitleMatch());
        view.put("fuzzy_normalization", policy.fuzzyNormalization());
        view.put("enforce_file_integrity", policy.enforceFileIntegrity());
        view.put("forensics_enabled", policy.forensicsEnabled());
        view.put("availability_queue_veto", policy.availabilityQueueVeto());
        view.put("bpm_tolerance", policy.bpmTolerance());
        view.put("blocked_source_count", policy.blockedSources().size());
        return view;
    }
}
