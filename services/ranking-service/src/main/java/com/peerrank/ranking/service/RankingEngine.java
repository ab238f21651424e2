package com.peerrank.ranking.service;

import com.peerrank.ranking.execution.RankingExecutionProperties;
import com.peerrank.ranking.forensic.ForensicReport;
import com.peerrank.ranking.model.Candidate;
import com.peerrank.ranking.model.Target;
import com.peerrank.ranking.model.Tier;
import com.peerrank.ranking.policy.RankingPolicy;
import com.peerrank.ranking.safety.SafetyFilter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class RankingEngine {
    private static final Logger log = LoggerFactory.getLogger(RankingEngine.class);
    static final String REASON_EVALUATION_ERROR = "evaluation_error";

    private final SafetyFilter safetyFilter;
    private final TierClassifier tierClassifier;
    private final ExecutorService rankingExecutor;
    private final RankingExecutionProperties executionProperties;
    private final MeterRegistry meterRegistry;

    public RankingEngine(
        SafetyFilter safetyFilter,
        TierClassifier tierClassifier,
        ExecutorService rankingExecutor,
        RankingExecutionProperties executionProperties,
        MeterRegistry meterRegistry
    ) {
        this.safetyFilter = safetyFilter;
        this.tierClassifier = tierClassifier;
        this.rankingExecutor = rankingExecutor;
        this.executionProperties = executionProperties;
        this.meterRegistry = meterRegistry;
    }

    public RankingResult rank(Target target, List<Candidate> candidates, RankingPolicy policy) {
        return rank(target, null, candidates, policy);
    }

    public RankingResult rank(Target target, String queryText, List<Candidate> candidates, RankingPolicy policy) {
        long started = System.nanoTime();
        RankingPolicy snapshot = policy == null ? RankingPolicy.qualityFirst() : policy;
        Target resolvedTarget = target == null ? Target.empty() : target;
        String resolvedQuery = isBlank(queryText) ? resolvedTarget.queryText() : queryText;
        List<Candidate> batch = candidates == null ? List.of() : new ArrayList<>(candidates);

        for (int i = 0; i < batch.size(); i++) {
            Candidate candidate = batch.get(i);
            if (candidate != null) {
                candidate.setOriginalIndex(i);
            }
        }

        List<Evaluation> evaluations = evaluateAll(batch, resolvedTarget, resolvedQuery, snapshot);

        List<Candidate> survivors = new ArrayList<>(batch.size());
        Map<String, Integer> rejections = new TreeMap<>();
        int rejectedCount = 0;
        int trashCount = 0;
        for (Evaluation evaluation : evaluations) {
            if (evaluation.rejection() != null) {
                rejectedCount++;
                rejections.merge(evaluation.rejection(), 1, Integer::sum);
                meterRegistry.counter("pr_safety_rejected_total", "reason", evaluation.rejection()).increment();
                continue;
            }
            Candidate candidate = evaluation.candidate();
            candidate.setTier(evaluation.tier());
            candidate.setForensicReasons(evaluation.forensicReport().reasonCodes());
            if (evaluation.tier() == Tier.TRASH) {
                trashCount++;
            }
            survivors.add(candidate);
        }

        survivors.sort(TieredCandidateComparator.byAssignedTier(snapshot));
        for (Candidate candidate : survivors) {
            RankReporter.annotate(candidate);
        }

        meterRegistry.counter("pr_rank_calls_total").increment();
        meterRegistry.counter("pr_rank_candidates_total").increment(batch.size());
        if (trashCount > 0) {
            meterRegistry.counter("pr_forensic_trash_total").increment(trashCount);
        }

        long tookMs = (System.nanoTime() - started) / 1_000_000L;
        log.debug(
            "ranked priority={} candidates_in={} rejected={} trash={} took_ms={}",
            snapshot.priority(),
            batch.size(),
            rejectedCount,
            trashCount,
            tookMs
        );
        return new RankingResult(survivors, rejectedCount, rejections, trashCount, snapshot);
    }

    private List<Evaluation> evaluateAll(List<Candidate> batch, Target target, String queryText, RankingPolicy policy) {
        int threshold = Math.max(1, executionProperties.getParallelThreshold());
        int workers = Math.max(1, executionProperties.getPoolSize());
        if (rankingExecutor == null || batch.size() < threshold || workers == 1) {
            return evaluateRange(batch, 0, batch.size(), target, queryText, policy);
        }

        int chunkSize = (batch.size() + workers - 1) / workers;
        List<CompletableFuture<List<Evaluation>>> futures = new ArrayList<>();
        try {
            for (int from = 0; from < batch.size(); from += chunkSize) {
                int start = from;
                int end = Math.min(batch.size(), from + chunkSize);
                futures.add(CompletableFuture.supplyAsync(
                    () -> evaluateRange(batch, start, end, target, queryText, policy),
                    rankingExecutor
                ));
            }
        } catch (RejectedExecutionException ex) {
            log.warn("ranking executor rejected work; evaluating inline candidates={}", batch.size(), ex);
            return evaluateRange(batch, 0, batch.size(), target, queryText, policy);
        }

        List<Evaluation> evaluations = new ArrayList<>(batch.size());
        for (CompletableFuture<List<Evaluation>> future : futures) {
            try {
                evaluations.addAll(future.join());
            } catch (CompletionException ex) {
                throw new IllegalStateException("candidate evaluation chunk failed", ex.getCause());
            }
        }
        return evaluations;
    }

    private List<Evaluation> evaluateRange(
        List<Candidate> batch,
        int from,
        int to,
        Target target,
        String queryText,
        RankingPolicy policy
    ) {
        List<Evaluation> evaluations = new ArrayList<>(to - from);
        for (int i = from; i < to; i++) {
            evaluations.add(evaluateOne(batch.get(i), i, target, queryText, policy));
        }
        return evaluations;
    }

    private Evaluation evaluateOne(Candidate candidate, int index, Target target, String queryText, RankingPolicy policy) {
        try {
            Optional<String> rejection = safetyFilter.evaluate(candidate, queryText, target.knownLengthSeconds(), policy);
            if (rejection.isPresent()) {
                return Evaluation.rejected(candidate, rejection.get());
            }
            TierClassifier.Classification classification = tierClassifier.evaluate(candidate, target, policy);
            return new Evaluation(candidate, null, classification.tier(), classification.forensicReport());
        } catch (RuntimeException ex) {
            if (candidate == null) {
                return Evaluation.rejected(null, SafetyFilter.REASON_INTEGRITY);
            }
            log.warn("candidate evaluation failed index={} source={}; demoting to trash", index, candidate.getSourceId(), ex);
            meterRegistry.counter("pr_evaluation_errors_total").increment();
            return new Evaluation(candidate, null, Tier.TRASH, ForensicReport.flagged(REASON_EVALUATION_ERROR));
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private record Evaluation(Candidate candidate, String rejection, Tier tier, ForensicReport forensicReport) {
        private static Evaluation rejected(Candidate candidate, String reason) {
            return new Evaluation(candidate, reason, null, ForensicReport.clean());
        }
    }
}
