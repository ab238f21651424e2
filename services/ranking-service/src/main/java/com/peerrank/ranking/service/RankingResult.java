package com.peerrank.ranking.service;

import com.peerrank.ranking.model.Candidate;
import com.peerrank.ranking.policy.RankingPolicy;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public record RankingResult(
    List<Candidate> ranked,
    int rejectedCount,
    Map<String, Integer> rejectionsByReason,
    int trashCount,
    RankingPolicy policy
) {
    public RankingResult {
        ranked = ranked == null ? List.of() : List.copyOf(ranked);
        rejectionsByReason = rejectionsByReason == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(rejectionsByReason));
    }
}
