package com.peerrank.ranking.safety;

import com.peerrank.ranking.model.Candidate;
import com.peerrank.ranking.policy.RankingPolicy;
import com.peerrank.ranking.query.QueryTokenizer;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class SafetyFilter {
    public static final String REASON_BLOCKED_SOURCE = "blocked_source";
    public static final String REASON_INTEGRITY = "integrity";
    public static final String REASON_DURATION_MISMATCH = "duration_mismatch";
    public static final String REASON_TOKEN_MISMATCH = "token_mismatch";

    public boolean isSafe(Candidate candidate, String queryText, Integer targetLengthSeconds, RankingPolicy policy) {
        return evaluate(candidate, queryText, targetLengthSeconds, policy).isEmpty();
    }

    /**
     * Returns the reason code of the first gate the candidate fails, or empty when it passes.
     */
    public Optional<String> evaluate(
        Candidate candidate,
        String queryText,
        Integer targetLengthSeconds,
        RankingPolicy policy
    ) {
        if (candidate == null) {
            return Optional.of(REASON_INTEGRITY);
        }

        if (policy.isBlocked(candidate.getSourceId())) {
            return Optional.of(REASON_BLOCKED_SOURCE);
        }

        if (policy.enforceFileIntegrity()) {
            boolean blankFilename = candidate.getFilename() == null || candidate.getFilename().isBlank();
            boolean emptyFile = candidate.getSizeBytes() != null && candidate.getSizeBytes() <= 0;
            if (blankFilename || emptyFile) {
                return Optional.of(REASON_INTEGRITY);
            }
        }

        if (exceedsDurationTolerance(candidate, targetLengthSeconds, policy)) {
            return Optional.of(REASON_DURATION_MISMATCH);
        }

        if (policy.enforceStrictTitleMatch()) {
            String candidateText = pathAsWords(candidate.getFilename());
            if (!QueryTokenizer.matchesAllTokens(queryText, candidateText, policy.fuzzyNormalization())) {
                return Optional.of(REASON_TOKEN_MISMATCH);
            }
        }

        return Optional.empty();
    }

    public static boolean exceedsDurationTolerance(Candidate candidate, Integer targetLengthSeconds, RankingPolicy policy) {
        if (!policy.enforceDurationMatch()) {
            return false;
        }
        Integer length = candidate.knownLengthSeconds();
        if (length == null || targetLengthSeconds == null || targetLengthSeconds <= 0) {
            return false;
        }
        return Math.abs(length - targetLengthSeconds) > policy.durationToleranceSeconds();
    }

    // peers report full share paths; folder names count as words too
    private static String pathAsWords(String filename) {
        if (filename == null) {
            return null;
        }
        return filename.replace('\\', ' ').replace('/', ' ');
    }
}
