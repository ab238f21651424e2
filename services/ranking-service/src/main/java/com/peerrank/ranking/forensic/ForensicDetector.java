package com.peerrank.ranking.forensic;

import com.peerrank.ranking.model.Candidate;
import com.peerrank.ranking.model.Target;

/**
 * Flags candidates whose self-reported metadata is implausible. Implementations must be pure:
 * the same candidate and target always produce the same report.
 */
public interface ForensicDetector {

    ForensicReport inspect(Candidate candidate, Target target);

    default boolean isFake(Candidate candidate) {
        return inspect(candidate, null).isFake();
    }

    default boolean isFake(Candidate candidate, Target target) {
        return inspect(candidate, target).isFake();
    }
}
