package com.peerrank.ranking.service;

import com.peerrank.ranking.model.Candidate;
import com.peerrank.ranking.model.Target;
import com.peerrank.ranking.model.Tier;
import com.peerrank.ranking.policy.RankingPolicy;
import java.util.Comparator;
import java.util.function.Function;

public final class TieredCandidateComparator implements Comparator<Candidate> {
    private final Function<Candidate, Tier> tierLookup;
    private final IntraTierComparator intraTier;

    public TieredCandidateComparator(Function<Candidate, Tier> tierLookup, RankingPolicy policy) {
        this.tierLookup = tierLookup;
        this.intraTier = new IntraTierComparator(policy);
    }

    /**
     * Comparator over candidates already annotated by the engine.
     */
    public static TieredCandidateComparator byAssignedTier(RankingPolicy policy) {
        return new TieredCandidateComparator(Candidate::getTier, policy);
    }

    /**
     * Comparator that classifies on every comparison; meant for small or one-off comparisons.
     */
    public static TieredCandidateComparator classifying(TierClassifier classifier, Target target, RankingPolicy policy) {
        return new TieredCandidateComparator(candidate -> classifier.classify(candidate, target, policy), policy);
    }

    @Override
    public int compare(Candidate a, Candidate b) {
        if (a == b) {
            return 0;
        }
        if (a == null) {
            return 1;
        }
        if (b == null) {
            return -1;
        }
        int tier = Integer.compare(tierRank(a), tierRank(b));
        if (tier != 0) {
            return tier;
        }
        return intraTier.compare(a, b);
    }

    private int tierRank(Candidate candidate) {
        Tier tier = tierLookup.apply(candidate);
        return tier == null ? Tier.TRASH.rank() : tier.rank();
    }
}
