package com.peerrank.ranking.service;

import com.peerrank.ranking.model.Candidate;
import com.peerrank.ranking.model.Tier;

public final class RankReporter {

    private RankReporter() {
    }

    public static double score(Tier tier) {
        if (tier == null) {
            return 0.10;
        }
        return switch (tier) {
            case DIAMOND -> 1.0;
            case GOLD -> 0.85;
            case SILVER -> 0.60;
            case BRONZE -> 0.40;
            case TRASH -> 0.10;
        };
    }

    public static String breakdown(Tier tier) {
        if (tier == null) {
            return "Unclassified";
        }
        return switch (tier) {
            case DIAMOND -> "Diamond: perfect match, high quality, available now";
            case GOLD -> "Gold: great quality, good availability";
            case SILVER -> "Silver: acceptable match";
            case BRONZE -> "Bronze: low quality or availability";
            case TRASH -> "Forensic Mismatch (possible fake)";
        };
    }

    public static void annotate(Candidate candidate) {
        candidate.setRankScore(score(candidate.getTier()));
        candidate.setRankBreakdown(breakdown(candidate.getTier()));
    }
}
