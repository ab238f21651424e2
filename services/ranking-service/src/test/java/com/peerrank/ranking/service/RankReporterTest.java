package com.peerrank.ranking.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.peerrank.ranking.model.Candidate;
import com.peerrank.ranking.model.Tier;
import org.junit.jupiter.api.Test;

class RankReporterTest {

    @Test
    void scoresDecreaseWithTier() {
        Tier[] tiers = Tier.values();
        for (int i = 1; i < tiers.length; i++) {
            assertTrue(RankReporter.score(tiers[i - 1]) > RankReporter.score(tiers[i]));
        }
        assertEquals(1.0, RankReporter.score(Tier.DIAMOND));
        assertEquals(RankReporter.score(Tier.TRASH), RankReporter.score(null));
    }

    @Test
    void trashBreakdownNamesForensicMismatch() {
        assertEquals("Forensic Mismatch (possible fake)", RankReporter.breakdown(Tier.TRASH));
        assertTrue(RankReporter.breakdown(Tier.DIAMOND).startsWith("Diamond"));
        assertEquals("Unclassified", RankReporter.breakdown(null));
    }

    @Test
    void annotateWritesScoreAndBreakdown() {
        Candidate candidate = new Candidate();
        candidate.setTier(Tier.GOLD);

        RankReporter.annotate(candidate);

        assertEquals(0.85, candidate.getRankScore());
        assertEquals("Gold: great quality, good availability", candidate.getRankBreakdown());
    }
}
