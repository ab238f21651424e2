package com.peerrank.ranking.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.peerrank.ranking.forensic.ForensicDetector;
import com.peerrank.ranking.forensic.ForensicProperties;
import com.peerrank.ranking.forensic.ForensicReport;
import com.peerrank.ranking.forensic.MetadataForensicDetector;
import com.peerrank.ranking.model.Candidate;
import com.peerrank.ranking.model.RankingPriority;
import com.peerrank.ranking.model.Target;
import com.peerrank.ranking.model.Tier;
import com.peerrank.ranking.policy.RankingPolicy;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TierClassifierTest {
    private final TierClassifier classifier = new TierClassifier(new MetadataForensicDetector(new ForensicProperties()));
    private final Target target = new Target("Title", "Artist", 300, null);
    private final Target bpmTarget = new Target("Title", "Artist", 300, 120.0);
    private final RankingPolicy quality = RankingPolicy.qualityFirst();
    private final RankingPolicy dj = RankingPolicy.djReady();

    @Mock
    private ForensicDetector forensicDetector;

    @Test
    void qualityFirstDiamondNeedsPerfectFormatAndFreeCapacity() {
        assertEquals(Tier.DIAMOND, classifier.classify(buildCandidate("mp3", 320, true, 0), target, quality));
        assertEquals(Tier.DIAMOND, classifier.classify(buildCandidate("flac", 0, true, 0), target, quality));
        assertEquals(Tier.DIAMOND, classifier.classify(buildCandidate("wav", 0, true, 0), target, quality));
    }

    @Test
    void qualityFirstBusyHighQualityIsGold() {
        assertEquals(Tier.GOLD, classifier.classify(buildCandidate("mp3", 320, false, 5), target, quality));
        assertEquals(Tier.GOLD, classifier.classify(buildCandidate("flac", 0, false, 5), target, quality));
    }

    @Test
    void qualityFirstUnusualHighBitrateIsGoldEvenWhenFree() {
        assertEquals(Tier.GOLD, classifier.classify(buildCandidate("ogg", 500, true, 0), target, quality));
    }

    @Test
    void qualityFirstMidAndLowBitrates() {
        assertEquals(Tier.SILVER, classifier.classify(buildCandidate("mp3", 192, true, 0), target, quality));
        assertEquals(Tier.SILVER, classifier.classify(buildCandidate("mp3", 256, true, 0), target, quality));
        assertEquals(Tier.BRONZE, classifier.classify(buildCandidate("mp3", 128, true, 0), target, quality));
        assertEquals(Tier.BRONZE, classifier.classify(buildCandidate("mp3", 0, true, 0), target, quality));
    }

    @Test
    void busySourceWithDeepQueueIsBronzeRegardlessOfQuality() {
        assertEquals(Tier.BRONZE, classifier.classify(buildCandidate("flac", 0, false, 501), target, quality));
        assertEquals(Tier.GOLD, classifier.classify(buildCandidate("flac", 0, false, 500), target, quality));
        assertEquals(Tier.DIAMOND, classifier.classify(buildCandidate("flac", 0, true, 900), target, quality));
    }

    @Test
    void durationMismatchIsBronzeWhenClassifierRunsStandalone() {
        Candidate candidate = buildCandidate("mp3", 320, true, 0);
        candidate.setLengthSeconds(320);

        assertEquals(Tier.BRONZE, classifier.classify(candidate, target, quality));
        assertEquals(Tier.DIAMOND, classifier.classify(candidate, target, quality.withDurationMatch(false, 4)));
    }

    @Test
    void djReadyDiamondNeedsTagsMatchingBpmQualityAndCapacity() {
        Candidate candidate = buildCandidate("mp3", 320, true, 0);
        candidate.setBpm(121.0);

        assertEquals(Tier.DIAMOND, classifier.classify(candidate, bpmTarget, dj));
    }

    @Test
    void djReadyBpmMismatchFallsBackToQualityBuckets() {
        Candidate mismatch = buildCandidate("mp3", 320, true, 0);
        mismatch.setBpm(140.0);

        assertEquals(Tier.SILVER, classifier.classify(mismatch, bpmTarget, dj));
    }

    @Test
    void djReadyBpmToleranceIsExclusive() {
        Candidate edge = buildCandidate("mp3", 320, true, 0);
        edge.setBpm(123.0);

        assertEquals(Tier.SILVER, classifier.classify(edge, bpmTarget, dj));
    }

    @Test
    void djReadyMatchingMidBitrateIsGold() {
        Candidate candidate = buildCandidate("mp3", 192, true, 0);
        candidate.setBpm(120.0);

        assertEquals(Tier.GOLD, classifier.classify(candidate, bpmTarget, dj));
    }

    @Test
    void djReadyKeyOnlyCountsWhenTargetHasNoBpm() {
        Candidate keyed = buildCandidate("mp3", 320, true, 0);
        keyed.setMusicalKey("8A");

        assertEquals(Tier.DIAMOND, classifier.classify(keyed, target, dj));
        assertEquals(Tier.SILVER, classifier.classify(keyed, bpmTarget, dj));
    }

    @Test
    void djReadyFilenameBpmMarkerCountsAsTagged() {
        Candidate marked = buildCandidate("mp3", 256, false, 3);
        marked.setFilename("Artist - Title 124bpm.mp3");

        assertEquals(Tier.GOLD, classifier.classify(marked, target, dj));
    }

    @Test
    void djReadyUntaggedAndLowBitrate() {
        assertEquals(Tier.SILVER, classifier.classify(buildCandidate("mp3", 320, true, 0), target, dj));
        assertEquals(Tier.BRONZE, classifier.classify(buildCandidate("mp3", 128, true, 0), target, dj));
    }

    @Test
    void forensicFlagIsTrashBeforeAnyOtherRule() {
        TierClassifier mocked = new TierClassifier(forensicDetector);
        when(forensicDetector.inspect(any(), any())).thenReturn(ForensicReport.flagged("suspect"));

        TierClassifier.Classification classification = mocked.evaluate(buildCandidate("flac", 0, true, 0), target, quality);

        assertEquals(Tier.TRASH, classification.tier());
        assertTrue(classification.forensicReport().reasonCodes().contains("suspect"));
    }

    @Test
    void forensicsCanBeSwitchedOff() {
        TierClassifier mocked = new TierClassifier(forensicDetector);
        RankingPolicy noForensics = new RankingPolicy(
            RankingPriority.QUALITY_FIRST, true, 4, 64, 5, Set.of(), true, true, true, false, 500, 3.0
        );

        assertEquals(Tier.DIAMOND, mocked.classify(buildCandidate("flac", 0, true, 0), target, noForensics));
        verify(forensicDetector, never()).inspect(any(), any());
    }

    @Test
    void shortDurationAgainstTargetIsTrash() {
        Candidate suspicious = buildCandidate("mp3", 320, true, 0);
        suspicious.setLengthSeconds(60);

        assertEquals(Tier.TRASH, classifier.classify(suspicious, target, quality));
    }

    @Test
    void nullCandidateIsTrash() {
        assertEquals(Tier.TRASH, classifier.classify(null, target, quality));
    }

    private Candidate buildCandidate(String format, int bitrate, boolean free, int queue) {
        Candidate candidate = new Candidate();
        candidate.setSourceId("peer");
        candidate.setFilename("Artist - Title." + format);
        candidate.setFormat(format);
        candidate.setBitrateKbps(bitrate);
        candidate.setLengthSeconds(300);
        candidate.setHasFreeCapacity(free);
        candidate.setQueueDepth(queue);
        return candidate;
    }
}
