package com.peerrank.ranking.policy;

import com.peerrank.ranking.model.RankingPriority;
import java.util.Set;

/**
 * Read-only ranking configuration. Constructing an invalid policy throws, so a bad
 * configuration is rejected before any batch is ranked.
 */
public record RankingPolicy(
    RankingPriority priority,
    boolean enforceDurationMatch,
    int durationToleranceSeconds,
    int significantBitrateGapKbps,
    int significantQueueGap,
    Set<String> blockedSources,
    boolean enforceStrictTitleMatch,
    boolean fuzzyNormalization,
    boolean enforceFileIntegrity,
    boolean forensicsEnabled,
    int availabilityQueueVeto,
    double bpmTolerance
) {
    public static final int DEFAULT_DURATION_TOLERANCE_SECONDS = 4;
    public static final int DJ_DURATION_TOLERANCE_SECONDS = 15;
    public static final int DEFAULT_BITRATE_GAP_KBPS = 64;
    public static final int DEFAULT_QUEUE_GAP = 5;
    public static final int DEFAULT_AVAILABILITY_QUEUE_VETO = 500;
    public static final double DEFAULT_BPM_TOLERANCE = 3.0;

    public RankingPolicy {
        if (priority == null) {
            throw new IllegalArgumentException("priority required");
        }
        if (durationToleranceSeconds < 0) {
            throw new IllegalArgumentException("duration_tolerance_seconds must be >= 0: " + durationToleranceSeconds);
        }
        if (significantBitrateGapKbps < 0) {
            throw new IllegalArgumentException("significant_bitrate_gap_kbps must be >= 0: " + significantBitrateGapKbps);
        }
        if (significantQueueGap < 0) {
            throw new IllegalArgumentException("significant_queue_gap must be >= 0: " + significantQueueGap);
        }
        if (availabilityQueueVeto < 0) {
            throw new IllegalArgumentException("availability_queue_veto must be >= 0: " + availabilityQueueVeto);
        }
        if (Double.isNaN(bpmTolerance) || bpmTolerance <= 0.0) {
            throw new IllegalArgumentException("bpm_tolerance must be > 0: " + bpmTolerance);
        }
        blockedSources = blockedSources == null ? Set.of() : Set.copyOf(blockedSources);
    }

    public static RankingPolicy qualityFirst() {
        return new RankingPolicy(
            RankingPriority.QUALITY_FIRST,
            true,
            DEFAULT_DURATION_TOLERANCE_SECONDS,
            DEFAULT_BITRATE_GAP_KBPS,
            DEFAULT_QUEUE_GAP,
            Set.of(),
            true,
            true,
            true,
            true,
            DEFAULT_AVAILABILITY_QUEUE_VETO,
            DEFAULT_BPM_TOLERANCE
        );
    }

    public static RankingPolicy djReady() {
        return new RankingPolicy(
            RankingPriority.DJ_READY,
            true,
            DJ_DURATION_TOLERANCE_SECONDS,
            DEFAULT_BITRATE_GAP_KBPS,
            DEFAULT_QUEUE_GAP,
            Set.of(),
            true,
            true,
            true,
            true,
            DEFAULT_AVAILABILITY_QUEUE_VETO,
            DEFAULT_BPM_TOLERANCE
        );
    }

    public static RankingPolicy dataSaver() {
        return qualityFirst().withFileIntegrity(false);
    }

    public static RankingPolicy preset(RankingPriority priority) {
        return priority == RankingPriority.DJ_READY ? djReady() : qualityFirst();
    }

    public RankingPolicy withBlockedSources(Set<String> sources) {
        return new RankingPolicy(
            priority,
            enforceDurationMatch,
            durationToleranceSeconds,
            significantBitrateGapKbps,
            significantQueueGap,
            sources,
            enforceStrictTitleMatch,
            fuzzyNormalization,
            enforceFileIntegrity,
            forensicsEnabled,
            availabilityQueueVeto,
            bpmTolerance
        );
    }

    public RankingPolicy withDurationMatch(boolean enforce, int toleranceSeconds) {
        return new RankingPolicy(
            priority,
            enforce,
            toleranceSeconds,
            significantBitrateGapKbps,
            significantQueueGap,
            blockedSources,
            enforceStrictTitleMatch,
            fuzzyNormalization,
            enforceFileIntegrity,
            forensicsEnabled,
            availabilityQueueVeto,
            bpmTolerance
        );
    }

    public RankingPolicy withStrictTitleMatch(boolean enforce) {
        return new RankingPolicy(
            priority,
            enforceDurationMatch,
            durationToleranceSeconds,
            significantBitrateGapKbps,
            significantQueueGap,
            blockedSources,
            enforce,
            fuzzyNormalization,
            enforceFileIntegrity,
            forensicsEnabled,
            availabilityQueueVeto,
            bpmTolerance
        );
    }

    public RankingPolicy withFileIntegrity(boolean enforce) {
        return new RankingPolicy(
            priority,
            enforceDurationMatch,
            durationToleranceSeconds,
            significantBitrateGapKbps,
            significantQueueGap,
            blockedSources,
            enforceStrictTitleMatch,
            fuzzyNormalization,
            enforce,
            forensicsEnabled,
            availabilityQueueVeto,
            bpmTolerance
        );
    }

    public boolean isBlocked(String sourceId) {
        return sourceId != null && blockedSources.contains(sourceId);
    }
}
