package com.peerrank.ranking.service;

import com.peerrank.ranking.model.Candidate;
import com.peerrank.ranking.policy.RankingPolicy;
import java.util.Comparator;

/**
 * Orders candidates of the same tier: free capacity, then bitrate, then queue depth, then
 * filename length. Bitrate and queue depth are compared by band, {@code floor(value / (gap + 1))}.
 * Two values further apart than the policy's significant gap always land in different bands;
 * closer values tie unless they straddle a band edge. Comparing bands keeps the ordering transitive.
 */
public final class IntraTierComparator implements Comparator<Candidate> {
    private static final int MISSING_FILENAME_LENGTH = Integer.MAX_VALUE;

    private final long bitrateBandWidth;
    private final long queueBandWidth;

    public IntraTierComparator(RankingPolicy policy) {
        this.bitrateBandWidth = policy.significantBitrateGapKbps() + 1L;
        this.queueBandWidth = policy.significantQueueGap() + 1L;
    }

    @Override
    public int compare(Candidate a, Candidate b) {
        if (a.isHasFreeCapacity() != b.isHasFreeCapacity()) {
            return a.isHasFreeCapacity() ? -1 : 1;
        }

        int bitrate = Long.compare(
            band(b.getBitrateKbps(), bitrateBandWidth),
            band(a.getBitrateKbps(), bitrateBandWidth)
        );
        if (bitrate != 0) {
            return bitrate;
        }

        int queue = Long.compare(
            band(a.getQueueDepth(), queueBandWidth),
            band(b.getQueueDepth(), queueBandWidth)
        );
        if (queue != 0) {
            return queue;
        }

        return Integer.compare(filenameLength(a), filenameLength(b));
    }

    static long band(int value, long width) {
        return Math.floorDiv((long) Math.max(value, 0), width);
    }

    private static int filenameLength(Candidate candidate) {
        String filename = candidate.getFilename();
        return filename == null ? MISSING_FILENAME_LENGTH : filename.length();
    }
}
