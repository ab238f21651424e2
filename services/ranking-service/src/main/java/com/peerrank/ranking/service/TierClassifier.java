package com.peerrank.ranking.service;

import com.peerrank.ranking.forensic.ForensicDetector;
import com.peerrank.ranking.forensic.ForensicReport;
import com.peerrank.ranking.model.Candidate;
import com.peerrank.ranking.model.RankingPriority;
import com.peerrank.ranking.model.Target;
import com.peerrank.ranking.model.Tier;
import com.peerrank.ranking.policy.RankingPolicy;
import com.peerrank.ranking.safety.SafetyFilter;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class TierClassifier {
    private static final Set<String> LOSSLESS_FORMATS = Set.of("flac", "wav");
    private static final int HIGH_QUALITY_KBPS = 320;
    private static final int MID_QUALITY_KBPS = 192;

    private final ForensicDetector forensicDetector;

    public TierClassifier(ForensicDetector forensicDetector) {
        this.forensicDetector = forensicDetector;
    }

    public Tier classify(Candidate candidate, Target target, RankingPolicy policy) {
        return evaluate(candidate, target, policy).tier();
    }

    public Classification evaluate(Candidate candidate, Target target, RankingPolicy policy) {
        if (candidate == null) {
            return new Classification(Tier.TRASH, ForensicReport.flagged("missing_candidate"));
        }
        Target resolvedTarget = target == null ? Target.empty() : target;

        if (policy.forensicsEnabled()) {
            ForensicReport report = forensicDetector.inspect(candidate, resolvedTarget);
            if (report.isFake()) {
                return new Classification(Tier.TRASH, report);
            }
        }
        return new Classification(decide(candidate, resolvedTarget, policy), ForensicReport.clean());
    }

    private Tier decide(Candidate candidate, Target target, RankingPolicy policy) {
        if (!candidate.isHasFreeCapacity() && candidate.getQueueDepth() > policy.availabilityQueueVeto()) {
            return Tier.BRONZE;
        }
        if (SafetyFilter.exceedsDurationTolerance(candidate, target.knownLengthSeconds(), policy)) {
            return Tier.BRONZE;
        }

        int bitrate = candidate.getBitrateKbps();
        boolean free = candidate.isHasFreeCapacity();
        boolean lossless = isLossless(candidate);
        boolean highQuality = bitrate >= HIGH_QUALITY_KBPS || lossless;
        boolean midQuality = bitrate >= MID_QUALITY_KBPS;
        boolean hasBpm = candidate.hasBpmValue() || mentionsBpm(candidate.getFilename());
        boolean hasKey = candidate.getMusicalKey() != null && !candidate.getMusicalKey().isBlank();
        boolean bpmMatches = bpmMatches(candidate, target, policy);

        if (policy.priority() == RankingPriority.DJ_READY) {
            boolean tagged = hasBpm || hasKey;
            if (tagged && bpmMatches && highQuality && free) {
                return Tier.DIAMOND;
            }
            if (tagged && bpmMatches && midQuality) {
                return Tier.GOLD;
            }
            if (midQuality) {
                return Tier.SILVER;
            }
            return Tier.BRONZE;
        }

        boolean perfectFormat = lossless || bitrate == HIGH_QUALITY_KBPS;
        if (perfectFormat && free) {
            return Tier.DIAMOND;
        }
        if (highQuality) {
            return Tier.GOLD;
        }
        if (midQuality) {
            return Tier.SILVER;
        }
        return Tier.BRONZE;
    }

    private boolean bpmMatches(Candidate candidate, Target target, RankingPolicy policy) {
        if (!target.hasBpm()) {
            return true;
        }
        return candidate.hasBpmValue() && Math.abs(target.bpm() - candidate.getBpm()) < policy.bpmTolerance();
    }

    private boolean isLossless(Candidate candidate) {
        String format = candidate.getFormat();
        return format != null && LOSSLESS_FORMATS.contains(format);
    }

    private boolean mentionsBpm(String filename) {
        return filename != null && filename.toLowerCase(Locale.ROOT).contains("bpm");
    }

    public record Classification(Tier tier, ForensicReport forensicReport) {}
}
