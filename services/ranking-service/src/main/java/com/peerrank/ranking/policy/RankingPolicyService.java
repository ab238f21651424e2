package com.peerrank.ranking.policy;

import com.peerrank.ranking.model.RankingPriority;
import jakarta.annotation.PostConstruct;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class RankingPolicyService {
    private static final Logger log = LoggerFactory.getLogger(RankingPolicyService.class);

    private final BlockedSourceLoader loader;
    private final RankingPolicyProperties properties;
    private volatile Set<String> blockedSources = Set.of();
    private volatile RankingPolicy policy;

    public RankingPolicyService(BlockedSourceLoader loader, RankingPolicyProperties properties) {
        this.loader = loader;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        Set<String> merged = new LinkedHashSet<>();
        if (properties.getBlockedSources() != null) {
            for (String source : properties.getBlockedSources()) {
                if (source != null && !source.isBlank()) {
                    merged.add(source.trim());
                }
            }
        }
        merged.addAll(loader.load(properties.getBlockedSourcesPath()));
        blockedSources = Set.copyOf(merged);
        policy = resolve(properties.getPreset());
        log.info(
            "ranking policy loaded priority={} duration_tolerance_s={} blocked_sources={}",
            policy.priority(),
            policy.durationToleranceSeconds(),
            policy.blockedSources().size()
        );
    }

    public RankingPolicy getPolicy() {
        RankingPolicy current = policy;
        return current == null ? RankingPolicy.qualityFirst() : current;
    }

    /**
     * Builds the named preset with the configured overrides and block list applied. A blank
     * name returns the active policy.
     */
    public RankingPolicy resolve(String presetName) {
        if (presetName == null || presetName.isBlank()) {
            RankingPolicy current = policy;
            if (current != null) {
                return current;
            }
            presetName = "quality_first";
        }
        return applyOverrides(basePreset(presetName)).withBlockedSources(blockedSources);
    }

    private RankingPolicy basePreset(String presetName) {
        String normalized = presetName.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if (normalized.equals("data_saver") || normalized.equals("datasaver")) {
            return RankingPolicy.dataSaver();
        }
        RankingPriority priority = RankingPriority.fromString(normalized);
        if (priority == null) {
            throw new IllegalArgumentException("unknown ranking preset: " + presetName);
        }
        return RankingPolicy.preset(priority);
    }

    private RankingPolicy applyOverrides(RankingPolicy base) {
        return new RankingPolicy(
            base.priority(),
            orDefault(properties.getEnforceDurationMatch(), base.enforceDurationMatch()),
            orDefault(properties.getDurationToleranceSeconds(), base.durationToleranceSeconds()),
            orDefault(properties.getSignificantBitrateGapKbps(), base.significantBitrateGapKbps()),
            orDefault(properties.getSignificantQueueGap(), base.significantQueueGap()),
            base.blockedSources(),
            orDefault(properties.getEnforceStrictTitleMatch(), base.enforceStrictTitleMatch()),
            orDefault(properties.getFuzzyNormalization(), base.fuzzyNormalization()),
            orDefault(properties.getEnforceFileIntegrity(), base.enforceFileIntegrity()),
            orDefault(properties.getForensicsEnabled(), base.forensicsEnabled()),
            orDefault(properties.getAvailabilityQueueVeto(), base.availabilityQueueVeto()),
            orDefault(properties.getBpmTolerance(), base.bpmTolerance())
        );
    }

    private static <T> T orDefault(T value, T fallback) {
        return value == null ? fallback : value;
    }
}
