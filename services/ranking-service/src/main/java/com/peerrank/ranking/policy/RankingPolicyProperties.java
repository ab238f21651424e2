package com.peerrank.ranking.policy;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ranking.policy")
public class RankingPolicyProperties {
    private String preset = "quality_first";
    private Boolean enforceDurationMatch;
    private Integer durationToleranceSeconds;
    private Integer significantBitrateGapKbps;
    private Integer significantQueueGap;
    private Boolean enforceStrictTitleMatch;
    private Boolean fuzzyNormalization;
    private Boolean enforceFileIntegrity;
    private Boolean forensicsEnabled;
    private Integer availabilityQueueVeto;
    private Double bpmTolerance;
    private List<String> blockedSources = new ArrayList<>();
    private String blockedSourcesPath = "config/blocked-sources.yaml";

    public String getPreset() {
        return preset;
    }

    public void setPreset(String preset) {
        this.preset = preset;
    }

    public Boolean getEnforceDurationMatch() {
        return enforceDurationMatch;
    }

    public void setEnforceDurationMatch(Boolean enforceDurationMatch) {
        this.enforceDurationMatch = enforceDurationMatch;
    }

    public Integer getDurationToleranceSeconds() {
        return durationToleranceSeconds;
    }

    public void setDurationToleranceSeconds(Integer durationToleranceSeconds) {
        this.durationToleranceSeconds = durationToleranceSeconds;
    }

    public Integer getSignificantBitrateGapKbps() {
        return significantBitrateGapKbps;
    }

    public void setSignificantBitrateGapKbps(Integer significantBitrateGapKbps) {
        this.significantBitrateGapKbps = significantBitrateGapKbps;
    }

    public Integer getSignificantQueueGap() {
        return significantQueueGap;
    }

    public void setSignificantQueueGap(Integer significantQueueGap) {
        this.significantQueueGap = significantQueueGap;
    }

    public Boolean getEnforceStrictTitleMatch() {
        return enforceStrictTitleMatch;
    }

    public void setEnforceStrictTitleMatch(Boolean enforceStrictTitleMatch) {
        this.enforceStrictTitleMatch = enforceStrictTitleMatch;
    }

    public Boolean getFuzzyNormalization() {
        return fuzzyNormalization;
    }

    public void setFuzzyNormalization(Boolean fuzzyNormalization) {
        this.fuzzyNormalization = fuzzyNormalization;
    }

    public Boolean getEnforceFileIntegrity() {
        return enforceFileIntegrity;
    }

    public void setEnforceFileIntegrity(Boolean enforceFileIntegrity) {
        this.enforceFileIntegrity = enforceFileIntegrity;
    }

    public Boolean getForensicsEnabled() {
        return forensicsEnabled;
    }

    public void setForensicsEnabled(Boolean forensicsEnabled) {
        this.forensicsEnabled = forensicsEnabled;
    }

    public Integer getAvailabilityQueueVeto() {
        return availabilityQueueVeto;
    }

    public void setAvailabilityQueueVeto(Integer availabilityQueueVeto) {
        this.availabilityQueueVeto = availabilityQueueVeto;
    }

    public Double getBpmTolerance() {
        return bpmTolerance;
    }

    public void setBpmTolerance(Double bpmTolerance) {
        this.bpmTolerance = bpmTolerance;
    }

    public List<String> getBlockedSources() {
        return blockedSources;
    }

    public void setBlockedSources(List<String> blockedSources) {
        this.blockedSources = blockedSources;
    }

    public String getBlockedSourcesPath() {
        return blockedSourcesPath;
    }

    public void setBlockedSourcesPath(String blockedSourcesPath) {
        this.blockedSourcesPath = blockedSourcesPath;
    }
}
