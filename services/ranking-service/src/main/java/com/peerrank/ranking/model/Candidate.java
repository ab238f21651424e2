package com.peerrank.ranking.model;

import java.util.List;
import java.util.Locale;

/**
 * One search result reported by a peer. Input fields are treated as read-only once the
 * candidate enters a ranking call; only the ranking engine writes the output fields.
 */
public class Candidate {
    private String sourceId;
    private String filename;
    private String format;
    private int bitrateKbps;
    private Integer lengthSeconds;
    private boolean hasFreeCapacity;
    private int queueDepth;
    private Double bpm;
    private String musicalKey;
    private Long sizeBytes;

    private Tier tier;
    private double rankScore;
    private String rankBreakdown;
    private int originalIndex = -1;
    private List<String> forensicReasons = List.of();

    public String getSourceId() {
        return sourceId;
    }

    public void setSourceId(String sourceId) {
        this.sourceId = sourceId;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public String getFormat() {
        if (format != null && !format.isBlank()) {
            String normalized = format.trim().toLowerCase(Locale.ROOT);
            return normalized.startsWith(".") ? normalized.substring(1) : normalized;
        }
        return extensionOf(filename);
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public int getBitrateKbps() {
        return Math.max(bitrateKbps, 0);
    }

    public void setBitrateKbps(int bitrateKbps) {
        this.bitrateKbps = bitrateKbps;
    }

    public Integer getLengthSeconds() {
        return lengthSeconds;
    }

    public void setLengthSeconds(Integer lengthSeconds) {
        this.lengthSeconds = lengthSeconds;
    }

    public Integer knownLengthSeconds() {
        return lengthSeconds == null || lengthSeconds <= 0 ? null : lengthSeconds;
    }

    public boolean isHasFreeCapacity() {
        return hasFreeCapacity;
    }

    public void setHasFreeCapacity(boolean hasFreeCapacity) {
        this.hasFreeCapacity = hasFreeCapacity;
    }

    public int getQueueDepth() {
        return Math.max(queueDepth, 0);
    }

    public void setQueueDepth(int queueDepth) {
        this.queueDepth = queueDepth;
    }

    public Double getBpm() {
        return bpm;
    }

    public void setBpm(Double bpm) {
        this.bpm = bpm;
    }

    public boolean hasBpmValue() {
        return bpm != null && !bpm.isNaN() && bpm > 0;
    }

    public String getMusicalKey() {
        return musicalKey;
    }

    public void setMusicalKey(String musicalKey) {
        this.musicalKey = musicalKey;
    }

    public Long getSizeBytes() {
        return sizeBytes;
    }

    public void setSizeBytes(Long sizeBytes) {
        this.sizeBytes = sizeBytes;
    }

    public Tier getTier() {
        return tier;
    }

    public void setTier(Tier tier) {
        this.tier = tier;
    }

    public double getRankScore() {
        return rankScore;
    }

    public void setRankScore(double rankScore) {
        this.rankScore = rankScore;
    }

    public String getRankBreakdown() {
        return rankBreakdown;
    }

    public void setRankBreakdown(String rankBreakdown) {
        this.rankBreakdown = rankBreakdown;
    }

    public int getOriginalIndex() {
        return originalIndex;
    }

    public void setOriginalIndex(int originalIndex) {
        this.originalIndex = originalIndex;
    }

    public List<String> getForensicReasons() {
        return forensicReasons;
    }

    public void setForensicReasons(List<String> forensicReasons) {
        this.forensicReasons = forensicReasons == null ? List.of() : List.copyOf(forensicReasons);
    }

    private static String extensionOf(String filename) {
        if (filename == null) {
            return null;
        }
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        int dot = filename.lastIndexOf('.');
        if (dot <= slash + 1 || dot == filename.length() - 1) {
            return null;
        }
        return filename.substring(dot + 1).trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "Candidate{sourceId=" + sourceId + ", filename=" + filename + ", tier=" + tier + "}";
    }
}
