package com.peerrank.ranking.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class RankResponse {
    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("took_ms")
    private long tookMs;

    private String priority;

    @JsonProperty("rejected_count")
    private int rejectedCount;

    @JsonProperty("trash_count")
    private int trashCount;

    private List<Hit> hits;
    private DebugInfo debug;

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public long getTookMs() {
        return tookMs;
    }

    public void setTookMs(long tookMs) {
        this.tookMs = tookMs;
    }

    public String getPriority() {
        return priority;
    }

    public void setPriority(String priority) {
        this.priority = priority;
    }

    public int getRejectedCount() {
        return rejectedCount;
    }

    public void setRejectedCount(int rejectedCount) {
        this.rejectedCount = rejectedCount;
    }

    public int getTrashCount() {
        return trashCount;
    }

    public void setTrashCount(int trashCount) {
        this.trashCount = trashCount;
    }

    public List<Hit> getHits() {
        return hits;
    }

    public void setHits(List<Hit> hits) {
        this.hits = hits;
    }

    public DebugInfo getDebug() {
        return debug;
    }

    public void setDebug(DebugInfo debug) {
        this.debug = debug;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Hit {
        private int rank;

        @JsonProperty("source_id")
        private String sourceId;

        private String filename;
        private String tier;

        @JsonProperty("rank_score")
        private double rankScore;

        @JsonProperty("rank_breakdown")
        private String rankBreakdown;

        @JsonProperty("original_index")
        private int originalIndex;

        private Debug debug;

        public int getRank() {
            return rank;
        }

        public void setRank(int rank) {
            this.rank = rank;
        }

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

        public String getTier() {
            return tier;
        }

        public void setTier(String tier) {
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

        public Debug getDebug() {
            return debug;
        }

        public void setDebug(Debug debug) {
            this.debug = debug;
        }
    }

    public static class Debug {
        @JsonProperty("forensic_reasons")
        private List<String> forensicReasons;

        public List<String> getForensicReasons() {
            return forensicReasons;
        }

        public void setForensicReasons(List<String> forensicReasons) {
            this.forensicReasons = forensicReasons;
        }
    }

    public static class DebugInfo {
        @JsonProperty("rejections_by_reason")
        private Map<String, Integer> rejectionsByReason;

        private Map<String, Object> policy;

        public Map<String, Integer> getRejectionsByReason() {
            return rejectionsByReason;
        }

        public void setRejectionsByReason(Map<String, Integer> rejectionsByReason) {
            this.rejectionsByReason = rejectionsByReason;
        }

        public Map<String, Object> getPolicy() {
            return policy;
        }

        public void setPolicy(Map<String, Object> policy) {
            this.policy = policy;
        }
    }
}
