package com.peerrank.ranking.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class RankRequest {
    private Query query;
    private TargetTrack target;
    private List<Candidate> candidates;
    private Options options;

    public Query getQuery() {
        return query;
    }

    public void setQuery(Query query) {
        this.query = query;
    }

    public TargetTrack getTarget() {
        return target;
    }

    public void setTarget(TargetTrack target) {
        this.target = target;
    }

    public List<Candidate> getCandidates() {
        return candidates;
    }

    public void setCandidates(List<Candidate> candidates) {
        this.candidates = candidates;
    }

    public Options getOptions() {
        return options;
    }

    public void setOptions(Options options) {
        this.options = options;
    }

    public static class Query {
        private String text;

        public String getText() {
            return text;
        }

        public void setText(String text) {
            this.text = text;
        }
    }

    public static class TargetTrack {
        private String title;
        private String artist;

        @JsonProperty("length_seconds")
        private Integer lengthSeconds;

        private Double bpm;

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }

        public String getArtist() {
            return artist;
        }

        public void setArtist(String artist) {
            this.artist = artist;
        }

        public Integer getLengthSeconds() {
            return lengthSeconds;
        }

        public void setLengthSeconds(Integer lengthSeconds) {
            this.lengthSeconds = lengthSeconds;
        }

        public Double getBpm() {
            return bpm;
        }

        public void setBpm(Double bpm) {
            this.bpm = bpm;
        }
    }

    public static class Candidate {
        @JsonProperty("source_id")
        private String sourceId;

        private String filename;
        private String format;

        @JsonProperty("bitrate_kbps")
        private Integer bitrateKbps;

        @JsonProperty("length_seconds")
        private Integer lengthSeconds;

        @JsonProperty("has_free_capacity")
        private Boolean hasFreeCapacity;

        @JsonProperty("queue_depth")
        private Integer queueDepth;

        private Double bpm;

        @JsonProperty("musical_key")
        private String musicalKey;

        @JsonProperty("size_bytes")
        private Long sizeBytes;

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
            return format;
        }

        public void setFormat(String format) {
            this.format = format;
        }

        public Integer getBitrateKbps() {
            return bitrateKbps;
        }

        public void setBitrateKbps(Integer bitrateKbps) {
            this.bitrateKbps = bitrateKbps;
        }

        public Integer getLengthSeconds() {
            return lengthSeconds;
        }

        public void setLengthSeconds(Integer lengthSeconds) {
            this.lengthSeconds = lengthSeconds;
        }

        public Boolean getHasFreeCapacity() {
            return hasFreeCapacity;
        }

        public void setHasFreeCapacity(Boolean hasFreeCapacity) {
            this.hasFreeCapacity = hasFreeCapacity;
        }

        public Integer getQueueDepth() {
            return queueDepth;
        }

        public void setQueueDepth(Integer queueDepth) {
            this.queueDepth = queueDepth;
        }

        public Double getBpm() {
            return bpm;
        }

        public void setBpm(Double bpm) {
            this.bpm = bpm;
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
    }

    public static class Options {
        private String priority;
        private Integer size;
        private Boolean debug;

        public String getPriority() {
            return priority;
        }

        public void setPriority(String priority) {
            this.priority = priority;
        }

        public Integer getSize() {
            return size;
        }

        public void setSize(Integer size) {
            this.size = size;
        }

        public Boolean getDebug() {
            return debug;
        }

        public void setDebug(Boolean debug) {
            this.debug = debug;
        }
    }
}
