package com.peerrank.ranking.model;

public record Target(String title, String artist, Integer lengthSeconds, Double bpm) {

    public static Target empty() {
        return new Target(null, null, null, null);
    }

    public String queryText() {
        StringBuilder sb = new StringBuilder();
        if (artist != null && !artist.isBlank()) {
            sb.append(artist.trim());
        }
        if (title != null && !title.isBlank()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(title.trim());
        }
        return sb.toString();
    }

    public Integer knownLengthSeconds() {
        return lengthSeconds == null || lengthSeconds <= 0 ? null : lengthSeconds;
    }

    public boolean hasBpm() {
        return bpm != null && !bpm.isNaN() && bpm > 0;
    }
}
