package com.peerrank.ranking.model;

import java.util.Locale;

public enum RankingPriority {
    QUALITY_FIRST,
    DJ_READY;

    public static RankingPriority fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(" ", "");
        if (normalized.isEmpty()) {
            return null;
        }
        return switch (normalized) {
            case "quality_first", "qualityfirst", "quality" -> QUALITY_FIRST;
            case "dj_ready", "djready", "dj" -> DJ_READY;
            default -> null;
        };
    }
}
