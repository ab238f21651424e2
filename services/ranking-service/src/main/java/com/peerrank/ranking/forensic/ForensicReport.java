package com.peerrank.ranking.forensic;

import java.util.List;

public record ForensicReport(List<String> reasonCodes) {
    private static final ForensicReport CLEAN = new ForensicReport(List.of());

    public ForensicReport {
        reasonCodes = reasonCodes == null ? List.of() : List.copyOf(reasonCodes);
    }

    public static ForensicReport clean() {
        return CLEAN;
    }

    public static ForensicReport flagged(String reasonCode) {
        return new ForensicReport(List.of(reasonCode));
    }

    public boolean isFake() {
        return !reasonCodes.isEmpty();
    }
}
