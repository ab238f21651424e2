package com.peerrank.ranking.model;

public enum Tier {
    DIAMOND(1),
    GOLD(2),
    SILVER(3),
    BRONZE(4),
    TRASH(5);

    private final int rank;

    Tier(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }
}
