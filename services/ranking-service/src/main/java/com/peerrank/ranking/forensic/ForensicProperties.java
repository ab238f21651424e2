package com.peerrank.ranking.forensic;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ranking.forensics")
public class ForensicProperties {
    private double minDurationRatio = 0.5;
    private double minSizeRatio = 0.75;
    private double minLosslessMbPerMinute = 2.5;
    private int minLosslessBitrateKbps = 320;
    private int maxLossyBitrateKbps = 320;

    public double getMinDurationRatio() {
        return minDurationRatio;
    }

    public void setMinDurationRatio(double minDurationRatio) {
        this.minDurationRatio = minDurationRatio;
    }

    public double getMinSizeRatio() {
        return minSizeRatio;
    }

    public void setMinSizeRatio(double minSizeRatio) {
        this.minSizeRatio = minSizeRatio;
    }

    public double getMinLosslessMbPerMinute() {
        return minLosslessMbPerMinute;
    }

    public void setMinLosslessMbPerMinute(double minLosslessMbPerMinute) {
        this.minLosslessMbPerMinute = minLosslessMbPerMinute;
    }

    public int getMinLosslessBitrateKbps() {
        return minLosslessBitrateKbps;
    }

    public void setMinLosslessBitrateKbps(int minLosslessBitrateKbps) {
        this.minLosslessBitrateKbps = minLosslessBitrateKbps;
    }

    public int getMaxLossyBitrateKbps() {
        return maxLossyBitrateKbps;
    }

    public void setMaxLossyBitrateKbps(int maxLossyBitrateKbps) {
        this.maxLossyBitrateKbps = maxLossyBitrateKbps;
    }
}
