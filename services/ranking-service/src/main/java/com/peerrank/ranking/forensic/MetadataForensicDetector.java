package com.peerrank.ranking.forensic;

import com.peerrank.ranking.model.Candidate;
import com.peerrank.ranking.model.Target;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class MetadataForensicDetector implements ForensicDetector {
    public static final String REASON_SHORT_FOR_TARGET = "duration_short_for_target";
    public static final String REASON_SHORT_FOR_FILENAME = "duration_short_for_filename";
    public static final String REASON_LOSSY_BITRATE = "lossy_bitrate_out_of_range";
    public static final String REASON_LOSSLESS_BITRATE = "lossless_bitrate_too_low";
    public static final String REASON_SIZE_FOR_BITRATE = "size_short_for_bitrate";
    public static final String REASON_LOSSLESS_SIZE = "lossless_size_short";

    private static final Set<String> LOSSLESS_FORMATS = Set.of("flac", "wav", "aiff", "alac");
    private static final Pattern EMBEDDED_DURATION_PATTERN = Pattern.compile("(?<![\\d:])(\\d{1,2}):([0-5]\\d)(?![\\d:])");
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final ForensicProperties properties;

    public MetadataForensicDetector(ForensicProperties properties) {
        if (properties.getMinDurationRatio() <= 0.0 || properties.getMinDurationRatio() > 1.0) {
            throw new IllegalArgumentException("min_duration_ratio must be in (0, 1]: " + properties.getMinDurationRatio());
        }
        if (properties.getMinSizeRatio() <= 0.0 || properties.getMinSizeRatio() > 1.0) {
            throw new IllegalArgumentException("min_size_ratio must be in (0, 1]: " + properties.getMinSizeRatio());
        }
        if (properties.getMinLosslessMbPerMinute() < 0.0) {
            throw new IllegalArgumentException("min_lossless_mb_per_minute must be >= 0");
        }
        this.properties = properties;
    }

    @Override
    public ForensicReport inspect(Candidate candidate, Target target) {
        if (candidate == null) {
            return ForensicReport.clean();
        }
        List<String> reasons = new ArrayList<>();
        Integer length = candidate.knownLengthSeconds();
        int bitrate = candidate.getBitrateKbps();
        String format = candidate.getFormat();
        boolean lossless = format != null && LOSSLESS_FORMATS.contains(format);
        boolean mp3 = "mp3".equals(format);

        Integer targetLength = target == null ? null : target.knownLengthSeconds();
        if (length != null && targetLength != null && length < targetLength * properties.getMinDurationRatio()) {
            reasons.add(REASON_SHORT_FOR_TARGET);
        }

        Integer embedded = embeddedDurationSeconds(candidate.getFilename());
        if (length != null && embedded != null && length < embedded * properties.getMinDurationRatio()) {
            reasons.add(REASON_SHORT_FOR_FILENAME);
        }

        if (mp3 && bitrate > properties.getMaxLossyBitrateKbps()) {
            reasons.add(REASON_LOSSY_BITRATE);
        }

        if (lossless && bitrate > 0 && bitrate < properties.getMinLosslessBitrateKbps()) {
            reasons.add(REASON_LOSSLESS_BITRATE);
        }

        Long size = candidate.getSizeBytes();
        if (length != null && size != null && size > 0) {
            if (mp3 && bitrate >= 320) {
                double expectedBytes = (bitrate * 1000.0 / 8.0) * length;
                if (size < expectedBytes * properties.getMinSizeRatio()) {
                    reasons.add(REASON_SIZE_FOR_BITRATE);
                }
            } else if (lossless) {
                double minutes = length / 60.0;
                double mbPerMinute = (size / BYTES_PER_MB) / minutes;
                if (mbPerMinute < properties.getMinLosslessMbPerMinute()) {
                    reasons.add(REASON_LOSSLESS_SIZE);
                }
            }
        }

        return reasons.isEmpty() ? ForensicReport.clean() : new ForensicReport(reasons);
    }

    static Integer embeddedDurationSeconds(String filename) {
        if (filename == null || filename.isBlank()) {
            return null;
        }
        Matcher matcher = EMBEDDED_DURATION_PATTERN.matcher(filename);
        Integer shortest = null;
        while (matcher.find()) {
            int seconds = Integer.parseInt(matcher.group(1)) * 60 + Integer.parseInt(matcher.group(2));
            if (seconds > 0 && (shortest == null || seconds < shortest)) {
                shortest = seconds;
            }
        }
        return shortest;
    }
}
