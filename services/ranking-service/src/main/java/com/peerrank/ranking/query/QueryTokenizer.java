package com.peerrank.ranking.query;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class QueryTokenizer {
    private static final Pattern DELIMITER_PATTERN = Pattern.compile("[\\s\\-_,.()\\[\\]]+");
    private static final Pattern JOINER_PATTERN = Pattern.compile(
        "\\b(feat|ft|featuring|vs|with|prod)\\b",
        Pattern.CASE_INSENSITIVE
    );
    private static final int MAX_EXTENSION_DISTANCE = 6;

    private QueryTokenizer() {
    }

    public static List<String> tokenize(String text, boolean fuzzy) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String normalized = text.toLowerCase(Locale.ROOT);

        int lastDot = normalized.lastIndexOf('.');
        if (lastDot > 0 && normalized.length() - lastDot < MAX_EXTENSION_DISTANCE) {
            normalized = normalized.substring(0, lastDot);
        }

        if (fuzzy) {
            normalized = JOINER_PATTERN.matcher(normalized).replaceAll(" ");
        }

        List<String> tokens = new ArrayList<>();
        for (String token : DELIMITER_PATTERN.split(normalized)) {
            if (!token.isBlank()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    public static boolean matchesAllTokens(String query, String candidateText) {
        return matchesAllTokens(query, candidateText, true);
    }

    public static boolean matchesAllTokens(String query, String candidateText, boolean fuzzy) {
        if (query == null || query.isBlank()) {
            return true;
        }
        if (candidateText == null || candidateText.isBlank()) {
            return false;
        }
        Set<String> candidateTokens = new HashSet<>(tokenize(candidateText, fuzzy));
        for (String token : tokenize(query, fuzzy)) {
            if (!candidateTokens.contains(token)) {
                return false;
            }
        }
        return true;
    }
}
