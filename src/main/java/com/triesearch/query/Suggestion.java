package com.triesearch.query;

public record Suggestion(
        String word,
        MatchKind kind,
        int cost
) {
}
