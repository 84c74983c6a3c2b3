package com.triesearch.query;

import java.util.List;

public record SuggestionResult(
        String query,
        MatchKind kind,
        List<Suggestion> suggestions,
        long elapsedMs
) {
    public List<String> words() {
        return suggestions.stream().map(Suggestion::word).toList();
    }
}
