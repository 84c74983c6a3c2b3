package com.triesearch.query;

import com.triesearch.config.EngineConfig;
import com.triesearch.trie.FrozenTrie;
import com.triesearch.trie.TrieNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 单次按键的建议级联：精确命中 → 前缀补全 → 子串匹配 → 编辑距离纠错。
 */
public class SuggestionEngine {
    private static final Logger logger = LoggerFactory.getLogger(SuggestionEngine.class);

    private static final Comparator<Map.Entry<String, Integer>> BY_COST_THEN_WORD =
        Map.Entry.<String, Integer>comparingByValue().thenComparing(Map.Entry.comparingByKey());

    private final FrozenTrie trie;
    private final EngineConfig config;

    /**
     * 使用默认参数构造建议引擎。
     */
    public SuggestionEngine(FrozenTrie trie) {
        this(trie, EngineConfig.defaults());
    }

    /**
     * 使用 EngineConfig 注入上限与大小写策略构造建议引擎。
     *
     * 配置为不区分大小写时只在本引擎内把查询转小写，共享字典树自身的大小写策略保持不变。
     */
    public SuggestionEngine(FrozenTrie trie, EngineConfig config) {
        if (trie == null || config == null) {
            throw new IllegalArgumentException("trie 与 config 不能为空");
        }
        this.trie = trie;
        this.config = config;
    }

    public SuggestionResult suggest(String rawQuery) {
        long startNanos = System.nanoTime();
        String query = fold(rawQuery == null ? "" : rawQuery.trim());
        List<Suggestion> suggestions = query.isEmpty() ? List.of() : collect(query);

        MatchKind kind = suggestions.isEmpty() ? MatchKind.NONE : suggestions.get(0).kind();
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.debug("建议完成: query={}, kind={}, count={}, elapsedMs={}", query, kind, suggestions.size(), elapsedMs);
        return new SuggestionResult(query, kind, suggestions, elapsedMs);
    }

    private String fold(String query) {
        return config.isCaseSensitive() ? query : query.toLowerCase(Locale.ROOT);
    }

    private List<Suggestion> collect(String query) {
        Optional<TrieNode> node = trie.lookupNode(query);
        if (node.isPresent() && node.get().isFinal()) {
            return List.of(new Suggestion(node.get().getWord(), MatchKind.EXACT, 0));
        }
        if (node.isPresent()) {
            List<Suggestion> completions = new ArrayList<>();
            for (String word : trie.lookupCompletions(node.get(), Math.max(config.getCompletionLimit(), 0))) {
                completions.add(new Suggestion(word, MatchKind.COMPLETION, 0));
            }
            return completions;
        }
        if (query.length() <= config.getSubmatchMinQueryLength()) {
            return List.of();
        }

        int submatchLimit = Math.max(config.getSubmatchLimit(), 0);
        Set<String> seen = new LinkedHashSet<>(trie.lookupSubmatches(query, submatchLimit));
        List<Suggestion> suggestions = new ArrayList<>();
        for (String word : seen) {
            suggestions.add(new Suggestion(word, MatchKind.SUBMATCH, 0));
        }
        if (suggestions.size() < submatchLimit) {
            appendCorrections(query, seen, suggestions);
        }
        return suggestions;
    }

    private void appendCorrections(String query, Set<String> seen, List<Suggestion> suggestions) {
        List<Map.Entry<String, Integer>> corrections = trie.search(query, Math.max(config.getMaxCost(), 0))
            .entrySet().stream()
            .sorted(BY_COST_THEN_WORD)
            .toList();
        for (Map.Entry<String, Integer> correction : corrections) {
            if (seen.add(correction.getKey())) {
                suggestions.add(new Suggestion(correction.getKey(), MatchKind.CORRECTION, correction.getValue()));
            }
        }
    }
}
