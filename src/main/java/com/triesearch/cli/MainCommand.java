package com.triesearch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.triesearch.config.Constants;
import com.triesearch.config.EngineConfig;
import com.triesearch.query.Suggestion;
import com.triesearch.query.SuggestionEngine;
import com.triesearch.query.SuggestionResult;
import com.triesearch.storage.TrieFormatException;
import com.triesearch.trie.FrozenTrie;
import com.triesearch.trie.TrieNode;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
    name = "fts",
    description = "🔤 冻结字典树查询工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.ExistsSubcommand.class,
        MainCommand.CompleteSubcommand.class,
        MainCommand.SubmatchSubcommand.class,
        MainCommand.FuzzySubcommand.class,
        MainCommand.SuggestSubcommand.class,
        MainCommand.InfoSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--trie"}, description = "字典树文件路径（原始记录或 trie_data 脚本）")
    private Path triePath;

    @Option(names = {"-i", "--ignore-case"}, description = "查询不区分大小写")
    private boolean ignoreCase;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔤 冻结字典树查询工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    private FrozenTrie openTrie() throws IOException {
        if (triePath == null) {
            throw new CommandLine.ParameterException(new CommandLine(this), "缺少 --trie 参数");
        }
        try {
            FrozenTrie trie = FrozenTrie.open(triePath);
            trie.setCaseSensitive(!ignoreCase);
            return trie;
        } catch (TrieFormatException exception) {
            throw new IOException("字典树数据损坏: " + triePath, exception);
        }
    }

    private EngineConfig buildConfig() {
        EngineConfig config = EngineConfig.defaults();
        config.setCaseSensitive(!ignoreCase);
        return config;
    }

    private int sanitizeLimit(int rawLimit) {
        if (rawLimit < 0) {
            System.err.printf("⚠️ limit=%d 非法，已使用 0%n", rawLimit);
            return 0;
        }
        if (rawLimit > Constants.MAX_RESULT_LIMIT) {
            System.err.printf("⚠️ limit=%d 超过上限 %d，已自动限制%n", rawLimit, Constants.MAX_RESULT_LIMIT);
            return Constants.MAX_RESULT_LIMIT;
        }
        return rawLimit;
    }

    private int sanitizeCost(int rawCost) {
        if (rawCost < 0) {
            System.err.printf("⚠️ cost=%d 非法，已使用 0%n", rawCost);
            return 0;
        }
        if (rawCost > Constants.MAX_COST_LIMIT) {
            System.err.printf("⚠️ cost=%d 超过上限 %d，已自动限制%n", rawCost, Constants.MAX_COST_LIMIT);
            return Constants.MAX_COST_LIMIT;
        }
        return rawCost;
    }

    private String sanitizeQuery(String rawQuery) {
        if (rawQuery == null) {
            return "";
        }
        String trimmed = rawQuery.trim();
        if (trimmed.length() > Constants.MAX_QUERY_LENGTH) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "查询长度超过限制（最大 " + Constants.MAX_QUERY_LENGTH + " 字符）");
        }
        return trimmed;
    }

    private static void printWords(List<String> words) {
        if (words.isEmpty()) {
            System.out.println("⚠️ 未找到匹配结果");
            return;
        }
        for (String word : words) {
            System.out.println(word);
        }
    }

    @Command(name = "exists", description = "✅ 判断词是否在字典中")
    static class ExistsSubcommand implements Callable<Integer> {

        @Parameters(description = "要检查的词", arity = "1")
        private String word;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                boolean present = main.openTrie().exists(main.sanitizeQuery(word));
                System.out.println(present);
                return present ? 0 : 1;
            } catch (IOException | TrieFormatException exception) {
                System.err.println("❌ 加载字典树失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "complete", description = "🔎 前缀补全")
    static class CompleteSubcommand implements Callable<Integer> {

        @Parameters(description = "前缀", arity = "1")
        private String prefix;

        @Option(names = {"-l", "--limit"}, description = "返回结果数量限制", defaultValue = "10")
        private int limit;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                FrozenTrie trie = main.openTrie();
                Optional<TrieNode> node = trie.lookupNode(main.sanitizeQuery(prefix));
                List<String> completions = node
                    .map(found -> trie.lookupCompletions(found, main.sanitizeLimit(limit)))
                    .orElse(List.of());
                printWords(completions);
                return 0;
            } catch (IOException | TrieFormatException exception) {
                System.err.println("❌ 加载字典树失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "submatch", description = "🧩 子串匹配")
    static class SubmatchSubcommand implements Callable<Integer> {

        @Parameters(description = "子串", arity = "1")
        private String infix;

        @Option(names = {"-l", "--limit"}, description = "返回结果数量限制", defaultValue = "10")
        private int limit;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                FrozenTrie trie = main.openTrie();
                printWords(trie.lookupSubmatches(main.sanitizeQuery(infix), main.sanitizeLimit(limit)));
                return 0;
            } catch (IOException | TrieFormatException exception) {
                System.err.println("❌ 加载字典树失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "fuzzy", description = "🩹 编辑距离纠错")
    static class FuzzySubcommand implements Callable<Integer> {

        @Parameters(description = "查询词", arity = "1")
        private String word;

        @Option(names = {"-c", "--max-cost"}, description = "最大编辑距离", defaultValue = "2")
        private int maxCost;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                FrozenTrie trie = main.openTrie();
                Map<String, Integer> corrections = trie.search(main.sanitizeQuery(word), main.sanitizeCost(maxCost));
                if (corrections.isEmpty()) {
                    System.out.println("⚠️ 未找到匹配结果");
                    return 0;
                }
                corrections.entrySet().stream()
                    .sorted(Map.Entry.<String, Integer>comparingByValue().thenComparing(Map.Entry.comparingByKey()))
                    .forEach(entry -> System.out.println(entry.getKey() + "\t" + entry.getValue()));
                return 0;
            } catch (IOException | TrieFormatException exception) {
                System.err.println("❌ 加载字典树失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "suggest", description = "💡 按输入框逻辑给出建议")
    static class SuggestSubcommand implements Callable<Integer> {

        @Parameters(description = "输入内容", arity = "1")
        private String query;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                SuggestionEngine engine = new SuggestionEngine(main.openTrie(), main.buildConfig());
                SuggestionResult result = engine.suggest(main.sanitizeQuery(query));
                if ("json".equalsIgnoreCase(format)) {
                    printJsonResult(result);
                } else {
                    printTextResult(result);
                }
                return 0;
            } catch (IOException | TrieFormatException exception) {
                System.err.println("❌ 建议失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printTextResult(SuggestionResult result) {
            System.out.println("🔍 查询: \"" + result.query() + "\"");
            if (result.suggestions().isEmpty()) {
                System.out.println("⚠️ 未找到匹配结果");
                return;
            }
            for (Suggestion suggestion : result.suggestions()) {
                System.out.printf("%s [%s, cost=%d]%n", suggestion.word(), suggestion.kind(), suggestion.cost());
            }
        }

        private void printJsonResult(SuggestionResult result) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        }
    }

    @Command(name = "info", description = "📊 查看字典树统计信息")
    static class InfoSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                FrozenTrie trie = main.openTrie();
                System.out.println("📊 字典树信息");
                System.out.println("═══════════");
                System.out.println("📁 文件: " + main.triePath);
                System.out.println("🔢 记录数: " + trie.blob().recordCount());
                System.out.println("💾 大小: " + formatBytes(trie.blob().byteLength()));
                return 0;
            } catch (IOException | TrieFormatException exception) {
                System.err.println("❌ 获取信息失败: " + exception.getMessage());
                return 1;
            }
        }

        private String formatBytes(long bytes) {
            if (bytes < 1024) {
                return bytes + " B";
            }
            if (bytes < 1024 * 1024L) {
                return String.format("%.2f KB", bytes / 1024.0);
            }
            return String.format("%.2f MB", bytes / (1024.0 * 1024.0));
        }
    }
}
