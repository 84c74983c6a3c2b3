package com.triesearch.trie;

import com.triesearch.config.Constants;
import com.triesearch.storage.NodeRecord;
import com.triesearch.storage.TrieBlob;
import com.triesearch.storage.TrieBlobLoader;
import com.triesearch.storage.TrieFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 只读冻结字典树引擎：精确查找、前缀补全、子串匹配与有界编辑距离搜索。
 *
 * 节点按记录下标缓存于引擎生命周期内，父节点引用在首次被发现时确定。
 * 所有遍历状态（工作栈、DP 行）都局限于单次调用。
 */
public class FrozenTrie {
    private static final Logger logger = LoggerFactory.getLogger(FrozenTrie.class);

    private final TrieBlob blob;
    private final Map<Integer, TrieNode> nodesByIndex = new ConcurrentHashMap<>();
    private final TrieNode root;
    private volatile boolean caseSensitive = true;

    /**
     * 基于字节缓冲构造引擎并解码根节点。
     *
     * @param blob 记录缓冲
     * @throws com.triesearch.storage.TrieFormatException 缓冲中连根记录都没有时抛出
     */
    public FrozenTrie(TrieBlob blob) {
        if (blob == null) {
            throw new IllegalArgumentException("字典树数据不能为空");
        }
        this.blob = blob;
        this.root = nodeAt(Constants.ROOT_INDEX, null);
        logger.debug("字典树引擎已创建: records={}", blob.recordCount());
    }

    /**
     * 由载荷与编码标志构造引擎。
     *
     * @param payload 载荷；未编码时每个字符代表一个字节
     * @param base64Encoded 载荷是否为 base64 编码
     * @return 引擎实例
     */
    public static FrozenTrie fromPayload(String payload, boolean base64Encoded) {
        if (payload == null) {
            throw new IllegalArgumentException("载荷不能为空");
        }
        TrieBlob blob = base64Encoded
            ? TrieBlob.fromBase64(payload)
            : TrieBlob.fromBytes(payload.getBytes(StandardCharsets.ISO_8859_1));
        return new FrozenTrie(blob);
    }

    /**
     * 从磁盘文件（原始记录或配套脚本）构造引擎。
     */
    public static FrozenTrie open(Path file) throws IOException {
        return new FrozenTrie(TrieBlobLoader.load(file));
    }

    public TrieNode root() {
        return root;
    }

    public TrieBlob blob() {
        return blob;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    /**
     * 设置查询字符串是否区分大小写；不区分时查询统一转小写，存储字母不做变换。
     */
    public void setCaseSensitive(boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
    }

    /**
     * 已解码的节点数量。
     */
    public int decodedNodeCount() {
        return nodesByIndex.size();
    }

    // ==================== 精确查找 ====================

    /**
     * 从根逐字符下降查找节点。
     *
     * @param word 查询词
     * @return 落点节点（不一定是完整词），不存在返回空
     */
    public Optional<TrieNode> lookupNode(String word) {
        return lookupNode(word, root);
    }

    /**
     * 从指定节点逐字符下降查找节点。
     *
     * @param word 查询词
     * @param start 起点，必须属于本引擎
     * @return 落点节点，不存在返回空
     */
    public Optional<TrieNode> lookupNode(String word, TrieNode start) {
        requireOwnNode(start);
        return descend(normalize(word), start);
    }

    /**
     * 判断词是否为字典中的完整词。
     */
    public boolean exists(String word) {
        return lookupNode(word).map(TrieNode::isFinal).orElse(false);
    }

    // ==================== 前缀补全 ====================

    /**
     * 枚举起点子树中的完整词，最多返回 maxResults 个。
     *
     * 遍历为深度优先：工作栈后进先出，截断时决定返回哪些词。
     *
     * @param start 起点节点
     * @param maxResults 结果上限
     * @return 按收集顺序排列的词
     */
    public List<String> lookupCompletions(TrieNode start, int maxResults) {
        requireOwnNode(start);
        requireNonNegative(maxResults, "maxResults");
        return toWords(collectCompletions(start, maxResults));
    }

    private List<TrieNode> collectCompletions(TrieNode start, int maxResults) {
        List<TrieNode> completions = new ArrayList<>();
        if (maxResults == 0) {
            return completions;
        }
        Deque<TrieNode> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            TrieNode vertex = stack.pop();
            for (TrieNode child : vertex.getEdges().values()) {
                if (child.isFinal()) {
                    completions.add(child);
                    if (completions.size() >= maxResults) {
                        return completions;
                    }
                }
                stack.push(child);
            }
        }
        return completions;
    }

    // ==================== 子串匹配 ====================

    /**
     * 以任意节点为锚点匹配查询词，收集匹配点本身及其下方的完整词。
     *
     * 结果达到上限后整个遍历立即终止。同一个词可能从多个锚点被发现，结果不去重。
     *
     * @param word 查询词
     * @param maxSubmatches 结果上限
     * @return 按发现顺序排列的词
     */
    public List<String> lookupSubmatches(String word, int maxSubmatches) {
        requireNonNegative(maxSubmatches, "maxSubmatches");
        String query = normalize(word);
        List<TrieNode> submatches = new ArrayList<>();
        if (maxSubmatches == 0) {
            return List.of();
        }

        collectSubmatchesAt(root, query, submatches, maxSubmatches);
        if (submatches.size() >= maxSubmatches) {
            return toWords(submatches);
        }

        Deque<TrieNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TrieNode vertex = stack.pop();
            for (TrieNode child : vertex.getEdges().values()) {
                collectSubmatchesAt(child, query, submatches, maxSubmatches);
                if (submatches.size() >= maxSubmatches) {
                    return toWords(submatches);
                }
                stack.push(child);
            }
        }
        return toWords(submatches);
    }

    private void collectSubmatchesAt(TrieNode anchor, String query, List<TrieNode> submatches, int maxSubmatches) {
        Optional<TrieNode> match = descend(query, anchor);
        if (match.isEmpty()) {
            return;
        }
        if (match.get().isFinal()) {
            submatches.add(match.get());
        }
        if (submatches.size() >= maxSubmatches) {
            return;
        }
        submatches.addAll(collectCompletions(match.get(), maxSubmatches - submatches.size()));
    }

    // ==================== 有界编辑距离搜索 ====================

    /**
     * 查找与查询词 Levenshtein 距离不超过 maxCost 的全部词。
     *
     * 沿字典树逐层传播 DP 行；某行最小值已超过预算时剪掉该分支。
     *
     * @param word 查询词
     * @param maxCost 最大编辑距离
     * @return 词到编辑距离的映射，无序
     */
    public Map<String, Integer> search(String word, int maxCost) {
        requireNonNegative(maxCost, "maxCost");
        String target = normalize(word);
        int[] firstRow = new int[target.length() + 1];
        for (int column = 0; column < firstRow.length; column++) {
            firstRow[column] = column;
        }

        Map<String, Integer> corrections = new HashMap<>();
        for (TrieNode child : root.getEdges().values()) {
            searchRecursive(child, target, firstRow, corrections, maxCost);
        }
        logger.trace("编辑距离搜索完成: word={}, maxCost={}, hits={}", target, maxCost, corrections.size());
        return corrections;
    }

    private void searchRecursive(TrieNode node, String word, int[] previousRow,
                                 Map<String, Integer> results, int maxCost) {
        int columns = word.length() + 1;
        char letter = node.letter();
        int[] currentRow = new int[columns];
        currentRow[0] = previousRow[0] + 1;
        int rowMinimum = currentRow[0];

        for (int column = 1; column < columns; column++) {
            int insertCost = currentRow[column - 1] + 1;
            int deleteCost = previousRow[column] + 1;
            int replaceCost = previousRow[column - 1] + (word.charAt(column - 1) == letter ? 0 : 1);
            currentRow[column] = Math.min(insertCost, Math.min(deleteCost, replaceCost));
            rowMinimum = Math.min(rowMinimum, currentRow[column]);
        }

        int cost = currentRow[columns - 1];
        if (cost <= maxCost && node.isFinal()) {
            results.put(node.getWord(), cost);
        }

        if (rowMinimum <= maxCost) {
            for (TrieNode child : node.getEdges().values()) {
                searchRecursive(child, word, currentRow, results, maxCost);
            }
        }
    }

    // ==================== 节点解码 ====================

    /**
     * 解码节点的整个兄弟区间：从首子节点开始顺序读取，直到（含）bftLast 记录。
     *
     * 广度优先编号下子节点下标必然大于父节点，且每个节点只有一个父节点；
     * 违反任一条件的数据含环或共享子树，直接判为损坏。
     */
    Map<Character, TrieNode> decodeEdges(TrieNode node) {
        int nextIndex = node.firstChildIndex();
        if (nextIndex == 0) {
            return Collections.emptyMap();
        }
        if (nextIndex <= node.index()) {
            throw new TrieFormatException("子节点下标不大于父节点下标，数据存在环", nextIndex, blob.byteLength());
        }
        Map<Character, TrieNode> edges = new LinkedHashMap<>();
        while (true) {
            TrieNode child = nodeAt(nextIndex, node);
            edges.put(child.letter(), child);
            if (child.isBftLast()) {
                break;
            }
            nextIndex++;
        }
        return Collections.unmodifiableMap(edges);
    }

    private TrieNode nodeAt(int index, TrieNode parent) {
        TrieNode node = nodesByIndex.get(index);
        if (node == null) {
            NodeRecord record = blob.recordAt(index);
            node = nodesByIndex.computeIfAbsent(index, ignored -> new TrieNode(this, index, record, parent));
        }
        if (node.parent() != parent) {
            throw new TrieFormatException("记录被多个父节点引用", index, blob.byteLength());
        }
        return node;
    }

    private Optional<TrieNode> descend(String word, TrieNode start) {
        TrieNode node = start;
        for (int position = 0; position < word.length(); position++) {
            node = node.getEdges().get(word.charAt(position));
            if (node == null) {
                return Optional.empty();
            }
        }
        return Optional.of(node);
    }

    private String normalize(String word) {
        if (word == null) {
            throw new IllegalArgumentException("查询词不能为空");
        }
        return caseSensitive ? word : word.toLowerCase(Locale.ROOT);
    }

    private void requireOwnNode(TrieNode node) {
        if (node == null || node.trie() != this) {
            throw new IllegalArgumentException("节点不属于当前字典树: " + node);
        }
    }

    private static void requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " 不能为负数: " + value);
        }
    }

    private static List<String> toWords(List<TrieNode> nodes) {
        List<String> words = new ArrayList<>(nodes.size());
        for (TrieNode node : nodes) {
            words.add(node.getWord());
        }
        return words;
    }
}
