package com.triesearch.trie;

import com.triesearch.config.Constants;
import com.triesearch.storage.NodeRecord;

import java.util.Map;

/**
 * 字典树节点视图，字段按需从记录解码。
 * 
 * 父节点引用只在被上级节点枚举子边时设定，节点从不自行指定父节点；
 * 因此 {@link #getWord()} 仅对从根出发遍历得到的节点有效。
 */
public final class TrieNode {
    private final FrozenTrie trie;
    private final int index;
    private final NodeRecord record;
    private final TrieNode parent;
    private volatile Map<Character, TrieNode> edges;

    TrieNode(FrozenTrie trie, int index, NodeRecord record, TrieNode parent) {
        this.trie = trie;
        this.index = index;
        this.record = record;
        this.parent = parent;
    }

    /**
     * 子节点映射（字母到节点），首次访问时解码整个兄弟区间并缓存。
     *
     * @return 不可修改的有序映射，叶子节点返回空映射
     */
    public Map<Character, TrieNode> getEdges() {
        Map<Character, TrieNode> cached = edges;
        if (cached == null) {
            // 并发重复解码得到同一批节点实例
            cached = trie.decodeEdges(this);
            edges = cached;
        }
        return cached;
    }

    /**
     * 沿父节点引用回溯到根，拼出从根（不含）到本节点（含）的词。
     *
     * @return 重建的词，根节点返回空串
     * @throws IllegalStateException 回溯链在到达根之前中断时抛出
     */
    public String getWord() {
        StringBuilder reversed = new StringBuilder();
        TrieNode current = this;
        while (current.parent != null) {
            reversed.append(current.letter());
            current = current.parent;
        }
        if (!current.isRoot()) {
            throw new IllegalStateException("节点祖先链不完整，无法重建词: index=" + index);
        }
        return reversed.reverse().toString();
    }

    public char letter() {
        return record.letter();
    }

    public boolean isFinal() {
        return record.isFinal();
    }

    public boolean isBftLast() {
        return record.bftLast();
    }

    public int firstChildIndex() {
        return record.firstChildIndex();
    }

    public int index() {
        return index;
    }

    public TrieNode parent() {
        return parent;
    }

    public boolean isRoot() {
        return index == Constants.ROOT_INDEX && parent == null;
    }

    FrozenTrie trie() {
        return trie;
    }

    @Override
    public String toString() {
        return "TrieNode{index=" + index + ", letter=" + letter() + ", final=" + isFinal() + "}";
    }
}
