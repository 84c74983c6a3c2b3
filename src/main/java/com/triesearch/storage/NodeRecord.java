package com.triesearch.storage;

import com.triesearch.config.Constants;

/**
 * 一条解码后的节点记录。
 *
 * @param letter 入边字母（根节点的字母无意义）
 * @param isFinal 从根到该节点是否构成完整词
 * @param bftLast 是否为兄弟区间的最后一条记录
 * @param firstChildIndex 首个子节点的记录下标，0 表示无子节点
 */
public record NodeRecord(char letter, boolean isFinal, boolean bftLast, int firstChildIndex) {

    /**
     * 按位拆解一个 32 位记录值，无副作用。
     *
     * @param raw 大端序读出的原始值
     * @return 解码结果
     */
    public static NodeRecord decode(int raw) {
        char letter = (char) (raw & Constants.LETTER_MASK);
        boolean isFinal = (raw & Constants.FINAL_MASK) != 0;
        boolean bftLast = (raw & Constants.BFT_LAST_MASK) != 0;
        int firstChildIndex = raw >>> Constants.FIRST_CHILD_SHIFT;
        return new NodeRecord(letter, isFinal, bftLast, firstChildIndex);
    }

    /**
     * 按位打包为 32 位记录值。
     *
     * @return 原始值
     */
    public int encode() {
        if (letter > Constants.LETTER_MASK) {
            throw new IllegalArgumentException("字母超出7位范围: " + (int) letter);
        }
        if (firstChildIndex < 0 || firstChildIndex > Constants.MAX_FIRST_CHILD_INDEX) {
            throw new IllegalArgumentException("firstChildIndex 超出23位范围: " + firstChildIndex);
        }
        int raw = firstChildIndex << Constants.FIRST_CHILD_SHIFT;
        if (bftLast) {
            raw |= Constants.BFT_LAST_MASK;
        }
        if (isFinal) {
            raw |= Constants.FINAL_MASK;
        }
        return raw | letter;
    }

    public boolean hasChildren() {
        return firstChildIndex != 0;
    }
}
