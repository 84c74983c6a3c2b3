package com.triesearch.storage;

import com.triesearch.config.Constants;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Base64;

/**
 * 冻结字典树的原始字节缓冲，按下标提供定长记录访问。
 * 
 * 缓冲在构造时复制，之后只读。
 */
public final class TrieBlob {
    private final ByteBuffer buffer;
    private final int byteLength;

    private TrieBlob(byte[] bytes) {
        this.byteLength = bytes.length;
        this.buffer = ByteBuffer.wrap(bytes.clone()).order(ByteOrder.BIG_ENDIAN).asReadOnlyBuffer();
    }

    /**
     * 由原始大端序记录字节构造。
     *
     * @param bytes 记录字节
     * @return 字节缓冲
     */
    public static TrieBlob fromBytes(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("字典树数据不能为空");
        }
        return new TrieBlob(bytes);
    }

    /**
     * 由 base64 编码的载荷构造，解码先于一切查询。
     *
     * @param payload base64 文本
     * @return 字节缓冲
     * @throws TrieFormatException 载荷不是合法 base64 时抛出
     */
    public static TrieBlob fromBase64(String payload) {
        if (payload == null) {
            throw new IllegalArgumentException("base64 载荷不能为空");
        }
        try {
            return new TrieBlob(Base64.getDecoder().decode(payload.strip()));
        } catch (IllegalArgumentException exception) {
            throw new TrieFormatException("base64 载荷非法", exception);
        }
    }

    /**
     * 读取并解码指定下标的记录。
     *
     * @param index 记录下标（以记录为单位，不是字节）
     * @return 解码后的记录
     * @throws TrieFormatException 记录超出缓冲范围时抛出
     */
    public NodeRecord recordAt(int index) {
        return NodeRecord.decode(rawAt(index));
    }

    /**
     * 读取指定下标的原始 32 位值。
     */
    public int rawAt(int index) {
        long offset = (long) index * Constants.RECORD_BYTES;
        if (index < 0 || offset + Constants.RECORD_BYTES > byteLength) {
            throw new TrieFormatException("记录下标越界", index, byteLength);
        }
        return buffer.getInt((int) offset);
    }

    /**
     * 完整记录数量，末尾不足4字节的部分不计入。
     */
    public int recordCount() {
        return byteLength / Constants.RECORD_BYTES;
    }

    public int byteLength() {
        return byteLength;
    }
}
