package com.triesearch.storage;

/**
 * 冻结字典树数据损坏或读取越界。
 */
public class TrieFormatException extends RuntimeException {
    private final int recordIndex;
    private final int byteLength;

    public TrieFormatException(String message, int recordIndex, int byteLength) {
        super(message + " (recordIndex=" + recordIndex + ", byteLength=" + byteLength + ")");
        this.recordIndex = recordIndex;
        this.byteLength = byteLength;
    }

    public TrieFormatException(String message, Throwable cause) {
        super(message, cause);
        this.recordIndex = -1;
        this.byteLength = -1;
    }

    public int getRecordIndex() {
        return recordIndex;
    }

    public int getByteLength() {
        return byteLength;
    }
}
