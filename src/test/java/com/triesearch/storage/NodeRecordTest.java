package com.triesearch.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class NodeRecordTest {

    @Test
    @DisplayName("按位拆解记录字段")
    void testDecodeAllFields() {
        // 3<<9 | bftLast | final | 'a'
        NodeRecord record = NodeRecord.decode(0x7E1);

        assertEquals('a', record.letter());
        assertTrue(record.isFinal());
        assertTrue(record.bftLast());
        assertEquals(3, record.firstChildIndex());
        assertTrue(record.hasChildren());
    }

    @Test
    @DisplayName("高位全1时首子节点下标按无符号处理")
    void testDecodeMaxFirstChildIndex() {
        NodeRecord record = NodeRecord.decode(0xFFFFFFFF);

        assertEquals((1 << 23) - 1, record.firstChildIndex());
        assertEquals((char) 0x7F, record.letter());
    }

    @ParameterizedTest
    @CsvSource({
        "a, true, true, 3",
        "z, false, true, 0",
        "m, true, false, 8388607",
        "x, false, false, 1"
    })
    @DisplayName("编码后解码字段保持一致")
    void testEncodeMatchesDecode(char letter, boolean isFinal, boolean bftLast, int firstChildIndex) {
        NodeRecord record = new NodeRecord(letter, isFinal, bftLast, firstChildIndex);
        assertEquals(record, NodeRecord.decode(record.encode()));
    }

    @Test
    @DisplayName("超出7位的字母或23位的下标不能编码")
    void testEncodeRejectsOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> new NodeRecord('é', false, false, 0).encode());
        assertThrows(IllegalArgumentException.class, () -> new NodeRecord('a', false, false, 1 << 23).encode());
    }

    @Test
    @DisplayName("叶子节点没有子节点")
    void testLeafHasNoChildren() {
        assertFalse(NodeRecord.decode(0x180 | 'g').hasChildren());
    }
}
