package com.triesearch.trie;

import com.triesearch.storage.NodeRecord;
import com.triesearch.storage.TrieBlob;
import com.triesearch.storage.TrieFormatException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TrieNodeTest {

    @Test
    void edgesFollowRecordOrderAndAreCached() {
        FrozenTrie trie = TrieFixtures.sampleTrie();
        TrieNode root = trie.root();

        Map<Character, TrieNode> edges = root.getEdges();
        assertEquals(List.of('c', 'd'), List.copyOf(edges.keySet()));
        assertSame(edges, root.getEdges());
        assertThrows(UnsupportedOperationException.class, () -> edges.remove('c'));
    }

    @Test
    void childrenPointBackToDiscoveringNode() {
        FrozenTrie trie = TrieFixtures.sampleTrie();
        TrieNode a = trie.lookupNode("ca").orElseThrow();

        for (TrieNode child : a.getEdges().values()) {
            assertSame(a, child.parent());
        }
        assertNull(trie.root().parent());
        assertTrue(trie.root().isRoot());
        assertFalse(a.isRoot());
    }

    @Test
    void rootSentinelLetterIsNotPartOfWords() {
        FrozenTrie trie = TrieFixtures.sampleTrie();

        assertEquals((char) 30, trie.root().letter());
        assertEquals("", trie.root().getWord());
        assertEquals("c", trie.lookupNode("c").orElseThrow().getWord());
        assertEquals("care", trie.lookupNode("care").orElseThrow().getWord());
    }

    @Test
    void leafHasNoEdges() {
        FrozenTrie trie = TrieFixtures.sampleTrie();
        TrieNode dog = trie.lookupNode("dog").orElseThrow();

        assertEquals(0, dog.firstChildIndex());
        assertTrue(dog.getEdges().isEmpty());
        assertTrue(dog.isFinal());
    }

    @Test
    void siblingRunWithoutTerminatorFailsInsteadOfReadingPastBuffer() {
        byte[] bytes = {
            0x00, 0x00, 0x03, 0x1E,
            0x00, 0x00, 0x00, (byte) 0xE1
        };
        FrozenTrie trie = new FrozenTrie(TrieBlob.fromBytes(bytes));

        TrieFormatException exception = assertThrows(TrieFormatException.class, () -> trie.root().getEdges());
        assertEquals(2, exception.getRecordIndex());
    }

    @Test
    void selfReferencingChildPointerFailsInsteadOfLooping() {
        byte[] bytes = {
            0x00, 0x00, 0x03, 0x1E,
            0x00, 0x00, 0x03, 0x61
        };
        FrozenTrie trie = new FrozenTrie(TrieBlob.fromBytes(bytes));
        TrieNode a = trie.root().getEdges().get('a');

        assertNotNull(a);
        TrieFormatException exception = assertThrows(TrieFormatException.class, a::getEdges);
        assertEquals(1, exception.getRecordIndex());
        assertThrows(TrieFormatException.class, () -> trie.lookupCompletions(trie.root(), 5));
        assertThrows(TrieFormatException.class, () -> trie.lookupSubmatches("a", 5));
        assertThrows(TrieFormatException.class, () -> trie.search("aaaa", 8));
    }

    @Test
    void siblingRunSharedByTwoParentsIsRejected() {
        byte[] bytes = {
            0x00, 0x00, 0x03, 0x1E,
            0x00, 0x00, 0x06, 0x61,
            0x00, 0x00, 0x07, 0x62,
            0x00, 0x00, 0x01, (byte) 0xE3
        };
        FrozenTrie trie = new FrozenTrie(TrieBlob.fromBytes(bytes));
        Map<Character, TrieNode> edges = trie.root().getEdges();

        assertEquals("ac", edges.get('a').getEdges().get('c').getWord());
        TrieFormatException exception = assertThrows(TrieFormatException.class, () -> edges.get('b').getEdges());
        assertEquals(3, exception.getRecordIndex());
    }

    @Test
    void wordRequiresCompleteAncestry() {
        FrozenTrie trie = TrieFixtures.sampleTrie();
        TrieNode detached = new TrieNode(trie, 5, new NodeRecord('r', true, false, 8), null);

        assertThrows(IllegalStateException.class, detached::getWord);
    }
}
