package com.triesearch.storage;

import com.triesearch.trie.TrieFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 覆盖原始记录文件与配套脚本两种形式的加载。
 */
class TrieBlobLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsRawRecordFile() throws IOException {
        byte[] encoded = TrieFixtures.encode(TrieFixtures.SAMPLE_WORDS);
        Path file = tempDir.resolve("search.trie");
        Files.write(file, encoded);

        TrieBlob blob = TrieBlobLoader.load(file);

        assertEquals(encoded.length / 4, blob.recordCount());
        for (int index = 0; index < blob.recordCount(); index++) {
            assertEquals(TrieBlob.fromBytes(encoded).rawAt(index), blob.rawAt(index));
        }
    }

    @Test
    void loadsScriptPayloadBySuffix() throws IOException {
        Path file = tempDir.resolve("trie_index.js");
        Files.writeString(file, TrieFixtures.scriptOf(TrieFixtures.SAMPLE_WORDS), StandardCharsets.US_ASCII);

        TrieBlob blob = TrieBlobLoader.load(file);

        byte[] expected = TrieFixtures.encode(TrieFixtures.SAMPLE_WORDS);
        assertEquals(expected.length, blob.byteLength());
        assertEquals(TrieBlob.fromBytes(expected).rawAt(3), blob.rawAt(3));
    }

    @Test
    void loadsScriptPayloadByContent() throws IOException {
        Path file = tempDir.resolve("dumped.data");
        Files.writeString(file, TrieFixtures.scriptOf(TrieFixtures.SAMPLE_WORDS) + "\n", StandardCharsets.US_ASCII);

        TrieBlob blob = TrieBlobLoader.load(file);

        assertEquals(TrieFixtures.encode(TrieFixtures.SAMPLE_WORDS).length, blob.byteLength());
    }

    @Test
    void rejectsIncompleteRecord() throws IOException {
        Path file = tempDir.resolve("broken.trie");
        Files.write(file, new byte[] {0x00, 0x00, 0x01, 0x1E, 0x00});

        IOException exception = assertThrows(IOException.class, () -> TrieBlobLoader.load(file));
        assertTrue(exception.getMessage().contains("不完整记录"));
    }

    @Test
    void rejectsScriptWithoutPayloadVariable() throws IOException {
        Path file = tempDir.resolve("other.js");
        Files.writeString(file, "var something_else=\"AAAA\";");

        assertThrows(IOException.class, () -> TrieBlobLoader.load(file));
    }

    @Test
    void rejectsScriptWithInvalidBase64() throws IOException {
        Path file = tempDir.resolve("corrupt.js");
        Files.writeString(file, "var trie_data=\"%%%%\";");

        IOException exception = assertThrows(IOException.class, () -> TrieBlobLoader.load(file));
        assertInstanceOf(TrieFormatException.class, exception.getCause());
    }

    @Test
    void missingFileFails() {
        assertThrows(NoSuchFileException.class, () -> TrieBlobLoader.load(tempDir.resolve("absent.trie")));
    }

    @Test
    void extractsPayloadBetweenQuotes() throws IOException {
        assertEquals("QUJD", TrieBlobLoader.extractScriptPayload("var trie_data=\"QUJD\";", Path.of("x.js")));
        String empty = TrieBlobLoader.extractScriptPayload("var trie_data=\"\";", Path.of("x.js"));
        assertEquals(0, TrieBlob.fromBase64(empty).recordCount());
    }
}
