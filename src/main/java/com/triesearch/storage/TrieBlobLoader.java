package com.triesearch.storage;

import com.triesearch.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 从磁盘加载冻结字典树。
 * 
 * 支持两种形式：
 * - 原始记录文件（如 search.trie）
 * - 配套脚本 var trie_data="&lt;base64&gt;"; （如 trie_index.js）
 */
public final class TrieBlobLoader {
    private static final Logger logger = LoggerFactory.getLogger(TrieBlobLoader.class);

    private static final String SCRIPT_SUFFIX = ".js";
    private static final String SCRIPT_PREFIX = "var ";

    private TrieBlobLoader() {
    }

    /**
     * 读取文件并按内容形式解码。
     *
     * @param file 字典树文件
     * @return 字节缓冲
     * @throws IOException 文件不可读或格式损坏时抛出
     */
    public static TrieBlob load(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("字典树文件不能为空");
        }
        byte[] content = Files.readAllBytes(file);
        TrieBlob blob;
        if (isScript(file, content)) {
            String payload = extractScriptPayload(new String(content, StandardCharsets.US_ASCII), file);
            try {
                blob = TrieBlob.fromBase64(payload);
            } catch (TrieFormatException exception) {
                throw new IOException("脚本载荷解码失败: " + file, exception);
            }
        } else {
            blob = TrieBlob.fromBytes(content);
        }
        if (blob.byteLength() % Constants.RECORD_BYTES != 0) {
            throw new IOException("字典树文件包含不完整记录，可能已损坏: " + file + ", bytes=" + blob.byteLength());
        }
        logger.info("已加载字典树: file={}, bytes={}, records={}", file, blob.byteLength(), blob.recordCount());
        return blob;
    }

    private static boolean isScript(Path file, byte[] content) {
        Path fileName = file.getFileName();
        if (fileName != null && fileName.toString().endsWith(SCRIPT_SUFFIX)) {
            return true;
        }
        if (content.length < SCRIPT_PREFIX.length()) {
            return false;
        }
        String head = new String(content, 0, SCRIPT_PREFIX.length(), StandardCharsets.US_ASCII);
        return head.equals(SCRIPT_PREFIX);
    }

    /**
     * 提取 var trie_data="..."; 中引号之间的载荷。
     */
    static String extractScriptPayload(String script, Path file) throws IOException {
        int variableAt = script.indexOf(Constants.SCRIPT_PAYLOAD_VARIABLE);
        if (variableAt < 0) {
            throw new IOException("脚本中缺少 " + Constants.SCRIPT_PAYLOAD_VARIABLE + " 变量: " + file);
        }
        int openQuote = script.indexOf('"', variableAt);
        int closeQuote = openQuote < 0 ? -1 : script.indexOf('"', openQuote + 1);
        if (openQuote < 0 || closeQuote < 0) {
            throw new IOException("脚本载荷缺少引号: " + file);
        }
        return script.substring(openQuote + 1, closeQuote);
    }
}
