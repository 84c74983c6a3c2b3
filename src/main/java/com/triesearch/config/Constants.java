package com.triesearch.config;

/**
 * 全局常量定义
 * 
 * 包含冻结字典树记录格式掩码、查询默认参数和CLI安全上限
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }
    
    // ==================== 记录格式 ====================
    /** 每条记录字节数（大端序无符号32位整数） */
    public static final int RECORD_BYTES = 4;
    /** 低7位：入边字母 */
    public static final int LETTER_MASK = 0x7F;
    /** 第7位：从根到该节点构成完整词 */
    public static final int FINAL_MASK = 1 << 7;
    /** 第8位：兄弟区间最后一条记录 */
    public static final int BFT_LAST_MASK = 1 << 8;
    /** 第9..31位：首个子节点记录下标 */
    public static final int FIRST_CHILD_SHIFT = 9;
    /** 首子节点下标可表示的最大值（23位） */
    public static final int MAX_FIRST_CHILD_INDEX = (1 << 23) - 1;
    /** 根节点固定位于下标0 */
    public static final int ROOT_INDEX = 0;
    /** 配套脚本形式中承载 base64 数据的变量名 */
    public static final String SCRIPT_PAYLOAD_VARIABLE = "trie_data";
    
    // ==================== 查询参数 ====================
    /** 默认补全条数 */
    public static final int DEFAULT_COMPLETION_LIMIT = 5;
    /** 默认子串匹配条数 */
    public static final int DEFAULT_SUBMATCH_LIMIT = 5;
    /** 默认纠错最大编辑距离 */
    public static final int DEFAULT_MAX_COST = 2;
    /** 查询长度超过该值才尝试子串匹配与纠错 */
    public static final int DEFAULT_SUBMATCH_MIN_QUERY_LENGTH = 3;
    
    // ==================== CLI安全上限 ====================
    /** 单次返回结果数量上限 */
    public static final int MAX_RESULT_LIMIT = 1000;
    /** 查询字符串最大长度 */
    public static final int MAX_QUERY_LENGTH = 256;
    /** 编辑距离上限 */
    public static final int MAX_COST_LIMIT = 8;
}
