package com.diskindex.config;

/**
 * 全局常量定义
 *
 * 包含索引文件名、存储格式魔数、构建参数与BM25默认参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 索引文件名 ====================
    /** 词项到TermID映射文件 */
    public static final String TERM_ID_MAPPING_FILE = "termid.mapping";
    /** 文档到DocID映射文件（SQLite） */
    public static final String DOC_ID_MAPPING_FILE = "docid.mapping";
    /** 文档长度表文件 */
    public static final String DOC_LENGTHS_FILE = "docs.lengths";
    /** 按TermID排序的倒排文件 */
    public static final String POSTINGS_FILE = "postings.index";
    /** 词典文件，存在即表示索引构建完成 */
    public static final String LEXICON_FILE = "lexicon.index";
    /** 索引元数据（JSON） */
    public static final String INDEX_META_FILE = "index.meta";
    /** 分块文件名前缀 */
    public static final String CHUNK_FILE_PREFIX = "chunk-";

    // ==================== 存储格式魔数 ====================
    /** 词典文件魔数 "DILX" */
    public static final int LEXICON_MAGIC = 0x44494C58;
    /** 倒排列表文件魔数 "DIPI" */
    public static final int POSTINGS_MAGIC = 0x44495049;
    /** 分块文件魔数 "DICK" */
    public static final int CHUNK_MAGIC = 0x4449434B;
    /** TermID映射文件魔数 "DITM" */
    public static final int TERM_MAPPING_MAGIC = 0x4449544D;
    /** 文档长度表魔数 "DIDL" */
    public static final int DOC_LENGTHS_MAGIC = 0x4449444C;
    /** 文件格式版本号 */
    public static final short FORMAT_VERSION = 1;

    // ==================== 索引参数 ====================
    /** 分块内存预算默认值（64MB） */
    public static final long DEFAULT_CHUNK_MEMORY_BYTES = 64L * 1024 * 1024;
    /** 分块累加器中每个词项的估算开销（字节） */
    public static final long ACCUMULATOR_TERM_OVERHEAD_BYTES = 64;
    /** 分块累加器中每个倒排项的估算开销（字节） */
    public static final long ACCUMULATOR_POSTING_BYTES = 8;

    // ==================== BM25参数 ====================
    /** 词频饱和系数 */
    public static final double BM25_K1 = 1.5;
    /** 长度归一化系数 */
    public static final double BM25_B = 0.75;
    /** 查询词频饱和系数 */
    public static final double BM25_K3 = 500;

    // ==================== 线程参数 ====================
    /** 默认索引工作线程数 */
    public static final int DEFAULT_INDEX_THREADS = Runtime.getRuntime().availableProcessors();
    /** 索引线程数安全上限 */
    public static final int MAX_INDEX_THREADS = 64;
    /** 构建失败时等待工作线程退出的上限（秒） */
    public static final long WORKER_SHUTDOWN_TIMEOUT_SECONDS = 60;

    // ==================== CLI参数 ====================
    /** 单次查询最大返回条数 */
    public static final int MAX_SEARCH_LIMIT = 1000;
    /** 查询文本最大长度 */
    public static final int MAX_QUERY_LENGTH = 4096;
}
