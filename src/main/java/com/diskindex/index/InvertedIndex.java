package com.diskindex.index;

import com.diskindex.config.Constants;
import com.diskindex.config.EngineConfig;
import com.diskindex.document.Document;
import com.diskindex.document.DocumentTable;
import com.diskindex.query.SearchResult;
import com.diskindex.scoring.BM25Scorer;
import com.diskindex.scoring.QueryScorer;
import com.diskindex.storage.CorruptIndexException;
import com.diskindex.storage.DocLengthsFile;
import com.diskindex.storage.PostingsReader;
import com.diskindex.text.DocumentTokenizer;
import com.diskindex.text.TermFrequencyTokenizer;
import com.diskindex.text.TokenizerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * 磁盘倒排索引句柄：一次性批量构建，构建完成后只读查询。
 *
 * 查询路径只访问不可变的内存词典与无锁的倒排定位读取，可被任意多个线程并发调用；
 * 构建与关闭需由调用方保证不与查询并发。
 */
public class InvertedIndex implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(InvertedIndex.class);

    /** 构建产物，词典文件不在其中，它最后写入 */
    private static final List<String> BUILD_ARTIFACTS = List.of(
        Constants.POSTINGS_FILE,
        Constants.DOC_LENGTHS_FILE,
        Constants.DOC_ID_MAPPING_FILE,
        Constants.TERM_ID_MAPPING_FILE,
        Constants.INDEX_META_FILE,
        Constants.LEXICON_FILE + LexiconBuilder.TEMP_SUFFIX
    );

    private final Path indexDir;
    private final DocumentTokenizer tokenizer;
    private final EngineConfig config;
    private final QueryScorer queryScorer;
    private volatile Lexicon lexicon;
    private volatile PostingsReader postingsReader;
    private volatile boolean closed;

    private InvertedIndex(Path indexDir, DocumentTokenizer tokenizer, EngineConfig config) {
        this.indexDir = indexDir;
        this.tokenizer = tokenizer;
        this.config = config;
        this.queryScorer = new QueryScorer(BM25Scorer.fromConfig(config));
        this.lexicon = Lexicon.empty();
    }

    /**
     * 按配置中的索引目录与分词策略打开索引；已构建的索引沿用元数据中记录的分词策略。
     */
    public static InvertedIndex open(EngineConfig config) throws IOException {
        TokenizerType tokenizerType = config.getTokenizerType();
        boolean stopWordsEnabled = config.isStopWordsEnabled();
        Path metaPath = config.getIndexDir().resolve(Constants.INDEX_META_FILE);
        if (Lexicon.exists(config.getIndexDir()) && Files.isRegularFile(metaPath)) {
            IndexMeta meta = IndexMeta.readFrom(metaPath.toFile());
            if (meta.customTokenizer()) {
                throw new IndexUsageException("索引以自定义分词器构建，需通过 open(indexDir, tokenizer, config) 打开: "
                    + config.getIndexDir());
            }
            try {
                tokenizerType = TokenizerType.valueOf(meta.tokenizerType());
            } catch (IllegalArgumentException exception) {
                throw new CorruptIndexException("未知的分词策略: " + meta.tokenizerType(), Constants.INDEX_META_FILE, exception);
            }
            stopWordsEnabled = meta.stopWordsEnabled();
            if (tokenizerType != config.getTokenizerType() || stopWordsEnabled != config.isStopWordsEnabled()) {
                logger.info("沿用索引构建时的分词策略: tokenizer={}, stopWords={}", tokenizerType, stopWordsEnabled);
            }
        }
        DocumentTokenizer tokenizer = TermFrequencyTokenizer.of(tokenizerType, stopWordsEnabled);
        return open(config.getIndexDir(), tokenizer, config);
    }

    /**
     * 打开索引目录；已构建时载入全部产物并把分词器绑定到已有的 TermID 空间。
     *
     * @param indexDir 索引目录，不存在时创建
     * @param tokenizer 文档分词器
     * @param config 引擎配置
     * @return 索引句柄
     * @throws CorruptIndexException 产物缺失或损坏时抛出
     * @throws IOException 读取失败时抛出
     */
    public static InvertedIndex open(Path indexDir, DocumentTokenizer tokenizer, EngineConfig config) throws IOException {
        if (indexDir == null || tokenizer == null || config == null) {
            throw new IllegalArgumentException("索引目录、分词器与配置不能为空");
        }
        Files.createDirectories(indexDir);
        InvertedIndex index = new InvertedIndex(indexDir, tokenizer, config);
        index.load();
        return index;
    }

    /**
     * 构建索引。DocID 按输入顺序从 0 分配。
     *
     * @param documents 待索引文档
     * @param chunkMemoryBudget 分块内存预算（字节）
     * @throws IndexUsageException 目录中已存在构建完成的索引时抛出，此时不触碰任何文件
     * @throws IOException 构建失败时抛出，已写出的部分产物会被删除
     */
    public synchronized void build(List<Document> documents, long chunkMemoryBudget) throws IOException {
        ensureOpen();
        if (!lexicon.isEmpty() || Lexicon.exists(indexDir)) {
            throw new IndexUsageException("索引已构建，不能重复构建: " + indexDir);
        }
        if (documents == null) {
            throw new IllegalArgumentException("文档列表不能为空");
        }
        if (tokenizer.termIdMapping().isReadOnly()) {
            throw new IndexUsageException("分词器已绑定只读 TermID 空间，无法用于构建");
        }

        long start = System.currentTimeMillis();
        PostingsStore postingsStore = new PostingsStore(indexDir, resolveThreads());
        deleteArtifacts(postingsStore);
        logger.info("开始构建索引: dir={}, docs={}, budget={}B", indexDir, documents.size(), chunkMemoryBudget);
        try {
            PostingsStore.ChunkBuildResult chunks = postingsStore.buildChunks(documents, chunkMemoryBudget, tokenizer);
            LexiconBuilder lexiconBuilder = new LexiconBuilder();
            postingsStore.mergeChunks(chunks.chunkCount(), lexiconBuilder, chunks.docFrequencies());

            File docLengthsFile = artifact(Constants.DOC_LENGTHS_FILE);
            postingsStore.persistDocLengths(documents, docLengthsFile);
            try (DocumentTable documentTable = DocumentTable.create(indexDir.resolve(Constants.DOC_ID_MAPPING_FILE))) {
                documentTable.insertAll(documents);
            }
            tokenizer.persistTermIdMapping(artifact(Constants.TERM_ID_MAPPING_FILE));

            new IndexMeta(
                documents.size(),
                lexiconBuilder.termCount(),
                chunks.chunkCount(),
                Files.size(artifact(Constants.POSTINGS_FILE).toPath()),
                tokenizer.tokenizerType().map(TokenizerType::name).orElse(IndexMeta.CUSTOM_TOKENIZER),
                tokenizer.stopWordsEnabled(),
                IndexMeta.STATUS_COMPLETE,
                Instant.now()
            ).writeTo(artifact(Constants.INDEX_META_FILE));

            lexiconBuilder.save(artifact(Constants.LEXICON_FILE), DocLengthsFile.read(docLengthsFile));
        } catch (IOException | RuntimeException exception) {
            logger.error("索引构建失败，清理部分产物: dir={}", indexDir, exception);
            try {
                deleteArtifacts(postingsStore);
            } catch (IOException cleanupException) {
                exception.addSuppressed(cleanupException);
            }
            throw exception;
        }

        load();
        logger.info("索引构建完成: docs={}, terms={}, elapsed={}ms",
            lexicon.numDocs(), lexicon.termCount(), System.currentTimeMillis() - start);
    }

    /**
     * 对查询文档打分。查询文档由同一分词器在已构建索引的 TermID 空间内重新分词，未知词项被丢弃；
     * 同一查询文档多次查询得到相同结果。
     *
     * @param queryDocument 查询文档
     * @return 得分升序的命中
     * @throws IndexUsageException 索引尚未构建时抛出
     * @throws IOException 读取倒排失败时抛出
     */
    public SearchResult search(Document queryDocument) throws IOException {
        ensureOpen();
        Lexicon currentLexicon = lexicon;
        if (currentLexicon.isEmpty()) {
            throw new IndexUsageException("索引尚未构建，无法查询: " + indexDir);
        }
        queryDocument.clearFrequencies();
        tokenizer.tokenize(queryDocument, null);
        return queryScorer.score(queryDocument.name(), queryDocument.frequencies(), currentLexicon, postingsReader);
    }

    /**
     * 对查询文本打分。
     */
    public SearchResult search(String queryText) throws IOException {
        return search(Document.ofText(queryText == null || queryText.isBlank() ? "<empty>" : queryText, null, queryText));
    }

    /**
     * 当前索引状态。
     */
    public IndexStatus status() throws IOException {
        Lexicon currentLexicon = lexicon;
        return new IndexStatus(
            indexDir,
            !currentLexicon.isEmpty(),
            currentLexicon.numDocs(),
            currentLexicon.termCount(),
            currentLexicon.avgDocLength(),
            directorySize()
        );
    }

    public Lexicon lexicon() {
        return lexicon;
    }

    public DocumentTokenizer tokenizer() {
        return tokenizer;
    }

    public Path getIndexDir() {
        return indexDir;
    }

    /**
     * 删除索引目录中的全部索引产物，词典文件最先删除。
     *
     * @param indexDir 索引目录
     * @throws IOException 删除失败时抛出
     */
    public static void destroy(Path indexDir) throws IOException {
        Files.deleteIfExists(indexDir.resolve(Constants.LEXICON_FILE));
        for (String artifactName : BUILD_ARTIFACTS) {
            Files.deleteIfExists(indexDir.resolve(artifactName));
        }
        new PostingsStore(indexDir, 1).deleteChunkFiles(0);
        logger.info("已删除索引产物: dir={}", indexDir);
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        PostingsReader reader = postingsReader;
        postingsReader = null;
        if (reader != null) {
            reader.close();
        }
    }

    private void load() throws IOException {
        Lexicon loaded = Lexicon.open(indexDir);
        if (loaded.isEmpty()) {
            lexicon = loaded;
            return;
        }
        PostingsReader reader = new PostingsReader(artifact(Constants.POSTINGS_FILE));
        PostingsReader previous = postingsReader;
        postingsReader = reader;
        lexicon = loaded;
        tokenizer.attachTermIdMapping(loaded.termIdMapping());
        if (previous != null) {
            previous.close();
        }
    }

    private void deleteArtifacts(PostingsStore postingsStore) throws IOException {
        for (String artifactName : BUILD_ARTIFACTS) {
            Files.deleteIfExists(indexDir.resolve(artifactName));
        }
        postingsStore.deleteChunkFiles(0);
    }

    private int resolveThreads() {
        int threads = config.getIndexThreads();
        if (threads <= 0) {
            logger.warn("非法线程数 {}，已回退为默认值 {}", threads, Constants.DEFAULT_INDEX_THREADS);
            return Math.min(Constants.DEFAULT_INDEX_THREADS, Constants.MAX_INDEX_THREADS);
        }
        return Math.min(threads, Constants.MAX_INDEX_THREADS);
    }

    private File artifact(String fileName) {
        return indexDir.resolve(fileName).toFile();
    }

    private long directorySize() throws IOException {
        long total = 0;
        for (String artifactName : BUILD_ARTIFACTS) {
            Path path = indexDir.resolve(artifactName);
            if (Files.isRegularFile(path)) {
                total += Files.size(path);
            }
        }
        Path lexiconPath = indexDir.resolve(Constants.LEXICON_FILE);
        if (Files.isRegularFile(lexiconPath)) {
            total += Files.size(lexiconPath);
        }
        return total;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("InvertedIndex 已关闭");
        }
    }
}
