package com.diskindex.index;

import com.diskindex.config.Constants;
import com.diskindex.document.DocumentInfo;
import com.diskindex.document.DocumentTable;
import com.diskindex.storage.CorruptIndexException;
import com.diskindex.storage.DocLengthsFile;
import com.diskindex.storage.LexiconReader;
import com.diskindex.storage.TermStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * 已构建索引的只读词典视图：词项统计量与定位、语料统计量、文档长度、文档元数据与 TermID 空间。
 *
 * 打开后所有数据常驻内存且不可变，查询线程可无锁并发访问。
 */
public final class Lexicon {
    private static final Logger logger = LoggerFactory.getLogger(Lexicon.class);
    private static final Lexicon EMPTY = new Lexicon(0, 0.0, Map.of(), new int[0], new DocumentInfo[0], null);

    private final int numDocs;
    private final double avgDocLength;
    private final Map<Integer, TermStats> termStatsById;
    private final int[] docLengths;
    private final DocumentInfo[] documents;
    private final TermIdMapping termIdMapping;

    private Lexicon(int numDocs, double avgDocLength, Map<Integer, TermStats> termStatsById, int[] docLengths,
                    DocumentInfo[] documents, TermIdMapping termIdMapping) {
        this.numDocs = numDocs;
        this.avgDocLength = avgDocLength;
        this.termStatsById = termStatsById;
        this.docLengths = docLengths;
        this.documents = documents;
        this.termIdMapping = termIdMapping;
    }

    /**
     * 尚未构建时的空词典。
     */
    public static Lexicon empty() {
        return EMPTY;
    }

    /**
     * 索引目录中是否存在已完成的索引。
     */
    public static boolean exists(Path indexDir) {
        return Files.isRegularFile(indexDir.resolve(Constants.LEXICON_FILE));
    }

    /**
     * 载入索引目录中的词典及其依赖的全部产物；词典文件不存在时返回空词典。
     *
     * @param indexDir 索引目录
     * @return 词典
     * @throws CorruptIndexException 产物缺失、损坏或彼此不一致时抛出
     * @throws IOException 读取失败时抛出
     */
    public static Lexicon open(Path indexDir) throws IOException {
        if (!exists(indexDir)) {
            return EMPTY;
        }
        LexiconReader lexiconReader = LexiconReader.read(indexDir.resolve(Constants.LEXICON_FILE).toFile());
        TermIdMapping termIdMapping = TermIdMapping.load(requireArtifact(indexDir, Constants.TERM_ID_MAPPING_FILE));
        int[] docLengths = DocLengthsFile.read(requireArtifact(indexDir, Constants.DOC_LENGTHS_FILE));
        DocumentInfo[] documents = loadDocuments(requireArtifact(indexDir, Constants.DOC_ID_MAPPING_FILE).toPath());
        requireArtifact(indexDir, Constants.POSTINGS_FILE);

        int numDocs = lexiconReader.getNumDocs();
        if (docLengths.length != numDocs) {
            throw new CorruptIndexException("文档长度表条数与词典不一致: " + docLengths.length + " vs " + numDocs,
                Constants.DOC_LENGTHS_FILE);
        }
        if (documents.length != numDocs) {
            throw new CorruptIndexException("文档映射条数与词典不一致: " + documents.length + " vs " + numDocs,
                Constants.DOC_ID_MAPPING_FILE);
        }
        double expectedAvg = LexiconBuilder.averageLength(docLengths);
        if (Math.abs(expectedAvg - lexiconReader.getAvgDocLength()) > 1e-9 * Math.max(1.0, expectedAvg)) {
            throw new CorruptIndexException("平均文档长度与长度表不一致: " + lexiconReader.getAvgDocLength()
                + " vs " + expectedAvg, Constants.LEXICON_FILE);
        }
        for (TermStats stats : lexiconReader.getTermStats().values()) {
            if (stats.termId() >= termIdMapping.size()) {
                throw new CorruptIndexException("词典中的 TermID 超出映射范围: " + stats.termId(), Constants.LEXICON_FILE);
            }
        }

        logger.info("词典载入完成: dir={}, docs={}, terms={}", indexDir, numDocs, lexiconReader.getTermStats().size());
        return new Lexicon(numDocs, lexiconReader.getAvgDocLength(), lexiconReader.getTermStats(), docLengths,
            documents, termIdMapping);
    }

    public boolean isEmpty() {
        return termIdMapping == null;
    }

    public boolean containsTermId(int termId) {
        return termStatsById.containsKey(termId);
    }

    /**
     * 词项是否出现在词典中。
     */
    public boolean containsTerm(String term) {
        if (termIdMapping == null) {
            return false;
        }
        OptionalInt termId = termIdMapping.lookup(term);
        return termId.isPresent() && containsTermId(termId.getAsInt());
    }

    public Optional<TermStats> termStats(int termId) {
        return Optional.ofNullable(termStatsById.get(termId));
    }

    /**
     * 文档长度。
     *
     * @throws IllegalArgumentException DocID 超出范围时抛出
     */
    public int docLength(int docId) {
        if (docId < 0 || docId >= docLengths.length) {
            throw new IllegalArgumentException("DocID 超出范围: " + docId);
        }
        return docLengths[docId];
    }

    public Optional<DocumentInfo> document(int docId) {
        if (docId < 0 || docId >= documents.length) {
            return Optional.empty();
        }
        return Optional.of(documents[docId]);
    }

    public int numDocs() {
        return numDocs;
    }

    public double avgDocLength() {
        return avgDocLength;
    }

    public int termCount() {
        return termStatsById.size();
    }

    /**
     * 按 TermID 递增排列的全部词项统计量。
     */
    public Map<Integer, TermStats> allTermStats() {
        return termStatsById;
    }

    /**
     * 已构建索引的只读 TermID 空间。
     *
     * @throws IndexUsageException 词典为空时抛出
     */
    public TermIdMapping termIdMapping() {
        if (termIdMapping == null) {
            throw new IndexUsageException("索引尚未构建，没有可用的 TermID 空间");
        }
        return termIdMapping;
    }

    private static File requireArtifact(Path indexDir, String fileName) throws CorruptIndexException {
        File file = indexDir.resolve(fileName).toFile();
        if (!file.isFile()) {
            throw new CorruptIndexException("缺少索引文件", fileName);
        }
        return file;
    }

    private static DocumentInfo[] loadDocuments(Path dbPath) throws CorruptIndexException {
        List<DocumentInfo> rows;
        try (DocumentTable documentTable = DocumentTable.open(dbPath)) {
            rows = documentTable.loadAll();
        } catch (IllegalStateException exception) {
            throw new CorruptIndexException("文档映射表无法读取", Constants.DOC_ID_MAPPING_FILE, exception);
        }
        DocumentInfo[] documents = new DocumentInfo[rows.size()];
        for (int index = 0; index < rows.size(); index++) {
            DocumentInfo row = rows.get(index);
            if (row.docId() != index) {
                throw new CorruptIndexException("文档映射 DocID 不连续: expected=" + index + ", actual=" + row.docId(),
                    Constants.DOC_ID_MAPPING_FILE);
            }
            documents[index] = row;
        }
        return documents;
    }
}
