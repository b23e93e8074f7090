package com.diskindex.index;

import com.diskindex.storage.LexiconWriter;
import com.diskindex.storage.TermStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 收集归并产出的词项统计量，并在全部产物落盘后写出词典文件。
 *
 * 词典先写入临时文件再原子改名，词典文件出现即代表索引构建完成。
 */
public final class LexiconBuilder {
    private static final Logger logger = LoggerFactory.getLogger(LexiconBuilder.class);
    static final String TEMP_SUFFIX = ".tmp";

    private final List<TermStats> termStats = new ArrayList<>();
    private int lastTermId = -1;

    /**
     * 登记一个词项，要求 TermID 严格递增。
     */
    public void addTermStats(TermStats stats) {
        if (stats == null) {
            throw new IllegalArgumentException("词条不能为空");
        }
        if (stats.termId() <= lastTermId) {
            throw new IllegalArgumentException("termId 必须严格递增，last=" + lastTermId + ", current=" + stats.termId());
        }
        termStats.add(stats);
        lastTermId = stats.termId();
    }

    public List<TermStats> getTermStats() {
        return Collections.unmodifiableList(termStats);
    }

    public int termCount() {
        return termStats.size();
    }

    /**
     * 平均文档长度，空语料为 0。
     */
    public static double averageLength(int[] docLengths) {
        if (docLengths.length == 0) {
            return 0.0;
        }
        long total = 0;
        for (int length : docLengths) {
            total += length;
        }
        return (double) total / docLengths.length;
    }

    /**
     * 写出词典文件。
     *
     * @param lexiconFile 目标词典文件
     * @param docLengths 按 DocID 排列的文档长度
     * @throws IOException 写入或改名失败时抛出
     */
    public void save(File lexiconFile, int[] docLengths) throws IOException {
        int numDocs = docLengths.length;
        double avgDocLength = averageLength(docLengths);
        for (TermStats stats : termStats) {
            if (stats.docFrequency() > numDocs) {
                throw new IllegalStateException("文档频率超过文档总数: " + stats + ", numDocs=" + numDocs);
            }
        }

        Path target = lexiconFile.toPath();
        Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        try (LexiconWriter lexiconWriter = new LexiconWriter(temp.toFile(), numDocs, avgDocLength)) {
            for (TermStats stats : termStats) {
                lexiconWriter.writeTermStats(stats);
            }
        }
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException exception) {
            logger.warn("文件系统不支持原子改名，退化为普通改名: {}", target);
            Files.move(temp, target);
        }
        logger.info("词典写出完成: terms={}, numDocs={}, avgDocLength={}", termStats.size(), numDocs, avgDocLength);
    }
}
