package com.diskindex.storage;

import java.util.Arrays;

/**
 * 单个词项的倒排列表，包含文档ID与文档内词频。
 *
 * @param docIds 严格递增的文档ID数组
 * @param termFreqs 与docIds同长度的词频数组
 */
public record PostingList(int[] docIds, int[] termFreqs) {
    /**
     * 构造时校验并复制输入数据。
     */
    public PostingList {
        if (docIds == null || termFreqs == null) {
            throw new IllegalArgumentException("docIds与termFreqs不能为null");
        }
        if (docIds.length != termFreqs.length) {
            throw new IllegalArgumentException("docIds与termFreqs长度不一致: " + docIds.length + " vs " + termFreqs.length);
        }
        for (int index = 0; index < docIds.length; index++) {
            if (docIds[index] < 0) {
                throw new IllegalArgumentException("docId不能为负数，位置=" + index + ", value=" + docIds[index]);
            }
            if (termFreqs[index] <= 0) {
                throw new IllegalArgumentException("termFreq必须为正数，位置=" + index + ", value=" + termFreqs[index]);
            }
            if (index > 0 && docIds[index] <= docIds[index - 1]) {
                throw new IllegalArgumentException("docIds必须严格递增，位置=" + index + ", current=" + docIds[index]);
            }
        }
        docIds = Arrays.copyOf(docIds, docIds.length);
        termFreqs = Arrays.copyOf(termFreqs, termFreqs.length);
    }

    /**
     * 返回倒排项数量，即该词项的文档频率。
     */
    public int size() {
        return docIds.length;
    }

    public int docId(int index) {
        return docIds[index];
    }

    public int termFreq(int index) {
        return termFreqs[index];
    }

    @Override
    public int[] docIds() {
        return Arrays.copyOf(docIds, docIds.length);
    }

    @Override
    public int[] termFreqs() {
        return Arrays.copyOf(termFreqs, termFreqs.length);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PostingList that)) {
            return false;
        }
        return Arrays.equals(docIds, that.docIds) && Arrays.equals(termFreqs, that.termFreqs);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(docIds) + Arrays.hashCode(termFreqs);
    }

    @Override
    public String toString() {
        return "PostingList[docIds=" + Arrays.toString(docIds) + ", termFreqs=" + Arrays.toString(termFreqs) + "]";
    }
}
