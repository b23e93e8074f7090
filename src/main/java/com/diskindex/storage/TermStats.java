package com.diskindex.storage;

/**
 * 词典词条：词项的文档频率与其倒排列表在倒排文件中的定位信息。
 *
 * @param termId 词项ID
 * @param docFrequency 包含该词项的不同文档数
 * @param postingsOffset 倒排列表起始偏移
 * @param postingsLength 倒排列表字节长度
 */
public record TermStats(int termId, int docFrequency, long postingsOffset, int postingsLength) {
}
