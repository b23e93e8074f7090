package com.diskindex.index;

import com.diskindex.storage.TermIdMappingFile;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 词项到 TermID 的分配服务。
 *
 * 构建期所有工作线程共享同一个计数器，首次遇到的词项获得下一个空闲 ID，保证 ID 全局稠密且唯一。
 * 只读实例由已完成的索引载入，查询期遇到未知词项不会分配新 ID。
 */
public final class TermIdMapping {
    private final ConcurrentHashMap<String, Integer> idsByTerm;
    private final AtomicInteger nextId;
    private final boolean readOnly;
    private final String[] termsById;

    private TermIdMapping(ConcurrentHashMap<String, Integer> idsByTerm, int nextId, boolean readOnly, String[] termsById) {
        this.idsByTerm = idsByTerm;
        this.nextId = new AtomicInteger(nextId);
        this.readOnly = readOnly;
        this.termsById = termsById;
    }

    /**
     * 创建空的可分配映射。
     */
    public static TermIdMapping create() {
        return new TermIdMapping(new ConcurrentHashMap<>(), 0, false, null);
    }

    /**
     * 由下标为 TermID 的词项列表创建只读映射。
     */
    public static TermIdMapping readOnly(List<String> termsById) {
        ConcurrentHashMap<String, Integer> idsByTerm = new ConcurrentHashMap<>(Math.max(16, termsById.size() * 2));
        for (int termId = 0; termId < termsById.size(); termId++) {
            if (idsByTerm.putIfAbsent(termsById.get(termId), termId) != null) {
                throw new IllegalArgumentException("词项重复: " + termsById.get(termId));
            }
        }
        return new TermIdMapping(idsByTerm, termsById.size(), true, termsById.toArray(new String[0]));
    }

    /**
     * 从映射文件载入只读映射。
     *
     * @param file 映射文件
     * @return 只读映射
     * @throws IOException 读取失败或文件损坏时抛出
     */
    public static TermIdMapping load(File file) throws IOException {
        return readOnly(TermIdMappingFile.read(file));
    }

    /**
     * 返回词项的 TermID，不存在时分配新 ID。
     *
     * @param term 词项
     * @return TermID
     * @throws IllegalStateException 只读映射中遇到未知词项时抛出
     */
    public int getOrAssign(String term) {
        if (term == null || term.isEmpty()) {
            throw new IllegalArgumentException("词项不能为空");
        }
        Integer existing = idsByTerm.get(term);
        if (existing != null) {
            return existing;
        }
        if (readOnly) {
            throw new IllegalStateException("只读TermID映射不能分配新词项: " + term);
        }
        return idsByTerm.computeIfAbsent(term, ignored -> nextId.getAndIncrement());
    }

    /**
     * 查找词项的 TermID，不分配。
     */
    public OptionalInt lookup(String term) {
        Integer termId = term == null ? null : idsByTerm.get(term);
        return termId == null ? OptionalInt.empty() : OptionalInt.of(termId);
    }

    /**
     * 按 TermID 反查词项。
     *
     * @param termId TermID
     * @return 词项
     * @throws IndexOutOfBoundsException TermID 未分配时抛出
     */
    public String term(int termId) {
        String[] snapshot = termsSnapshot();
        if (termId < 0 || termId >= snapshot.length) {
            throw new IndexOutOfBoundsException("TermID 未分配: " + termId);
        }
        return snapshot[termId];
    }

    /**
     * 已分配的 TermID 数量。
     */
    public int size() {
        return idsByTerm.size();
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    /**
     * 返回下标为 TermID 的词项列表快照。
     */
    public List<String> termsById() {
        return List.of(termsSnapshot());
    }

    /**
     * 将当前映射保存到文件。
     *
     * @param file 目标文件
     * @throws IOException 写入失败时抛出
     */
    public void save(File file) throws IOException {
        TermIdMappingFile.write(file, termsById());
    }

    private String[] termsSnapshot() {
        if (termsById != null) {
            return termsById;
        }
        String[] rebuilt = new String[idsByTerm.size()];
        List<String> gaps = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : idsByTerm.entrySet()) {
            int termId = entry.getValue();
            if (termId >= rebuilt.length) {
                gaps.add(entry.getKey());
                continue;
            }
            rebuilt[termId] = entry.getKey();
        }
        if (!gaps.isEmpty()) {
            throw new IllegalStateException("TermID 分配进行中，无法生成快照: " + gaps);
        }
        return rebuilt;
    }
}
