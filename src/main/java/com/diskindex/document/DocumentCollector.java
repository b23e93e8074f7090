package com.diskindex.document;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 将目录树转换为待索引文档列表。
 *
 * 类别取源目录下的第一级子目录名，直接位于源目录中的文件归入 {@link Document#DEFAULT_CATEGORY}。
 * 隐藏文件与隐藏目录被跳过，结果按路径排序以保证 DocID 分配可复现。
 */
public final class DocumentCollector {
    private static final Logger logger = LoggerFactory.getLogger(DocumentCollector.class);

    private DocumentCollector() {
    }

    /**
     * 收集多个源路径下的文档；源路径本身是文件时直接作为默认类别文档。
     *
     * @param sourcePaths 源目录或文件
     * @return 文档列表
     * @throws IOException 遍历失败或路径不存在时抛出
     */
    public static List<Document> collect(List<Path> sourcePaths) throws IOException {
        if (sourcePaths == null || sourcePaths.isEmpty()) {
            throw new IllegalArgumentException("源路径不能为空");
        }
        List<Document> documents = new ArrayList<>();
        for (Path sourcePath : sourcePaths) {
            documents.addAll(collect(sourcePath));
        }
        return documents;
    }

    /**
     * 收集单个源路径下的文档。
     */
    public static List<Document> collect(Path sourcePath) throws IOException {
        if (!Files.exists(sourcePath)) {
            throw new IOException("源路径不存在: " + sourcePath);
        }
        if (Files.isRegularFile(sourcePath)) {
            return List.of(Document.ofFile(sourcePath, Document.DEFAULT_CATEGORY));
        }

        Path root = sourcePath.toAbsolutePath().normalize();
        List<Path> files;
        try (Stream<Path> paths = Files.walk(root)) {
            files = paths
                .filter(Files::isRegularFile)
                .filter(path -> !isHidden(root.relativize(path)))
                .sorted()
                .collect(Collectors.toList());
        }

        List<Document> documents = new ArrayList<>(files.size());
        for (Path file : files) {
            documents.add(Document.ofFile(file, categoryOf(root, file)));
        }
        logger.info("收集文档完成: root={}, count={}", root, documents.size());
        return documents;
    }

    static String categoryOf(Path root, Path file) {
        Path relative = root.relativize(file);
        if (relative.getNameCount() <= 1) {
            return Document.DEFAULT_CATEGORY;
        }
        return relative.getName(0).toString();
    }

    private static boolean isHidden(Path relative) {
        for (Path part : relative) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
