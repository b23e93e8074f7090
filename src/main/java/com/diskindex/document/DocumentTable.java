package com.diskindex.document;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DocID 与文档元数据的映射表，持久化为 SQLite 文件。
 *
 * 构建阶段一次性写入；打开索引时整体读入内存后即可关闭连接。
 */
public final class DocumentTable implements AutoCloseable {
    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE documents (
                doc_id      INTEGER PRIMARY KEY,
                name        TEXT NOT NULL,
                category    TEXT NOT NULL,
                token_count INTEGER NOT NULL DEFAULT 0
            )
            """;

    private static final String CREATE_IDX_NAME_SQL = "CREATE INDEX idx_name ON documents(name)";
    private static final String CREATE_IDX_CATEGORY_SQL = "CREATE INDEX idx_category ON documents(category)";
    private static final String SELECT_COLUMNS = "SELECT doc_id, name, category, token_count FROM documents";

    private final Connection connection;
    private final Path dbPath;

    private DocumentTable(Path dbPath, Connection connection) {
        this.dbPath = dbPath;
        this.connection = connection;
    }

    /**
     * 新建文档映射表文件并初始化表结构。
     *
     * @param dbPath 数据库文件路径，必须不存在
     */
    public static DocumentTable create(Path dbPath) {
        if (Files.exists(dbPath)) {
            throw new IllegalStateException("文档映射表已存在: " + dbPath);
        }
        Connection connection = connect(dbPath);
        DocumentTable table = new DocumentTable(dbPath, connection);
        try {
            table.initializeSchema();
        } catch (SQLException sqlException) {
            table.close();
            throw new IllegalStateException("初始化文档表失败: " + dbPath, sqlException);
        }
        return table;
    }

    /**
     * 打开已存在的文档映射表并校验表结构。
     *
     * @param dbPath 数据库文件路径
     */
    public static DocumentTable open(Path dbPath) {
        if (!Files.isRegularFile(dbPath)) {
            throw new IllegalStateException("文档映射表不存在: " + dbPath);
        }
        DocumentTable table = new DocumentTable(dbPath, connect(dbPath));
        String sql = "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = 'documents'";
        try (Statement statement = table.connection.createStatement();
             ResultSet resultSet = statement.executeQuery(sql)) {
            if (!resultSet.next() || resultSet.getInt(1) != 1) {
                throw new IllegalStateException("文档映射表缺少 documents 表: " + dbPath);
            }
        } catch (SQLException sqlException) {
            table.close();
            throw new IllegalStateException("打开文档映射表失败: " + dbPath, sqlException);
        } catch (IllegalStateException exception) {
            table.close();
            throw exception;
        }
        return table;
    }

    /**
     * 在单个事务中批量插入已分配 DocID 的文档。
     */
    public void insertAll(List<Document> documents) {
        String sql = "INSERT INTO documents(doc_id, name, category, token_count) VALUES (?, ?, ?, ?)";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            connection.setAutoCommit(false);
            for (Document document : documents) {
                if (document.docId() < 0) {
                    throw new IllegalArgumentException("文档尚未分配 DocID: " + document.name());
                }
                preparedStatement.setInt(1, document.docId());
                preparedStatement.setString(2, document.name());
                preparedStatement.setString(3, document.category());
                preparedStatement.setInt(4, document.length());
                preparedStatement.addBatch();
            }
            preparedStatement.executeBatch();
            connection.commit();
        } catch (SQLException sqlException) {
            rollback(sqlException);
            throw new IllegalStateException("批量插入文档失败, count=" + documents.size(), sqlException);
        } catch (RuntimeException exception) {
            rollback(exception);
            throw exception;
        } finally {
            restoreAutoCommit();
        }
    }

    /**
     * 按 ID 查找文档。
     */
    public Optional<DocumentInfo> findById(int docId) {
        String sql = SELECT_COLUMNS + " WHERE doc_id = ?";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setInt(1, docId);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(readDocument(resultSet));
            }
        } catch (SQLException sqlException) {
            throw new IllegalStateException("按 ID 查询失败, docId=" + docId, sqlException);
        }
    }

    /**
     * 按类别过滤文档 ID。
     */
    public List<Integer> findDocIdsByCategory(String category) {
        String sql = "SELECT doc_id FROM documents WHERE category = ? ORDER BY doc_id";
        List<Integer> docIds = new ArrayList<>();
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setString(1, category);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                while (resultSet.next()) {
                    docIds.add(resultSet.getInt(1));
                }
            }
            return docIds;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("按类别查询失败, category=" + category, sqlException);
        }
    }

    /**
     * 按 DocID 顺序读出全部文档。
     */
    public List<DocumentInfo> loadAll() {
        String sql = SELECT_COLUMNS + " ORDER BY doc_id";
        List<DocumentInfo> documents = new ArrayList<>();
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            while (resultSet.next()) {
                documents.add(readDocument(resultSet));
            }
            return documents;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("读取文档映射失败: " + dbPath, sqlException);
        }
    }

    /**
     * 获取文档总数。
     */
    public int getTotalDocCount() {
        String sql = "SELECT COUNT(*) FROM documents";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            return resultSet.next() ? resultSet.getInt(1) : 0;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("查询文档总数失败", sqlException);
        }
    }

    /**
     * 关闭数据库连接。
     */
    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("关闭数据库连接失败: " + dbPath, sqlException);
        }
    }

    private static Connection connect(Path dbPath) {
        try {
            return DriverManager.getConnection("jdbc:sqlite:" + dbPath.toAbsolutePath());
        } catch (SQLException sqlException) {
            throw new IllegalStateException("连接文档映射表失败: " + dbPath, sqlException);
        }
    }

    private void initializeSchema() throws SQLException {
        connection.setAutoCommit(false);
        try (Statement statement = connection.createStatement()) {
            statement.execute(CREATE_TABLE_SQL);
            statement.execute(CREATE_IDX_NAME_SQL);
            statement.execute(CREATE_IDX_CATEGORY_SQL);
            connection.commit();
        } catch (SQLException sqlException) {
            connection.rollback();
            throw sqlException;
        } finally {
            connection.setAutoCommit(true);
        }
    }

    private DocumentInfo readDocument(ResultSet resultSet) throws SQLException {
        return new DocumentInfo(
                resultSet.getInt("doc_id"),
                resultSet.getString("name"),
                resultSet.getString("category"),
                resultSet.getInt("token_count")
        );
    }

    private void rollback(Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackException) {
            cause.addSuppressed(rollbackException);
        }
    }

    private void restoreAutoCommit() {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException sqlException) {
            throw new IllegalStateException("恢复自动提交失败: " + dbPath, sqlException);
        }
    }
}
