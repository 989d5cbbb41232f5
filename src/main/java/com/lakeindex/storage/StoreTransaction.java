package com.lakeindex.storage;

import com.lakeindex.document.DocumentCatalog;
import com.lakeindex.document.DocumentContents;

import java.sql.Connection;

/**
 * 事务作用域：同一事务内的词典、文档目录、倒排与原文表访问共享一个连接。
 */
public final class StoreTransaction {
    private final Connection connection;
    private final TermDictionary terms;
    private final DocumentCatalog documents;
    private final PostingsTable postings;
    private final DocumentContents contents;

    StoreTransaction(Connection connection) {
        this.connection = connection;
        this.terms = new TermDictionary(connection);
        this.documents = new DocumentCatalog(connection);
        this.postings = new PostingsTable(connection);
        this.contents = new DocumentContents(connection);
    }

    public TermDictionary terms() {
        return terms;
    }

    public DocumentCatalog documents() {
        return documents;
    }

    public PostingsTable postings() {
        return postings;
    }

    public DocumentContents contents() {
        return contents;
    }

    /**
     * 暴露底层连接，供需要下推聚合 SQL 的组件使用。
     */
    public Connection connection() {
        return connection;
    }
}
