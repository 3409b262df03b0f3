package com.rfqlog.adapter.out.persistence;

import io.vertx.core.Future;
import io.vertx.sqlclient.SqlClient;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Creates the revision log table and index from schema.sql
 */
@Slf4j
public class SchemaInitializer {

    public static final String DEFAULT_SCRIPT = "schema.sql";

    private final SqlClient sqlClient;
    private final String script;

    public SchemaInitializer(SqlClient sqlClient, String script) {
        this.sqlClient = sqlClient;
        this.script = script;
    }

    public SchemaInitializer(SqlClient sqlClient) {
        this(sqlClient, DEFAULT_SCRIPT);
    }

    public Future<Void> initialize() {
        List<String> statements;
        try {
            statements = loadStatements();
        } catch (IOException e) {
            log.error("Failed to read {}", script, e);
            return Future.failedFuture(e);
        }

        Future<Void> chain = Future.succeededFuture();
        for (String statement : statements) {
            chain = chain.compose(v -> sqlClient.query(statement).execute().mapEmpty());
        }

        return chain
                .onSuccess(v -> log.info("Revision schema ready ({} statement(s) from {})", statements.size(), script))
                .onFailure(error -> log.error("Failed to initialize revision schema: {}", error.getMessage()));
    }

    private List<String> loadStatements() throws IOException {
        try (InputStream is = SchemaInitializer.class.getClassLoader().getResourceAsStream(script)) {
            if (is == null) {
                throw new IOException(script + " not found in classpath");
            }
            String sql = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            return Arrays.stream(sql.split(";"))
                    .map(String::strip)
                    .filter(statement -> !statement.isEmpty())
                    .collect(Collectors.toList());
        }
    }
}
