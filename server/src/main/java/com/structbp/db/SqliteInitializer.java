package com.structbp.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class SqliteInitializer {

    public static void initialize(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        try (Connection conn = DriverManager.getConnection(url)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA journal_mode = WAL;");

                stmt.execute("CREATE TABLE IF NOT EXISTS marginal_result (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "model_hash TEXT NOT NULL, " +
                        "target_id TEXT NOT NULL, " +
                        "iterations INTEGER NOT NULL, " +
                        "values_json TEXT NOT NULL, " +
                        "probabilities_blob BLOB NOT NULL, " +
                        "created_ts INTEGER NOT NULL, " +
                        "UNIQUE (model_hash, target_id, iterations)" +
                        ");");

                stmt.execute("CREATE INDEX IF NOT EXISTS idx_marginal_lookup " +
                        "ON marginal_result (model_hash, target_id, iterations);");
            }
        }
    }
}
