package com.structbp.db;

import com.structbp.util.MarginalCodec;

import java.sql.*;
import java.util.Optional;

public class MarginalResultDao {

    private final String dbPath;

    public MarginalResultDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public Optional<CachedMarginal> load(String modelHash, String targetId, int iterations) throws SQLException {
        String sql = "SELECT values_json, probabilities_blob FROM marginal_result " +
                "WHERE model_hash = ? AND target_id = ? AND iterations = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, modelHash);
            ps.setString(2, targetId);
            ps.setInt(3, iterations);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    String valuesJson = rs.getString("values_json");
                    double[] probabilities = MarginalCodec.fromBytes(rs.getBytes("probabilities_blob"));
                    return Optional.of(new CachedMarginal(valuesJson, probabilities));
                }
            }
        }
        return Optional.empty();
    }

    public void upsert(String modelHash, String targetId, int iterations, String valuesJson, double[] probabilities)
            throws SQLException {
        byte[] blob = MarginalCodec.toBytes(probabilities);
        long now = System.currentTimeMillis();
        String sql = "INSERT INTO marginal_result " +
                "(model_hash, target_id, iterations, values_json, probabilities_blob, created_ts) " +
                "VALUES (?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT(model_hash, target_id, iterations) DO UPDATE SET " +
                "values_json = excluded.values_json, probabilities_blob = excluded.probabilities_blob, " +
                "created_ts = excluded.created_ts";

        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, modelHash);
            ps.setString(2, targetId);
            ps.setInt(3, iterations);
            ps.setString(4, valuesJson);
            ps.setBytes(5, blob);
            ps.setLong(6, now);
            ps.executeUpdate();
        }
    }

    public int deleteByModel(String modelHash) throws SQLException {
        String sql = "DELETE FROM marginal_result WHERE model_hash = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, modelHash);
            return ps.executeUpdate();
        }
    }
}
