package com.structbp.db;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.Optional;

public class MarginalResultDaoTest {

    @TempDir
    Path tempDir;

    private MarginalResultDao resultDao;

    @BeforeEach
    public void setup() throws SQLException {
        String dbPath = tempDir.resolve("test_cache.db").toString();
        SqliteInitializer.initialize(dbPath);
        resultDao = new MarginalResultDao(dbPath);
    }

    @Test
    public void testMarginalResultCrud() throws SQLException {
        double[] probabilities = { 0.59, 0.41 };
        resultDao.upsert("hash1", "sprinkler", 10, "[false,true]", probabilities);

        Optional<CachedMarginal> loaded = resultDao.load("hash1", "sprinkler", 10);
        Assertions.assertTrue(loaded.isPresent());
        Assertions.assertEquals("[false,true]", loaded.get().getValuesJson());
        Assertions.assertArrayEquals(probabilities, loaded.get().getProbabilities(), 0.0001);

        // Other iteration counts are separate entries
        Assertions.assertFalse(resultDao.load("hash1", "sprinkler", 20).isPresent());

        // Update
        double[] probabilities2 = { 0.5, 0.5 };
        resultDao.upsert("hash1", "sprinkler", 10, "[false,true]", probabilities2);
        loaded = resultDao.load("hash1", "sprinkler", 10);
        Assertions.assertArrayEquals(probabilities2, loaded.get().getProbabilities(), 0.0001);

        // Delete
        resultDao.upsert("hash2", "sprinkler", 10, "[true]", new double[] { 1.0 });
        Assertions.assertEquals(1, resultDao.deleteByModel("hash1"));
        Assertions.assertFalse(resultDao.load("hash1", "sprinkler", 10).isPresent());
        Assertions.assertTrue(resultDao.load("hash2", "sprinkler", 10).isPresent());
    }

    @Test
    public void testInitializeIsIdempotent() throws SQLException {
        String dbPath = tempDir.resolve("test_cache.db").toString();
        SqliteInitializer.initialize(dbPath);
        Assertions.assertFalse(resultDao.load("none", "x", 1).isPresent());
    }
}
