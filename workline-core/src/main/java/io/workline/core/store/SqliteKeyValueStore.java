package io.workline.core.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.sqlite.SQLiteConfig;

public final class SqliteKeyValueStore implements KeyValueStore {
    private final String jdbcUrl;
    private final Clock clock;
    private final SQLiteConfig sqliteConfig;

    public SqliteKeyValueStore(Path dbPath, Clock clock) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.sqliteConfig = new SQLiteConfig();
        this.sqliteConfig.setJournalMode(SQLiteConfig.JournalMode.WAL);
        this.sqliteConfig.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        this.sqliteConfig.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        this.sqliteConfig.setBusyTimeout(5_000);
        init();
    }

    @Override
    public synchronized void put(String key, String value, Duration ttl) throws IOException {
        String sql = """
            INSERT INTO kv_entries (key, value, expires_at_ms) VALUES (?, ?, ?)
            ON CONFLICT(key) DO UPDATE SET value = excluded.value, expires_at_ms = excluded.expires_at_ms
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, requireKey(key));
            statement.setString(2, Objects.requireNonNull(value, "value must not be null"));
            statement.setLong(3, expiry(ttl));
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to put key " + key, e);
        }
    }

    @Override
    public synchronized Optional<String> get(String key) throws IOException {
        String sql = "SELECT value FROM kv_entries WHERE key = ? AND expires_at_ms > ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, requireKey(key));
            statement.setLong(2, clock.millis());
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(resultSet.getString("value")) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read key " + key, e);
        }
    }

    @Override
    public synchronized boolean replace(String key, String value, Duration ttl) throws IOException {
        String sql = "UPDATE kv_entries SET value = ?, expires_at_ms = ? WHERE key = ? AND expires_at_ms > ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, Objects.requireNonNull(value, "value must not be null"));
            statement.setLong(2, expiry(ttl));
            statement.setString(3, requireKey(key));
            statement.setLong(4, clock.millis());
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to replace key " + key, e);
        }
    }

    @Override
    public synchronized boolean putIfAbsent(String key, String value, Duration ttl) throws IOException {
        String sql = """
            INSERT INTO kv_entries (key, value, expires_at_ms) VALUES (?, ?, ?)
            ON CONFLICT(key) DO UPDATE SET value = excluded.value, expires_at_ms = excluded.expires_at_ms
            WHERE kv_entries.expires_at_ms <= ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, requireKey(key));
            statement.setString(2, Objects.requireNonNull(value, "value must not be null"));
            statement.setLong(3, expiry(ttl));
            statement.setLong(4, clock.millis());
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to claim key " + key, e);
        }
    }

    @Override
    public synchronized boolean delete(String key) throws IOException {
        String sql = "DELETE FROM kv_entries WHERE key = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, requireKey(key));
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to delete key " + key, e);
        }
    }

    @Override
    public synchronized long increment(String key, Duration ttlOnCreate) throws IOException {
        String safeKey = requireKey(key);
        long now = clock.millis();
        long createdExpiry = expiry(ttlOnCreate);
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try {
                long next = 1;
                long expiresAt = createdExpiry;
                try (PreparedStatement select = connection.prepareStatement(
                    "SELECT value, expires_at_ms FROM kv_entries WHERE key = ?"
                )) {
                    select.setString(1, safeKey);
                    try (ResultSet resultSet = select.executeQuery()) {
                        if (resultSet.next() && resultSet.getLong("expires_at_ms") > now) {
                            next = Long.parseLong(resultSet.getString("value")) + 1;
                            expiresAt = resultSet.getLong("expires_at_ms");
                        }
                    }
                }
                try (PreparedStatement upsert = connection.prepareStatement("""
                    INSERT INTO kv_entries (key, value, expires_at_ms) VALUES (?, ?, ?)
                    ON CONFLICT(key) DO UPDATE SET value = excluded.value, expires_at_ms = excluded.expires_at_ms
                    """)) {
                    upsert.setString(1, safeKey);
                    upsert.setString(2, Long.toString(next));
                    upsert.setLong(3, expiresAt);
                    upsert.executeUpdate();
                }
                connection.commit();
                return next;
            } catch (SQLException | NumberFormatException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException | NumberFormatException e) {
            throw new IOException("Failed to increment key " + key, e);
        }
    }

    @Override
    public synchronized Optional<Instant> expiresAt(String key) throws IOException {
        String sql = "SELECT expires_at_ms FROM kv_entries WHERE key = ? AND expires_at_ms > ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, requireKey(key));
            statement.setLong(2, clock.millis());
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next()
                    ? Optional.of(Instant.ofEpochMilli(resultSet.getLong(1)))
                    : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read expiry of key " + key, e);
        }
    }

    @Override
    public synchronized List<String> keys(String prefix) throws IOException {
        String safePrefix = prefix == null ? "" : prefix;
        String sql = """
            SELECT key FROM kv_entries
            WHERE substr(key, 1, ?) = ? AND expires_at_ms > ?
            ORDER BY key ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setInt(1, safePrefix.length());
            statement.setString(2, safePrefix);
            statement.setLong(3, clock.millis());
            try (ResultSet resultSet = statement.executeQuery()) {
                List<String> keys = new ArrayList<>();
                while (resultSet.next()) {
                    keys.add(resultSet.getString(1));
                }
                return keys;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list keys with prefix " + safePrefix, e);
        }
    }

    @Override
    public synchronized int purgeExpired() throws IOException {
        String sql = "DELETE FROM kv_entries WHERE expires_at_ms <= ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, clock.millis());
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to purge expired keys", e);
        }
    }

    private Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, sqliteConfig.toProperties());
    }

    private void init() throws IOException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS kv_entries (
                key TEXT PRIMARY KEY,
                value TEXT NOT NULL,
                expires_at_ms INTEGER NOT NULL
            )
            """;
        String idx = """
            CREATE INDEX IF NOT EXISTS idx_kv_entries_expires_at
            ON kv_entries(expires_at_ms)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            statement.execute(idx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite key-value store", e);
        }
    }

    private long expiry(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        return clock.millis() + ttl.toMillis();
    }

    private String requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        return key;
    }
}
