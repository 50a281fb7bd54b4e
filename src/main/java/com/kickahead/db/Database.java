package com.kickahead.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

// Small connection pool over an H2 database
public class Database {
    private static final Logger logger = Logger.getLogger(Database.class.getName());

    public static final String DEFAULT_URL = "jdbc:h2:./kickahead";
    private static final String DB_USER = "sa";
    private static final String DB_PASSWORD = "";
    private static final String SCHEMA_RESOURCE = "schema.sql";
    private static final int DEFAULT_POOL_SIZE = 4;
    private static final int CONNECTION_TIMEOUT_SECONDS = 30;

    private final String url;
    private final int poolSize;
    private final BlockingQueue<Connection> connectionPool;
    private volatile boolean initialized = false;
    private volatile boolean closed = false;

    /**
     * Work performed with a borrowed connection.
     *
     * @param <T> the result type
     */
    @FunctionalInterface
    public interface ConnectionCallback<T> {
        T apply(Connection connection) throws SQLException;
    }

    public Database() {
        this(DEFAULT_URL);
    }

    public Database(String url) {
        this(url, DEFAULT_POOL_SIZE);
    }

    public Database(String url, int poolSize) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be >= 1");
        }
        this.url = url;
        this.poolSize = poolSize;
        this.connectionPool = new ArrayBlockingQueue<>(poolSize);
    }

    public synchronized void initialize() throws SQLException {
        if (initialized) {
            logger.fine("Database already initialized");
            return;
        }

        logger.info("Initializing database connection pool for " + url);
        for (int i = 0; i < poolSize; i++) {
            connectionPool.offer(createConnection());
        }

        initializeSchema();

        initialized = true;
        logger.info("Database initialization complete (" + poolSize + " connections)");
    }

    private Connection createConnection() throws SQLException {
        return DriverManager.getConnection(url, DB_USER, DB_PASSWORD);
    }

    /**
     * Borrow a pooled connection, run {@code callback} with it and hand it back.
     *
     * @param callback the work to perform
     * @param <T> the result type
     * @return whatever the callback returns
     * @throws SQLException if no connection is available or the callback fails
     */
    public <T> T withConnection(ConnectionCallback<T> callback) throws SQLException {
        Connection conn = borrowConnection();
        try {
            return callback.apply(conn);
        } finally {
            returnConnection(conn);
        }
    }

    private Connection borrowConnection() throws SQLException {
        if (!initialized) {
            throw new SQLException("Database not initialized. Call initialize() first.");
        }
        if (closed) {
            throw new SQLException("Database has been closed");
        }

        try {
            Connection conn = connectionPool.poll(CONNECTION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (conn == null) {
                throw new SQLException("Timeout waiting for available connection");
            }
            if (conn.isClosed() || !conn.isValid(2)) {
                logger.warning("Connection invalid, creating new one");
                closeQuietly(conn);
                conn = createConnection();
            }
            return conn;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SQLException("Interrupted while waiting for connection", e);
        }
    }

    private synchronized void returnConnection(Connection connection) {
        if (closed) {
            closeQuietly(connection);
            return;
        }
        if (!connectionPool.offer(connection)) {
            logger.warning("Connection pool full, closing connection");
            closeQuietly(connection);
        }
    }

    private void closeQuietly(Connection conn) {
        try {
            conn.close();
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Failed to close connection", e);
        }
    }

    // Runs schema.sql from the classpath, one statement per ';'
    private void initializeSchema() throws SQLException {
        String schema;
        try (InputStream in = Database.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new SQLException("Schema resource not found on classpath: " + SCHEMA_RESOURCE);
            }
            schema = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Failed to read " + SCHEMA_RESOURCE, e);
        }

        Connection conn = connectionPool.peek();
        int executedCount = 0;
        try (Statement stmt = conn.createStatement()) {
            StringBuilder currentStatement = new StringBuilder();
            for (String line : schema.split("\n")) {
                line = line.trim();
                if (line.startsWith("--") || line.isEmpty()) {
                    continue;
                }
                currentStatement.append(line).append(' ');
                if (line.endsWith(";")) {
                    String sql = currentStatement.toString().trim();
                    sql = sql.substring(0, sql.length() - 1).trim();
                    if (!sql.isEmpty()) {
                        stmt.execute(sql);
                        executedCount++;
                    }
                    currentStatement = new StringBuilder();
                }
            }
        }
        logger.fine("Executed " + executedCount + " schema statements");
    }

    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;

        int closedCount = 0;
        Connection conn;
        while ((conn = connectionPool.poll()) != null) {
            closeQuietly(conn);
            closedCount++;
        }
        logger.info("Closed " + closedCount + " database connections");
    }
}
