package com.codeheadsystems.warden.jdbc;

import com.codeheadsystems.warden.server.exception.StoreFailureException;
import com.codeheadsystems.warden.server.store.StoreTransactor;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.function.Supplier;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link StoreTransactor} over a {@link DataSource}. The connection of the current unit of work
 * is bound to the calling thread; JDBC stores built on the same transactor join it, and run on
 * their own auto-commit connection outside one.
 */
public class JdbcTransactor implements StoreTransactor {

  private static final Logger log = LoggerFactory.getLogger(JdbcTransactor.class);

  public static final int DEFAULT_QUERY_TIMEOUT_SECONDS = 5;

  private final DataSource dataSource;
  private final int queryTimeoutSeconds;
  private final ThreadLocal<Connection> current = new ThreadLocal<>();

  public JdbcTransactor(DataSource dataSource) {
    this(dataSource, DEFAULT_QUERY_TIMEOUT_SECONDS);
  }

  public JdbcTransactor(DataSource dataSource, int queryTimeoutSeconds) {
    if (queryTimeoutSeconds < 1) {
      throw new IllegalArgumentException("queryTimeoutSeconds must be positive: " + queryTimeoutSeconds);
    }
    this.dataSource = dataSource;
    this.queryTimeoutSeconds = queryTimeoutSeconds;
  }

  /**
   * SQL work against a connection.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface SqlWork<T> {
    T apply(Connection connection) throws SQLException;
  }

  @Override
  public <T> T inTransaction(Supplier<T> work) {
    if (current.get() != null) {
      return work.get();
    }
    Connection connection = open();
    current.set(connection);
    boolean committed = false;
    try {
      connection.setAutoCommit(false);
      T result = work.get();
      connection.commit();
      committed = true;
      return result;
    } catch (SQLException e) {
      throw failure("commit", e);
    } finally {
      current.remove();
      // Any throwable, Errors included, rolls back before auto-commit is restored.
      if (!committed) {
        rollback(connection);
      }
      close(connection);
    }
  }

  /**
   * Runs SQL work on the thread's unit of work, or on a fresh auto-commit connection outside one.
   *
   * @param operation name used in error messages
   * @param work      the SQL work
   * @param <T>       result type
   * @return the work's result
   * @throws StoreFailureException on any SQL failure
   */
  public <T> T execute(String operation, SqlWork<T> work) {
    Connection bound = current.get();
    try {
      if (bound != null) {
        return work.apply(bound);
      }
      try (Connection connection = dataSource.getConnection()) {
        return work.apply(connection);
      }
    } catch (SQLException e) {
      throw failure(operation, e);
    }
  }

  /**
   * Prepares a statement with the configured query timeout.
   *
   * @param connection the connection
   * @param sql        the SQL
   * @return the statement
   * @throws SQLException if preparation fails
   */
  public PreparedStatement prepare(Connection connection, String sql) throws SQLException {
    PreparedStatement statement = connection.prepareStatement(sql);
    statement.setQueryTimeout(queryTimeoutSeconds);
    return statement;
  }

  private Connection open() {
    try {
      return dataSource.getConnection();
    } catch (SQLException e) {
      throw failure("connect", e);
    }
  }

  private static void rollback(Connection connection) {
    try {
      connection.rollback();
    } catch (SQLException e) {
      log.warn("Rollback failed: {}", e.getMessage());
    }
  }

  private static void close(Connection connection) {
    try {
      connection.setAutoCommit(true);
      connection.close();
    } catch (SQLException e) {
      log.warn("Closing connection failed: {}", e.getMessage());
    }
  }

  private static StoreFailureException failure(String operation, SQLException e) {
    if (e instanceof SQLTimeoutException) {
      log.error("Store {} timed out: {}", operation, e.getMessage());
      return new StoreFailureException("Store " + operation + " timed out", e);
    }
    log.error("Store {} failed: {}", operation, e.getMessage());
    return new StoreFailureException("Store " + operation + " failed", e);
  }
}
