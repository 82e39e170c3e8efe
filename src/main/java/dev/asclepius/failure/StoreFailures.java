package dev.asclepius.failure;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.support.SQLStateSQLExceptionTranslator;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Classifies persistence failures for the {@code @Retryable} store operations.
 *
 * <p>{@link #RETRYABLE} lists the connectivity failures worth retrying. {@link #afterRetries}
 * is called from {@code @Recover} methods: connectivity failures become {@link
 * StoreUnavailableException}, anything else is returned unchanged for the caller to rethrow.
 *
 * <p>LangChain4j embedding stores wrap JDBC errors in a plain {@link RuntimeException}. Calls to
 * them go through {@link #translated} so that {@code retryFor} sees a {@link
 * DataAccessException}.
 */
public final class StoreFailures {

  private static final Logger log = LoggerFactory.getLogger(StoreFailures.class);

  private static final SQLStateSQLExceptionTranslator TRANSLATOR =
      new SQLStateSQLExceptionTranslator();

  /** SQLSTATE class for connection exceptions. */
  private static final String CONNECTION_EXCEPTION_CLASS = "08";

  /** Keep in sync with the {@code retryFor} of every store {@code @Retryable}. */
  public static final Class<?>[] RETRYABLE = {
    DataAccessResourceFailureException.class,
    TransientDataAccessException.class,
    CannotCreateTransactionException.class
  };

  private StoreFailures() {}

  /** Whether {@code e} or any of its causes says the store could not be reached. */
  public static boolean isConnectivityFailure(Throwable e) {
    for (Throwable current = e; current != null; current = next(current)) {
      for (Class<?> type : RETRYABLE) {
        if (type.isInstance(current)) {
          return true;
        }
      }
      if (current instanceof SQLTransientException
          || current instanceof SQLRecoverableException) {
        return true;
      }
      if (current instanceof SQLException sql
          && sql.getSQLState() != null
          && sql.getSQLState().startsWith(CONNECTION_EXCEPTION_CLASS)) {
        return true;
      }
    }
    return false;
  }

  public static RuntimeException afterRetries(Capability capability, RuntimeException e) {
    if (!isConnectivityFailure(e)) {
      return e;
    }
    log.warn("{} unreachable after retries: {}", capability.value(), e.getMessage());
    return new StoreUnavailableException(
        capability, capability.value() + " is unreachable: " + e.getMessage(), e);
  }

  /**
   * Runs an embedding store call, rethrowing wrapped JDBC errors as {@link DataAccessException}.
   * Connectivity failures become {@link DataAccessResourceFailureException}; other SQL errors
   * go through {@link SQLStateSQLExceptionTranslator}. Exceptions without a SQL cause pass
   * through unchanged.
   */
  public static <T> T translated(String task, Supplier<T> call) {
    try {
      return call.get();
    } catch (DataAccessException e) {
      throw e;
    } catch (RuntimeException e) {
      throw translate(task, e);
    }
  }

  /** {@link #translated(String, Supplier)} for calls without a result. */
  public static void translatedRun(String task, Runnable call) {
    translated(
        task,
        () -> {
          call.run();
          return null;
        });
  }

  static RuntimeException translate(String task, RuntimeException e) {
    SQLException sql = sqlCause(e);
    if (sql == null) {
      return e;
    }
    if (isConnectivityFailure(e)) {
      return new DataAccessResourceFailureException(task + ": " + sql.getMessage(), e);
    }
    DataAccessException translated = TRANSLATOR.translate(task, null, sql);
    return translated != null ? translated : e;
  }

  private static @Nullable SQLException sqlCause(Throwable e) {
    for (Throwable current = e; current != null; current = next(current)) {
      if (current instanceof SQLException sql) {
        return sql;
      }
    }
    return null;
  }

  private static @Nullable Throwable next(Throwable current) {
    Throwable cause = current.getCause();
    return cause != current ? cause : null;
  }
}
