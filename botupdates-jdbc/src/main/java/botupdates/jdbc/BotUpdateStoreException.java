package botupdates.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the stores in this module.
 */
public final class BotUpdateStoreException extends RuntimeException {
  public BotUpdateStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
