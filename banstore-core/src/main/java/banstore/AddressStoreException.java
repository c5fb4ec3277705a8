package banstore;

/**
 * Unchecked exception wrapping storage failures (JDBC errors, connection acquisition,
 * commit/rollback) raised by the store and its JDBC implementations.
 */
public final class AddressStoreException extends RuntimeException {
  public AddressStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
