package com.logicsignalprotector.cortexconnector.connection;

/** Cortex-M could not be reached, refused the session, or dropped the connection. */
public class BackendUnavailableException extends RuntimeException {
  public BackendUnavailableException(String message) {
    super(message);
  }

  public BackendUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
