package com.logicsignalprotector.cortexconnector.relay;

/** Raised when a wire frame is not a JSON object and cannot be treated as an envelope. */
public class EnvelopeParseException extends Exception {
  public EnvelopeParseException(String message) {
    super(message);
  }

  public EnvelopeParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
