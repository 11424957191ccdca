package com.logicsignalprotector.cortexconnector.connection;

import java.io.IOException;

/**
 * One open streaming connection to Cortex-M.
 *
 * <p>{@link #send} is called only by the writer thread and {@link #receive} only by the reader
 * thread; {@link #close} may be called from anywhere, any number of times.
 */
public interface BackendConnection extends AutoCloseable {

  void send(String frame) throws IOException;

  /**
   * Blocks until the next text frame arrives.
   *
   * @return the frame, or null once the connection has been closed by either side
   * @throws IOException if the transport reported an error
   */
  String receive() throws IOException, InterruptedException;

  boolean isOpen();

  @Override
  void close();
}
