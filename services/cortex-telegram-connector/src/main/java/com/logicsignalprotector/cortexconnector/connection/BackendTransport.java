package com.logicsignalprotector.cortexconnector.connection;

import java.io.IOException;
import java.net.URI;

public interface BackendTransport {

  BackendConnection connect(URI uri) throws IOException, InterruptedException;
}
