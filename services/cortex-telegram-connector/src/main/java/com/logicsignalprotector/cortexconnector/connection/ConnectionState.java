package com.logicsignalprotector.cortexconnector.connection;

public enum ConnectionState {
  IDLE,
  HANDSHAKING,
  CONNECTED,
  RESYNC,
  STREAMING,
  STOPPED
}
