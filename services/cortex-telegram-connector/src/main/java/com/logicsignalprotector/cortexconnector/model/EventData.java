package com.logicsignalprotector.cortexconnector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EventData(String connectorId, String conversationId, String roomId, String text) {

  public static final EventData EMPTY = new EventData(null, null, null, null);

  public String textOrEmpty() {
    return text == null ? "" : text;
  }
}
