package com.logicsignalprotector.cortexconnector.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.logicsignalprotector.cortexconnector.telegram.InboundChatMessage;
import com.logicsignalprotector.cortexconnector.telegram.TelegramMessageHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class DevTelegramControllerTest {

  private TelegramMessageHandler handler;
  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    handler = mock(TelegramMessageHandler.class);
    mvc = MockMvcBuilders.standaloneSetup(new DevTelegramController(handler)).build();
  }

  @Test
  void injectsMessage() throws Exception {
    mvc.perform(
            post("/dev/telegram/message")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"telegramUserId\":1001,\"username\":\"alice\",\"chatId\":42,"
                        + "\"text\":\"hi\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.queued").value(true));

    verify(handler).handle(new InboundChatMessage("42", "1001", "alice", "hi"));
  }

  @Test
  void rejectsBlankText() throws Exception {
    mvc.perform(
            post("/dev/telegram/message")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"telegramUserId\":1001,\"chatId\":42,\"text\":\" \"}"))
        .andExpect(status().isBadRequest());

    verify(handler, never()).handle(any());
  }
}
