package com.logicsignalprotector.cortexconnector.telegram;

/** A text message a Telegram user sent to the bot. */
public record InboundChatMessage(
    String chatId, String senderId, String senderUsername, String text) {}
