package ru.tgproxy.proxybot.utils;

import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;

public final class BotMessageFactory {

    private BotMessageFactory() {
    }

    public static SendMessage simpleMessage(Long chatId, String text) {
        return SendMessage.builder()
                .chatId(chatId.toString())
                .text(text)
                .build();
    }

    public static SendMessage htmlMessage(Long chatId, String text, InlineKeyboardMarkup markup) {
        return SendMessage.builder()
                .chatId(chatId.toString())
                .text(text)
                .parseMode("HTML")
                .disableWebPagePreview(true)
                .replyMarkup(markup)
                .build();
    }

    public static EditMessageText editFromSendMessage(SendMessage sm, Long chatId, Integer messageId) {
        return EditMessageText.builder()
                .chatId(chatId.toString())
                .messageId(messageId)
                .text(sm.getText())
                .parseMode(sm.getParseMode())
                .disableWebPagePreview(sm.getDisableWebPagePreview())
                .replyMarkup((InlineKeyboardMarkup) sm.getReplyMarkup())
                .build();
    }

    public static AnswerCallbackQuery callbackAnswer(String callbackId, String text) {
        AnswerCallbackQuery.AnswerCallbackQueryBuilder b = AnswerCallbackQuery.builder()
                .callbackQueryId(callbackId);
        if (text != null && !text.isBlank()) {
            b.text(text).showAlert(false);
        }
        return b.build();
    }

    public static AnswerCallbackQuery callbackAlert(String callbackId, String text) {
        return AnswerCallbackQuery.builder()
                .callbackQueryId(callbackId)
                .text(text)
                .showAlert(true)
                .build();
    }
}
