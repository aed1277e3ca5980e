package ru.tgproxy.proxybot.bots;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.BotApiMethod;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import ru.tgproxy.proxybot.config.BotProperties;
import ru.tgproxy.proxybot.services.BotUpdateHandler;
import ru.tgproxy.proxybot.services.UpdateGuardService;

import java.io.Serializable;
import java.util.List;

@Slf4j
@Component
public class MainBot extends TelegramLongPollingBot {

    private final BotUpdateHandler botUpdateHandler;
    private final UpdateGuardService updateGuardService;
    private final String username;

    public MainBot(BotProperties props,
                   BotUpdateHandler botUpdateHandler,
                   UpdateGuardService updateGuardService) {
        super(props.token());
        this.username = props.username();
        this.botUpdateHandler = botUpdateHandler;
        this.updateGuardService = updateGuardService;
    }

    @Override
    public String getBotUsername() {
        return username;
    }

    @Override
    public void onUpdateReceived(Update update) {
        try {
            UpdateGuardService.GuardResult guard = updateGuardService.guard(update);
            if (guard.blocked()) {
                executeAll(guard.responses());
                return;
            }
            executeAll(botUpdateHandler.handle(update));
        } catch (Exception e) {
            log.error("Ошибка при обработке апдейта {}", update == null ? null : update.getUpdateId(), e);
        }
    }

    private void executeAll(List<BotApiMethod<?>> methods) {
        for (BotApiMethod<?> method : methods) {
            send(method);
        }
    }

    private <T extends Serializable> void send(BotApiMethod<T> method) {
        try {
            execute(method);
        } catch (TelegramApiException e) {
            log.warn("Telegram API call {} failed: {}", method.getMethod(), e.getMessage());
        }
    }
}
