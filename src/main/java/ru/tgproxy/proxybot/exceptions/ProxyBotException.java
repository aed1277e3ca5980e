package ru.tgproxy.proxybot.exceptions;

/**
 * Ожидаемая бизнес-ошибка: показывается пользователю, транзакция откатывается.
 */
public abstract class ProxyBotException extends RuntimeException {

    protected ProxyBotException(String message) {
        super(message);
    }
}
