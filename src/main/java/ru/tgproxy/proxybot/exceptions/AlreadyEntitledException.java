package ru.tgproxy.proxybot.exceptions;

public class AlreadyEntitledException extends ProxyBotException {

    public AlreadyEntitledException() {
        super("Подписка уже активна");
    }
}
