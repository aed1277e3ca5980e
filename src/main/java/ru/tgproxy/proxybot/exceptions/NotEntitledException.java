package ru.tgproxy.proxybot.exceptions;

public class NotEntitledException extends ProxyBotException {

    public NotEntitledException() {
        super("Нет активной подписки");
    }
}
