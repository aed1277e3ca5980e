package ru.tgproxy.proxybot.exceptions;

public class NoActiveServersException extends ProxyBotException {

    public NoActiveServersException() {
        super("Нет доступных прокси-серверов");
    }
}
