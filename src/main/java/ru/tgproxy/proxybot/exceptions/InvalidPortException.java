package ru.tgproxy.proxybot.exceptions;

public class InvalidPortException extends ProxyBotException {

    public InvalidPortException(String port) {
        super("Некорректный порт: " + port);
    }
}
