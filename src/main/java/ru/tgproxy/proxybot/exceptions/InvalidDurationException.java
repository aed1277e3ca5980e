package ru.tgproxy.proxybot.exceptions;

public class InvalidDurationException extends ProxyBotException {

    public InvalidDurationException(long days) {
        super("Количество дней должно быть положительным: " + days);
    }
}
